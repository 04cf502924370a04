package org.circulardrives.cdihealth.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void scanDefaultsCoverProbePolicyAndOutput() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("scan");

    assertEquals("smartctl", defaults.get("smartctl"));
    assertEquals("30", defaults.get("probeTimeoutSeconds"));
    assertEquals("10", defaults.get("policy.pendingSectorsMax"));
    assertEquals("97", defaults.get("policy.availableSpareMin"));
    assertEquals("550.0", defaults.get("policy.workloadTbPerYearMax"));
    assertEquals("table", defaults.get("format"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertFalse(defaults.containsKey("file"));
  }

  @Test
  void discoverHasNoPolicyOrOutputKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("Discover");

    assertTrue(defaults.containsKey("ignoreUsb"));
    assertFalse(defaults.containsKey("policy.percentUsedMax"));
    assertFalse(defaults.containsKey("out"));
  }

  @Test
  void gradeHasFilesButNoProbeKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("grade");

    assertEquals("", defaults.get("file"));
    assertFalse(defaults.containsKey("smartctl"));
    assertFalse(defaults.containsKey("workers"));
  }

  @Test
  void everyModeBuildsAValidConfiguration() {
    for (String mode : new String[] {"scan", "discover", "grade"}) {
      HealthConfig config = HealthConfig.fromMap(DefaultsForMode.asFlatMap(mode));
      assertEquals(OutputFormat.TABLE, config.format());
      assertTrue(config.out().isEmpty());
    }
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
