package org.circulardrives.cdihealth.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("workers", "", "sudo", "false", "smartctl", "smartctl");
    Map<String, String> yaml = Map.of("workers", "4", "sudo", "true");
    Map<String, String> cli = Map.of("workers", "8");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig("scan", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("8", merged.get("workers"));
    assertEquals("true", merged.get("sudo"));
    assertEquals("smartctl", merged.get("smartctl"));
    assertEquals(List.of("CLI overrides YAML for key: workers"), warnings);
  }

  @Test
  void unknownCliKeyIsRejected() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("discover");

    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "discover", Optional.empty(), Map.of("format", "json"), defaults, msg -> {}));
    assertEquals("Unknown CLI setting for discover: format", ex.getMessage());
  }

  @Test
  void unknownYamlKeyIsRejected() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("grade");

    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "grade", Optional.of(Map.of("policy.bogus", "1")), Map.of(), defaults, msg -> {}));
    assertTrue(ex.getMessage().startsWith("Unknown YAML setting"));
  }

  @Test
  void defaultsSurviveWhenNothingOverrides() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("scan");

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig("scan", Optional.empty(), null, defaults, null);

    assertEquals(defaults, merged);
  }
}
