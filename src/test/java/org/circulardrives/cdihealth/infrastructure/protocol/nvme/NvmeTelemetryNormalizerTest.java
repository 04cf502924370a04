package org.circulardrives.cdihealth.infrastructure.protocol.nvme;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.circulardrives.cdihealth.TelemetryFixtures;
import org.circulardrives.cdihealth.application.normalize.IdentityResolver;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;
import org.circulardrives.cdihealth.domain.telemetry.SelfTestOutcome;
import org.junit.jupiter.api.Test;

class NvmeTelemetryNormalizerTest {
  private final NvmeTelemetryNormalizer normalizer = new NvmeTelemetryNormalizer();

  @Test
  void readsHealthLog() {
    CanonicalAttributes attrs = normalize(TelemetryFixtures.raw(TelemetryFixtures.NVME));

    assertEquals(OptionalLong.of(2), attrs.percentUsed());
    assertEquals(OptionalLong.of(100), attrs.availableSparePct());
    assertEquals(OptionalLong.of(0), attrs.mediaErrors());
    assertEquals(OptionalLong.of(0), attrs.warningTempMinutes());
    assertEquals(OptionalLong.of(0), attrs.criticalTempMinutes());
    assertEquals(OptionalLong.of(4383), attrs.powerOnHours());
    assertEquals(OptionalLong.of(420), attrs.powerCycleCount());
    assertEquals(OptionalLong.of(38), attrs.currentTemperature());
    assertEquals(OptionalLong.of(20_000_000L * NvmeTelemetryNormalizer.DATA_UNIT_BYTES), attrs.hostReadsBytes());
    assertEquals(OptionalLong.of(30_000_000L * NvmeTelemetryNormalizer.DATA_UNIT_BYTES), attrs.hostWritesBytes());
    assertEquals(List.of(SelfTestOutcome.PASSED), attrs.selfTestOutcomes());
    assertTrue(attrs.pendingSectors().isEmpty());
  }

  @Test
  void kelvinLogTemperatureIsConverted() {
    RawTelemetry raw = RawTelemetry.of(Map.of(
        NvmeTelemetryNormalizer.HEALTH_LOG, Map.of("temperature", 318)));

    assertEquals(OptionalLong.of(45), normalize(raw).currentTemperature());
    assertEquals(OptionalLong.of(45), NvmeTelemetryNormalizer.toCelsius(OptionalLong.of(45)));
  }

  @Test
  void selfTestResultCodesMapToOutcomes() {
    RawTelemetry raw = RawTelemetry.of(Map.of("nvme_self_test_log", Map.of("table", List.of(
        Map.of("self_test_result", Map.of("value", 0)),
        Map.of("self_test_result", Map.of("value", 1)),
        Map.of("self_test_result", Map.of("value", 7))))));

    assertEquals(List.of(SelfTestOutcome.PASSED, SelfTestOutcome.FAILED), NvmeTelemetryNormalizer.selfTests(raw));
  }

  @Test
  void identityWithoutHealthLogIsNotObtained() {
    RawTelemetry raw = RawTelemetry.of(Map.of(
        "model_name", "X", "serial_number", "S1", "smartctl", Map.of("exit_status", 4)));

    CanonicalAttributes attrs = normalize(raw);

    assertFalse(attrs.telemetryObtained());
    assertTrue(attrs.percentUsed().isEmpty());
  }

  private CanonicalAttributes normalize(RawTelemetry raw) {
    return normalizer.normalize(IdentityResolver.resolve("/dev/nvme0", TransportProtocol.NVME, raw), raw);
  }
}
