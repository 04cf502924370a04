package org.circulardrives.cdihealth.infrastructure.protocol.ata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.circulardrives.cdihealth.TelemetryFixtures;
import org.circulardrives.cdihealth.application.normalize.AttributeTable;
import org.circulardrives.cdihealth.application.normalize.IdentityResolver;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;
import org.circulardrives.cdihealth.domain.telemetry.SelfTestOutcome;
import org.junit.jupiter.api.Test;

class AtaTelemetryNormalizerTest {
  private final AtaTelemetryNormalizer normalizer = new AtaTelemetryNormalizer();

  @Test
  void hardDiskCountersAndTemperatures() {
    CanonicalAttributes attrs = normalize("/dev/sda", TelemetryFixtures.raw(TelemetryFixtures.ATA_HDD));

    assertTrue(attrs.telemetryObtained());
    assertEquals(OptionalLong.of(0), attrs.pendingSectors());
    assertEquals(OptionalLong.of(0), attrs.reallocatedSectors());
    assertEquals(OptionalLong.of(0), attrs.uncorrectableErrors());
    assertEquals(OptionalLong.of(26298), attrs.powerOnHours());
    assertEquals(OptionalLong.of(36), attrs.currentTemperature());
    assertEquals(OptionalLong.of(47), attrs.highestTemperature());
    assertEquals(OptionalLong.of(31), attrs.startStopCount());
    assertEquals(OptionalLong.of(31), attrs.powerCycleCount());
    assertEquals(OptionalLong.of(20_000_000_000L * 512), attrs.hostWritesBytes());
    assertEquals(OptionalLong.of(40_000_000_000L * 512), attrs.hostReadsBytes());
    assertEquals(Optional.of(true), attrs.smartStatus());
    assertTrue(attrs.percentUsed().isEmpty());
    assertEquals(List.of(SelfTestOutcome.PASSED, SelfTestOutcome.PASSED, SelfTestOutcome.PASSED),
        attrs.selfTestOutcomes());
  }

  @Test
  void solidStateUsesUnitSuffixedCountersAndDeviceStatistics() {
    CanonicalAttributes attrs = normalize("/dev/sdb", TelemetryFixtures.raw(TelemetryFixtures.ATA_SSD));

    long thirtyTwoMib = 32L * 1024 * 1024;
    assertEquals(OptionalLong.of(100_000L * thirtyTwoMib), attrs.hostWritesBytes());
    assertEquals(OptionalLong.of(200_000L * thirtyTwoMib), attrs.hostReadsBytes());
    assertEquals(OptionalLong.of(3), attrs.percentUsed());
    assertEquals(OptionalLong.of(99), attrs.availableSparePct());
    assertEquals(OptionalLong.of(27), attrs.currentTemperature());
    assertEquals(OptionalLong.of(41), attrs.highestTemperature());
    assertTrue(attrs.pendingSectors().isEmpty());
    assertTrue(attrs.selfTestOutcomes().isEmpty());
  }

  @Test
  void lifeLeftAttributeTakesPrecedenceForPercentUsed() {
    AttributeTable table = AttributeTable.fromRows(List.of(
        Map.of("id", 231, "name", "SSD_Life_Left", "value", 88, "raw", Map.of("value", 0)),
        Map.of("id", 202, "name", "Percent_Lifetime_Used", "value", 100, "raw", Map.of("value", 40))));

    assertEquals(OptionalLong.of(12),
        AtaTelemetryNormalizer.percentUsed(table, AtaDeviceStatistics.from(RawTelemetry.empty())));
  }

  @Test
  void deviceStatisticsFillInLogicalSectorCounters() {
    RawTelemetry raw = RawTelemetry.of(Map.of(
        "logical_block_size", 4096,
        "ata_device_statistics", Map.of("pages", List.of(Map.of("table", List.of(
            Map.of("name", "Logical Sectors Written", "value", 1000, "flags", Map.of("valid", true)),
            Map.of("name", "Logical Sectors Read", "value", 2000, "flags", Map.of("valid", false))))))));

    CanonicalAttributes attrs = normalize("/dev/sdz", raw);

    assertEquals(OptionalLong.of(4_096_000), attrs.hostWritesBytes());
    assertTrue(attrs.hostReadsBytes().isEmpty());
  }

  @Test
  void failedSelfTestIsCaptured() {
    RawTelemetry raw = RawTelemetry.of(Map.of(
        "ata_smart_data", Map.of("self_test", Map.of("status", Map.of("passed", false)))));

    CanonicalAttributes attrs = normalize("/dev/sdz", raw);

    assertTrue(attrs.anySelfTestFailed());
  }

  @Test
  void packedTemperatureRawUsesLowByte() {
    RawTelemetry raw = RawTelemetry.of(Map.of("ata_smart_attributes", Map.of("table", List.of(
        Map.of("id", 194, "name", "Temperature_Celsius", "value", 60, "raw", Map.of("value", 0x2F0012_0028L))))));

    CanonicalAttributes attrs = normalize("/dev/sdz", raw);

    assertEquals(OptionalLong.of(0x28), attrs.currentTemperature());
  }

  @Test
  void identityWithoutSmartDataIsNotObtained() {
    RawTelemetry raw = RawTelemetry.of(Map.of(
        "model_name", "X", "serial_number", "S1",
        "power_on_time", Map.of("hours", 100),
        "smartctl", Map.of("exit_status", 4)));

    assertFalse(normalize("/dev/sdz", raw).telemetryObtained());
  }

  @Test
  void selfTestStatusAloneCountsAsTelemetry() {
    RawTelemetry raw = RawTelemetry.of(Map.of(
        "ata_smart_data", Map.of("self_test", Map.of("status", Map.of("passed", true)))));

    assertTrue(normalize("/dev/sdz", raw).telemetryObtained());
  }

  @Test
  void emptyTelemetryIsNotObtained() {
    CanonicalAttributes attrs = normalizer.normalize(
        DeviceIdentity.unidentified("/dev/sdz", TransportProtocol.ATA), RawTelemetry.empty());

    assertFalse(attrs.telemetryObtained());
  }

  private CanonicalAttributes normalize(String path, RawTelemetry raw) {
    return normalizer.normalize(IdentityResolver.resolve(path, TransportProtocol.ATA, raw), raw);
  }
}
