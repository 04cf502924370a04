package org.circulardrives.cdihealth.application.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.circulardrives.cdihealth.TelemetryFixtures;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;
import org.junit.jupiter.api.Test;

class AttributeTableTest {

  @Test
  void readsRawNormalizedAndRawString() {
    AttributeTable table = AttributeTable.from(TelemetryFixtures.raw(TelemetryFixtures.ATA_HDD));

    assertEquals(10, table.entries().size());
    AttributeEntry temperature = table.find(194, "Temperature_Celsius").orElseThrow();
    assertEquals(OptionalLong.of(36), temperature.normalized());
    assertEquals(OptionalLong.of(53), temperature.worst());
    assertEquals(Optional.of("36 (Min/Max 18/47)"), temperature.rawString());
    assertEquals(OptionalLong.of(26298), table.value(9, "Power_On_Hours", AttributeField.RAW));
  }

  @Test
  void fallsBackToNameWhenIdDiffers() {
    AttributeTable table = AttributeTable.fromRows(List.of(
        Map.of("id", 202, "name", "Percent_Lifetime_Used", "value", 95, "raw", Map.of("value", 5))));

    assertEquals(OptionalLong.of(5), table.value(231, "percent_lifetime_used", AttributeField.RAW));
    assertTrue(table.findByName("PERCENT_LIFETIME_USED").isPresent());
  }

  @Test
  void skipsMalformedRows() {
    AttributeTable table = AttributeTable.fromRows(List.of(
        "junk", Map.of("name", "no id"), Map.of("id", 999, "name", "out of range"),
        Map.of("id", 5, "name", "Reallocated_Sector_Ct", "raw", 12)));

    assertEquals(1, table.entries().size());
    assertEquals(OptionalLong.of(12), table.value(5, "", AttributeField.RAW));
  }

  @Test
  void missingTableIsEmpty() {
    assertTrue(AttributeTable.from(RawTelemetry.empty()).isEmpty());
  }
}
