package org.circulardrives.cdihealth.application.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class TemperatureReadingTest {

  @Test
  void parsesCurrentWithMinMax() {
    TemperatureReading reading = TemperatureReading.parse("36 (Min/Max 18/47)");

    assertEquals(OptionalLong.of(36), reading.current());
    assertEquals(OptionalLong.of(18), reading.min());
    assertEquals(OptionalLong.of(47), reading.max());
  }

  @Test
  void parsesBareCurrent() {
    TemperatureReading reading = TemperatureReading.parse("29");

    assertEquals(OptionalLong.of(29), reading.current());
    assertTrue(reading.max().isEmpty());
  }

  @Test
  void unparseableTextYieldsNone() {
    assertSame(TemperatureReading.none(), TemperatureReading.parse("unknown"));
    assertSame(TemperatureReading.none(), TemperatureReading.parse(null));
  }
}
