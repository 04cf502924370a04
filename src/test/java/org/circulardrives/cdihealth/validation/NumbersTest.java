package org.circulardrives.cdihealth.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("workers", 10, 1, 256));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 0, 1, 256));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 257, 1, 256));
  }

  @Test
  void parseLongUsesDefaultForBlank() {
    assertEquals(30, Numbers.parseLong("probeTimeoutSeconds", "  ", 30, 1, 3600));
    assertEquals(30, Numbers.parseLong("probeTimeoutSeconds", null, 30, 1, 3600));
  }

  @Test
  void parseLongTrimsAndChecksRange() {
    assertEquals(45, Numbers.parseLong("probeTimeoutSeconds", " 45 ", 30, 1, 3600));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseLong("probeTimeoutSeconds", "0", 30, 1, 3600));
    assertTrue(ex.getMessage().startsWith("probeTimeoutSeconds must be between 1 and 3600"));
  }

  @Test
  void parseLongRejectsNonIntegers() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("workers", "4.5", 1, 1, 256));
    assertTrue(ex.getMessage().contains("must be an integer"));
  }

  @Test
  void parsePositiveDoubleAcceptsDecimals() {
    assertEquals(550.0, Numbers.parsePositiveDouble("policy.workloadTbPerYearMax", "", 550.0));
    assertEquals(12.5, Numbers.parsePositiveDouble("policy.workloadTbPerYearMax", "12.5", 550.0));
  }

  @Test
  void parsePositiveDoubleRejectsZeroNegativeAndInfinite() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parsePositiveDouble("w", "0", 1.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parsePositiveDouble("w", "-3", 1.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parsePositiveDouble("w", "Infinity", 1.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parsePositiveDouble("w", "NaN", 1.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parsePositiveDouble("w", "lots", 1.0));
  }
}
