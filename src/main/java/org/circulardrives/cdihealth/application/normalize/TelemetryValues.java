package org.circulardrives.cdihealth.application.normalize;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Coerces loosely typed JSON values into "reported or not" numbers.
 *
 * <p>Booleans, blank strings, non-numeric strings, non-finite numbers and values outside the {@code long}
 * range are all not reported. Fractional values are truncated toward zero.</p>
 *
 * @since 0.1.0
 */
public final class TelemetryValues {
  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  private TelemetryValues() {
    // Utility
  }

  /**
   * Reads a signed integer.
   *
   * @param value JSON value (number or numeric string); may be {@code null}
   * @return integer value, or empty when absent or unparseable
   */
  public static OptionalLong asLong(Object value) {
    if (value == null || value instanceof Boolean) {
      return OptionalLong.empty();
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      return OptionalLong.of(((Number) value).longValue());
    }
    if (value instanceof BigInteger big) {
      return fits(big) ? OptionalLong.of(big.longValue()) : OptionalLong.empty();
    }
    if (value instanceof BigDecimal decimal) {
      return fromBigInteger(decimal.toBigInteger());
    }
    if (value instanceof Number number) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return OptionalLong.empty();
      }
      return fromBigInteger(BigDecimal.valueOf(d).toBigInteger());
    }
    if (value instanceof String text) {
      return parse(text);
    }
    return OptionalLong.empty();
  }

  /**
   * Reads a counter, which must be zero or positive.
   *
   * @param value JSON value; may be {@code null}
   * @return non-negative value, or empty when absent, unparseable or negative
   */
  public static OptionalLong asCount(Object value) {
    OptionalLong parsed = asLong(value);
    if (parsed.isPresent() && parsed.getAsLong() < 0) {
      return OptionalLong.empty();
    }
    return parsed;
  }

  /**
   * Reads a decimal number.
   *
   * @param value JSON value; may be {@code null}
   * @return decimal value, or empty when absent or unparseable
   */
  public static Optional<BigDecimal> asDecimal(Object value) {
    if (value == null || value instanceof Boolean) {
      return Optional.empty();
    }
    try {
      if (value instanceof BigDecimal decimal) {
        return Optional.of(decimal);
      }
      if (value instanceof BigInteger big) {
        return Optional.of(new BigDecimal(big));
      }
      if (value instanceof Number number) {
        double d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
          return Optional.empty();
        }
        return Optional.of(value instanceof Double || value instanceof Float
            ? BigDecimal.valueOf(d) : BigDecimal.valueOf(number.longValue()));
      }
      if (value instanceof String text && !text.isBlank()) {
        return Optional.of(new BigDecimal(stripGrouping(text)));
      }
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
    return Optional.empty();
  }

  /**
   * Reads a boolean.
   *
   * @param value JSON value; may be {@code null}
   * @return boolean value, or empty unless the value is a JSON boolean
   */
  public static Optional<Boolean> asBoolean(Object value) {
    if (value instanceof Boolean flag) {
      return Optional.of(flag);
    }
    return Optional.empty();
  }

  /**
   * Multiplies two reported quantities.
   *
   * @param count reported count
   * @param unitBytes reported unit size
   * @return product, or empty when either side is not reported or the product overflows
   */
  public static OptionalLong multiply(OptionalLong count, OptionalLong unitBytes) {
    if (count.isEmpty() || unitBytes.isEmpty()) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Math.multiplyExact(count.getAsLong(), unitBytes.getAsLong()));
    } catch (ArithmeticException ex) {
      return OptionalLong.empty();
    }
  }

  /**
   * Returns the first reported value.
   *
   * @param candidates values in precedence order
   * @return first present value, or empty
   */
  public static OptionalLong firstPresent(OptionalLong... candidates) {
    for (OptionalLong candidate : candidates) {
      if (candidate != null && candidate.isPresent()) {
        return candidate;
      }
    }
    return OptionalLong.empty();
  }

  private static OptionalLong parse(String text) {
    String trimmed = stripGrouping(text);
    if (trimmed.isEmpty()) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(trimmed));
    } catch (NumberFormatException notInteger) {
      try {
        return fromBigInteger(new BigDecimal(trimmed).toBigInteger());
      } catch (NumberFormatException notDecimal) {
        return OptionalLong.empty();
      }
    }
  }

  private static String stripGrouping(String text) {
    return text.trim().replace(",", "");
  }

  private static OptionalLong fromBigInteger(BigInteger big) {
    return fits(big) ? OptionalLong.of(big.longValue()) : OptionalLong.empty();
  }

  private static boolean fits(BigInteger big) {
    return big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0;
  }
}
