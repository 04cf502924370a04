package org.circulardrives.cdihealth.application.normalize;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Current, minimum and maximum temperature parsed from a SMART raw string.
 *
 * <p>Drives embed history in the raw string of the temperature attribute in several shapes:
 * {@code "30 (Min/Max 25/40)"}, {@code "36 (0 19 0 0 0)"} or plain {@code "41"}. Only the leading reading is
 * mandatory; min/max are filled in when the {@code Min/Max} form is present.</p>
 *
 * @param current current reading in Celsius
 * @param min lowest recorded reading
 * @param max highest recorded reading
 * @since 0.1.0
 */
public record TemperatureReading(OptionalLong current, OptionalLong min, OptionalLong max) {
  private static final Pattern LEADING = Pattern.compile("^\\s*(-?\\d+)(.*)$", Pattern.DOTALL);
  private static final Pattern MIN_MAX =
      Pattern.compile("\\(\\s*Min/Max\\s+(-?\\d+)\\s*/\\s*(-?\\d+)", Pattern.CASE_INSENSITIVE);

  private static final TemperatureReading NONE =
      new TemperatureReading(OptionalLong.empty(), OptionalLong.empty(), OptionalLong.empty());

  public TemperatureReading {
    current = current == null ? OptionalLong.empty() : current;
    min = min == null ? OptionalLong.empty() : min;
    max = max == null ? OptionalLong.empty() : max;
  }

  public static TemperatureReading none() {
    return NONE;
  }

  /**
   * Parses a composite raw string.
   *
   * @param raw raw string; may be {@code null}
   * @return parsed reading, or {@link #none()} when the string does not start with a number
   */
  public static TemperatureReading parse(String raw) {
    if (raw == null) {
      return NONE;
    }
    Matcher leading = LEADING.matcher(raw);
    if (!leading.matches()) {
      return NONE;
    }
    OptionalLong current;
    try {
      current = OptionalLong.of(Long.parseLong(leading.group(1)));
    } catch (NumberFormatException ex) {
      return NONE;
    }
    Matcher minMax = MIN_MAX.matcher(leading.group(2));
    if (minMax.find()) {
      try {
        return new TemperatureReading(
            current,
            OptionalLong.of(Long.parseLong(minMax.group(1))),
            OptionalLong.of(Long.parseLong(minMax.group(2))));
      } catch (NumberFormatException ex) {
        return new TemperatureReading(current, OptionalLong.empty(), OptionalLong.empty());
      }
    }
    return new TemperatureReading(current, OptionalLong.empty(), OptionalLong.empty());
  }
}
