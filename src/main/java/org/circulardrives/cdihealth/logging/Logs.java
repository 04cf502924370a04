package org.circulardrives.cdihealth.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * <strong>What:</strong> Helpers that keep diagnostic tool output readable in operator logs.
 * <p><strong>Role:</strong> Cross-cutting utility used by discovery, probing and command execution.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Cap captured stdout/stderr at a UTF-8 byte budget before logging it.</li>
 *   <li>Mask device serial numbers in probe diagnostics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final Set<String> UNMASKED = Set.of("", "Not Reported");

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String kept;
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      kept = buffer.toString();
    } catch (CharacterCodingException ex) {
      kept = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return kept + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
  }

  /**
   * Masks all but the last four characters of a serial number.
   *
   * @param serial serial number; {@code null} results in {@code "<null>"}
   * @return masked serial, or the input unchanged when it is empty or not reported
   */
  public static String maskSerial(String serial) {
    if (serial == null) {
      return NULL_PLACEHOLDER;
    }
    String trimmed = serial.trim();
    if (UNMASKED.contains(trimmed) || trimmed.length() <= 4) {
      return trimmed;
    }
    return "*".repeat(trimmed.length() - 4) + trimmed.substring(trimmed.length() - 4);
  }
}
