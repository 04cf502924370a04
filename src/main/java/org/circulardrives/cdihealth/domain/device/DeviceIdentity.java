package org.circulardrives.cdihealth.domain.device;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Identity of one device under test as seen during a single scan.
 * <p><strong>Why:</strong> Gives reports a stable key for each row independent of grading outcome.</p>
 * <p><strong>Role:</strong> Domain value object produced by discovery and carried through normalization and grading.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share across worker threads.</p>
 *
 * @param path device path such as {@code /dev/sda}; never blank
 * @param protocol transport protocol classification
 * @param vendor vendor or brand; {@link #NOT_REPORTED} when unknown
 * @param model model name; {@link #NOT_REPORTED} when unknown
 * @param serial serial number; {@link #NOT_REPORTED} when unknown
 * @param firmware firmware revision; {@link #NOT_REPORTED} when unknown
 * @param capacityBytes user capacity in bytes when reported
 * @param logicalBlockSize logical block size in bytes when reported
 * @param mediaType rotating or solid state media
 * @since 0.1.0
 */
public record DeviceIdentity(
    String path,
    TransportProtocol protocol,
    String vendor,
    String model,
    String serial,
    String firmware,
    OptionalLong capacityBytes,
    OptionalLong logicalBlockSize,
    MediaType mediaType) {

  /** Placeholder rendered for identity strings the device did not report. */
  public static final String NOT_REPORTED = "Not Reported";

  public DeviceIdentity {
    Objects.requireNonNull(path, "path");
    if (path.isBlank()) {
      throw new IllegalArgumentException("path must not be blank");
    }
    protocol = Objects.requireNonNullElse(protocol, TransportProtocol.UNKNOWN);
    vendor = orNotReported(vendor);
    model = orNotReported(model);
    serial = orNotReported(serial);
    firmware = orNotReported(firmware);
    capacityBytes = Objects.requireNonNullElse(capacityBytes, OptionalLong.empty());
    logicalBlockSize = Objects.requireNonNullElse(logicalBlockSize, OptionalLong.empty());
    mediaType = Objects.requireNonNullElse(mediaType, MediaType.UNKNOWN);
  }

  /**
   * Creates an identity carrying only the path and protocol, used when a probe never returned data.
   *
   * @param path device path
   * @param protocol protocol classification from the scan
   * @return identity with every descriptive field marked not reported
   */
  public static DeviceIdentity unidentified(String path, TransportProtocol protocol) {
    return new DeviceIdentity(
        path, protocol, null, null, null, null, OptionalLong.empty(), OptionalLong.empty(), MediaType.UNKNOWN);
  }

  /**
   * Key that identifies the physical unit within one scan.
   *
   * @return {@code model/serial}, or empty when either is not reported
   */
  public Optional<String> unitKey() {
    if (NOT_REPORTED.equals(model) || NOT_REPORTED.equals(serial)) {
      return Optional.empty();
    }
    return Optional.of(model + '/' + serial);
  }

  private static String orNotReported(String value) {
    if (value == null || value.isBlank()) {
      return NOT_REPORTED;
    }
    return value.trim();
  }
}
