package org.circulardrives.cdihealth.domain.device;

import java.util.Objects;
import java.util.Optional;

/**
 * A device path reported by the scan command, before any per-device probe.
 *
 * @param path device path such as {@code /dev/nvme0}
 * @param deviceType tool-specific device type hint (e.g. {@code sat}, {@code nvme}); may be blank
 * @param protocol protocol classification from the scan
 * @param openError error text when the scan could not open the device
 * @since 0.1.0
 */
public record DeviceCandidate(
    String path, String deviceType, TransportProtocol protocol, Optional<String> openError) {

  public DeviceCandidate {
    Objects.requireNonNull(path, "path");
    if (path.isBlank()) {
      throw new IllegalArgumentException("path must not be blank");
    }
    deviceType = deviceType == null ? "" : deviceType.trim();
    protocol = Objects.requireNonNullElse(protocol, TransportProtocol.UNKNOWN);
    openError = Objects.requireNonNullElse(openError, Optional.empty());
  }

  /**
   * Creates a candidate the scan opened without error.
   *
   * @param path device path
   * @param deviceType device type hint
   * @param protocol protocol classification
   * @return reachable candidate
   */
  public static DeviceCandidate reachable(String path, String deviceType, TransportProtocol protocol) {
    return new DeviceCandidate(path, deviceType, protocol, Optional.empty());
  }

  public boolean openFailed() {
    return openError.isPresent();
  }
}
