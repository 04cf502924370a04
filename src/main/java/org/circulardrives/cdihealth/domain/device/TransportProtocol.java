package org.circulardrives.cdihealth.domain.device;

import java.util.Locale;

/**
 * Transport protocol a storage device is reached through.
 *
 * @since 0.1.0
 */
public enum TransportProtocol {
  /** Serial/parallel ATA devices, including SATA behind a SAT bridge. */
  ATA,
  /** NVMe devices. */
  NVME,
  /** SCSI and SAS devices. */
  SCSI,
  /** Removable USB bridges that do not expose a pass-through protocol. */
  USB,
  /** Anything smartctl reports that is not recognised. */
  UNKNOWN;

  /**
   * Parses protocol labels such as {@code "NVMe"} or {@code "ATA"} case-insensitively.
   *
   * @param raw protocol label; may be {@code null}
   * @return matching protocol, or {@link #UNKNOWN} when blank or unrecognised
   */
  public static TransportProtocol fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return UNKNOWN;
    }
    return switch (raw.trim().toUpperCase(Locale.ROOT)) {
      case "ATA", "SATA", "SAT" -> ATA;
      case "NVME" -> NVME;
      case "SCSI", "SAS" -> SCSI;
      case "USB" -> USB;
      default -> UNKNOWN;
    };
  }
}
