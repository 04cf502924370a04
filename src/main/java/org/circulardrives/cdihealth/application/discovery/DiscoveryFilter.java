package org.circulardrives.cdihealth.application.discovery;

import org.circulardrives.cdihealth.domain.device.TransportProtocol;

/**
 * Protocols excluded from a scan before any device is probed.
 *
 * @param ignoreAta skip ATA devices
 * @param ignoreNvme skip NVMe devices
 * @param ignoreScsi skip SCSI/SAS devices
 * @param ignoreUsb skip USB bridges
 * @since 0.1.0
 */
public record DiscoveryFilter(boolean ignoreAta, boolean ignoreNvme, boolean ignoreScsi, boolean ignoreUsb) {
  private static final DiscoveryFilter NONE = new DiscoveryFilter(false, false, false, false);

  public static DiscoveryFilter none() {
    return NONE;
  }

  /**
   * Indicates whether devices of a protocol should be probed.
   *
   * @param protocol protocol from the scan
   * @return {@code false} when the protocol is ignored
   */
  public boolean accepts(TransportProtocol protocol) {
    return switch (protocol) {
      case ATA -> !ignoreAta;
      case NVME -> !ignoreNvme;
      case SCSI -> !ignoreScsi;
      case USB -> !ignoreUsb;
      case UNKNOWN -> true;
    };
  }
}
