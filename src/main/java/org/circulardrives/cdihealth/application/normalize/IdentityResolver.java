package org.circulardrives.cdihealth.application.normalize;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.device.MediaType;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;

/**
 * Builds a {@link DeviceIdentity} from the identification fields of a telemetry document.
 *
 * <p>ATA and NVMe report {@code model_name}, {@code serial_number} and {@code firmware_version}; SCSI reports
 * {@code scsi_vendor}, {@code scsi_model_name} (or {@code scsi_product}) and {@code scsi_revision}.</p>
 *
 * @since 0.1.0
 */
public final class IdentityResolver {
  private IdentityResolver() {
    // Utility
  }

  /**
   * Resolves the protocol a telemetry document describes.
   *
   * @param raw telemetry
   * @param scanned protocol the scan reported
   * @return {@code scanned} unless it is unknown, in which case {@code device.protocol} from the document
   */
  public static TransportProtocol protocol(RawTelemetry raw, TransportProtocol scanned) {
    if (scanned != null && scanned != TransportProtocol.UNKNOWN) {
      return scanned;
    }
    return raw.stringAt("device", "protocol").map(TransportProtocol::fromString).orElse(TransportProtocol.UNKNOWN);
  }

  /**
   * Resolves an identity.
   *
   * @param path device path
   * @param protocol resolved protocol
   * @param raw telemetry
   * @return identity with unreported strings rendered as {@link DeviceIdentity#NOT_REPORTED}
   */
  public static DeviceIdentity resolve(String path, TransportProtocol protocol, RawTelemetry raw) {
    Optional<String> model = raw.stringAt("model_name")
        .or(() -> raw.stringAt("scsi_model_name"))
        .or(() -> raw.stringAt("scsi_product"));
    Optional<String> vendor = raw.stringAt("scsi_vendor")
        .or(() -> raw.stringAt("vendor"))
        .or(() -> model.flatMap(VendorResolver::fromModel))
        .or(() -> raw.stringAt("model_family").flatMap(VendorResolver::fromModel));
    String serial = raw.stringAt("serial_number").orElse(null);
    String firmware = raw.stringAt("firmware_version").or(() -> raw.stringAt("scsi_revision")).orElse(null);
    OptionalLong capacity = raw.at("user_capacity", "bytes")
        .map(TelemetryValues::asCount)
        .orElse(OptionalLong.empty());
    if (capacity.isEmpty()) {
      capacity = raw.at("nvme_total_capacity").map(TelemetryValues::asCount).orElse(OptionalLong.empty());
    }
    OptionalLong blockSize = raw.at("logical_block_size").map(TelemetryValues::asCount).orElse(OptionalLong.empty());
    return new DeviceIdentity(
        path,
        protocol,
        vendor.map(v -> v.toUpperCase(Locale.ROOT)).orElse(null),
        model.orElse(null),
        serial,
        firmware,
        capacity,
        blockSize,
        mediaType(protocol, raw));
  }

  private static MediaType mediaType(TransportProtocol protocol, RawTelemetry raw) {
    if (protocol == TransportProtocol.NVME) {
      return MediaType.SSD;
    }
    OptionalLong rotation = raw.at("rotation_rate").map(TelemetryValues::asCount).orElse(OptionalLong.empty());
    if (rotation.isEmpty()) {
      return MediaType.UNKNOWN;
    }
    return rotation.getAsLong() == 0 ? MediaType.SSD : MediaType.HDD;
  }
}
