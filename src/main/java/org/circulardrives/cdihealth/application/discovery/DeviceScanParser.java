package org.circulardrives.cdihealth.application.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.circulardrives.cdihealth.application.json.TelemetryJsonParser;
import org.circulardrives.cdihealth.domain.device.DeviceCandidate;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@code --scan-open --json} document into device candidates.
 *
 * <p>Entries without a name and RAID pass-through entries ({@code /dev/bus/*}) are skipped. Ignore filters are
 * applied here, before any per-device probe. Entries carrying {@code open_error} are kept as candidates so they
 * surface in the failures list.</p>
 *
 * @since 0.1.0
 */
public final class DeviceScanParser {
  private static final Logger log = LoggerFactory.getLogger(DeviceScanParser.class);
  private static final String RAID_PASSTHROUGH_PREFIX = "/dev/bus";

  private final TelemetryJsonParser json;

  public DeviceScanParser(TelemetryJsonParser json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Parses scan output.
   *
   * @param scanJson scan command stdout
   * @param filter ignore filters
   * @return candidates in scan order
   * @throws IllegalArgumentException when the output is not JSON or lacks a {@code devices} array
   */
  public List<DeviceCandidate> parse(String scanJson, DiscoveryFilter filter) {
    Objects.requireNonNull(filter, "filter");
    Map<String, Object> root = json.parseObject(scanJson);
    if (!(root.get("devices") instanceof List<?> devices)) {
      throw new IllegalArgumentException("scan output has no devices array");
    }
    List<DeviceCandidate> candidates = new ArrayList<>();
    int ignored = 0;
    for (Object node : devices) {
      if (!(node instanceof Map<?, ?> device) || !(device.get("name") instanceof String name) || name.isBlank()) {
        continue;
      }
      String path = name.trim();
      if (path.startsWith(RAID_PASSTHROUGH_PREFIX)) {
        log.debug("Skipping RAID pass-through entry {}", path);
        continue;
      }
      String type = device.get("type") instanceof String t ? t.trim() : "";
      TransportProtocol protocol = classify(device.get("protocol"), type);
      if (!filter.accepts(protocol)) {
        ignored++;
        log.debug("Ignoring {} device {}", protocol, path);
        continue;
      }
      Optional<String> openError = device.get("open_error") instanceof String error && !error.isBlank()
          ? Optional.of(error.trim())
          : Optional.empty();
      candidates.add(new DeviceCandidate(path, type, protocol, openError));
    }
    log.info("Scan found {} candidate devices ({} ignored by filter)", candidates.size(), ignored);
    return candidates;
  }

  /**
   * Classifies a scan entry, preferring the reported protocol over the device type.
   *
   * @param protocol reported protocol value
   * @param type device type such as {@code sat}, {@code nvme} or {@code usbjmicron}
   * @return protocol classification
   */
  static TransportProtocol classify(Object protocol, String type) {
    TransportProtocol reported = protocol instanceof String p ? TransportProtocol.fromString(p) : TransportProtocol.UNKNOWN;
    if (reported != TransportProtocol.UNKNOWN) {
      return reported;
    }
    String lower = type == null ? "" : type.toLowerCase(Locale.ROOT);
    if (lower.startsWith("nvme")) {
      return TransportProtocol.NVME;
    }
    if (lower.startsWith("sat") || lower.equals("ata")) {
      return TransportProtocol.ATA;
    }
    if (lower.startsWith("scsi")) {
      return TransportProtocol.SCSI;
    }
    if (lower.startsWith("usb")) {
      return TransportProtocol.USB;
    }
    return TransportProtocol.UNKNOWN;
  }
}
