package org.circulardrives.cdihealth.application.normalize;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.circulardrives.cdihealth.application.port.TelemetryNormalizer;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes telemetry to the normalizer registered for the device protocol.
 *
 * <p>Protocols without a normalizer (USB bridges, unknown transports) and empty telemetry yield
 * {@link CanonicalAttributes#notObtained(TransportProtocol)}.</p>
 *
 * @since 0.1.0
 */
public final class TelemetryNormalizers {
  private static final Logger log = LoggerFactory.getLogger(TelemetryNormalizers.class);

  private final Map<TransportProtocol, TelemetryNormalizer> byProtocol;

  /**
   * Creates a registry.
   *
   * @param normalizers normalizers; at most one per protocol
   * @throws IllegalArgumentException when two normalizers claim the same protocol
   */
  public TelemetryNormalizers(List<? extends TelemetryNormalizer> normalizers) {
    Map<TransportProtocol, TelemetryNormalizer> map = new EnumMap<>(TransportProtocol.class);
    for (TelemetryNormalizer normalizer : Objects.requireNonNull(normalizers, "normalizers")) {
      TelemetryNormalizer previous = map.put(normalizer.protocol(), normalizer);
      if (previous != null) {
        throw new IllegalArgumentException("duplicate normalizer for " + normalizer.protocol());
      }
    }
    this.byProtocol = Map.copyOf(map);
  }

  public Optional<TelemetryNormalizer> forProtocol(TransportProtocol protocol) {
    return Optional.ofNullable(byProtocol.get(protocol));
  }

  public boolean supports(TransportProtocol protocol) {
    return byProtocol.containsKey(protocol);
  }

  /**
   * Normalizes telemetry for a device.
   *
   * @param identity device identity; its protocol selects the normalizer
   * @param raw raw telemetry
   * @return canonical attributes
   */
  public CanonicalAttributes normalize(DeviceIdentity identity, RawTelemetry raw) {
    TransportProtocol protocol = identity.protocol();
    if (raw == null || raw.isEmpty()) {
      return CanonicalAttributes.notObtained(protocol);
    }
    Optional<TelemetryNormalizer> normalizer = forProtocol(protocol);
    if (normalizer.isEmpty()) {
      log.debug("No normalizer for {} device {}", protocol, identity.path());
      return CanonicalAttributes.notObtained(protocol);
    }
    return normalizer.get().normalize(identity, raw);
  }
}
