package org.circulardrives.cdihealth.application.port;

import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;

/**
 * <strong>What:</strong> Maps one protocol's raw telemetry onto {@link CanonicalAttributes}.
 * <p><strong>Role:</strong> Port implemented once per supported protocol (ATA, NVMe, SCSI).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Prefer numeric attribute IDs over name matching when both could source a field.</li>
 *   <li>Leave fields not reported when the source is missing or unparseable; never substitute zero.</li>
 *   <li>Reconcile units into bytes, hours, minutes and degrees Celsius.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are stateless pure functions.</p>
 *
 * @since 0.1.0
 */
public interface TelemetryNormalizer {
  /**
   * Protocol this normalizer understands.
   *
   * @return supported protocol
   */
  TransportProtocol protocol();

  /**
   * Normalizes raw telemetry.
   *
   * @param identity identity of the device the telemetry belongs to
   * @param raw raw telemetry; a document without any of the protocol's health data yields
   *     {@link CanonicalAttributes#notObtained(TransportProtocol)}
   * @return canonical attributes
   */
  CanonicalAttributes normalize(DeviceIdentity identity, RawTelemetry raw);
}
