package org.circulardrives.cdihealth.infrastructure.protocol.nvme;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import org.circulardrives.cdihealth.application.normalize.TelemetryValues;
import org.circulardrives.cdihealth.application.port.TelemetryNormalizer;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;
import org.circulardrives.cdihealth.domain.telemetry.SelfTestOutcome;

/**
 * <strong>What:</strong> Normalizes the NVMe SMART / Health Information log.
 * <p><strong>Role:</strong> {@link TelemetryNormalizer} for {@link TransportProtocol#NVME}.</p>
 * <p><strong>Units:</strong> data units are thousands of 512-byte blocks; the log temperature is Kelvin when
 * read from the controller directly, Celsius when smartctl has already converted it.</p>
 * <p>A document without the health log or the self-test log is reported as not obtained.</p>
 *
 * @since 0.1.0
 */
public final class NvmeTelemetryNormalizer implements TelemetryNormalizer {
  /** Bytes per NVMe data unit. */
  public static final long DATA_UNIT_BYTES = 512L * 1000L;
  static final String HEALTH_LOG = "nvme_smart_health_information_log";
  static final String SELF_TEST_LOG = "nvme_self_test_log";
  private static final long KELVIN_THRESHOLD = 200;
  private static final long KELVIN_OFFSET = 273;
  private static final long RESULT_NO_ERROR = 0;
  private static final Set<Long> FAILED_RESULTS = Set.of(5L, 6L, 7L);

  @Override
  public TransportProtocol protocol() {
    return TransportProtocol.NVME;
  }

  @Override
  public CanonicalAttributes normalize(DeviceIdentity identity, RawTelemetry raw) {
    if (raw == null || (raw.objectAt(HEALTH_LOG).isEmpty() && raw.objectAt(SELF_TEST_LOG).isEmpty())) {
      return CanonicalAttributes.notObtained(TransportProtocol.NVME);
    }
    OptionalLong logTemperature = count(raw, "temperature");
    return CanonicalAttributes.builder(TransportProtocol.NVME)
        .percentUsed(count(raw, "percentage_used"))
        .availableSparePct(count(raw, "available_spare"))
        .uncorrectableErrors(count(raw, "media_errors"))
        .criticalTempMinutes(count(raw, "critical_comp_time"))
        .warningTempMinutes(count(raw, "warning_temp_time"))
        .hostReadsBytes(TelemetryValues.multiply(count(raw, "data_units_read"), OptionalLong.of(DATA_UNIT_BYTES)))
        .hostWritesBytes(
            TelemetryValues.multiply(count(raw, "data_units_written"), OptionalLong.of(DATA_UNIT_BYTES)))
        .powerOnHours(TelemetryValues.firstPresent(
            count(raw, "power_on_hours"),
            raw.at("power_on_time", "hours").map(TelemetryValues::asCount).orElse(OptionalLong.empty())))
        .powerCycleCount(count(raw, "power_cycles"))
        .currentTemperature(TelemetryValues.firstPresent(
            raw.at("temperature", "current").map(TelemetryValues::asLong).orElse(OptionalLong.empty()),
            toCelsius(logTemperature)))
        .smartStatus(raw.at("smart_status", "passed").flatMap(TelemetryValues::asBoolean))
        .selfTests(selfTests(raw))
        .build();
  }

  static OptionalLong toCelsius(OptionalLong reading) {
    if (reading.isEmpty()) {
      return reading;
    }
    long value = reading.getAsLong();
    return OptionalLong.of(value >= KELVIN_THRESHOLD ? value - KELVIN_OFFSET : value);
  }

  static List<SelfTestOutcome> selfTests(RawTelemetry raw) {
    List<SelfTestOutcome> outcomes = new ArrayList<>();
    for (Object row : raw.listAt(SELF_TEST_LOG, "table").orElse(List.of())) {
      if (!(row instanceof Map<?, ?> entry) || !(entry.get("self_test_result") instanceof Map<?, ?> result)) {
        continue;
      }
      OptionalLong code = TelemetryValues.asCount(result.get("value"));
      if (code.isEmpty()) {
        continue;
      }
      if (code.getAsLong() == RESULT_NO_ERROR) {
        outcomes.add(SelfTestOutcome.PASSED);
      } else if (FAILED_RESULTS.contains(code.getAsLong())) {
        outcomes.add(SelfTestOutcome.FAILED);
      }
    }
    return outcomes;
  }

  private static OptionalLong count(RawTelemetry raw, String field) {
    return raw.at(HEALTH_LOG, field).map(TelemetryValues::asCount).orElse(OptionalLong.empty());
  }
}
