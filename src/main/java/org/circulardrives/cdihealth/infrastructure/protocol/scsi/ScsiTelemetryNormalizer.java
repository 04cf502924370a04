package org.circulardrives.cdihealth.infrastructure.protocol.scsi;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.circulardrives.cdihealth.application.normalize.TelemetryValues;
import org.circulardrives.cdihealth.application.port.TelemetryNormalizer;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;
import org.circulardrives.cdihealth.domain.telemetry.SelfTestOutcome;

/**
 * <strong>What:</strong> Normalizes SCSI/SAS error counter, defect and self-test logs.
 * <p><strong>Role:</strong> {@link TelemetryNormalizer} for {@link TransportProtocol#SCSI}.</p>
 * <p>SCSI has no pending-sector or spare-capacity concept; those fields stay not reported. The start-stop cycle
 * counter page carries no power-cycle count, so that comes from the top-level {@code power_cycle_count} when
 * smartctl reports one.</p>
 *
 * @since 0.1.0
 */
public final class ScsiTelemetryNormalizer implements TelemetryNormalizer {
  private static final Pattern SELF_TEST_KEY = Pattern.compile("^scsi_self_test_(\\d+)$");
  private static final BigDecimal BYTES_PER_GB = BigDecimal.valueOf(1_000_000_000L);
  private static final long RESULT_NO_ERROR = 0;
  private static final Set<Long> FAILED_RESULTS = Set.of(3L, 4L, 5L, 6L, 7L);
  private static final List<String> ERROR_LOG_SECTIONS = List.of("read", "write", "verify");
  private static final List<String> HEALTH_LOGS = List.of(
      "scsi_grown_defect_list",
      "scsi_error_counter_log",
      "scsi_percentage_used_endurance_indicator",
      "scsi_start_stop_cycle_counter");

  @Override
  public TransportProtocol protocol() {
    return TransportProtocol.SCSI;
  }

  @Override
  public CanonicalAttributes normalize(DeviceIdentity identity, RawTelemetry raw) {
    if (raw == null || !hasHealthData(raw)) {
      return CanonicalAttributes.notObtained(TransportProtocol.SCSI);
    }
    return CanonicalAttributes.builder(TransportProtocol.SCSI)
        .reallocatedSectors(raw.at("scsi_grown_defect_list").map(TelemetryValues::asCount).orElse(OptionalLong.empty()))
        .uncorrectableErrors(uncorrectedErrors(raw))
        .percentUsed(raw.at("scsi_percentage_used_endurance_indicator")
            .map(TelemetryValues::asCount)
            .orElse(OptionalLong.empty()))
        .powerOnHours(raw.at("power_on_time", "hours").map(TelemetryValues::asCount).orElse(OptionalLong.empty()))
        .hostReadsBytes(gigabytesProcessed(raw, "read"))
        .hostWritesBytes(gigabytesProcessed(raw, "write"))
        .currentTemperature(raw.at("temperature", "current").map(TelemetryValues::asLong).orElse(OptionalLong.empty()))
        .startStopCount(raw.at("scsi_start_stop_cycle_counter", "accumulated_start_stop_cycles")
            .map(TelemetryValues::asCount)
            .orElse(OptionalLong.empty()))
        .powerCycleCount(raw.at("power_cycle_count").map(TelemetryValues::asCount).orElse(OptionalLong.empty()))
        .smartStatus(raw.at("smart_status", "passed").flatMap(TelemetryValues::asBoolean))
        .selfTests(selfTests(raw))
        .build();
  }

  static boolean hasHealthData(RawTelemetry raw) {
    for (String log : HEALTH_LOGS) {
      if (raw.at(log).isPresent()) {
        return true;
      }
    }
    return raw.root().keySet().stream().anyMatch(key -> SELF_TEST_KEY.matcher(key).matches());
  }

  /**
   * Sums {@code total_uncorrected_errors} over the read, write and verify sections that are present.
   *
   * @param raw telemetry
   * @return sum, or empty when no section reports a count
   */
  static OptionalLong uncorrectedErrors(RawTelemetry raw) {
    boolean reported = false;
    long total = 0;
    for (String section : ERROR_LOG_SECTIONS) {
      OptionalLong count = raw.at("scsi_error_counter_log", section, "total_uncorrected_errors")
          .map(TelemetryValues::asCount)
          .orElse(OptionalLong.empty());
      if (count.isPresent()) {
        reported = true;
        try {
          total = Math.addExact(total, count.getAsLong());
        } catch (ArithmeticException ex) {
          return OptionalLong.empty();
        }
      }
    }
    return reported ? OptionalLong.of(total) : OptionalLong.empty();
  }

  private static OptionalLong gigabytesProcessed(RawTelemetry raw, String section) {
    Optional<BigDecimal> gigabytes = raw.at("scsi_error_counter_log", section, "gigabytes_processed")
        .flatMap(TelemetryValues::asDecimal)
        .filter(value -> value.signum() >= 0);
    return gigabytes
        .map(value -> TelemetryValues.asLong(value.multiply(BYTES_PER_GB)))
        .orElse(OptionalLong.empty());
  }

  static List<SelfTestOutcome> selfTests(RawTelemetry raw) {
    TreeMap<Integer, Object> ordered = new TreeMap<>();
    for (Map.Entry<String, Object> entry : raw.root().entrySet()) {
      Matcher matcher = SELF_TEST_KEY.matcher(entry.getKey());
      if (matcher.matches()) {
        try {
          ordered.put(Integer.parseInt(matcher.group(1)), entry.getValue());
        } catch (NumberFormatException ex) {
          // index out of int range; not a real log slot
          continue;
        }
      }
    }
    List<SelfTestOutcome> outcomes = new ArrayList<>();
    for (Object value : ordered.values()) {
      if (!(value instanceof Map<?, ?> test) || !(test.get("result") instanceof Map<?, ?> result)) {
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
}
