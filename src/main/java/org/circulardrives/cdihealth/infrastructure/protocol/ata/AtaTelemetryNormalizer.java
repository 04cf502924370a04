package org.circulardrives.cdihealth.infrastructure.protocol.ata;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.circulardrives.cdihealth.application.normalize.AttributeEntry;
import org.circulardrives.cdihealth.application.normalize.AttributeField;
import org.circulardrives.cdihealth.application.normalize.AttributeTable;
import org.circulardrives.cdihealth.application.normalize.TelemetryValues;
import org.circulardrives.cdihealth.application.normalize.TemperatureReading;
import org.circulardrives.cdihealth.application.port.TelemetryNormalizer;
import org.circulardrives.cdihealth.domain.device.DeviceIdentity;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;
import org.circulardrives.cdihealth.domain.telemetry.RawTelemetry;
import org.circulardrives.cdihealth.domain.telemetry.SelfTestOutcome;

/**
 * <strong>What:</strong> Normalizes ATA S.M.A.R.T. telemetry.
 * <p><strong>Role:</strong> {@link TelemetryNormalizer} for {@link TransportProtocol#ATA}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read sector counters, endurance and spare from the attribute table by ID, falling back to names.</li>
 *   <li>Scale host read/write counters by the unit encoded in the attribute name or the logical block size.</li>
 *   <li>Parse composite temperature strings, falling back to the plain raw counter.</li>
 *   <li>Collect self-test verdicts from the self-test log and the current self-test status.</li>
 *   <li>Report telemetry as not obtained when none of the attribute table, device statistics or self-test data
 *   is present.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class AtaTelemetryNormalizer implements TelemetryNormalizer {
  static final int ID_REALLOCATED = 5;
  static final int ID_POWER_ON_HOURS = 9;
  static final int ID_START_STOP = 4;
  static final int ID_POWER_CYCLES = 12;
  static final int ID_AIRFLOW_TEMPERATURE = 190;
  static final int ID_TEMPERATURE = 194;
  static final int ID_PENDING = 197;
  static final int ID_OFFLINE_UNCORRECTABLE = 198;
  static final int ID_SSD_LIFE_LEFT = 231;
  static final int ID_AVAILABLE_RESERVED_SPACE = 232;
  static final int ID_HOST_WRITES = 241;
  static final int ID_HOST_READS = 242;
  static final String PERCENT_LIFETIME_USED = "Percent_Lifetime_Used";

  private static final long MIB = 1024L * 1024L;
  private static final long GIB = MIB * 1024L;

  @Override
  public TransportProtocol protocol() {
    return TransportProtocol.ATA;
  }

  @Override
  public CanonicalAttributes normalize(DeviceIdentity identity, RawTelemetry raw) {
    if (raw == null || raw.isEmpty()) {
      return CanonicalAttributes.notObtained(TransportProtocol.ATA);
    }
    AttributeTable table = AttributeTable.from(raw);
    AtaDeviceStatistics statistics = AtaDeviceStatistics.from(raw);
    if (!hasHealthData(raw, table, statistics)) {
      return CanonicalAttributes.notObtained(TransportProtocol.ATA);
    }
    OptionalLong blockSize = identity.logicalBlockSize().isPresent()
        ? identity.logicalBlockSize()
        : raw.at("logical_block_size").map(TelemetryValues::asCount).orElse(OptionalLong.empty());

    TemperatureReading temperature = temperature(table);

    return CanonicalAttributes.builder(TransportProtocol.ATA)
        .pendingSectors(table.value(ID_PENDING, "Current_Pending_Sector", AttributeField.RAW))
        .reallocatedSectors(table.value(ID_REALLOCATED, "Reallocated_Sector_Ct", AttributeField.RAW))
        .uncorrectableErrors(table.value(ID_OFFLINE_UNCORRECTABLE, "Offline_Uncorrectable", AttributeField.RAW))
        .percentUsed(percentUsed(table, statistics))
        .availableSparePct(
            table.value(ID_AVAILABLE_RESERVED_SPACE, "Available_Reservd_Space", AttributeField.NORMALIZED))
        .powerOnHours(TelemetryValues.firstPresent(
            raw.at("power_on_time", "hours").map(TelemetryValues::asCount).orElse(OptionalLong.empty()),
            table.value(ID_POWER_ON_HOURS, "Power_On_Hours", AttributeField.RAW)))
        .hostWritesBytes(TelemetryValues.firstPresent(
            hostBytes(table.find(ID_HOST_WRITES, "Total_LBAs_Written"), blockSize),
            TelemetryValues.multiply(statistics.value(AtaDeviceStatistics.LOGICAL_SECTORS_WRITTEN), blockSize)))
        .hostReadsBytes(TelemetryValues.firstPresent(
            hostBytes(table.find(ID_HOST_READS, "Total_LBAs_Read"), blockSize),
            TelemetryValues.multiply(statistics.value(AtaDeviceStatistics.LOGICAL_SECTORS_READ), blockSize)))
        .currentTemperature(TelemetryValues.firstPresent(
            raw.at("temperature", "current").map(TelemetryValues::asLong).orElse(OptionalLong.empty()),
            temperature.current(),
            statistics.value(AtaDeviceStatistics.CURRENT_TEMPERATURE)))
        .highestTemperature(TelemetryValues.firstPresent(
            raw.at("temperature", "lifetime_max").map(TelemetryValues::asLong).orElse(OptionalLong.empty()),
            statistics.value(AtaDeviceStatistics.HIGHEST_TEMPERATURE),
            temperature.max()))
        .startStopCount(table.value(ID_START_STOP, "Start_Stop_Count", AttributeField.RAW))
        .powerCycleCount(TelemetryValues.firstPresent(
            raw.at("power_cycle_count").map(TelemetryValues::asCount).orElse(OptionalLong.empty()),
            table.value(ID_POWER_CYCLES, "Power_Cycle_Count", AttributeField.RAW)))
        .smartStatus(raw.at("smart_status", "passed").flatMap(TelemetryValues::asBoolean))
        .selfTests(selfTests(raw))
        .build();
  }

  /**
   * Whether the document carries any S.M.A.R.T. source; identity fields alone do not count.
   */
  static boolean hasHealthData(RawTelemetry raw, AttributeTable table, AtaDeviceStatistics statistics) {
    return !table.isEmpty()
        || !statistics.isEmpty()
        || raw.objectAt("ata_smart_self_test_log").isPresent()
        || raw.at("ata_smart_data", "self_test", "status").isPresent();
  }

  /**
   * Endurance consumed: 100 minus the normalized SSD life left, then the raw lifetime-used attribute, then the
   * device statistics endurance indicator.
   */
  static OptionalLong percentUsed(AttributeTable table, AtaDeviceStatistics statistics) {
    OptionalLong lifeLeft = table.value(ID_SSD_LIFE_LEFT, "SSD_Life_Left", AttributeField.NORMALIZED);
    if (lifeLeft.isPresent() && lifeLeft.getAsLong() <= 100) {
      return OptionalLong.of(100 - lifeLeft.getAsLong());
    }
    OptionalLong lifetimeUsed = table.findByName(PERCENT_LIFETIME_USED)
        .map(entry -> entry.get(AttributeField.RAW))
        .orElse(OptionalLong.empty());
    if (lifetimeUsed.isPresent()) {
      return lifetimeUsed;
    }
    return statistics.value(AtaDeviceStatistics.PERCENT_USED_ENDURANCE);
  }

  private static TemperatureReading temperature(AttributeTable table) {
    TemperatureReading reading = temperatureFrom(table.find(ID_TEMPERATURE, "Temperature_Celsius"));
    if (reading.current().isPresent()) {
      return reading;
    }
    return temperatureFrom(table.find(ID_AIRFLOW_TEMPERATURE, "Airflow_Temperature_Cel"));
  }

  private static TemperatureReading temperatureFrom(Optional<AttributeEntry> entry) {
    if (entry.isEmpty()) {
      return TemperatureReading.none();
    }
    TemperatureReading parsed = entry.get().rawString().map(TemperatureReading::parse).orElse(TemperatureReading.none());
    if (parsed.current().isPresent()) {
      return parsed;
    }
    OptionalLong raw = entry.get().raw();
    if (raw.isEmpty()) {
      return TemperatureReading.none();
    }
    // Packed raw counters keep the current reading in the low byte.
    long value = raw.getAsLong() > 0xFF ? raw.getAsLong() & 0xFF : raw.getAsLong();
    return new TemperatureReading(OptionalLong.of(value), OptionalLong.empty(), OptionalLong.empty());
  }

  static OptionalLong hostBytes(Optional<AttributeEntry> entry, OptionalLong blockSize) {
    if (entry.isEmpty()) {
      return OptionalLong.empty();
    }
    OptionalLong count = entry.get().raw();
    String name = entry.get().name().toLowerCase(Locale.ROOT);
    if (name.contains("32mib")) {
      return TelemetryValues.multiply(count, OptionalLong.of(32 * MIB));
    }
    if (name.contains("gib")) {
      return TelemetryValues.multiply(count, OptionalLong.of(GIB));
    }
    if (name.contains("mib")) {
      return TelemetryValues.multiply(count, OptionalLong.of(MIB));
    }
    return TelemetryValues.multiply(count, blockSize);
  }

  static List<SelfTestOutcome> selfTests(RawTelemetry raw) {
    List<SelfTestOutcome> outcomes = new ArrayList<>();
    raw.at("ata_smart_data", "self_test", "status", "passed")
        .flatMap(TelemetryValues::asBoolean)
        .ifPresent(passed -> outcomes.add(passed ? SelfTestOutcome.PASSED : SelfTestOutcome.FAILED));
    List<Object> log = raw.listAt("ata_smart_self_test_log", "extended", "table")
        .or(() -> raw.listAt("ata_smart_self_test_log", "standard", "table"))
        .orElse(List.of());
    for (Object row : log) {
      if (!(row instanceof Map<?, ?> entry) || !(entry.get("status") instanceof Map<?, ?> status)) {
        continue;
      }
      TelemetryValues.asBoolean(status.get("passed"))
          .ifPresent(passed -> outcomes.add(passed ? SelfTestOutcome.PASSED : SelfTestOutcome.FAILED));
    }
    return outcomes;
  }
}
