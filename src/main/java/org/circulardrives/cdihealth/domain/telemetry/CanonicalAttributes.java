package org.circulardrives.cdihealth.domain.telemetry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;

/**
 * <strong>What:</strong> Protocol-agnostic health attributes for one device.
 * <p><strong>Why:</strong> ATA, NVMe and SCSI tooling name, scale and omit fields differently; grading only ever
 * sees this record.</p>
 * <p><strong>Role:</strong> Domain value produced by a {@code TelemetryNormalizer} and consumed by the grading engine.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep "not reported" distinct from zero: every numeric field is an {@link OptionalLong}.</li>
 *   <li>Carry the protocol the record was normalized for so grading can pick its rule set.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; the self-test list is copied on construction.</p>
 *
 * @param protocol protocol the telemetry came from
 * @param telemetryObtained {@code false} when no usable telemetry was read at all
 * @param pendingSectors sectors awaiting remap
 * @param reallocatedSectors remapped sectors (grown defects on SCSI)
 * @param uncorrectableErrors uncorrectable errors; media and data integrity errors on NVMe
 * @param percentUsed estimated endurance consumed, in percent
 * @param availableSparePct remaining spare capacity, in percent
 * @param powerOnHours cumulative power-on hours
 * @param hostReadsBytes bytes read by the host
 * @param hostWritesBytes bytes written by the host
 * @param currentTemperature current temperature in Celsius
 * @param highestTemperature highest temperature in Celsius the device reported
 * @param warningTempMinutes minutes spent above the warning temperature
 * @param criticalTempMinutes minutes spent above the critical temperature
 * @param startStopCount spindle start/stop cycles
 * @param powerCycleCount power cycles
 * @param smartStatus overall SMART verdict when reported
 * @param selfTestOutcomes self-test results, most recent first as reported by the device
 * @since 0.1.0
 */
public record CanonicalAttributes(
    TransportProtocol protocol,
    boolean telemetryObtained,
    OptionalLong pendingSectors,
    OptionalLong reallocatedSectors,
    OptionalLong uncorrectableErrors,
    OptionalLong percentUsed,
    OptionalLong availableSparePct,
    OptionalLong powerOnHours,
    OptionalLong hostReadsBytes,
    OptionalLong hostWritesBytes,
    OptionalLong currentTemperature,
    OptionalLong highestTemperature,
    OptionalLong warningTempMinutes,
    OptionalLong criticalTempMinutes,
    OptionalLong startStopCount,
    OptionalLong powerCycleCount,
    Optional<Boolean> smartStatus,
    List<SelfTestOutcome> selfTestOutcomes) {

  public CanonicalAttributes {
    protocol = Objects.requireNonNullElse(protocol, TransportProtocol.UNKNOWN);
    pendingSectors = orEmpty(pendingSectors);
    reallocatedSectors = orEmpty(reallocatedSectors);
    uncorrectableErrors = orEmpty(uncorrectableErrors);
    percentUsed = orEmpty(percentUsed);
    availableSparePct = orEmpty(availableSparePct);
    powerOnHours = orEmpty(powerOnHours);
    hostReadsBytes = orEmpty(hostReadsBytes);
    hostWritesBytes = orEmpty(hostWritesBytes);
    currentTemperature = orEmpty(currentTemperature);
    highestTemperature = orEmpty(highestTemperature);
    warningTempMinutes = orEmpty(warningTempMinutes);
    criticalTempMinutes = orEmpty(criticalTempMinutes);
    startStopCount = orEmpty(startStopCount);
    powerCycleCount = orEmpty(powerCycleCount);
    smartStatus = Objects.requireNonNullElse(smartStatus, Optional.empty());
    selfTestOutcomes = selfTestOutcomes == null ? List.of() : List.copyOf(selfTestOutcomes);
  }

  /**
   * Returns the record for a device from which no telemetry could be read.
   *
   * @param protocol protocol classification from discovery
   * @return attributes with {@link #telemetryObtained()} {@code false} and every field not reported
   */
  public static CanonicalAttributes notObtained(TransportProtocol protocol) {
    return builder(protocol).telemetryObtained(false).build();
  }

  /**
   * Starts a builder for telemetry that was read successfully.
   *
   * @param protocol protocol the telemetry came from
   * @return builder with every field not reported
   */
  public static Builder builder(TransportProtocol protocol) {
    return new Builder(protocol);
  }

  /**
   * NVMe name for {@link #uncorrectableErrors()}.
   *
   * @return media and data integrity errors
   */
  public OptionalLong mediaErrors() {
    return uncorrectableErrors;
  }

  /**
   * Indicates whether any self-test outcome is a failure.
   *
   * @return {@code true} when at least one self-test failed
   */
  public boolean anySelfTestFailed() {
    return selfTestOutcomes.contains(SelfTestOutcome.FAILED);
  }

  private static OptionalLong orEmpty(OptionalLong value) {
    return value == null ? OptionalLong.empty() : value;
  }

  /** Mutable builder used by the protocol normalizers. */
  public static final class Builder {
    private final TransportProtocol protocol;
    private boolean telemetryObtained = true;
    private OptionalLong pendingSectors = OptionalLong.empty();
    private OptionalLong reallocatedSectors = OptionalLong.empty();
    private OptionalLong uncorrectableErrors = OptionalLong.empty();
    private OptionalLong percentUsed = OptionalLong.empty();
    private OptionalLong availableSparePct = OptionalLong.empty();
    private OptionalLong powerOnHours = OptionalLong.empty();
    private OptionalLong hostReadsBytes = OptionalLong.empty();
    private OptionalLong hostWritesBytes = OptionalLong.empty();
    private OptionalLong currentTemperature = OptionalLong.empty();
    private OptionalLong highestTemperature = OptionalLong.empty();
    private OptionalLong warningTempMinutes = OptionalLong.empty();
    private OptionalLong criticalTempMinutes = OptionalLong.empty();
    private OptionalLong startStopCount = OptionalLong.empty();
    private OptionalLong powerCycleCount = OptionalLong.empty();
    private Optional<Boolean> smartStatus = Optional.empty();
    private final List<SelfTestOutcome> selfTestOutcomes = new ArrayList<>();

    private Builder(TransportProtocol protocol) {
      this.protocol = protocol;
    }

    public Builder telemetryObtained(boolean value) {
      this.telemetryObtained = value;
      return this;
    }

    public Builder pendingSectors(OptionalLong value) {
      this.pendingSectors = value;
      return this;
    }

    public Builder reallocatedSectors(OptionalLong value) {
      this.reallocatedSectors = value;
      return this;
    }

    public Builder uncorrectableErrors(OptionalLong value) {
      this.uncorrectableErrors = value;
      return this;
    }

    public Builder percentUsed(OptionalLong value) {
      this.percentUsed = value;
      return this;
    }

    public Builder availableSparePct(OptionalLong value) {
      this.availableSparePct = value;
      return this;
    }

    public Builder powerOnHours(OptionalLong value) {
      this.powerOnHours = value;
      return this;
    }

    public Builder hostReadsBytes(OptionalLong value) {
      this.hostReadsBytes = value;
      return this;
    }

    public Builder hostWritesBytes(OptionalLong value) {
      this.hostWritesBytes = value;
      return this;
    }

    public Builder currentTemperature(OptionalLong value) {
      this.currentTemperature = value;
      return this;
    }

    public Builder highestTemperature(OptionalLong value) {
      this.highestTemperature = value;
      return this;
    }

    public Builder warningTempMinutes(OptionalLong value) {
      this.warningTempMinutes = value;
      return this;
    }

    public Builder criticalTempMinutes(OptionalLong value) {
      this.criticalTempMinutes = value;
      return this;
    }

    public Builder startStopCount(OptionalLong value) {
      this.startStopCount = value;
      return this;
    }

    public Builder powerCycleCount(OptionalLong value) {
      this.powerCycleCount = value;
      return this;
    }

    public Builder smartStatus(Optional<Boolean> value) {
      this.smartStatus = value;
      return this;
    }

    public Builder addSelfTest(SelfTestOutcome outcome) {
      this.selfTestOutcomes.add(Objects.requireNonNull(outcome, "outcome"));
      return this;
    }

    public Builder selfTests(List<SelfTestOutcome> outcomes) {
      outcomes.forEach(this::addSelfTest);
      return this;
    }

    public CanonicalAttributes build() {
      return new CanonicalAttributes(
          protocol,
          telemetryObtained,
          pendingSectors,
          reallocatedSectors,
          uncorrectableErrors,
          percentUsed,
          availableSparePct,
          powerOnHours,
          hostReadsBytes,
          hostWritesBytes,
          currentTemperature,
          highestTemperature,
          warningTempMinutes,
          criticalTempMinutes,
          startStopCount,
          powerCycleCount,
          smartStatus,
          selfTestOutcomes);
    }
  }
}
