package org.circulardrives.cdihealth.application.grading;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import org.circulardrives.cdihealth.domain.device.TransportProtocol;
import org.circulardrives.cdihealth.domain.grading.FailureReason;
import org.circulardrives.cdihealth.domain.grading.ThresholdPolicy;
import org.circulardrives.cdihealth.domain.telemetry.CanonicalAttributes;
import org.junit.jupiter.api.Test;

class GradingRulesTest {

  @Test
  void scsiSharesTheAtaRuleSet() {
    assertSame(GradingRules.forProtocol(TransportProtocol.ATA), GradingRules.forProtocol(TransportProtocol.SCSI));
    assertEquals(
        List.of(GradingRules.PENDING_SECTORS, GradingRules.REALLOCATED_SECTORS, GradingRules.PERCENT_USED,
            GradingRules.AVAILABLE_SPARE),
        GradingRules.forProtocol(TransportProtocol.SCSI));
  }

  @Test
  void nvmeRuleOrder() {
    assertEquals(
        List.of(GradingRules.PERCENT_USED, GradingRules.AVAILABLE_SPARE, GradingRules.MEDIA_ERRORS,
            GradingRules.CRITICAL_TEMP),
        GradingRules.forProtocol(TransportProtocol.NVME));
  }

  @Test
  void absentValuesNeverFire() {
    CanonicalAttributes empty = CanonicalAttributes.builder(TransportProtocol.NVME).build();

    for (GradingRule rule : GradingRules.forProtocol(TransportProtocol.NVME)) {
      assertTrue(rule.evaluate(empty, ThresholdPolicy.defaults()).isEmpty());
    }
  }

  @Test
  void criticalTemperatureFiresOnAnyMinuteByDefault() {
    CanonicalAttributes attrs = CanonicalAttributes.builder(TransportProtocol.NVME)
        .criticalTempMinutes(OptionalLong.of(1))
        .build();

    assertEquals(Optional.of(FailureReason.CRITICAL_TEMP),
        GradingRules.CRITICAL_TEMP.evaluate(attrs, ThresholdPolicy.defaults()));
  }
}
