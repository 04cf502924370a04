package org.circulardrives.cdihealth.domain.grading;

/**
 * Non-fatal caveats attached to an otherwise passing result.
 *
 * @since 0.1.0
 */
public enum FlagReason {
  HEAVY_USE("HeavyUse"),
  TEMP_WARNING("TempWarning");

  private final String label;

  FlagReason(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
