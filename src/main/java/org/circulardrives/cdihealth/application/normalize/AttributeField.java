package org.circulardrives.cdihealth.application.normalize;

/**
 * Column of a SMART attribute table entry a caller wants.
 *
 * @since 0.1.0
 */
public enum AttributeField {
  /** Vendor raw counter ({@code raw.value}). */
  RAW,
  /** Normalized value, usually counting down from 100 or 200. */
  NORMALIZED,
  /** Worst normalized value seen. */
  WORST,
  /** Vendor failure threshold for the normalized value. */
  THRESHOLD
}
