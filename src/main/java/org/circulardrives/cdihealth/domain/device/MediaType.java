package org.circulardrives.cdihealth.domain.device;

/**
 * Physical media behind a device, derived from its reported rotation rate.
 *
 * @since 0.1.0
 */
public enum MediaType {
  HDD,
  SSD,
  UNKNOWN
}
