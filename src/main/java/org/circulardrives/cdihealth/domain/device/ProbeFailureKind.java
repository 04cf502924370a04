package org.circulardrives.cdihealth.domain.device;

/**
 * Why a device ended up in the failures list instead of the results list.
 *
 * @since 0.1.0
 */
public enum ProbeFailureKind {
  /** The scan reported the device could not be opened. */
  OPEN_ERROR,
  /** The probe exceeded its time box. */
  TIMEOUT,
  /** The diagnostic command could not be run or reported a fatal exit status. */
  COMMAND_FAILED,
  /** The command output was empty or not valid JSON. */
  UNPARSEABLE,
  /** Cancellation was requested before the probe started. */
  CANCELLED,
  /** No normalizer exists for the device protocol. */
  UNSUPPORTED_PROTOCOL,
  /** Any other failure raised while assessing the device. */
  INTERNAL
}
