/**
 * Logging utilities that tune verbosity and keep captured tool output within a readable budget.
 *
 * @since 0.1.0
 */
package org.circulardrives.cdihealth.logging;
