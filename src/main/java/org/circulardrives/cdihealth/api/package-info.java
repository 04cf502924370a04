/**
 * <strong>Purpose:</strong> Command-line entry points: the {@code cdi-health} dispatcher and its {@code scan},
 * {@code discover} and {@code grade} commands.
 * <p>Reports go to stdout through {@link org.circulardrives.cdihealth.api.CliPrinter}; logs go to stderr.</p>
 *
 * @since 0.1.0
 */
package org.circulardrives.cdihealth.api;
