/**
 * <strong>Purpose:</strong> Adapters that connect the application ports to processes, files and telemetry backends.
 * <p><strong>Concurrency:</strong> The command executor and metrics adapters are called from probe workers.</p>
 *
 * @since 0.1.0
 */
package org.circulardrives.cdihealth.infrastructure;
