/**
 * <strong>Purpose:</strong> Configuration loading, merge precedence and object-graph wiring.
 * <p>Settings resolve as CLI &gt; YAML &gt; embedded defaults and are validated into immutable records before
 * any device is touched.</p>
 *
 * @since 0.1.0
 */
package org.circulardrives.cdihealth.config;
