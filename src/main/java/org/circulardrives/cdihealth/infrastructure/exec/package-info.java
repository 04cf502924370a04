/**
 * Process execution and the probe worker pool.
 */
package org.circulardrives.cdihealth.infrastructure.exec;
