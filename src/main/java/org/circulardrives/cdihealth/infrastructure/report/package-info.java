/**
 * Report sinks: console table and JSON file.
 */
package org.circulardrives.cdihealth.infrastructure.report;
