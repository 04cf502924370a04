/**
 * Command catalogs for the external diagnostic tools.
 */
package org.circulardrives.cdihealth.infrastructure.command;
