/**
 * Process attach: helper-tool layout, the inject-and-connect workflow and the process-wide attachment
 * registry.
 */
package ca.gc.cra.lumen.application.attach;
