/**
 * Executor and thread factories with consistent naming and uncaught-exception logging.
 */
package ca.gc.cra.lumen.infrastructure.exec;
