/**
 * Input validation helpers shared by configuration records and CLI parsing.
 * <p><strong>Concurrency:</strong> Stateless utilities; safe for concurrent use.</p>
 * <p><strong>Errors:</strong> Violations raise {@link java.lang.IllegalArgumentException} with the offending
 * parameter name.</p>
 */
package ca.gc.cra.lumen.validation;
