/**
 * Logging helpers layered on SLF4J with Logback as the runtime backend.
 * <p><strong>Role:</strong> Cross-cutting utilities used by the CLI, transporters and the attach workflow.</p>
 * <p><strong>MDC keys:</strong> {@code session} (debug session id) and {@code pid} (attach target).</p>
 */
package ca.gc.cra.lumen.logging;
