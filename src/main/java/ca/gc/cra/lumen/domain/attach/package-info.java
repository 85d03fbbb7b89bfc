/**
 * Process-attach model: port derivation, target architecture, process listings, module scans and
 * attachment registry records.
 * <p><strong>Concurrency:</strong> All types are immutable value objects.</p>
 */
package ca.gc.cra.lumen.domain.attach;
