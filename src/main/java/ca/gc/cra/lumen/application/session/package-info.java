/**
 * Debug session engine: the serial session driver, breakpoint synchronization and top-frame selection.
 * <p><strong>Concurrency:</strong> Each session owns a single-threaded driver; transporter receive loops and
 * attach workers only enqueue work onto it.</p>
 */
package ca.gc.cra.lumen.application.session;
