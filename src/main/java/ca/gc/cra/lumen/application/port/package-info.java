/**
 * Ports (interfaces) between the LUMEN application layer and its adapters: transporters, helper processes,
 * script and breakpoint sources, metrics, clock and platform facts.
 * <p><strong>Concurrency:</strong> Each port documents its threading contract; implementations must honour it.</p>
 */
package ca.gc.cra.lumen.application.port;
