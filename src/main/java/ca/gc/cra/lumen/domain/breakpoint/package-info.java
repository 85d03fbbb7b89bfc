/**
 * Breakpoint model: IDE-side breakpoint objects, session-local handles and wire descriptors.
 */
package ca.gc.cra.lumen.domain.breakpoint;
