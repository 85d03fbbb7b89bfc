/**
 * Debug session vocabulary: lifecycle states, protocol selection, failure categories and the events a
 * session publishes to its listeners.
 */
package ca.gc.cra.lumen.domain.session;
