/**
 * Request/reply correlation shared by all transporters.
 */
package ca.gc.cra.lumen.application.callback;
