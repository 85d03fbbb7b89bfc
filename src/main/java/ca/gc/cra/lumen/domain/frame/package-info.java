/**
 * Immutable stack-frame and variable snapshots produced from break notifications and evaluation replies.
 */
package ca.gc.cra.lumen.domain.frame;
