/**
 * File-system source resolution used for top-frame selection.
 */
package ca.gc.cra.lumen.infrastructure.source;
