/**
 * Configuration records, YAML loading, source merging and the composition root.
 *
 * <p>Precedence is CLI over YAML over embedded defaults.</p>
 */
package ca.gc.cra.lumen.config;
