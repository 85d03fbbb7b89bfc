/**
 * Script providers for the Emmy helper: bundled classpath resources and user files.
 */
package ca.gc.cra.lumen.infrastructure.script;
