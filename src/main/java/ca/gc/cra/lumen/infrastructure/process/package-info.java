/**
 * Child-process adapters: helper tool invocation, process listing and module scanning.
 */
package ca.gc.cra.lumen.infrastructure.process;
