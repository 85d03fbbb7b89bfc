/**
 * Command-line entry points: {@code attach}, {@code panda} and {@code processes}, plus the interactive
 * console.
 */
package ca.gc.cra.lumen.api;
