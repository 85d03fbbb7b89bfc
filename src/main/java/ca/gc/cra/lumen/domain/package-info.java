/**
 * Domain model of the LUMEN debugger engine. Pure Java value types with no I/O and no third-party
 * dependencies.
 */
package ca.gc.cra.lumen.domain;
