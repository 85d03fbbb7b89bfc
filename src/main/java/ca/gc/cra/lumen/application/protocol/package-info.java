/**
 * Debugger dialects: payload construction and interpretation for Emmy and LuaPanda, plus expression and
 * helper-script preparation.
 */
package ca.gc.cra.lumen.application.protocol;
