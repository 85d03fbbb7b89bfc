/**
 * JSON encoding and decoding for wire codecs, built on the Jackson streaming API.
 */
package ca.gc.cra.lumen.infrastructure.json;
