/**
 * Socket transporters and wire codecs for the Emmy and LuaPanda protocols.
 *
 * <p>Every transporter owns one receive-loop thread; outbound writes are serialized under a lock.</p>
 */
package ca.gc.cra.lumen.infrastructure.transport;
