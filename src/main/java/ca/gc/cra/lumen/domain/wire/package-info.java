/**
 * Protocol-neutral wire envelope shared by every transporter and codec.
 * <p><strong>Concurrency:</strong> Messages are immutable once built and may cross thread boundaries freely.</p>
 */
package ca.gc.cra.lumen.domain.wire;
