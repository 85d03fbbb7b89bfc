package ca.gc.cra.lumen.infrastructure.transport;

import ca.gc.cra.lumen.domain.wire.WireMessage;
import java.io.BufferedReader;
import java.io.IOException;

/**
 * Framing and encoding of {@link WireMessage}s for one debugger dialect.
 *
 * @since 0.1.0
 */
public interface WireCodec {

  /**
   * Reads the next complete frame, without its terminator.
   *
   * @param reader buffered UTF-8 reader over the socket input
   * @return frame text, or {@code null} at end of stream
   * @throws IOException when the read fails
   */
  String readFrame(BufferedReader reader) throws IOException;

  /**
   * Decodes one frame.
   *
   * @param frame frame text returned by {@link #readFrame(BufferedReader)}
   * @return decoded message
   * @throws IllegalArgumentException when the frame is malformed; the connection stays open
   */
  WireMessage decode(String frame);

  /**
   * Encodes a message into its complete on-wire text, including terminators.
   *
   * @param message message to encode
   * @return wire text
   * @throws IllegalArgumentException when the dialect has no representation for the command
   */
  String encode(WireMessage message);

  /**
   * URI scheme used by {@code describe()}, e.g. {@code emmy}.
   *
   * @return scheme
   */
  String scheme();
}
