package ca.gc.cra.lumen.domain.wire;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed envelope exchanged over a transporter connection.
 * <p><strong>Why:</strong> Separates the command, its structured payload and the correlation token so the
 * callback registry can match replies without understanding payload shapes.</p>
 * <p><strong>Thread-safety:</strong> Immutable at the top level; nested maps and lists are treated as read-only
 * by convention once a message is built.</p>
 *
 * @param command neutral command; never {@code null}
 * @param payload structured body (maps, lists, strings, numbers, booleans, nulls); never {@code null}
 * @param correlationId token linking a request to its reply; {@link #NO_CORRELATION} for notifications
 * @param rawCommand command name as seen on the wire, or {@code null} when built locally
 * @since 0.1.0
 */
public record WireMessage(
    WireCommand command,
    Map<String, Object> payload,
    String correlationId,
    String rawCommand) {

  /** Sentinel correlation id carried by messages that expect no reply. */
  public static final String NO_CORRELATION = "0";

  /**
   * Normalizes the payload into an unmodifiable insertion-ordered map and the correlation id to the
   * sentinel when absent.
   */
  public WireMessage {
    Objects.requireNonNull(command, "command");
    payload = payload == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    correlationId = (correlationId == null || correlationId.isBlank())
        ? NO_CORRELATION
        : correlationId.trim();
  }

  /**
   * Creates an uncorrelated message.
   *
   * @param command neutral command
   * @param payload structured body; {@code null} means empty
   * @return new message
   */
  public static WireMessage of(WireCommand command, Map<String, Object> payload) {
    return new WireMessage(command, payload, NO_CORRELATION, null);
  }

  /**
   * Creates an uncorrelated message with an empty payload.
   *
   * @param command neutral command
   * @return new message
   */
  public static WireMessage of(WireCommand command) {
    return of(command, Map.of());
  }

  /**
   * Returns a copy carrying the supplied correlation id.
   *
   * @param id correlation id
   * @return new message
   */
  public WireMessage withCorrelationId(String id) {
    return new WireMessage(command, payload, id, rawCommand);
  }

  /**
   * Indicates whether this message carries a correlation id that may match a pending callback.
   *
   * @return {@code false} for the sentinel
   */
  public boolean isCorrelated() {
    return !NO_CORRELATION.equals(correlationId);
  }

  /**
   * Name used for logging: the raw wire name when known, otherwise the neutral command.
   *
   * @return display name
   */
  public String displayName() {
    return rawCommand != null ? command + "(" + rawCommand + ")" : command.name();
  }
}
