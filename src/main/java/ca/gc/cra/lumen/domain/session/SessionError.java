package ca.gc.cra.lumen.domain.session;

import java.util.Objects;

/**
 * Terminal error event delivered to session listeners before the session stops.
 *
 * @param kind failure category
 * @param message human-readable reason, including hints where the category provides them
 * @param cause underlying exception, or {@code null}
 * @since 0.1.0
 */
public record SessionError(FailureKind kind, String message, Throwable cause) {

  public SessionError {
    Objects.requireNonNull(kind, "kind");
    message = Objects.requireNonNullElse(message, kind.name());
  }
}
