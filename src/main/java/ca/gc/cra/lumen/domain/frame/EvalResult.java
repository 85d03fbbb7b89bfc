package ca.gc.cra.lumen.domain.frame;

import java.util.Objects;

/**
 * Outcome of an expression evaluation.
 *
 * @param success whether the runtime evaluated the expression
 * @param value resulting value when successful, otherwise {@code null}
 * @param error runtime error text when unsuccessful, otherwise {@code null}
 * @since 0.1.0
 */
public record EvalResult(boolean success, Variable value, String error) {

  public EvalResult {
    if (success) {
      Objects.requireNonNull(value, "value");
    }
  }

  public static EvalResult ok(Variable value) {
    return new EvalResult(true, value, null);
  }

  public static EvalResult failed(String error) {
    return new EvalResult(false, null, Objects.requireNonNullElse(error, "evaluation failed"));
  }
}
