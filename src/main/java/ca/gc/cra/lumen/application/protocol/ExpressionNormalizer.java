package ca.gc.cra.lumen.application.protocol;

/**
 * Rewrites watch expressions into a form the debuggee can evaluate.
 *
 * <p>A trailing method reference {@code obj:method} is not valid Lua outside a call, so the last colon is
 * turned into a dot when it comes after the last dot. Calls ({@code obj:method()}) are left alone.</p>
 *
 * @since 0.1.0
 */
public final class ExpressionNormalizer {

  private ExpressionNormalizer() {
    // Utility
  }

  /**
   * Normalizes an expression.
   *
   * @param expression raw expression; {@code null} yields an empty string
   * @return normalized expression
   */
  public static String normalize(String expression) {
    if (expression == null) {
      return "";
    }
    String expr = expression.trim();
    if (expr.endsWith(")")) {
      return expr;
    }
    int lastDot = expr.lastIndexOf('.');
    int lastColon = expr.lastIndexOf(':');
    if (lastColon > lastDot) {
      return expr.substring(0, lastColon) + "." + expr.substring(lastColon + 1);
    }
    return expr;
  }
}
