package ca.gc.cra.lumen.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by LUMEN CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards retry bounds, delays, ports and pids before the attach workflow or a
 * transporter allocates sockets and threads.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., ms, attempts)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and validates its range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value; {@code null} or blank yields {@code defaultValue}
   * @param defaultValue value used when {@code raw} is absent
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed and validated value
   * @throws IllegalArgumentException when {@code raw} is not numeric or out of range
   */
  public static long parseInRange(String name, String raw, long defaultValue, long min, long max) {
    if (raw == null || raw.isBlank()) {
      return requireRange(name, defaultValue, min, max);
    }
    long parsed;
    try {
      parsed = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name) + " must be numeric (was " + raw + ")", ex);
    }
    return requireRange(name, parsed, min, max);
  }
}
