package ca.gc.cra.imagine.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by configuration parsing and backtracking.
 * <p><strong>Why:</strong> Rejects out-of-range log budgets and history offsets before they reach the engine.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Throws {@link IllegalArgumentException} when validation fails.
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
   * @param value candidate value
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
   * @param name configuration key used in diagnostics
   * @param raw textual value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or lies outside {@code [min, max]}
   */
  public static int parseInt(String name, String raw, int min, int max) {
    int parsed;
    try {
      parsed = Integer.parseInt(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was " + raw + ")", ex);
    }
    return (int) requireRange(name, parsed, min, max);
  }
}
