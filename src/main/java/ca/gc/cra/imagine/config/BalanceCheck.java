package ca.gc.cra.imagine.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Reaction to an activation exiting while a different chain is active for its target.
 * <p><strong>Why:</strong> Out-of-order exits leave a callable's cursor inconsistent with caller intent; operators
 * choose whether to ignore, log, or fail on them.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 * <p><strong>Observability:</strong> {@link #WARN} and {@link #FAIL} both count
 * {@code <prefix>.activation.unbalanced}.</p>
 *
 * @since 0.1.0
 */
public enum BalanceCheck {
  /** Restore silently. */
  OFF,
  /** Restore and log a warning. */
  WARN,
  /** Restore, then throw {@code UnbalancedActivationException}. */
  FAIL;

  /**
   * Parses a string into a {@link BalanceCheck}, defaulting to {@link #WARN} when blank. {@code false} maps to
   * {@link #OFF} because YAML 1.1 reads an unquoted {@code off} as a boolean.
   *
   * @param value textual representation such as {@code "off"} or {@code "fail"}
   * @return parsed mode
   * @throws IllegalArgumentException if the string does not match a known mode
   */
  public static BalanceCheck fromString(String value) {
    if (value == null || value.isBlank()) {
      return WARN;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    if (normalized.equals("FALSE")) {
      return OFF;
    }
    try {
      return BalanceCheck.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown balanceCheck: " + value, ex);
    }
  }
}
