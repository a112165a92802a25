package ca.gc.cra.imagine.validation;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for names and configuration text.
 * <p><strong>Why:</strong> Callable names and metric prefixes end up in log lines and metric identifiers, so they
 * must be printable and non-blank.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Normalize metric prefixes to the supported character set.</li>
 *   <li>Parse boolean switches strictly.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities.</p>
 * <p><strong>Observability:</strong> Validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern METRIC_PREFIX = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Validates a dotted metric prefix such as {@code imagine} or {@code app.whatif}.
   *
   * @param name configuration key for diagnostics
   * @param value candidate prefix
   * @return trimmed prefix without trailing dots
   * @throws IllegalArgumentException if the prefix is blank or uses characters outside {@code [A-Za-z0-9._-]}
   */
  public static String requireMetricPrefix(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    while (trimmed.endsWith(".")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    if (!METRIC_PREFIX.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(message(name, "must match [A-Za-z][A-Za-z0-9._-]* (was " + value + ")"));
    }
    return trimmed;
  }

  /**
   * Parses {@code true}/{@code false} (case-insensitive) and rejects anything else.
   *
   * @param name configuration key for diagnostics
   * @param value candidate text
   * @return parsed flag
   * @throws IllegalArgumentException if the value is neither {@code true} nor {@code false}
   */
  public static boolean parseBoolean(String name, String value) {
    String normalized = requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(message(name, "must be true or false (was " + value + ")"));
    };
  }

  private static boolean containsControl(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    return (name == null || name.isBlank() ? "value" : name) + ' ' + suffix;
  }
}
