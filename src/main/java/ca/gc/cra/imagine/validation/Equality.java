package ca.gc.cra.imagine.validation;

import ca.gc.cra.imagine.domain.call.CallArguments;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Checks that captured override points can be compared by value.
 * <p><strong>Why:</strong> Point guards match calls through {@link Object#equals(Object)}. Java arrays only compare by
 * identity, so a point containing one would silently never match a fresh call.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Performance:</strong> One pass over the captured arguments, including nested collections and maps. Other
 * {@link Iterable}s such as {@link java.nio.file.Path} are treated as opaque values: they may iterate over themselves
 * or be single-use.</p>
 *
 * @since 0.1.0
 */
public final class Equality {
  private Equality() {
    // Utility
  }

  /**
   * Rejects override points that contain arrays anywhere in their arguments.
   *
   * @param point captured arguments
   * @return {@code point} for fluent call sites
   * @throws IllegalArgumentException naming the first offending argument
   */
  public static CallArguments requireValueComparable(CallArguments point) {
    Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    List<Object> positional = point.positional();
    for (int i = 0; i < positional.size(); i++) {
      check("argument " + i, positional.get(i), visited);
    }
    for (Map.Entry<String, Object> entry : point.keywords().entrySet()) {
      check("keyword " + entry.getKey(), entry.getValue(), visited);
    }
    return point;
  }

  private static void check(String label, Object value, Set<Object> visited) {
    if (value == null) {
      return;
    }
    if (value.getClass().isArray()) {
      throw new IllegalArgumentException(
          label + " is an array (" + value.getClass().getSimpleName()
              + "); arrays compare by identity and cannot key an override, use a List instead");
    }
    if (value instanceof Collection<?> items) {
      if (visited.add(items)) {
        for (Object item : items) {
          check(label, item, visited);
        }
      }
    } else if (value instanceof Map<?, ?> map) {
      if (visited.add(map)) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
          check(label, entry.getKey(), visited);
          check(label, entry.getValue(), visited);
        }
      }
    }
  }
}
