package ca.gc.cra.imagine.domain.call;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One point in a callable's input space: positional plus keyword arguments.
 * <p><strong>Why:</strong> Guards and original computations need a single value describing a call so overrides can be
 * keyed on it.</p>
 * <p><strong>Role:</strong> Domain value passed from wrapped callables to guards and computations.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for sharing. Argument objects themselves are not copied.</p>
 * <p><strong>Performance:</strong> Copies argument containers once at construction.</p>
 * <p><strong>Observability:</strong> {@link #toString()} renders {@code (1, 2, scale=3)} for log lines.</p>
 *
 * <p>Equality compares positional lists element-wise and keyword maps by content, ignoring keyword order. A keyword
 * omitted from one point and present in another makes the points different even when the present value equals the
 * callable's default.
 *
 * @param positional positional arguments in call order; may contain {@code null} elements
 * @param keywords keyword arguments by name; values may be {@code null}
 * @since 0.1.0
 */
public record CallArguments(List<Object> positional, Map<String, Object> keywords) {
  private static final CallArguments EMPTY = new CallArguments(List.of(), Map.of());

  /**
   * Creates an argument set, taking defensive copies of both containers.
   *
   * @throws NullPointerException if either container or a keyword name is {@code null}
   */
  public CallArguments {
    Objects.requireNonNull(positional, "positional");
    Objects.requireNonNull(keywords, "keywords");
    positional = Collections.unmodifiableList(new ArrayList<>(positional));
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : keywords.entrySet()) {
      copy.put(Objects.requireNonNull(entry.getKey(), "keyword name"), entry.getValue());
    }
    keywords = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the argument set of a call without arguments.
   *
   * @return shared empty instance
   */
  public static CallArguments empty() {
    return EMPTY;
  }

  /**
   * Builds an argument set from positional arguments only.
   *
   * @param positional positional arguments; a {@code null} array is treated as a single {@code null} argument
   * @return argument set without keywords
   */
  public static CallArguments of(Object... positional) {
    if (positional == null) {
      return new CallArguments(Collections.singletonList(null), Map.of());
    }
    return new CallArguments(Arrays.asList(positional), Map.of());
  }

  /**
   * Returns a copy of this argument set with one keyword argument added or replaced.
   *
   * @param name keyword name; must not be {@code null}
   * @param value keyword value; may be {@code null}
   * @return new argument set
   */
  public CallArguments with(String name, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(keywords);
    copy.put(Objects.requireNonNull(name, "name"), value);
    return new CallArguments(positional, copy);
  }

  /**
   * Returns the positional argument at {@code index}, cast to the caller's type.
   *
   * @param index zero-based position
   * @param <T> expected argument type
   * @return argument value; may be {@code null}
   * @throws IndexOutOfBoundsException if fewer arguments were supplied
   */
  @SuppressWarnings("unchecked")
  public <T> T get(int index) {
    return (T) positional.get(index);
  }

  /**
   * Returns the keyword argument named {@code name}, or {@code defaultValue} when it was not supplied.
   *
   * @param name keyword name
   * @param defaultValue value used when the keyword is absent
   * @param <T> expected argument type
   * @return keyword value or the default
   */
  @SuppressWarnings("unchecked")
  public <T> T keyword(String name, T defaultValue) {
    if (!keywords.containsKey(name)) {
      return defaultValue;
    }
    return (T) keywords.get(name);
  }

  /** Number of positional arguments. */
  public int size() {
    return positional.size();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(");
    boolean first = true;
    for (Object arg : positional) {
      if (!first) {
        sb.append(", ");
      }
      sb.append(render(arg));
      first = false;
    }
    for (Map.Entry<String, Object> entry : keywords.entrySet()) {
      if (!first) {
        sb.append(", ");
      }
      sb.append(entry.getKey()).append('=').append(render(entry.getValue()));
      first = false;
    }
    return sb.append(')').toString();
  }

  private static String render(Object value) {
    if (value instanceof Object[] array) {
      return Arrays.deepToString(array);
    }
    return String.valueOf(value);
  }
}
