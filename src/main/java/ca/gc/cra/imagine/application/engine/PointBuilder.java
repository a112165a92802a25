package ca.gc.cra.imagine.application.engine;

import ca.gc.cra.imagine.domain.call.CallArguments;
import ca.gc.cra.imagine.domain.scene.Guard;
import ca.gc.cra.imagine.domain.scene.PointGuard;
import ca.gc.cra.imagine.domain.scene.Scene;
import ca.gc.cra.imagine.validation.Equality;
import java.util.Objects;

/**
 * <strong>What:</strong> First half of {@code at(...).imagine(value)}: a frozen point (or sub-domain) waiting for its
 * substitute value.
 * <p><strong>Why:</strong> Separating the point from the value lets one point be bound to several values:
 * <pre>{@code
 * PointBuilder<Integer> at = f.at(3);
 * for (int i = 0; i < 3; i++) {
 *   at.imagine(i).run(() -> report(f.call(3)));
 * }
 * }</pre>
 * <p><strong>Role:</strong> Bound to the chain that was active (or the activation head it was chained from) when it
 * was created. Building never touches the callable's cursor.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param <R> result type of the target callable
 * @since 0.1.0
 */
public final class PointBuilder<R> {
  private final Imagined<R> target;
  private final Scene<R> base;
  private final CallArguments point;
  private final Guard guard;

  private PointBuilder(Imagined<R> target, Scene<R> base, CallArguments point, Guard guard) {
    this.target = target;
    this.base = base;
    this.point = point;
    this.guard = guard;
  }

  static <R> PointBuilder<R> atPoint(Imagined<R> target, Scene<R> base, CallArguments point) {
    return new PointBuilder<>(target, base, Objects.requireNonNull(point, "point"), null);
  }

  static <R> PointBuilder<R> where(Imagined<R> target, Scene<R> base, Guard guard) {
    return new PointBuilder<>(target, base, null, Objects.requireNonNull(guard, "guard"));
  }

  /**
   * Binds {@code value} to this builder's point, producing a new scene on top of the builder's base chain.
   *
   * @param value substitute result; may be {@code null}
   * @return activation that installs the extended chain when entered
   * @throws IllegalArgumentException if the captured point contains an array, which cannot be compared by value
   */
  public SceneActivation<R> imagine(R value) {
    Guard effective = guard != null ? guard : new PointGuard(Equality.requireValueComparable(point));
    return new SceneActivation<>(target, new Scene<>(base, effective, value));
  }

  @Override
  public String toString() {
    return target.name() + (guard != null ? ".when(" + guard + ")" : ".at" + point);
  }
}
