package ca.gc.cra.imagine.domain.scene;

import ca.gc.cra.imagine.domain.call.CallArguments;
import java.util.Objects;

/**
 * <strong>What:</strong> One immutable override fact linked to the scene beneath it.
 * <p><strong>Why:</strong> Persistent singly-linked chains let many activations share suffixes without copying.</p>
 * <p><strong>Role:</strong> Domain node of an override chain; {@code null} stands for the empty chain.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share. The value object itself is not copied.</p>
 * <p><strong>Performance:</strong> Constant-size node; extending a chain allocates exactly one scene.</p>
 *
 * <p>Scenes compare by identity. Two structurally identical chains built separately are different chains.
 *
 * @param <R> result type of the overridden callable
 * @since 0.1.0
 */
public final class Scene<R> {
  private final Scene<R> parent;
  private final Guard guard;
  private final R value;

  /**
   * Creates a scene on top of {@code parent}.
   *
   * @param parent scene beneath this one, or {@code null} for a chain root
   * @param guard predicate deciding where the override applies; use {@link Guard#ALWAYS} for every input
   * @param value substitute result; may be {@code null}
   */
  public Scene(Scene<R> parent, Guard guard, R value) {
    this.parent = parent;
    this.guard = Objects.requireNonNull(guard, "guard");
    this.value = value;
  }

  /** Scene beneath this one, or {@code null} at the chain root. */
  public Scene<R> parent() {
    return parent;
  }

  public Guard guard() {
    return guard;
  }

  public R value() {
    return value;
  }

  /**
   * Tests whether this scene's value applies to a call.
   *
   * @param args call arguments
   * @return {@code true} when the guard accepts {@code args}
   */
  public boolean applies(CallArguments args) {
    return guard.test(args);
  }

  /**
   * Copies this scene's guard and value onto a different parent.
   *
   * @param newParent parent of the copy; may be {@code null}
   * @return new scene; this scene is unchanged
   */
  public Scene<R> withParent(Scene<R> newParent) {
    return new Scene<>(newParent, guard, value);
  }

  @Override
  public String toString() {
    return "Scene[" + guard + " -> " + value + "]";
  }
}
