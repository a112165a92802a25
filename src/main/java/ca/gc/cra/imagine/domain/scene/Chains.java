package ca.gc.cra.imagine.domain.scene;

import ca.gc.cra.imagine.domain.call.CallArguments;
import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> Algorithms over persistent scene chains.
 * <p><strong>Why:</strong> Centralizes head-to-root lookup and re-parenting so callers never mutate nodes.</p>
 * <p><strong>Role:</strong> Domain support used by wrapped callables and activations.</p>
 * <p><strong>Thread-safety:</strong> Stateless; chains are immutable.</p>
 * <p><strong>Performance:</strong> All operations are O(n) in chain length; {@link #graft(Scene, Scene)} allocates
 * n new scenes and shares {@code base} untouched.</p>
 *
 * @since 0.1.0
 */
public final class Chains {
  private Chains() {
    // Utility
  }

  /**
   * Finds the scene deciding the result of a call: the first one, walking from {@code head} toward the root, whose
   * guard accepts {@code args}.
   *
   * @param head chain head; {@code null} for the empty chain
   * @param args call arguments
   * @param <R> result type
   * @return the deciding scene, or {@code null} when the original computation should run
   */
  public static <R> Scene<R> find(Scene<R> head, CallArguments args) {
    for (Scene<R> p = head; p != null; p = p.parent()) {
      if (p.applies(args)) {
        return p;
      }
    }
    return null;
  }

  /**
   * Counts the scenes reachable from {@code head}.
   *
   * @param head chain head; may be {@code null}
   * @return chain length, {@code 0} for the empty chain
   */
  public static int length(Scene<?> head) {
    int n = 0;
    for (Scene<?> p = head; p != null; p = p.parent()) {
      n++;
    }
    return n;
  }

  /**
   * Re-links the scenes of {@code head} onto {@code base}. The result has the same guards and values in the same
   * order, but its root-most scene points at {@code base}. Neither input chain is modified.
   *
   * @param head chain to copy; may be {@code null}
   * @param base new ancestry; may be {@code null}
   * @param <R> result type
   * @return head of the grafted chain, or {@code base} when {@code head} is empty
   */
  public static <R> Scene<R> graft(Scene<R> head, Scene<R> base) {
    List<Scene<R>> scenes = new ArrayList<>();
    for (Scene<R> p = head; p != null; p = p.parent()) {
      scenes.add(p);
    }
    Scene<R> top = base;
    for (int i = scenes.size() - 1; i >= 0; i--) {
      top = scenes.get(i).withParent(top);
    }
    return top;
  }
}
