package ca.gc.cra.imagine.application.engine;

import ca.gc.cra.imagine.domain.scene.Scene;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-callable pointer to the active chain head, plus the heads that were active before each open activation.
 *
 * <p>Not thread-safe. {@code history.get(i)} is the head that was active when the {@code (i + 1)}-th currently open
 * activation was entered.
 */
final class Cursor<R> {
  private Scene<R> active;
  private final List<Scene<R>> history;

  Cursor() {
    this(null, new ArrayList<>());
  }

  private Cursor(Scene<R> active, List<Scene<R>> history) {
    this.active = active;
    this.history = history;
  }

  Scene<R> active() {
    return active;
  }

  /** Number of open activations. */
  int depth() {
    return history.size();
  }

  /**
   * Installs {@code head}, remembering the previous one.
   *
   * @return history depth before the push
   */
  int push(Scene<R> head) {
    int depth = history.size();
    history.add(active);
    active = head;
    return depth;
  }

  /** Reinstalls {@code prior} and truncates history back to {@code depth} entries. */
  void restore(Scene<R> prior, int depth) {
    active = prior;
    while (history.size() > depth) {
      history.remove(history.size() - 1);
    }
  }

  /**
   * Head that was active {@code activations} entries ago; {@code 0} is the current head.
   *
   * @param activations offset in {@code [0, depth()]}
   */
  Scene<R> activeAgo(int activations) {
    return activations == 0 ? active : history.get(history.size() - activations);
  }

  /** Detached copy positioned {@code activations} entries back. */
  Cursor<R> snapshot(int activations) {
    return new Cursor<>(
        activeAgo(activations),
        new ArrayList<>(history.subList(0, history.size() - activations)));
  }
}
