package ca.gc.cra.imagine.application.engine;

import java.util.function.Supplier;

/**
 * <strong>What:</strong> Scoped handle that installs override chains on acquisition and restores the prior chains on
 * release.
 * <p><strong>Why:</strong> Overrides must stay confined to a delimited scope however that scope ends.</p>
 * <p><strong>Role:</strong> Implemented by {@link SceneActivation} (one callable) and {@link CompositeActivation}
 * (several, in order).</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Enter and exit a callable's activations from one thread only;
 * concurrent use corrupts the restore order. Callers that share callables across threads must lock externally.</p>
 *
 * <p>An activation may be entered again after it has exited, and may also be entered while already active; each
 * {@link #exit()} restores the state recorded by the matching {@link #enter()}. Exits must mirror entries: releasing
 * an activation that is not the most recently entered one for its target is a caller error, reported according to
 * the engine's {@code balanceCheck} setting but never repaired.
 *
 * @since 0.1.0
 */
public interface Activation {
  /**
   * Installs this activation's chains.
   *
   * @return scope whose {@link Scope#close()} calls {@link #exit()}; use it with try-with-resources
   */
  Scope enter();

  /**
   * Restores the chains that were active before the matching {@link #enter()}.
   *
   * @throws IllegalStateException if there is no open entry to exit
   * @throws UnbalancedActivationException in {@code fail} mode when the exit is out of order
   */
  void exit();

  /**
   * Groups this activation with {@code other}; the result enters this one first and exits it last.
   *
   * @param other activation to enter after this one
   * @return composite activation
   */
  Activation combine(Activation other);

  /**
   * Re-parents this activation's chains onto whatever is active for each target right now.
   *
   * @return activation layering this one's overrides on top of the live ones
   */
  Activation rebase();

  /**
   * Runs {@code body} with this activation entered, exiting on every path.
   *
   * @param body code to run
   */
  default void run(Runnable body) {
    try (Scope ignored = enter()) {
      body.run();
    }
  }

  /**
   * Evaluates {@code body} with this activation entered, exiting on every path.
   *
   * @param body code to evaluate
   * @param <T> result type
   * @return {@code body}'s result
   */
  default <T> T supply(Supplier<T> body) {
    try (Scope ignored = enter()) {
      return body.get();
    }
  }
}
