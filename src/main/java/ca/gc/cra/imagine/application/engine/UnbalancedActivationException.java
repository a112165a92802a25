package ca.gc.cra.imagine.application.engine;

/**
 * Raised in {@code fail} mode when an activation exits while a different chain is active for its target.
 *
 * <p>The requested restore has already happened when this is thrown.
 *
 * @since 0.1.0
 */
public final class UnbalancedActivationException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final String target;

  public UnbalancedActivationException(String target, String message) {
    super(message);
    this.target = target;
  }

  /** Name of the callable whose activations were released out of order. */
  public String target() {
    return target;
  }
}
