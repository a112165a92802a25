package ca.gc.cra.imagine.application.engine;

import java.util.Objects;

/**
 * Handle returned by {@link Activation#enter()}; closing it exits the activation exactly once.
 *
 * <pre>{@code
 * try (Scope scope = f.at(1).imagine(2).enter()) {
 *   assert f.call(1) == 2;
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Scope implements AutoCloseable {
  private final Activation activation;
  private boolean closed;

  Scope(Activation activation) {
    this.activation = Objects.requireNonNull(activation, "activation");
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Exits the activation. Repeated calls are ignored.
   *
   * @throws UnbalancedActivationException in {@code fail} mode when the exit is out of order
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    activation.exit();
  }
}
