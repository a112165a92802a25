package ca.gc.cra.imagine.application.port;

import ca.gc.cra.imagine.domain.call.CallArguments;

/**
 * <strong>What:</strong> Port to the original computation behind an overridable callable.
 * <p><strong>Why:</strong> The engine only intercepts calls; it never inspects what the computation does.</p>
 * <p><strong>Role:</strong> External collaborator invoked by {@code Imagined} when no override applies.</p>
 * <p><strong>Thread-safety:</strong> Whatever the wrapped code provides.</p>
 * <p><strong>Observability:</strong> Failures propagate to the caller unchanged; the engine neither logs nor wraps
 * them.</p>
 *
 * @param <R> result type
 * @since 0.1.0
 */
@FunctionalInterface
public interface Computation<R> {
  /**
   * Computes the original result for {@code args}.
   *
   * @param args positional and keyword arguments of the call; never {@code null}
   * @return computed result
   */
  R compute(CallArguments args);
}
