package ca.gc.cra.imagine.domain.scene;

import ca.gc.cra.imagine.domain.call.CallArguments;

/**
 * <strong>What:</strong> Predicate deciding whether a {@link Scene}'s value applies to a call.
 * <p><strong>Why:</strong> Lets a scene cover a single point, a sub-domain, or the whole input space.</p>
 * <p><strong>Role:</strong> Domain strategy consulted by {@link Chains#find(Scene, CallArguments)}.</p>
 * <p><strong>Thread-safety:</strong> Implementations should be stateless; guards are shared across chains.</p>
 * <p><strong>Performance:</strong> Evaluated once per visited scene on every call; keep it cheap.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Guard {
  /**
   * Tests whether the guarded override applies to {@code args}.
   *
   * @param args arguments of the call being resolved; never {@code null}
   * @return {@code true} when the scene's value should be returned
   */
  boolean test(CallArguments args);

  /** Guard that matches every call; turns the callable into a constant. */
  Guard ALWAYS = new Guard() {
    @Override
    public boolean test(CallArguments args) {
      return true;
    }

    @Override
    public String toString() {
      return "*";
    }
  };
}
