package ca.gc.cra.imagine.domain.scene;

import ca.gc.cra.imagine.domain.call.CallArguments;
import java.util.Objects;

/**
 * Guard that matches exactly one point of the input space.
 *
 * <p>Matching relies on {@link Object#equals(Object)} of every captured argument, so argument types used as override
 * points must implement value equality. Arrays are rejected when the point is captured; see
 * {@link ca.gc.cra.imagine.validation.Equality}.
 *
 * @param point the captured arguments
 * @since 0.1.0
 */
public record PointGuard(CallArguments point) implements Guard {

  public PointGuard {
    Objects.requireNonNull(point, "point");
  }

  @Override
  public boolean test(CallArguments args) {
    return point.equals(args);
  }

  @Override
  public String toString() {
    return "at" + point;
  }
}
