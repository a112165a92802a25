package ca.gc.cra.imagine.application.engine;

import ca.gc.cra.imagine.application.port.Computation;
import ca.gc.cra.imagine.domain.call.CallArguments;
import ca.gc.cra.imagine.domain.scene.Chains;
import ca.gc.cra.imagine.domain.scene.Guard;
import ca.gc.cra.imagine.domain.scene.Scene;
import ca.gc.cra.imagine.logging.Logs;
import ca.gc.cra.imagine.validation.Numbers;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> A callable whose results can be temporarily overridden for chosen inputs.
 * <p><strong>Why:</strong> Explores alternative computed values without touching the original computation or its
 * call sites: every caller holding this object sees the overrides while they are active.</p>
 * <p><strong>Role:</strong> Adapter around a {@link Computation}, created by {@link ImagineEngine#wrap}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve calls against the active override chain, newest scene first, before computing.</li>
 *   <li>Start point, sub-domain and universal overrides on top of the active chain.</li>
 *   <li>Expose earlier states of the chain through {@link #backtrack(int)}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. The active chain is shared mutable state; confine a callable
 * and its activations to one thread.</p>
 * <p><strong>Observability:</strong> Counts {@code <prefix>.call.imagined} and {@code <prefix>.call.computed};
 * traces every resolution at TRACE.</p>
 *
 * <pre>{@code
 * Imagined<Integer> f = Imagine.unary((Integer x) -> x + 1);
 * f.call(0);                                   // 1
 * try (Scope s = f.at(0).imagine(-1).enter()) {
 *   f.call(0);                                 // -1
 * }
 * f.call(0);                                   // 1
 * }</pre>
 *
 * @param <R> result type
 * @since 0.1.0
 */
public final class Imagined<R> {
  private static final Logger log = LoggerFactory.getLogger(Imagined.class);

  private final String name;
  private final Computation<R> body;
  private final Cursor<R> cursor;
  private final ImagineEngine engine;

  Imagined(String name, Computation<R> body, Cursor<R> cursor, ImagineEngine engine) {
    this.name = name;
    this.body = Objects.requireNonNull(body, "body");
    this.cursor = cursor;
    this.engine = engine;
  }

  public String name() {
    return name;
  }

  /**
   * Calls with positional arguments only.
   *
   * @param positional arguments
   * @return the imagined value for this point, or the computed one
   */
  public R call(Object... positional) {
    return call(CallArguments.of(positional));
  }

  /**
   * Resolves a call: the newest active scene whose guard matches decides the result; otherwise the original
   * computation runs. Never changes which overrides are active. Exceptions from the computation propagate unchanged.
   *
   * @param args positional and keyword arguments
   * @return imagined or computed result
   */
  public R call(CallArguments args) {
    Objects.requireNonNull(args, "args");
    Scene<R> hit = Chains.find(cursor.active(), args);
    if (hit != null) {
      engine.metrics().increment(engine.metric("call.imagined"));
      if (log.isTraceEnabled()) {
        int budget = engine.config().logArgumentBytes();
        log.trace("{}{} imagined as {}", name, Logs.render(args, budget), Logs.render(hit.value(), budget));
      }
      return hit.value();
    }
    engine.metrics().increment(engine.metric("call.computed"));
    if (log.isTraceEnabled()) {
      log.trace("{}{} computed", name, Logs.render(args, engine.config().logArgumentBytes()));
    }
    return body.compute(args);
  }

  /**
   * Freezes a point of the input space on top of the currently active chain.
   *
   * @param positional positional components of the point
   * @return builder awaiting the substitute value
   */
  public PointBuilder<R> at(Object... positional) {
    return at(CallArguments.of(positional));
  }

  /**
   * Freezes a point, including keyword arguments. A keyword omitted here is a different point from the same keyword
   * passed with its default value.
   *
   * @param point full point
   * @return builder awaiting the substitute value
   */
  public PointBuilder<R> at(CallArguments point) {
    return PointBuilder.atPoint(this, cursor.active(), point);
  }

  /**
   * Freezes a sub-domain of the input space, on top of the currently active chain.
   *
   * @param guard predicate selecting the overridden calls
   * @return builder awaiting the substitute value
   */
  public PointBuilder<R> when(Guard guard) {
    return PointBuilder.where(this, cursor.active(), guard);
  }

  /**
   * Overrides every input on top of the currently active chain, turning the callable into a constant until a newer
   * scene shadows it.
   *
   * @param value constant result
   * @return activation installing the override
   */
  public SceneActivation<R> imagine(R value) {
    return new SceneActivation<>(this, new Scene<>(cursor.active(), Guard.ALWAYS, value));
  }

  /**
   * Returns a view that resolves calls against the chain active {@code activations} entries ago, so values inside
   * and outside the current scopes can be compared without leaving them:
   * <pre>{@code
   * f.call(0) - f.backtrack(1).call(0)
   * }</pre>
   * The view owns a detached copy of the history; activations built from it affect only the view.
   *
   * @param activations how many open activations to look past; {@code 0} returns this callable
   * @return view of an earlier state
   * @throws IllegalArgumentException if {@code activations} is negative or exceeds {@link #depth()}
   */
  public Imagined<R> backtrack(int activations) {
    Numbers.requireRange("activations", activations, 0, cursor.depth());
    if (activations == 0) {
      return this;
    }
    return new Imagined<>(name + "[-" + activations + "]", body, cursor.snapshot(activations), engine);
  }

  /** Number of activations currently open on this callable. */
  public int depth() {
    return cursor.depth();
  }

  Cursor<R> cursor() {
    return cursor;
  }

  ImagineEngine engine() {
    return engine;
  }

  @Override
  public String toString() {
    return "Imagined[" + name + ", depth " + cursor.depth() + "]";
  }
}
