package ca.gc.cra.imagine.api;

import ca.gc.cra.imagine.application.engine.ImagineEngine;
import ca.gc.cra.imagine.application.engine.Imagined;
import ca.gc.cra.imagine.application.port.Computation;
import ca.gc.cra.imagine.application.port.MetricsPort;
import ca.gc.cra.imagine.config.ImagineConfig;
import ca.gc.cra.imagine.config.ImagineConfigLoader;
import ca.gc.cra.imagine.domain.call.CallArguments;
import ca.gc.cra.imagine.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.io.IOException;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Entry point that wraps plain Java functions into overridable {@link Imagined} callables.
 * <p><strong>Why:</strong> Callers want {@code Imagine.unary(f)} rather than wiring an engine by hand.</p>
 * <p><strong>Role:</strong> Composition root: resolves configuration through {@link ImagineConfigLoader} once and
 * selects the metrics adapter it asks for.</p>
 * <p><strong>Thread-safety:</strong> The default engine is initialized once under a lock; the callables returned are
 * not thread-safe.</p>
 *
 * <pre>{@code
 * Imagined<Integer> f = Imagine.unary("f", (Integer x) -> x + 1);
 * Imagined<Integer> g = Imagine.unary("g", (Integer x) -> x - 1);
 * f.at(0).imagine(g.call(0)).combine(g.at(0).imagine(f.call(0))).run(() -> {
 *   f.call(0); // -1
 *   g.call(0); // 1
 * });
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Imagine {
  private static final Logger log = LoggerFactory.getLogger(Imagine.class);
  private static final Object LOCK = new Object();
  private static final Object METRICS_LOCK = new Object();
  private static volatile ImagineEngine defaultEngine;
  private static volatile OpenTelemetryMetricsAdapter sharedMetrics;

  private Imagine() {}

  /**
   * Returns the engine configured from {@code imagine.config}/{@code IMAGINE_CONFIG} and {@code imagine.*} system
   * properties, creating it on first use.
   *
   * @return shared default engine
   * @throws IllegalStateException if the configuration file exists but cannot be read
   * @throws IllegalArgumentException if the configuration holds invalid values
   */
  public static ImagineEngine defaultEngine() {
    ImagineEngine engine = defaultEngine;
    if (engine != null) {
      return engine;
    }
    synchronized (LOCK) {
      if (defaultEngine == null) {
        try {
          defaultEngine = engine(ImagineConfigLoader.loadDefault());
        } catch (IOException ex) {
          throw new IllegalStateException("Failed to load imagine configuration", ex);
        }
      }
      return defaultEngine;
    }
  }

  /**
   * Builds an engine for {@code config}, exporting metrics through OpenTelemetry when enabled.
   *
   * @param config engine settings
   * @return new engine
   */
  public static ImagineEngine engine(ImagineConfig config) {
    Objects.requireNonNull(config, "config");
    return new ImagineEngine(config, metricsFor(config));
  }

  static MetricsPort metricsFor(ImagineConfig config) {
    if (!config.metricsEnabled()) {
      return MetricsPort.NO_OP;
    }
    log.info("Imagine metrics enabled with prefix {}", config.metricsPrefix());
    return sharedMetrics();
  }

  /**
   * Returns the process-wide OpenTelemetry adapter, creating it and its shutdown hook on first use. Engines differ
   * only in metric prefix, so they share one meter provider and its export thread.
   */
  static OpenTelemetryMetricsAdapter sharedMetrics() {
    OpenTelemetryMetricsAdapter adapter = sharedMetrics;
    if (adapter != null) {
      return adapter;
    }
    synchronized (METRICS_LOCK) {
      if (sharedMetrics == null) {
        OpenTelemetryMetricsAdapter created = new OpenTelemetryMetricsAdapter();
        Runtime.getRuntime().addShutdownHook(new Thread(created::close, "imagine-metrics-shutdown"));
        sharedMetrics = created;
      }
      return sharedMetrics;
    }
  }

  /**
   * Wraps a computation receiving the full argument set.
   *
   * @param name label used in logs
   * @param body original computation
   * @param <R> result type
   * @return overridable callable
   */
  public static <R> Imagined<R> wrap(String name, Computation<R> body) {
    return defaultEngine().wrap(name, body);
  }

  /** Same as {@link #wrap(String, Computation)} with the label {@code imagined}. */
  public static <R> Imagined<R> wrap(Computation<R> body) {
    return wrap("imagined", body);
  }

  /**
   * Wraps a function of no arguments.
   *
   * @param name label used in logs
   * @param body original supplier
   * @param <R> result type
   * @return overridable callable expecting no positional arguments
   */
  public static <R> Imagined<R> nullary(String name, Supplier<R> body) {
    Objects.requireNonNull(body, "body");
    return wrap(name, args -> {
      requireArity(name, args, 0);
      return body.get();
    });
  }

  /**
   * Wraps a function of one positional argument.
   *
   * @param name label used in logs
   * @param body original function
   * @param <T> argument type
   * @param <R> result type
   * @return overridable callable expecting one positional argument
   */
  public static <T, R> Imagined<R> unary(String name, Function<T, R> body) {
    Objects.requireNonNull(body, "body");
    return wrap(name, args -> {
      requireArity(name, args, 1);
      return body.apply(args.<T>get(0));
    });
  }

  /** Same as {@link #unary(String, Function)} with the label {@code imagined}. */
  public static <T, R> Imagined<R> unary(Function<T, R> body) {
    return unary("imagined", body);
  }

  /**
   * Wraps a function of two positional arguments. Methods can be wrapped this way with the receiver as first
   * argument, which makes overrides specific to one instance.
   *
   * @param name label used in logs
   * @param body original function
   * @param <T> first argument type
   * @param <U> second argument type
   * @param <R> result type
   * @return overridable callable expecting two positional arguments
   */
  public static <T, U, R> Imagined<R> binary(String name, BiFunction<T, U, R> body) {
    Objects.requireNonNull(body, "body");
    return wrap(name, args -> {
      requireArity(name, args, 2);
      return body.apply(args.<T>get(0), args.<U>get(1));
    });
  }

  private static void requireArity(String name, CallArguments args, int arity) {
    if (args.size() != arity || !args.keywords().isEmpty()) {
      throw new IllegalArgumentException(
          name + " expects " + arity + " positional argument(s) and no keywords, got " + args);
    }
  }
}
