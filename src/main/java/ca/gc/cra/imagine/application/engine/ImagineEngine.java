package ca.gc.cra.imagine.application.engine;

import ca.gc.cra.imagine.application.port.Computation;
import ca.gc.cra.imagine.application.port.MetricsPort;
import ca.gc.cra.imagine.config.ImagineConfig;
import ca.gc.cra.imagine.validation.Strings;
import java.util.Objects;

/**
 * <strong>What:</strong> Factory for {@link Imagined} callables sharing one configuration and metrics sink.
 * <p><strong>Why:</strong> Keeps settings out of the callables themselves; every callable still owns its own cursor,
 * so there is no state shared between callables.</p>
 * <p><strong>Thread-safety:</strong> The engine is immutable; the callables it creates are not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ImagineEngine {
  private final ImagineConfig config;
  private final MetricsPort metrics;

  public ImagineEngine(ImagineConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Wraps a computation so its results can be overridden.
   *
   * @param name label used in logs and diagnostics
   * @param body original computation
   * @param <R> result type
   * @return new callable with an empty override chain
   */
  public <R> Imagined<R> wrap(String name, Computation<R> body) {
    return new Imagined<>(Strings.requireNonBlank("name", name), body, new Cursor<>(), this);
  }

  public ImagineConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  String metric(String suffix) {
    return config.metricsPrefix() + '.' + suffix;
  }
}
