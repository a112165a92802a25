package ca.gc.cra.imagine.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the override engine.
 * <p><strong>Why:</strong> Lets callables and activations count lookups and scope changes without binding to a vendor
 * SDK.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like imagined results or unbalanced exits.</li>
 *   <li>Record numeric observations such as the length of each chain installed by an activation.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread that drives a callable.</p>
 * <p><strong>Performance:</strong> Calls sit on the lookup hot path; keep them non-blocking and O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code imagine.call.imagined}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code imagine.activation.entered}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
