/**
 * <strong>Purpose:</strong> Metrics adapters implementing {@link ca.gc.cra.imagine.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instrument caches are concurrent maps; the engine itself is single-threaded.
 * <p><strong>Observability:</strong> Exports through the OpenTelemetry SDK and OTLP.
 *
 * @since 0.1.0
 */
package ca.gc.cra.imagine.infrastructure.metrics;
