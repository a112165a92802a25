package ca.gc.cra.imagine.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the meter that {@link OpenTelemetryMetricsAdapter} records into.
 *
 * <p>Reads the standard OpenTelemetry settings, system property first and environment variable second:
 * <ul>
 *   <li>{@code otel.metrics.exporter} / {@code OTEL_METRICS_EXPORTER}: {@code otlp} (default) or {@code none}</li>
 *   <li>{@code otel.exporter.otlp.endpoint} / {@code OTEL_EXPORTER_OTLP_ENDPOINT}</li>
 *   <li>{@code otel.metric.export.interval} / {@code OTEL_METRIC_EXPORT_INTERVAL} in milliseconds</li>
 *   <li>{@code otel.resource.attributes} / {@code OTEL_RESOURCE_ATTRIBUTES}: {@code k=v,k=v}</li>
 * </ul>
 * A host application embedding the engine never fails because of metrics: any bootstrap error yields a noop meter.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.imagine";
  private static final String FALLBACK_VERSION = "0.0.0-dev";
  private static final long FLUSH_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize() {
    try {
      Settings settings = Settings.read();
      if (settings.exporter() == ExporterMode.NONE) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build())
          .setInterval(settings.interval())
          .build();
      BootstrapResult result = build(reader, settings.resourceAttributes());
      log.info("Imagine metrics exported over OTLP to {} every {}", settings.endpoint(), settings.interval());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; recording into a noop meter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extras) {
    String version = libraryVersion();
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "imagine")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version)
        .put(AttributeKey.stringKey("service.instance.id"), ManagementFactory.getRuntimeMXBean().getName())
        .putAll(extras)
        .build()));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    return new BootstrapResult(
        provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build(), provider);
  }

  private static String libraryVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? FALLBACK_VERSION : version;
  }

  /**
   * Parses {@code k=v} pairs separated by commas, skipping and logging malformed entries.
   */
  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String pair : raw.split(",")) {
      String entry = pair.trim();
      int eq = entry.indexOf('=');
      if (eq <= 0 || eq == entry.length() - 1) {
        if (!entry.isEmpty()) {
          log.warn("Ignoring malformed resource attribute '{}'", entry);
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(entry.substring(0, eq).trim()), entry.substring(eq + 1).trim());
    }
    return builder.build();
  }

  private static String setting(String property, String env) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null || value.isBlank() ? null : value.trim();
  }

  private record Settings(ExporterMode exporter, String endpoint, Duration interval, Attributes resourceAttributes) {
    private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
    private static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

    static Settings read() {
      String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT");
      return new Settings(
          ExporterMode.from(setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER")),
          endpoint == null ? DEFAULT_ENDPOINT : endpoint,
          interval(setting("otel.metric.export.interval", "OTEL_METRIC_EXPORT_INTERVAL")),
          parseResourceAttributes(setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES")));
    }

    private static Duration interval(String millis) {
      if (millis == null) {
        return DEFAULT_INTERVAL;
      }
      try {
        long parsed = Long.parseLong(millis);
        if (parsed > 0) {
          return Duration.ofMillis(parsed);
        }
      } catch (NumberFormatException ex) {
        log.debug("Non-numeric export interval '{}'", millis, ex);
      }
      log.warn("Ignoring invalid metric export interval '{}'; using {}", millis, DEFAULT_INTERVAL);
      return DEFAULT_INTERVAL;
    }
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null) {
        return OTLP;
      }
      switch (raw.toLowerCase(Locale.ROOT)) {
        case "none":
          return NONE;
        case "otlp":
          return OTLP;
        default:
          log.warn("Unsupported metrics exporter '{}'; falling back to otlp", raw);
          return OTLP;
      }
    }
  }

  /** Meter plus the provider that owns it; the provider is absent in noop mode. */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode pending, String operation) {
      if (!pending.join(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("OpenTelemetry meter provider {} did not complete within {}s", operation, FLUSH_TIMEOUT_SECONDS);
      }
    }
  }
}
