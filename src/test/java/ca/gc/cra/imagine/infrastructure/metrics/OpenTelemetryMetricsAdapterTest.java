package ca.gc.cra.imagine.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.imagine.application.engine.ImagineEngine;
import ca.gc.cra.imagine.application.engine.Imagined;
import ca.gc.cra.imagine.config.ImagineConfig;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  private Optional<MetricData> find(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }

  @Test
  void engineCountersReachOpenTelemetry() {
    Imagined<Integer> f = new ImagineEngine(ImagineConfig.defaults(), adapter).wrap("f", args -> 1);
    f.at(0).imagine(2).run(() -> {
      f.call(0);
      f.call(0);
      f.call(1);
    });
    adapter.forceFlush();

    MetricData imagined = find("imagine.call.imagined").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, imagined.getType());
    LongPointData point = imagined.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("imagine.call.imagined", point.getAttributes().get(AttributeKey.stringKey("imagine.metric.key")));

    AttributeKey<String> serviceName = AttributeKey.stringKey("service.name");
    assertEquals("imagine", imagined.getResource().getAttribute(serviceName));
    assertTrue(find("imagine.activation.entered").isPresent());
  }

  @Test
  void observeRecordsSanitizedHistogram() {
    adapter.observe("Imagine.Chain Length", 2L);
    adapter.observe("Imagine.Chain Length", 4L);
    adapter.forceFlush();

    MetricData histogram = find("imagine.chain_length").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(6.0, point.getSum());
    assertEquals("Imagine.Chain Length", point.getAttributes().get(AttributeKey.stringKey("imagine.metric.key")));
  }

  @Test
  void sanitizeNamePrefixesNonLetters() {
    assertEquals("m1.count", OpenTelemetryMetricsAdapter.sanitizeName("1.count"));
    assertEquals("imagine.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }
}
