package ca.gc.cra.imagine.testutil;

import ca.gc.cra.imagine.application.port.MetricsPort;
import java.util.HashMap;
import java.util.Map;

/** In-memory {@link MetricsPort} for assertions on counters and last observations. */
public final class RecordingMetrics implements MetricsPort {
  private final Map<String, Long> counters = new HashMap<>();
  private final Map<String, Long> observations = new HashMap<>();

  @Override
  public void increment(String key) {
    counters.merge(key, 1L, Long::sum);
  }

  @Override
  public void observe(String key, long value) {
    observations.put(key, value);
  }

  public long counter(String key) {
    return counters.getOrDefault(key, 0L);
  }

  public long observation(String key) {
    return observations.getOrDefault(key, 0L);
  }
}
