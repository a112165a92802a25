package ca.gc.cra.imagine.config;

import ca.gc.cra.imagine.validation.Numbers;
import ca.gc.cra.imagine.validation.Strings;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable settings shared by every callable an engine wraps.
 * <p><strong>Why:</strong> Lets operators tighten misuse detection and enable metrics without code changes.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@code ImagineEngine}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param balanceCheck reaction to out-of-order activation exits
 * @param metricsEnabled {@code true} to export metrics through OpenTelemetry
 * @param metricsPrefix dotted prefix of every metric key (e.g., {@code imagine})
 * @param logArgumentBytes UTF-8 byte budget for call arguments rendered into log lines
 * @since 0.1.0
 */
public record ImagineConfig(
    BalanceCheck balanceCheck,
    boolean metricsEnabled,
    String metricsPrefix,
    int logArgumentBytes) {

  /** Configuration key for {@link #balanceCheck()}. */
  public static final String BALANCE_CHECK = "balanceCheck";
  /** Configuration key for {@link #metricsEnabled()}. */
  public static final String METRICS_ENABLED = "metrics.enabled";
  /** Configuration key for {@link #metricsPrefix()}. */
  public static final String METRICS_PREFIX = "metrics.prefix";
  /** Configuration key for {@link #logArgumentBytes()}. */
  public static final String LOG_ARGUMENT_BYTES = "log.argumentBytes";

  static final int MAX_LOG_ARGUMENT_BYTES = 65_536;

  public ImagineConfig {
    Objects.requireNonNull(balanceCheck, BALANCE_CHECK);
    metricsPrefix = Strings.requireMetricPrefix(METRICS_PREFIX, metricsPrefix);
    Numbers.requireRange(LOG_ARGUMENT_BYTES, logArgumentBytes, 1, MAX_LOG_ARGUMENT_BYTES);
  }

  /**
   * Provides default values used when no external configuration is supplied.
   *
   * @return default configuration record
   */
  public static ImagineConfig defaults() {
    return new ImagineConfig(BalanceCheck.WARN, false, "imagine", 256);
  }

  /**
   * Defaults expressed as a flat key/value map, the lowest-precedence layer of {@link ConfigMerger}.
   *
   * @return immutable map of default settings
   */
  public static Map<String, String> defaultsAsMap() {
    ImagineConfig d = defaults();
    return Map.of(
        BALANCE_CHECK, d.balanceCheck().name().toLowerCase(Locale.ROOT),
        METRICS_ENABLED, String.valueOf(d.metricsEnabled()),
        METRICS_PREFIX, d.metricsPrefix(),
        LOG_ARGUMENT_BYTES, String.valueOf(d.logArgumentBytes()));
  }

  /**
   * Builds a configuration from a flat key/value map. Missing keys keep their default.
   *
   * @param values flattened settings
   * @return validated configuration
   * @throws IllegalArgumentException when a value is invalid; the message names the key
   */
  public static ImagineConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    ImagineConfig d = defaults();
    BalanceCheck balance = values.containsKey(BALANCE_CHECK)
        ? BalanceCheck.fromString(values.get(BALANCE_CHECK))
        : d.balanceCheck();
    boolean metrics = values.containsKey(METRICS_ENABLED)
        ? Strings.parseBoolean(METRICS_ENABLED, values.get(METRICS_ENABLED))
        : d.metricsEnabled();
    String prefix = values.getOrDefault(METRICS_PREFIX, d.metricsPrefix());
    int argumentBytes = values.containsKey(LOG_ARGUMENT_BYTES)
        ? Numbers.parseInt(LOG_ARGUMENT_BYTES, values.get(LOG_ARGUMENT_BYTES), 1, MAX_LOG_ARGUMENT_BYTES)
        : d.logArgumentBytes();
    return new ImagineConfig(balance, metrics, prefix, argumentBytes);
  }

  /**
   * Returns a copy with a different balance check.
   *
   * @param mode new mode
   * @return updated configuration
   */
  public ImagineConfig withBalanceCheck(BalanceCheck mode) {
    return new ImagineConfig(mode, metricsEnabled, metricsPrefix, logArgumentBytes);
  }
}
