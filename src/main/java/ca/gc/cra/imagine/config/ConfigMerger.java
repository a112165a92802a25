package ca.gc.cra.imagine.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, a config file, and JVM system properties while enforcing precedence.
 */
public final class ConfigMerger {
  /** Prefix marking JVM system properties that override file settings. */
  public static final String SYSTEM_PREFIX = "imagine.";

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence system properties &gt; file &gt; defaults.
   *
   * @param defaults embedded defaults
   * @param file optional settings read from YAML or properties
   * @param overrides settings taken from system properties, already stripped of {@link #SYSTEM_PREFIX}
   * @param warn consumer invoked for keys no layer knows about, and when an override shadows a file value
   * @return immutable merged configuration map
   */
  public static Map<String, String> buildEffectiveConfig(
      Map<String, String> defaults,
      Optional<Map<String, String>> file,
      Map<String, String> overrides,
      Consumer<String> warn) {
    Objects.requireNonNull(file, "file");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> fileCopy = file.orElse(Map.of());
    Map<String, String> overridesCopy = overrides == null ? Map.of() : overrides;
    Consumer<String> sink = warn == null ? message -> {} : warn;

    Set<String> known = defaultsCopy.keySet();
    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : fileCopy.entrySet()) {
      if (!known.isEmpty() && !known.contains(entry.getKey())) {
        sink.accept("Ignoring unknown configuration key '" + entry.getKey() + "'");
        continue;
      }
      merged.put(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String> entry : overridesCopy.entrySet()) {
      String key = entry.getKey();
      if (!known.isEmpty() && !known.contains(key)) {
        sink.accept("Ignoring unknown system property '" + SYSTEM_PREFIX + key + "'");
        continue;
      }
      if (fileCopy.containsKey(key) && !Objects.equals(fileCopy.get(key), entry.getValue())) {
        sink.accept("System property " + SYSTEM_PREFIX + key + " overrides config file value");
      }
      merged.put(key, entry.getValue());
    }
    return Map.copyOf(merged);
  }

  /**
   * Extracts {@code imagine.*} entries from a property set, dropping the prefix. The {@code imagine.config} locator
   * itself is skipped.
   *
   * @param properties source properties, usually {@link System#getProperties()}
   * @return flat override map
   */
  public static Map<String, String> systemOverrides(Properties properties) {
    Map<String, String> result = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      if (!name.startsWith(SYSTEM_PREFIX) || name.equals(ImagineConfigLoader.CONFIG_PROPERTY)) {
        continue;
      }
      result.put(name.substring(SYSTEM_PREFIX.length()), properties.getProperty(name));
    }
    return result;
  }
}
