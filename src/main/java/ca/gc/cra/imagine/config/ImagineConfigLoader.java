package ca.gc.cra.imagine.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads {@link ImagineConfig} from a YAML or properties file plus system properties.
 * <p><strong>Why:</strong> Lets operators switch balance checking or metrics without recompiling callers.</p>
 * <p><strong>Role:</strong> Configuration bootstrap used by the default engine behind {@code Imagine}.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 * <p><strong>Observability:</strong> Logs the resolved file and warns about unknown keys.</p>
 *
 * @since 0.1.0
 */
public final class ImagineConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ImagineConfigLoader.class);

  /** System property naming the configuration file. */
  public static final String CONFIG_PROPERTY = "imagine.config";
  /** Environment variable naming the configuration file when the system property is absent. */
  public static final String CONFIG_ENV = "IMAGINE_CONFIG";
  /** YAML section read on top of {@code common}. */
  public static final String SECTION = "imagine";

  private ImagineConfigLoader() {}

  /**
   * Resolves the configuration file from {@value #CONFIG_PROPERTY} or {@value #CONFIG_ENV} and loads it together with
   * {@code imagine.*} system properties.
   *
   * @return effective configuration; defaults when nothing is configured
   * @throws IOException if the configured file exists but cannot be read
   */
  public static ImagineConfig loadDefault() throws IOException {
    String location = System.getProperty(CONFIG_PROPERTY);
    if (location == null || location.isBlank()) {
      location = System.getenv(CONFIG_ENV);
    }
    Path path = location == null || location.isBlank() ? null : Path.of(location.trim());
    return load(path, System.getProperties());
  }

  /**
   * Loads configuration from {@code path} (may be {@code null}) and applies {@code imagine.*} overrides.
   *
   * @param path YAML ({@code .yaml}/{@code .yml}) or properties file; {@code null} or missing uses defaults
   * @param systemProperties source of {@code imagine.*} overrides
   * @return effective configuration
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if a value is invalid
   */
  public static ImagineConfig load(Path path, Properties systemProperties) throws IOException {
    Optional<Map<String, String>> file = path == null ? Optional.empty() : readFile(path);
    if (path != null) {
      if (file.isPresent()) {
        log.debug("Loaded imagine configuration from {}", path);
      } else {
        log.debug("Imagine configuration file {} not found; using defaults", path);
      }
    }
    Map<String, String> overrides =
        systemProperties == null ? Map.of() : ConfigMerger.systemOverrides(systemProperties);
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        ImagineConfig.defaultsAsMap(), file, overrides, log::warn);
    return ImagineConfig.fromMap(effective);
  }

  private static Optional<Map<String, String>> readFile(Path path) throws IOException {
    String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".yaml") || name.endsWith(".yml")) {
      return YamlConfigLoader.load(path, SECTION);
    }
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (String key : props.stringPropertyNames()) {
      String stripped = key.startsWith(ConfigMerger.SYSTEM_PREFIX)
          ? key.substring(ConfigMerger.SYSTEM_PREFIX.length())
          : key;
      values.put(stripped, props.getProperty(key).trim());
    }
    return Optional.of(values);
  }
}
