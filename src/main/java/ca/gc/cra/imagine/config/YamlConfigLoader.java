package ca.gc.cra.imagine.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads an imagine YAML file into flat {@code dotted.key -> text} pairs.
 *
 * <p>The document root is a mapping of sections. Keys of the {@code common} section apply first; the requested
 * section (matched ignoring case) overrides them. Nested mappings become dotted keys, so
 * <pre>{@code
 * imagine:
 *   metrics:
 *     prefix: whatif
 * }</pre>
 * yields {@code metrics.prefix=whatif}. Sequences are rejected; a null scalar becomes the empty string.
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads the {@code common} section merged with {@code section}.
   *
   * @param path YAML file
   * @param section overriding section, usually {@code imagine}
   * @return flat settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed or not shaped as sections of mappings
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    String wanted = Objects.requireNonNull(section, "section").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = newYaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("YAML config at " + path + " must be a mapping of sections");
    }

    Map<String, String> settings = new LinkedHashMap<>();
    walk("", sectionNamed(root, COMMON_SECTION), settings);
    walk("", sectionNamed(root, wanted), settings);
    return Optional.of(Map.copyOf(settings));
  }

  private static Yaml newYaml() {
    LoaderOptions options = new LoaderOptions();
    options.setAllowDuplicateKeys(false);
    return new Yaml(new SafeConstructor(options));
  }

  private static Object sectionNamed(Map<?, ?> root, String name) {
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT).equals(name)) {
        Object value = entry.getValue();
        if (value != null && !(value instanceof Map<?, ?>)) {
          throw new IllegalArgumentException("Section '" + entry.getKey() + "' must be a mapping");
        }
        return value;
      }
    }
    return null;
  }

  private static void walk(String path, Object node, Map<String, String> out) {
    if (node instanceof Map<?, ?> mapping) {
      for (Map.Entry<?, ?> entry : mapping.entrySet()) {
        if (!(entry.getKey() instanceof String name) || name.isBlank()) {
          throw new IllegalArgumentException("YAML keys under '" + path + "' must be non-blank strings");
        }
        walk(path.isEmpty() ? name : path + '.' + name, entry.getValue(), out);
      }
    } else if (node instanceof Iterable<?>) {
      throw new IllegalArgumentException("YAML arrays are not supported for key " + path);
    } else if (!path.isEmpty()) {
      out.put(path, node == null ? "" : node.toString());
    }
  }
}
