package ca.gc.cra.proxyrow.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads decode settings from a YAML document.
 *
 * <p>The {@code common} section is merged with the requested section (default {@code decode}); keys of the
 * requested section win. Nested mappings are flattened into dotted keys.</p>
 *
 * <pre>
 * decode:
 *   parallelism: 4
 *   dropInvalid: true
 * </pre>
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);

  public static final String DEFAULT_SECTION = "decode";

  private YamlConfigLoader() {}

  /**
   * Loads a {@link DecodeConfig} from the {@code decode} section of {@code path}.
   *
   * @param path location of the YAML configuration; a missing file yields {@link DecodeConfig#defaults()}
   * @return decode configuration
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the YAML structure or a value is invalid
   */
  public static DecodeConfig loadDecodeConfig(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      log.debug("No decode configuration at {}; using defaults", path);
      return DecodeConfig.defaults();
    }
    return DecodeConfig.fromMap(load(path, DEFAULT_SECTION));
  }

  /**
   * Reads {@code path} and merges the {@code common} section with {@code section} into a flat map.
   *
   * @param path location of the YAML configuration; must exist
   * @param section name of the section to merge over {@code common}, matched case-insensitively
   * @return immutable flat map of merged values
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Map<String, String> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");

    String normalizedSection = section.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Map.of();
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      Object commonSection = findSection(root, "common");
      if (commonSection != null) {
        flatten(asMap(commonSection, "common"), "", flattened);
      }
      Object namedSection = findSection(root, normalizedSection);
      if (namedSection != null) {
        flatten(asMap(namedSection, normalizedSection), "", flattened);
      }
      return Map.copyOf(flattened);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
