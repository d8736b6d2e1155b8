package ca.gc.cra.screenlog.config;

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
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a SCREENLOG YAML file and flattens the {@code common} section plus one command section into dotted keys.
 *
 * <p>Mode sections override {@code common}. Nested mappings become dotted keys ({@code retention.retentionDays});
 * scalar lists become comma-separated values. Unknown top-level sections are ignored with a debug line.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  private static final String COMMON = "common";
  private static final Set<String> MODES = Set.of("record", "cleanup", "chunks", "memory");

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and merges {@code common} with the {@code mode} section.
   *
   * @param path YAML file
   * @param mode command name (record, cleanup, chunks, memory)
   * @return flat configuration, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the mode is unknown or the YAML is malformed
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String normalizedMode = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    if (!MODES.contains(normalizedMode)) {
      throw new IllegalArgumentException("Unknown configuration mode: " + mode);
    }
    if (!Files.exists(path)) {
      log.debug("No configuration file at {}", path);
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> root = mapping(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    Object common = section(root, COMMON);
    if (common != null) {
      flatten(mapping(common, COMMON), "", flattened);
    }
    Object modeSection = section(root, normalizedMode);
    if (modeSection != null) {
      flatten(mapping(modeSection, normalizedMode), "", flattened);
    }
    for (String key : root.keySet()) {
      String normalized = key.trim().toLowerCase(Locale.ROOT);
      if (!normalized.equals(COMMON) && !MODES.contains(normalized)) {
        log.debug("Ignoring unknown configuration section '{}'", key);
      }
    }
    return Optional.of(Map.copyOf(flattened));
  }

  private static Map<String, Object> mapping(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException("Section '" + context + "' must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException("Section '" + context + "' contains a blank or non-string key");
      }
      map.put(key.trim(), entry.getValue());
    }
    return map;
  }

  private static Object section(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        target.put(key, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(mapping(nested, key), key, target);
      } else if (value instanceof Iterable<?> items) {
        target.put(key, joinScalars(key, items));
      } else {
        target.put(key, value.toString());
      }
    }
  }

  private static String joinScalars(String key, Iterable<?> items) {
    StringBuilder joined = new StringBuilder();
    for (Object item : items) {
      if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("Only scalar lists are supported for key " + key);
      }
      if (joined.length() > 0) {
        joined.append(',');
      }
      joined.append(item == null ? "" : item.toString());
    }
    return joined.toString();
  }
}
