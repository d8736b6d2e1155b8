package ca.gc.cra.screenlog.api;

import ca.gc.cra.screenlog.validation.Numbers;
import ca.gc.cra.screenlog.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a mutable map and reads typed values out of it.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}. Later duplicates win.
   *
   * @param args {@code key=value} tokens; {@code null} yields an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException when a token is not {@code key=value} or the key is malformed
   */
  static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      int idx = raw.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw.trim() + "')");
      }
      String key = raw.substring(0, idx).trim();
      String value = raw.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (!value.isEmpty()) {
        Strings.requireNonBlank(key, value);
      }
      map.put(key, value);
    }
    return map;
  }

  /**
   * Removes and parses an integer argument.
   *
   * @param map argument map; the key is consumed
   * @param key argument name
   * @param defaultValue value when absent
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return parsed value
   * @throws IllegalArgumentException when the value is not an integer in range
   */
  static long takeLong(Map<String, String> map, String key, long defaultValue, long min, long max) {
    String raw = map.remove(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    long value;
    try {
      value = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
    return Numbers.requireRange(key, value, min, max);
  }

  /** Removes and returns a config file path argument ({@code config=PATH}), or {@code null}. */
  static String takeConfigPath(Map<String, String> map) {
    String value = map.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }
}
