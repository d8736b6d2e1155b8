package ca.gc.cra.screenlog.config;

import ca.gc.cra.screenlog.validation.Numbers;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Retention policy for recorded chunks.
 * <p><strong>Why:</strong> Bounds disk usage by age and by total size; stored as JSON under
 * {@code retention.policy} so changes survive restarts.</p>
 * <p><strong>Validation:</strong> Out-of-range values are rejected, never clamped. The exception message names
 * every violated bound.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param enabled whether periodic cleanup runs
 * @param retentionDays days a chunk is kept (1-365)
 * @param maxStorageGB storage quota in GB (1-1000)
 * @param cleanupIntervalHours hours between cleanup passes (1-24)
 * @since 0.1.0
 */
public record RetentionConfig(boolean enabled, int retentionDays, int maxStorageGB, int cleanupIntervalHours) {
  public static final int MIN_RETENTION_DAYS = 1;
  public static final int MAX_RETENTION_DAYS = 365;
  public static final int MIN_STORAGE_GB = 1;
  public static final int MAX_STORAGE_GB = 1000;
  public static final int MIN_INTERVAL_HOURS = 1;
  public static final int MAX_INTERVAL_HOURS = 24;

  private static final long BYTES_PER_GB = 1024L * 1024L * 1024L;

  public RetentionConfig {
    List<String> violations = violations(retentionDays, maxStorageGB, cleanupIntervalHours);
    if (!violations.isEmpty()) {
      throw new IllegalArgumentException("Invalid retention policy: " + String.join("; ", violations));
    }
  }

  /** Enabled, 3 days, 10 GB, hourly. */
  public static RetentionConfig defaults() {
    return new RetentionConfig(true, 3, 10, 1);
  }

  /**
   * Builds a policy from flat {@code retention.*} keys, using defaults for missing ones.
   *
   * @param map flattened configuration
   * @return validated policy
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static RetentionConfig fromMap(Map<String, String> map) {
    return fromMap(map, defaults());
  }

  /**
   * Builds a policy from flat {@code retention.*} keys, taking missing ones from {@code defaults}.
   *
   * @param map flattened configuration
   * @param defaults values for absent keys
   * @return validated policy
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static RetentionConfig fromMap(Map<String, String> map, RetentionConfig defaults) {
    Objects.requireNonNull(defaults, "defaults");
    if (map == null || map.isEmpty()) {
      return defaults;
    }
    return new RetentionConfig(
        parseBoolean(map, "retention.enabled", defaults.enabled()),
        parseInt(map, "retention.retentionDays", defaults.retentionDays()),
        parseInt(map, "retention.maxStorageGB", defaults.maxStorageGB()),
        parseInt(map, "retention.cleanupIntervalHours", defaults.cleanupIntervalHours()));
  }

  /**
   * Checks candidate values without constructing a policy.
   *
   * @throws IllegalArgumentException listing every violation
   */
  public static void validate(int retentionDays, int maxStorageGB, int cleanupIntervalHours) {
    new RetentionConfig(true, retentionDays, maxStorageGB, cleanupIntervalHours);
  }

  public long maxStorageBytes() {
    return maxStorageGB * BYTES_PER_GB;
  }

  private static List<String> violations(int retentionDays, int maxStorageGB, int cleanupIntervalHours) {
    List<String> violations = new ArrayList<>(3);
    if (!Numbers.inRange(retentionDays, MIN_RETENTION_DAYS, MAX_RETENTION_DAYS)) {
      violations.add(Numbers.rangeMessage("retentionDays", retentionDays, MIN_RETENTION_DAYS, MAX_RETENTION_DAYS));
    }
    if (!Numbers.inRange(maxStorageGB, MIN_STORAGE_GB, MAX_STORAGE_GB)) {
      violations.add(Numbers.rangeMessage("maxStorageGB", maxStorageGB, MIN_STORAGE_GB, MAX_STORAGE_GB));
    }
    if (!Numbers.inRange(cleanupIntervalHours, MIN_INTERVAL_HOURS, MAX_INTERVAL_HOURS)) {
      violations.add(Numbers.rangeMessage(
          "cleanupIntervalHours", cleanupIntervalHours, MIN_INTERVAL_HOURS, MAX_INTERVAL_HOURS));
    }
    return violations;
  }

  private static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("true") && !normalized.equals("false")) {
      throw new IllegalArgumentException(key + " must be true or false (was '" + value + "')");
    }
    return Boolean.parseBoolean(normalized);
  }

  private static int parseInt(Map<String, String> map, String key, int defaultValue) {
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + value + "')", ex);
    }
  }
}
