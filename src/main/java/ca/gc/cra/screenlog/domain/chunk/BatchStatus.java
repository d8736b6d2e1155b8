package ca.gc.cra.screenlog.domain.chunk;

import java.util.Locale;

/**
 * Processing status of an analysis batch as reported by the analysis consumer.
 *
 * @since 0.1.0
 */
public enum BatchStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a stored column value.
   *
   * @param raw database value
   * @return matching status
   */
  public static BatchStatus fromDbValue(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("batch status must not be null");
    }
    return BatchStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
