package ca.gc.cra.screenlog.domain.chunk;

import java.util.Locale;

/**
 * <strong>What:</strong> Lifecycle status of a recording chunk.
 * <p><strong>Why:</strong> Status only moves forward; a chunk is never reopened once completed or failed.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ChunkStatus {
  /** Registered but not yet finalized. */
  PENDING,
  /** Finalized and available to analysis. */
  COMPLETED,
  /** Encoding or persistence failed; the chunk is discarded. */
  FAILED;

  /**
   * Returns the column value stored in the database.
   *
   * @return lower-case status name
   */
  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Checks whether moving from this status to {@code next} is allowed.
   *
   * @param next requested status
   * @return {@code true} only for {@code PENDING -> COMPLETED} and {@code PENDING -> FAILED}
   */
  public boolean canTransitionTo(ChunkStatus next) {
    return this == PENDING && (next == COMPLETED || next == FAILED);
  }

  /**
   * Parses a stored column value.
   *
   * @param raw database value
   * @return matching status
   * @throws IllegalArgumentException if the value is unknown
   */
  public static ChunkStatus fromDbValue(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("chunk status must not be null");
    }
    return ChunkStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
