package ca.gc.cra.screenlog.domain.chunk;

/**
 * Outcome of one retention cleanup pass.
 *
 * @param chunksFound chunks older than the cutoff
 * @param filesDeleted chunk files removed from disk
 * @param recordsDeleted chunk rows removed from the store
 * @param bytesFreed total size of the deleted files
 * @since 0.1.0
 */
public record CleanupStats(int chunksFound, int filesDeleted, int recordsDeleted, long bytesFreed) {
  /** Result of a pass that found nothing to delete. */
  public static final CleanupStats EMPTY = new CleanupStats(0, 0, 0, 0L);

  public CleanupStats {
    if (chunksFound < 0 || filesDeleted < 0 || recordsDeleted < 0 || bytesFreed < 0) {
      throw new IllegalArgumentException("cleanup counters must be non-negative");
    }
  }

  public double megabytesFreed() {
    return bytesFreed / (1024.0 * 1024.0);
  }
}
