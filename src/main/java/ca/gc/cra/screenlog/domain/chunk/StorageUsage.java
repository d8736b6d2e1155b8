package ca.gc.cra.screenlog.domain.chunk;

/**
 * Bytes used on disk by the store and the recordings directory.
 *
 * @param databaseBytes size of the database files
 * @param recordingsBytes size of all chunk files
 * @since 0.1.0
 */
public record StorageUsage(long databaseBytes, long recordingsBytes) {
  public long totalBytes() {
    return databaseBytes + recordingsBytes;
  }

  /**
   * Returns the share of a quota consumed by this usage.
   *
   * @param quotaBytes quota in bytes; must be positive
   * @return fraction of the quota, may exceed {@code 1.0}
   */
  public double fractionOf(long quotaBytes) {
    if (quotaBytes <= 0) {
      throw new IllegalArgumentException("quotaBytes must be positive");
    }
    return (double) totalBytes() / quotaBytes;
  }
}
