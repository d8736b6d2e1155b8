package ca.gc.cra.screenlog.domain.capture;

/**
 * Read-only snapshot of frame buffer pool state.
 *
 * @param count live handles at snapshot time
 * @param capacity maximum live handles
 * @param totalAllocated handles admitted since creation
 * @param totalEvicted handles evicted because the pool was full
 * @param totalReleased handles released or transferred explicitly
 * @param estimatedBytes sum of live payload sizes
 * @param oldestAgeMillis age of the oldest live handle; {@code 0} when empty
 * @since 0.1.0
 */
public record BufferPoolDiagnostics(
    int count,
    int capacity,
    long totalAllocated,
    long totalEvicted,
    long totalReleased,
    long estimatedBytes,
    long oldestAgeMillis) {

  /**
   * Returns the estimated footprint in mebibytes.
   *
   * @return footprint in MiB
   */
  public double estimatedMegabytes() {
    return estimatedBytes / (1024.0 * 1024.0);
  }
}
