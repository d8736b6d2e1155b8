package ca.gc.cra.screenlog.domain.compression;

/**
 * Diagnostic record of one multiplier change.
 *
 * @param timestampMillis adjustment time in epoch milliseconds
 * @param previousMultiplier multiplier before the change
 * @param newMultiplier multiplier after the change
 * @param deviation relative deviation of the window average from the target
 * @param averageChunkBytes average size across the analysis window
 * @param targetChunkBytes target size for the chunk duration
 * @param triggeringChunkBytes size of the chunk that completed the window
 * @param reason short explanation such as {@code "Oversized chunks"}
 * @since 0.1.0
 */
public record AdjustmentRecord(
    long timestampMillis,
    double previousMultiplier,
    double newMultiplier,
    double deviation,
    long averageChunkBytes,
    long targetChunkBytes,
    long triggeringChunkBytes,
    String reason) {

  public double change() {
    return newMultiplier - previousMultiplier;
  }

  public double changePercent() {
    return change() / previousMultiplier * 100.0;
  }
}
