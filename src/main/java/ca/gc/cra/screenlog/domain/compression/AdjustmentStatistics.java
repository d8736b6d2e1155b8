package ca.gc.cra.screenlog.domain.compression;

/**
 * Aggregate view over the adjustment history.
 *
 * @param totalAdjustments adjustments in the history
 * @param increasedCount adjustments that raised the multiplier
 * @param decreasedCount adjustments that lowered the multiplier
 * @param currentMultiplier multiplier in effect
 * @param averageMultiplier mean of the recorded new multipliers, or the current one when empty
 * @param minMultiplier smallest recorded multiplier
 * @param maxMultiplier largest recorded multiplier
 * @since 0.1.0
 */
public record AdjustmentStatistics(
    int totalAdjustments,
    int increasedCount,
    int decreasedCount,
    double currentMultiplier,
    double averageMultiplier,
    double minMultiplier,
    double maxMultiplier) {

  /**
   * Scores how close the current multiplier is to the historical average.
   *
   * @return {@code 1.0} when stable, down to {@code 0.0}
   */
  public double stabilityScore() {
    if (averageMultiplier <= 0) {
      return 0.0;
    }
    double deviation = Math.abs(currentMultiplier - averageMultiplier) / averageMultiplier;
    return Math.max(0.0, 1.0 - deviation);
  }
}
