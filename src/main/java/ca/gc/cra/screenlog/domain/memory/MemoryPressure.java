package ca.gc.cra.screenlog.domain.memory;

/**
 * Coarse memory pressure level derived from usage percent.
 *
 * @since 0.1.0
 */
public enum MemoryPressure {
  /** Usage below the warning threshold. */
  NORMAL,
  /** Usage at or above 75%. */
  WARNING,
  /** Usage at or above 90%. */
  CRITICAL;

  /** Usage percent at which pressure becomes {@link #WARNING}. */
  public static final double WARNING_PERCENT = 75.0;
  /** Usage percent at which pressure becomes {@link #CRITICAL}. */
  public static final double CRITICAL_PERCENT = 90.0;

  /**
   * Classifies a usage percent.
   *
   * @param usagePercent usage in percent (0-100)
   * @return matching pressure level
   */
  public static MemoryPressure fromUsagePercent(double usagePercent) {
    if (usagePercent >= CRITICAL_PERCENT) {
      return CRITICAL;
    }
    if (usagePercent >= WARNING_PERCENT) {
      return WARNING;
    }
    return NORMAL;
  }
}
