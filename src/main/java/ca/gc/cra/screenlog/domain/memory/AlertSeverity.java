package ca.gc.cra.screenlog.domain.memory;

/**
 * Severity attached to a {@link MemoryAlert}.
 *
 * @since 0.1.0
 */
public enum AlertSeverity {
  /** Elevated usage worth watching. */
  WARNING,
  /** Usage or growth that needs mitigation. */
  CRITICAL
}
