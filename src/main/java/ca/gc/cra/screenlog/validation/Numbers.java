package ca.gc.cra.screenlog.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by SCREENLOG CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards against invalid recorder (frame rate, chunk length), retention (days, quota) and
 * monitor (sampling interval) parameters before components allocate executors or open the store.
 * <p><strong>Role:</strong> Domain support utilities invoked by configuration loaders and components.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enforce inclusive numeric bounds declared in configuration schemas.</li>
 *   <li>Provide consistent error messaging for CLI feedback.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Performance:</strong> Constant-time range checks.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., days, seconds)
   * @param min minimum inclusive value in the same units as {@code value}
   * @param max maximum inclusive value in the same units as {@code value}
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(rangeMessage(name, value, min, max));
    }
    return value;
  }

  /**
   * Returns {@code true} when the value lies inside the inclusive range.
   *
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return whether {@code min <= value <= max}
   */
  public static boolean inRange(long value, long min, long max) {
    return value >= min && value <= max;
  }

  /**
   * Formats the standard range violation message.
   *
   * @param name logical parameter name
   * @param value offending value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return message of the form {@code "name must be between min and max (was value)"}
   */
  public static String rangeMessage(String name, long value, long min, long max) {
    return label(name) + " must be between " + min + " and " + max + " (was " + value + ")";
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
