package ca.gc.cra.screenlog.api;

/**
 * <strong>What:</strong> Process exit statuses returned by SCREENLOG commands.
 * <p><strong>Why:</strong> Scripts wrapping the recorder (login items, service units) branch on these values.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments could not be parsed or were out of range. */
  INVALID_ARGS(2),
  /** Files or the database could not be read or written. */
  IO_ERROR(3),
  /** Configuration file was missing a required value or malformed. */
  CONFIG_ERROR(4),
  /** Recording ended in an error state or an unexpected exception escaped. */
  RUNTIME_FAILURE(5),
  /** Interrupted (for example by SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
