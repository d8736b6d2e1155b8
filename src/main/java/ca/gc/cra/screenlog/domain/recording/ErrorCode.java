package ca.gc.cra.screenlog.domain.recording;

/**
 * <strong>What:</strong> Classified recorder failure.
 * <p><strong>Why:</strong> Retryable codes are transient faults the recorder retries within a bounded budget;
 * the rest move the recorder straight to the error state.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ErrorCode {
  PERMISSION_DENIED("permission_denied", "Permission Denied", false),
  DISPLAY_CONFIGURATION_CHANGED("display_configuration_changed", "Display Configuration Changed", true),
  STORAGE_SPACE_LOW("storage_space_low", "Storage Space Low", false),
  COMPRESSION_FAILED("compression_failed", "Compression Failed", true),
  FRAME_CAPTURE_TIMEOUT("frame_capture_timeout", "Frame Capture Timeout", true),
  DATABASE_WRITE_FAILED("database_write_failed", "Database Write Failed", true);

  private final String code;
  private final String displayName;
  private final boolean retryable;

  ErrorCode(String code, String displayName, boolean retryable) {
    this.code = code;
    this.displayName = displayName;
    this.retryable = retryable;
  }

  /**
   * Returns the stable wire identifier.
   *
   * @return snake-case code such as {@code permission_denied}
   */
  public String code() {
    return code;
  }

  public String displayName() {
    return displayName;
  }

  public boolean retryable() {
    return retryable;
  }
}
