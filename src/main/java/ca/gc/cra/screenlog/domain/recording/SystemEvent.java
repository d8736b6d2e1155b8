package ca.gc.cra.screenlog.domain.recording;

/**
 * Environment notifications the recorder reacts to.
 *
 * @since 0.1.0
 */
public enum SystemEvent {
  /** System is going to sleep; recording pauses. */
  SLEEP,
  /** System woke up; recording resumes after a settle delay. */
  WAKE,
  /** Screen locked; recording pauses. */
  SCREEN_LOCKED,
  /** Screen unlocked; recording resumes shortly after. */
  SCREEN_UNLOCKED,
  /** Capture permission was withdrawn; fatal. */
  PERMISSION_REVOKED,
  /** Capture stream stopped unexpectedly; retried. */
  STREAM_INTERRUPTED
}
