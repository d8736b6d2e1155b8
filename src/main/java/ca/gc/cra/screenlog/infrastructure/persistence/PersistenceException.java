package ca.gc.cra.screenlog.infrastructure.persistence;

/**
 * Unchecked failure raised by the chunk store when a read, write or migration cannot complete.
 *
 * <p>Writes that throw have already been rolled back by the time this exception reaches the caller.</p>
 *
 * @since 0.1.0
 */
public class PersistenceException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public PersistenceException(String message) {
    super(message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
