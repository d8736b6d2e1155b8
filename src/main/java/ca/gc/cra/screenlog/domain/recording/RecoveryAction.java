package ca.gc.cra.screenlog.domain.recording;

import java.util.Objects;

/**
 * Recovery option offered to the user alongside a recorder error.
 *
 * @param title button label
 * @param primary whether this is the suggested action
 * @since 0.1.0
 */
public record RecoveryAction(String title, boolean primary) {
  public RecoveryAction {
    Objects.requireNonNull(title, "title");
  }

  static RecoveryAction primary(String title) {
    return new RecoveryAction(title, true);
  }

  static RecoveryAction secondary(String title) {
    return new RecoveryAction(title, false);
  }
}
