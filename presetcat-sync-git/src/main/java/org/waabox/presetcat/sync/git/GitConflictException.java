package org.waabox.presetcat.sync.git;

/**
 * Thrown when a pull or a submodule update cannot proceed because local
 * changes conflict with the incoming ones.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class GitConflictException extends GitSyncException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public GitConflictException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public GitConflictException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
