package org.waabox.presetcat.sync.git;

import org.waabox.presetcat.PresetCatalogException;

/**
 * Thrown when a git operation on the catalog repository fails.
 *
 * <p>Wraps JGit's checked exceptions and I/O failures so the sync engine
 * can move on to the next recovery step.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class GitSyncException extends PresetCatalogException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public GitSyncException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public GitSyncException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
