package org.waabox.presetcat.sync;

import java.util.Objects;

/**
 * The result of a sync engine operation.
 *
 * <p>The code follows HTTP conventions so the route layer can hand it
 * back unchanged: 200 for success, 400 when the catalog root is not a
 * repository, 404 when it is missing and 500 for any other failure.
 *
 * @param status  the outcome, never null
 * @param message a human readable description, never null
 * @param code    the status code
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SyncResult(SyncStatus status, String message, int code) {

  /** The message returned by every entry point when sync is off. */
  public static final String DISABLED_MESSAGE = "Sync is disabled";

  /**
   * Creates a new result.
   *
   * @param status  the outcome, never null
   * @param message the message, never null
   * @param code    the status code
   */
  public SyncResult {
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(message, "message must not be null");
  }

  /**
   * Creates a successful result with code 200.
   *
   * @param message the message, never null
   *
   * @return the result, never null
   */
  public static SyncResult ok(final String message) {
    return new SyncResult(SyncStatus.SUCCESS, message, 200);
  }

  /**
   * Creates a failed result.
   *
   * @param message the message, never null
   * @param code    the status code
   *
   * @return the result, never null
   */
  public static SyncResult failure(final String message, final int code) {
    return new SyncResult(SyncStatus.FAILED, message, code);
  }

  /**
   * Creates the result returned when sync is disabled.
   *
   * @return the skipped result, never null
   */
  public static SyncResult disabled() {
    return new SyncResult(SyncStatus.SKIPPED, DISABLED_MESSAGE, 200);
  }

  /**
   * Whether the operation completed.
   *
   * @return true only for {@link SyncStatus#SUCCESS}
   */
  public boolean succeeded() {
    return status == SyncStatus.SUCCESS;
  }
}
