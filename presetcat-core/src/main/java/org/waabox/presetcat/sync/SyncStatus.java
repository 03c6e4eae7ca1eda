package org.waabox.presetcat.sync;

/**
 * Outcome of a sync engine operation.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SyncStatus {

  /** The operation completed. */
  SUCCESS,

  /** The operation did not run, usually because sync is disabled. */
  SKIPPED,

  /** The operation failed; the message explains why. */
  FAILED
}
