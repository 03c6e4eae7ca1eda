package org.waabox.presetcat.sync;

/**
 * Keeps the catalog root in line with the remote preset repository.
 *
 * <p>Implementations never throw for operational failures. Every entry
 * point reports its outcome through a {@link SyncResult}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CatalogSync {

  /**
   * Makes sure the catalog root is a usable checkout for the given mode,
   * cloning or registering it when needed. Calling it again on a healthy
   * root does not discard anything.
   *
   * @param mode the sync mode, never null
   *
   * @return the result, never null
   */
  SyncResult ensureHealthy(SyncMode mode);

  /**
   * Brings the catalog root up to date with the remote.
   *
   * @param mode the sync mode, never null
   *
   * @return the result, never null
   */
  SyncResult sync(SyncMode mode);

  /**
   * Runs the graduated submodule repair, from a plain update up to a
   * complete re-initialization that keeps local files.
   *
   * @return the result, never null
   */
  SyncResult repair();

  /**
   * Commits local edits and uploads them to the remote.
   *
   * @param mode the sync mode, never null
   *
   * @return the result, never null
   */
  SyncResult pushLocalChanges(SyncMode mode);
}
