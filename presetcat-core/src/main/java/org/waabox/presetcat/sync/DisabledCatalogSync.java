package org.waabox.presetcat.sync;

/**
 * A {@link CatalogSync} that never touches git.
 *
 * <p>Used when sync is turned off or when no sync engine is configured.
 * Every entry point returns {@link SyncResult#disabled()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DisabledCatalogSync implements CatalogSync {

  /** {@inheritDoc} */
  @Override
  public SyncResult ensureHealthy(final SyncMode mode) {
    return SyncResult.disabled();
  }

  /** {@inheritDoc} */
  @Override
  public SyncResult sync(final SyncMode mode) {
    return SyncResult.disabled();
  }

  /** {@inheritDoc} */
  @Override
  public SyncResult repair() {
    return SyncResult.disabled();
  }

  /** {@inheritDoc} */
  @Override
  public SyncResult pushLocalChanges(final SyncMode mode) {
    return SyncResult.disabled();
  }
}
