package org.waabox.presetcat.metrics;

import java.nio.file.Path;

import org.waabox.presetcat.sync.SyncMode;
import org.waabox.presetcat.sync.SyncResult;

/**
 * A no-operation implementation of {@link CatalogMetrics}.
 *
 * <p>All methods in this class are intentionally empty.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopCatalogMetrics implements CatalogMetrics {

  /** {@inheritDoc} */
  @Override
  public void scanCompleted(final int manufacturers, final int devices,
      final long durationMs) {
  }

  /** {@inheritDoc} */
  @Override
  public void documentSkipped(final Path path, final String cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void syncCompleted(final SyncMode mode, final SyncResult result) {
  }
}
