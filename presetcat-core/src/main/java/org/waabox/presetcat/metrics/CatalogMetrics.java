package org.waabox.presetcat.metrics;

import java.nio.file.Path;

import org.waabox.presetcat.sync.SyncMode;
import org.waabox.presetcat.sync.SyncResult;

/**
 * Metrics hooks for the preset catalog.
 *
 * <p>Implementations record scan, parse and sync activity. Every method
 * is called synchronously on the thread doing the work, so
 * implementations must be fast and must not throw.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CatalogMetrics {

  /**
   * Called when a full scan of the catalog root finishes.
   *
   * @param manufacturers the number of manufacturers found
   * @param devices       the number of devices in the resulting index
   * @param durationMs    the time the scan took, in milliseconds
   */
  void scanCompleted(int manufacturers, int devices, long durationMs);

  /**
   * Called when a document is skipped during a scan.
   *
   * @param path  the path of the skipped document, never null
   * @param cause a short description of why it was skipped, never null
   */
  void documentSkipped(Path path, String cause);

  /**
   * Called after every sync engine entry point returns.
   *
   * @param mode   the sync mode used, never null
   * @param result the result of the operation, never null
   */
  void syncCompleted(SyncMode mode, SyncResult result);
}
