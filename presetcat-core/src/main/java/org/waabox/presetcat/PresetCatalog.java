package org.waabox.presetcat;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.presetcat.document.CommunityDocument;
import org.waabox.presetcat.document.DocumentCache;
import org.waabox.presetcat.document.DocumentCodec;
import org.waabox.presetcat.document.DocumentParseException;
import org.waabox.presetcat.document.JsonDocumentStore;
import org.waabox.presetcat.document.Preset;
import org.waabox.presetcat.document.PresetCollection;
import org.waabox.presetcat.metrics.CatalogMetrics;
import org.waabox.presetcat.metrics.NoopCatalogMetrics;
import org.waabox.presetcat.mutation.CatalogMutations;
import org.waabox.presetcat.mutation.DeviceRequest;
import org.waabox.presetcat.mutation.DirectoryStructure;
import org.waabox.presetcat.mutation.DocumentLocks;
import org.waabox.presetcat.mutation.OperationResult;
import org.waabox.presetcat.mutation.PresetRequest;
import org.waabox.presetcat.scan.CatalogScanner;
import org.waabox.presetcat.sync.CatalogSync;
import org.waabox.presetcat.sync.DisabledCatalogSync;
import org.waabox.presetcat.sync.SyncMode;
import org.waabox.presetcat.sync.SyncResult;

/**
 * Main entry point of the preset catalog.
 *
 * <p>A PresetCatalog owns one catalog root: it makes sure the root is in
 * sync with the remote repository, scans it into a {@link CatalogIndex},
 * answers read queries from that index and applies mutations that rewrite
 * the backing documents and rescan.
 *
 * <p>The current index is held in an {@link AtomicReference}; rescans are
 * serialized by a lock and swap the reference, so reads never block.
 *
 * <p>Usage:
 * <pre>{@code
 * PresetCatalog catalog = PresetCatalog.builder()
 *     .root(Path.of("midi-presets"))
 *     .sync(new GitCatalogSync(GitSyncConfig.create(root)))
 *     .syncMode(SyncMode.fromRole(role))
 *     .build();
 *
 * catalog.start();
 * List<PresetEntry> presets = catalog.presets(PresetQuery.of("Moog", "Sub37"));
 * catalog.stop();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PresetCatalog {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      PresetCatalog.class);

  /** The catalog root. */
  private final Path root;

  /** How long cached documents stay fresh. */
  private final Duration cacheTtl;

  /** The document cache shared by scanner and readers. */
  private final DocumentCache cache;

  /** The codec for community documents. */
  private final DocumentCodec codec;

  /** The scanner that builds indices. */
  private final CatalogScanner scanner;

  /** The mutation operations, bound to this catalog's index. */
  private final CatalogMutations mutations;

  /** The sync engine. */
  private final CatalogSync sync;

  /** The sync mode. */
  private final SyncMode syncMode;

  /** The metrics hooks. */
  private final CatalogMetrics metrics;

  /** The current index, atomically swapped on rescan. */
  private final AtomicReference<CatalogIndex> current =
      new AtomicReference<>(CatalogIndex.empty());

  /** The lock used to serialize rescans. */
  private final ReentrantLock refreshLock = new ReentrantLock();

  /** Whether start() has been called. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether stop() has been called. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  private PresetCatalog(final Path root, final Duration cacheTtl,
      final CatalogSync sync, final SyncMode syncMode,
      final CatalogMetrics metrics, final Clock clock) {
    this.root = root;
    this.cacheTtl = cacheTtl;
    this.sync = sync;
    this.syncMode = syncMode;
    this.metrics = metrics;
    codec = new DocumentCodec();
    cache = new DocumentCache(codec, clock);
    scanner = new CatalogScanner(cache, codec, cacheTtl, metrics);
    mutations = new CatalogMutations(root, new JsonDocumentStore(codec),
        cache, new DocumentLocks(), current::get, this::rescan, clock);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the catalog: makes sure the root is healthy for the configured
   * sync mode and then scans it.
   *
   * <p>A failed sync does not prevent the scan; whatever is on disk is
   * indexed.
   *
   * @return the result of the sync step, never null
   *
   * @throws IllegalStateException if the catalog was already started
   */
  public SyncResult start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException(
          "PresetCatalog has already been started");
    }
    final SyncResult result = sync.ensureHealthy(syncMode);
    metrics.syncCompleted(syncMode, result);
    switch (result.status()) {
      case SUCCESS -> log.info("Catalog root {} ready: {}", root,
          result.message());
      case SKIPPED -> log.info("Catalog root {}: {}", root, result.message());
      case FAILED -> log.error("Catalog root {} could not be synced: {}",
          root, result.message());
      default -> throw new IllegalStateException(
          "Unknown sync status " + result.status());
    }
    rescan();
    return result;
  }

  /**
   * Rebuilds the index from disk and swaps it in.
   *
   * @throws IllegalStateException if the catalog has been stopped
   */
  public void rescan() {
    if (stopped.get()) {
      throw new IllegalStateException(
          "Cannot rescan after stop() has been called");
    }
    refreshLock.lock();
    try {
      current.set(scanner.scan(root));
    } finally {
      refreshLock.unlock();
    }
  }

  /**
   * Brings the root up to date with the remote and rescans on success.
   * Cached documents are dropped since the sync may rewrite any file.
   *
   * @return the sync result, never null
   */
  public SyncResult sync() {
    return afterSync(sync.sync(syncMode));
  }

  /**
   * Runs the submodule repair ladder and rescans on success.
   *
   * @return the sync result, never null
   */
  public SyncResult repair() {
    return afterSync(sync.repair());
  }

  /**
   * Commits and pushes local edits to the remote.
   *
   * @return the sync result, never null
   */
  public SyncResult pushLocalChanges() {
    final SyncResult result = sync.pushLocalChanges(syncMode);
    metrics.syncCompleted(syncMode, result);
    log.info("Remote sync of {}: {}", root, result.message());
    return result;
  }

  /**
   * Stops the catalog, shutting down the scanner pools and dropping the
   * cache. Calling it more than once has no effect.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    scanner.close();
    cache.clear();
    log.info("Preset catalog at {} stopped", root);
  }

  /** Drops every cached document. The next scan reads from disk. */
  public void clearCache() {
    cache.clear();
  }

  /**
   * Returns the current index.
   *
   * @return the index, never null
   */
  public CatalogIndex index() {
    return current.get();
  }

  /**
   * Returns the catalog root.
   *
   * @return the root, never null
   */
  public Path root() {
    return root;
  }

  /**
   * Returns the sync mode this catalog runs with.
   *
   * @return the sync mode, never null
   */
  public SyncMode syncMode() {
    return syncMode;
  }

  /**
   * Returns the manufacturers, sorted.
   *
   * @return the manufacturer names, never null
   */
  public List<String> manufacturers() {
    return current.get().manufacturers();
  }

  /**
   * Returns the device names of a manufacturer, sorted.
   *
   * @param manufacturer the manufacturer, never null
   *
   * @return the device names, empty when the manufacturer is unknown
   */
  public List<String> devicesByManufacturer(final String manufacturer) {
    return current.get().deviceNames(mutations.manufacturerKey(manufacturer));
  }

  /**
   * Returns the devices of a manufacturer.
   *
   * @param manufacturer the manufacturer, never null
   *
   * @return the devices, empty when the manufacturer is unknown
   */
  public List<Device> deviceInfo(final String manufacturer) {
    return current.get().devicesOf(mutations.manufacturerKey(manufacturer));
  }

  /**
   * Returns the community folders available to a device.
   *
   * @param device the device name, never null
   *
   * @return the folder names, empty when the device is unknown
   */
  public List<String> communityFolders(final String device) {
    return current.get().device(device)
        .map(Device::communityFolders)
        .orElse(List.of());
  }

  /**
   * Returns the collection keys of a device, in document order.
   *
   * @param manufacturer the manufacturer, never null
   * @param device       the device name, never null
   *
   * @return the collection keys, empty when the device is unknown
   */
  public List<String> collections(final String manufacturer,
      final String device) {
    return current.get().device(mutations.manufacturerKey(manufacturer),
            device)
        .map(Device::collectionNames)
        .orElse(List.of());
  }

  /**
   * Lists presets.
   *
   * <p>Devices are selected by the query's manufacturer and device; a
   * null filter matches everything. The presets of every collection of
   * each selected device are returned with source {@code default}. When
   * the query names a community folder that a device has, its presets are
   * appended with the folder name as source.
   *
   * @param query the filters, never null
   *
   * @return the presets, never null
   */
  public List<PresetEntry> presets(final PresetQuery query) {
    Objects.requireNonNull(query, "query must not be null");
    final List<PresetEntry> result = new ArrayList<>();
    for (final Device device : select(current.get(), query,
        mutations::manufacturerKey)) {
      for (final Map.Entry<String, PresetCollection> entry
          : device.document().presetCollections().entrySet()) {
        for (final Preset preset : entry.getValue().presets()) {
          result.add(new PresetEntry(preset, device.manufacturer(),
              device.name(), entry.getKey(), PresetEntry.DEFAULT_SOURCE));
        }
      }
      if (query.communityFolder() != null) {
        result.addAll(communityPresets(device, query.communityFolder()));
      }
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Finds the first preset with the given name, searching devices in
   * name order.
   *
   * @param presetName the preset name, never null
   *
   * @return the preset, or empty if no device has it
   */
  public Optional<PresetEntry> presetByName(final String presetName) {
    Objects.requireNonNull(presetName, "presetName must not be null");
    return presets(PresetQuery.all()).stream()
        .filter(entry -> presetName.equals(entry.presetName()))
        .findFirst();
  }

  /** See {@link CatalogMutations#createManufacturer(String)}. */
  public OperationResult createManufacturer(final String name) {
    return mutations.createManufacturer(name);
  }

  /** See {@link CatalogMutations#deleteManufacturer(String)}. */
  public OperationResult deleteManufacturer(final String name) {
    return mutations.deleteManufacturer(name);
  }

  /** See {@link CatalogMutations#createDevice(DeviceRequest)}. */
  public OperationResult createDevice(final DeviceRequest request) {
    return mutations.createDevice(request);
  }

  /** See {@link CatalogMutations#deleteDevice(String, String)}. */
  public OperationResult deleteDevice(final String manufacturer,
      final String device) {
    return mutations.deleteDevice(manufacturer, device);
  }

  /** See {@link CatalogMutations#createPreset(PresetRequest)}. */
  public OperationResult createPreset(final PresetRequest request) {
    return mutations.createPreset(request);
  }

  /** See {@link CatalogMutations#updatePreset(PresetRequest)}. */
  public OperationResult updatePreset(final PresetRequest request) {
    return mutations.updatePreset(request);
  }

  /** See {@link CatalogMutations#deletePreset}. */
  public OperationResult deletePreset(final String manufacturer,
      final String device, final String collection, final String presetName) {
    return mutations.deletePreset(manufacturer, device, collection,
        presetName);
  }

  /** See {@link CatalogMutations#createCollection}. */
  public OperationResult createCollection(final String manufacturer,
      final String device, final String collection) {
    return mutations.createCollection(manufacturer, device, collection);
  }

  /** See {@link CatalogMutations#renameCollection}. */
  public OperationResult renameCollection(final String manufacturer,
      final String device, final String collection, final String newName) {
    return mutations.renameCollection(manufacturer, device, collection,
        newName);
  }

  /** See {@link CatalogMutations#deleteCollection}. */
  public OperationResult deleteCollection(final String manufacturer,
      final String device, final String collection) {
    return mutations.deleteCollection(manufacturer, device, collection);
  }

  /** See {@link CatalogMutations#checkDirectoryStructure}. */
  public DirectoryStructure checkDirectoryStructure(final String manufacturer,
      final String device, final boolean createIfMissing) {
    return mutations.checkDirectoryStructure(manufacturer, device,
        createIfMissing);
  }

  private SyncResult afterSync(final SyncResult result) {
    metrics.syncCompleted(syncMode, result);
    if (result.succeeded()) {
      cache.clear();
      rescan();
    } else {
      log.warn("Sync of {} did not complete: {}", root, result.message());
    }
    return result;
  }

  private static List<Device> select(final CatalogIndex index,
      final PresetQuery query, final UnaryOperator<String> manufacturerKey) {
    if (query.device() != null) {
      final Optional<Device> device = query.manufacturer() != null
          ? index.device(manufacturerKey.apply(query.manufacturer()),
              query.device())
          : index.device(query.device());
      return device.map(List::of).orElse(List.of());
    }
    if (query.manufacturer() != null) {
      return index.devicesOf(manufacturerKey.apply(query.manufacturer()));
    }
    return List.copyOf(index.devices().values());
  }

  private List<PresetEntry> communityPresets(final Device device,
      final String folder) {
    if (!device.communityFolders().contains(folder)) {
      log.warn("Community folder {} not found for device {}", folder,
          device.name());
      return List.of();
    }
    final Path file = root.resolve(device.manufacturer())
        .resolve(CatalogScanner.COMMUNITY_DIR)
        .resolve(folder + ".json");
    final JsonNode node = cache.get(file, cacheTtl);
    try {
      final CommunityDocument document = codec.toCommunity(node);
      final List<PresetEntry> result = new ArrayList<>();
      for (final Preset preset : document.presets()) {
        result.add(new PresetEntry(preset, device.manufacturer(),
            device.name(), null, folder));
      }
      return result;
    } catch (final DocumentParseException e) {
      log.warn("Skipping community folder {}: {}", file, e.getMessage());
      return List.of();
    }
  }

  /**
   * Builder for {@link PresetCatalog}.
   *
   * <p>Defaults:
   * <ul>
   *   <li>cacheTtl: {@link DocumentCache#DEFAULT_TTL}</li>
   *   <li>sync: {@link DisabledCatalogSync}</li>
   *   <li>syncMode: {@link SyncMode#CLONE}</li>
   *   <li>metrics: {@link NoopCatalogMetrics}</li>
   *   <li>clock: the system UTC clock</li>
   * </ul>
   */
  public static final class Builder {

    /** The catalog root, required. */
    private Path root;

    /** The optional cache TTL. */
    private Duration cacheTtl;

    /** The optional sync engine. */
    private CatalogSync sync;

    /** The optional sync mode. */
    private SyncMode syncMode;

    /** The optional metrics hooks. */
    private CatalogMetrics metrics;

    /** The optional time source. */
    private Clock clock;

    private Builder() {
    }

    /**
     * Sets the catalog root directory.
     *
     * @param theRoot the root, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder root(final Path theRoot) {
      Objects.requireNonNull(theRoot, "root must not be null");
      this.root = theRoot;
      return this;
    }

    /**
     * Sets how long parsed documents stay cached.
     *
     * @param theCacheTtl the TTL, never null and not negative
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if the TTL is negative
     */
    public Builder cacheTtl(final Duration theCacheTtl) {
      Objects.requireNonNull(theCacheTtl, "cacheTtl must not be null");
      if (theCacheTtl.isNegative()) {
        throw new IllegalArgumentException("cacheTtl must not be negative");
      }
      this.cacheTtl = theCacheTtl;
      return this;
    }

    /**
     * Sets the sync engine.
     *
     * @param theSync the sync engine, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder sync(final CatalogSync theSync) {
      Objects.requireNonNull(theSync, "sync must not be null");
      this.sync = theSync;
      return this;
    }

    /**
     * Sets the sync mode.
     *
     * @param theSyncMode the mode, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder syncMode(final SyncMode theSyncMode) {
      Objects.requireNonNull(theSyncMode, "syncMode must not be null");
      this.syncMode = theSyncMode;
      return this;
    }

    /**
     * Sets the metrics hooks.
     *
     * @param theMetrics the metrics, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metrics(final CatalogMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Sets the time source used for cache expiry and metadata stamps.
     *
     * @param theClock the clock, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder clock(final Clock theClock) {
      Objects.requireNonNull(theClock, "clock must not be null");
      this.clock = theClock;
      return this;
    }

    /**
     * Builds the catalog.
     *
     * @return a new catalog, never null
     *
     * @throws IllegalStateException if no root was set
     */
    public PresetCatalog build() {
      if (root == null) {
        throw new IllegalStateException("root must be set");
      }
      return new PresetCatalog(
          root,
          cacheTtl != null ? cacheTtl : DocumentCache.DEFAULT_TTL,
          sync != null ? sync : new DisabledCatalogSync(),
          syncMode != null ? syncMode : SyncMode.CLONE,
          metrics != null ? metrics : new NoopCatalogMetrics(),
          clock != null ? clock : Clock.systemUTC());
    }
  }
}
