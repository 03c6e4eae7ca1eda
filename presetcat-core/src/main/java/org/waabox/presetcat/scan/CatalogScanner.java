package org.waabox.presetcat.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.presetcat.CatalogIndex;
import org.waabox.presetcat.Device;
import org.waabox.presetcat.document.DeviceDocument;
import org.waabox.presetcat.document.DocumentCache;
import org.waabox.presetcat.document.DocumentCodec;
import org.waabox.presetcat.document.DocumentParseException;
import org.waabox.presetcat.metrics.CatalogMetrics;

/**
 * Walks the catalog root and builds a {@link CatalogIndex}.
 *
 * <p>The work fans out on two levels: an outer pool goes over the
 * manufacturer directories and, for each manufacturer, an inner pool
 * parses its device documents. Both pools are bounded so the total
 * number of concurrent reads stays limited.
 *
 * <p>Workers only return per-manufacturer results; the calling thread
 * merges them into the index once every future has completed. A broken
 * document is logged and skipped, a manufacturer that cannot be listed
 * contributes nothing, and if the concurrent path fails as a whole the
 * scan is repeated sequentially. {@link #scan(Path)} never throws.
 *
 * <p>The pools belong to the scanner; {@link #close()} shuts them down.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogScanner implements AutoCloseable {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      CatalogScanner.class);

  /** The directory holding community folders, never a device. */
  public static final String COMMUNITY_DIR = "community";

  /** The extension of catalog documents. */
  private static final String JSON_EXTENSION = ".json";

  /** Upper bound for both pools. */
  private static final int MAX_WORKERS = 32;

  /** The document cache shared with the rest of the catalog. */
  private final DocumentCache cache;

  /** The codec used to turn trees into records. */
  private final DocumentCodec codec;

  /** How long a cached document stays fresh. */
  private final Duration ttl;

  /** The metrics hooks. */
  private final CatalogMetrics metrics;

  /** The pool that scans manufacturers. */
  private final ExecutorService manufacturerPool;

  /** The pool that parses device documents. */
  private final ExecutorService documentPool;

  /** The version given to the next index. */
  private final AtomicLong versionCounter = new AtomicLong(0);

  /**
   * Creates a new scanner with pools sized from the available processors.
   *
   * @param cache   the document cache, never null
   * @param codec   the codec, never null
   * @param ttl     the document TTL, never null
   * @param metrics the metrics hooks, never null
   */
  public CatalogScanner(final DocumentCache cache, final DocumentCodec codec,
      final Duration ttl, final CatalogMetrics metrics) {
    this(cache, codec, ttl, metrics, manufacturerWorkers(),
        documentWorkers());
  }

  /**
   * Creates a new scanner.
   *
   * @param cache               the document cache, never null
   * @param codec               the codec, never null
   * @param ttl                 the document TTL, never null
   * @param metrics             the metrics hooks, never null
   * @param manufacturerWorkers the width of the manufacturer pool
   * @param documentWorkers     the width of the document pool
   */
  public CatalogScanner(final DocumentCache cache, final DocumentCodec codec,
      final Duration ttl, final CatalogMetrics metrics,
      final int manufacturerWorkers, final int documentWorkers) {
    this.cache = Objects.requireNonNull(cache, "cache must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
    this.metrics = Objects.requireNonNull(metrics,
        "metrics must not be null");
    if (manufacturerWorkers < 1 || documentWorkers < 1) {
      throw new IllegalArgumentException("Pool widths must be positive");
    }
    manufacturerPool = Executors.newFixedThreadPool(manufacturerWorkers,
        threadFactory("presetcat-scan-manufacturer"));
    documentPool = Executors.newFixedThreadPool(documentWorkers,
        threadFactory("presetcat-scan-document"));
  }

  /**
   * The default width of the manufacturer pool.
   *
   * @return {@code min(32, 4 * processors)}
   */
  static int manufacturerWorkers() {
    return Math.min(MAX_WORKERS,
        Runtime.getRuntime().availableProcessors() * 4);
  }

  /**
   * The default width of the document pool.
   *
   * @return {@code min(32, 2 * processors)}
   */
  static int documentWorkers() {
    return Math.min(MAX_WORKERS,
        Runtime.getRuntime().availableProcessors() * 2);
  }

  /**
   * Scans the given root and returns a fresh index.
   *
   * @param root the catalog root, never null
   *
   * @return the index, never null; empty when the root does not exist
   */
  public CatalogIndex scan(final Path root) {
    Objects.requireNonNull(root, "root must not be null");

    final long start = System.nanoTime();

    if (!Files.isDirectory(root)) {
      log.warn("Catalog root {} does not exist", root);
      return CatalogIndex.of(root, List.of(), Map.of(), Map.of(),
          versionCounter.incrementAndGet());
    }

    final List<String> manufacturers;
    try {
      manufacturers = listManufacturers(root);
    } catch (final IOException e) {
      log.error("Could not list catalog root {}", root, e);
      return CatalogIndex.of(root, List.of(), Map.of(), Map.of(),
          versionCounter.incrementAndGet());
    }

    List<ManufacturerScan> results;
    try {
      results = scanConcurrently(root, manufacturers);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Scan of {} interrupted, falling back to sequential scan",
          root);
      results = scanSequentially(root, manufacturers);
    } catch (final RuntimeException | ExecutionException e) {
      log.warn("Concurrent scan of {} failed, falling back to sequential"
          + " scan: {}", root, e.toString());
      results = scanSequentially(root, manufacturers);
    }

    final CatalogIndex index = merge(root, manufacturers, results);

    final long durationMs = TimeUnit.NANOSECONDS.toMillis(
        System.nanoTime() - start);
    log.info("Scanned {} manufacturers and {} devices in {} ms",
        index.manufacturers().size(), index.devices().size(), durationMs);
    metrics.scanCompleted(index.manufacturers().size(),
        index.devices().size(), durationMs);
    return index;
  }

  /** Shuts both pools down, waiting briefly for running work. */
  @Override
  public void close() {
    shutdown(manufacturerPool);
    shutdown(documentPool);
  }

  private List<ManufacturerScan> scanConcurrently(final Path root,
      final List<String> manufacturers)
      throws InterruptedException, ExecutionException {
    final List<Future<ManufacturerScan>> futures = new ArrayList<>();
    for (final String manufacturer : manufacturers) {
      futures.add(manufacturerPool.submit(
          () -> scanManufacturer(root, manufacturer, true)));
    }
    final List<ManufacturerScan> results = new ArrayList<>();
    for (final Future<ManufacturerScan> future : futures) {
      results.add(future.get());
    }
    return results;
  }

  private List<ManufacturerScan> scanSequentially(final Path root,
      final List<String> manufacturers) {
    final List<ManufacturerScan> results = new ArrayList<>();
    for (final String manufacturer : manufacturers) {
      results.add(scanManufacturer(root, manufacturer, false));
    }
    return results;
  }

  /**
   * Scans one manufacturer directory. Never throws; a directory that
   * cannot be listed yields an empty result.
   */
  private ManufacturerScan scanManufacturer(final Path root,
      final String manufacturer, final boolean concurrent) {
    final Path manufacturerDir = root.resolve(manufacturer);
    try {
      final List<String> communityFolders = listCommunityFolders(
          manufacturerDir);
      final List<Path> documents = listDeviceDocuments(manufacturerDir);

      final List<Device> devices = new ArrayList<>();
      if (concurrent) {
        final List<Future<Optional<Device>>> futures = new ArrayList<>();
        for (final Path document : documents) {
          futures.add(documentPool.submit(
              () -> loadDevice(document, manufacturer, communityFolders)));
        }
        for (final Future<Optional<Device>> future : futures) {
          future.get().ifPresent(devices::add);
        }
      } else {
        for (final Path document : documents) {
          loadDevice(document, manufacturer, communityFolders)
              .ifPresent(devices::add);
        }
      }
      log.debug("Manufacturer {} has {} devices", manufacturer,
          devices.size());
      return new ManufacturerScan(manufacturer, devices);

    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Scan of manufacturer {} interrupted", manufacturer);
    } catch (final IOException | ExecutionException | RuntimeException e) {
      log.error("Error processing manufacturer {}: {}", manufacturer,
          e.toString());
    }
    return new ManufacturerScan(manufacturer, List.of());
  }

  /**
   * Loads one device document through the cache. Documents that are
   * unreadable or lack a device name are skipped.
   */
  private Optional<Device> loadDevice(final Path document,
      final String manufacturer, final List<String> communityFolders) {
    final JsonNode node = cache.get(document, ttl);
    if (node.isEmpty()) {
      metrics.documentSkipped(document, "unreadable or empty document");
      return Optional.empty();
    }
    try {
      final DeviceDocument parsed = codec.toDevice(node);
      log.debug("Added device {} from {}", parsed.deviceInfo().name(),
          document);
      return Optional.of(Device.of(manufacturer, document, parsed,
          communityFolders));
    } catch (final DocumentParseException e) {
      log.warn("Skipping {}: {}", document, e.getMessage());
      metrics.documentSkipped(document, e.getMessage());
      return Optional.empty();
    }
  }

  private CatalogIndex merge(final Path root,
      final List<String> manufacturers,
      final List<ManufacturerScan> results) {
    final Map<String, Device> devices = new HashMap<>();
    final Map<String, List<String>> structure = new HashMap<>();
    for (final String manufacturer : manufacturers) {
      structure.put(manufacturer, List.of());
    }
    for (final ManufacturerScan result : results) {
      final TreeSet<String> names = new TreeSet<>();
      for (final Device device : result.devices()) {
        final Device previous = devices.put(device.name(), device);
        if (previous != null) {
          log.warn("Device name {} found in {} and {}; keeping {}",
              device.name(), previous.documentPath(),
              device.documentPath(), device.documentPath());
        }
        names.add(device.name());
      }
      structure.put(result.manufacturer(), new ArrayList<>(names));
    }
    return CatalogIndex.of(root, manufacturers, structure, devices,
        versionCounter.incrementAndGet());
  }

  private static List<String> listManufacturers(final Path root)
      throws IOException {
    try (Stream<Path> entries = Files.list(root)) {
      final List<String> names = new ArrayList<>();
      entries.filter(Files::isDirectory)
          .map(p -> p.getFileName().toString())
          .filter(name -> !name.startsWith("."))
          .forEach(names::add);
      Collections.sort(names);
      return names;
    }
  }

  /** Lists the JSON documents directly under the manufacturer directory
   * and under each device directory, excluding the community directory. */
  private static List<Path> listDeviceDocuments(final Path manufacturerDir)
      throws IOException {
    final List<Path> documents = new ArrayList<>(jsonFiles(manufacturerDir));
    try (Stream<Path> entries = Files.list(manufacturerDir)) {
      final List<Path> deviceDirs = entries
          .filter(Files::isDirectory)
          .filter(p -> !COMMUNITY_DIR.equals(p.getFileName().toString()))
          .sorted()
          .toList();
      for (final Path deviceDir : deviceDirs) {
        documents.addAll(jsonFiles(deviceDir));
      }
    }
    return documents;
  }

  private static List<String> listCommunityFolders(
      final Path manufacturerDir) throws IOException {
    final Path communityDir = manufacturerDir.resolve(COMMUNITY_DIR);
    if (!Files.isDirectory(communityDir)) {
      return List.of();
    }
    final List<String> folders = new ArrayList<>();
    for (final Path file : jsonFiles(communityDir)) {
      final String name = file.getFileName().toString();
      folders.add(name.substring(0, name.length() - JSON_EXTENSION.length()));
    }
    return folders;
  }

  private static List<Path> jsonFiles(final Path dir) throws IOException {
    try (Stream<Path> entries = Files.list(dir)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().endsWith(JSON_EXTENSION))
          .sorted()
          .toList();
    }
  }

  private static ThreadFactory threadFactory(final String prefix) {
    final AtomicInteger counter = new AtomicInteger();
    return r -> {
      final Thread thread = new Thread(r,
          prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private static void shutdown(final ExecutorService pool) {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
        pool.shutdownNow();
      }
    } catch (final InterruptedException e) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** The devices found under one manufacturer directory. */
  private record ManufacturerScan(String manufacturer, List<Device> devices) {
  }
}
