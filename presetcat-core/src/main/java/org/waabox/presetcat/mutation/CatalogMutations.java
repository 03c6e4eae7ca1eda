package org.waabox.presetcat.mutation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.presetcat.CatalogIndex;
import org.waabox.presetcat.Device;
import org.waabox.presetcat.document.DeviceDocument;
import org.waabox.presetcat.document.DeviceInfo;
import org.waabox.presetcat.document.DocumentCache;
import org.waabox.presetcat.document.DocumentParseException;
import org.waabox.presetcat.document.FileTrees;
import org.waabox.presetcat.document.JsonDocumentStore;
import org.waabox.presetcat.document.Preset;
import org.waabox.presetcat.document.PresetCollection;

/**
 * Create, update and delete operations over the catalog tree.
 *
 * <p>Every operation validates its input, resolves names through the
 * {@link PathSanitizer}, reads the current document straight from disk
 * while holding its {@link DocumentLocks lock}, rewrites the whole
 * document atomically, invalidates the written path in the cache and
 * finally asks for a rescan so read accessors see the change. Rewrites
 * keep whatever the document holds outside the edited collections.
 *
 * <p>Operations never throw for expected failures: a missing entity, an
 * unsafe name or an I/O error produce a failed {@link OperationResult}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogMutations {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      CatalogMutations.class);

  /** The extension of catalog documents. */
  private static final String JSON_EXTENSION = ".json";

  /** The sanitizer bound to the catalog root. */
  private final PathSanitizer sanitizer;

  /** The store used to read and write documents. */
  private final JsonDocumentStore store;

  /** The cache, invalidated for every written path. */
  private final DocumentCache cache;

  /** The per-document locks. */
  private final DocumentLocks locks;

  /** Supplies the current index. */
  private final Supplier<CatalogIndex> index;

  /** Rebuilds the index after a change. */
  private final Runnable rescan;

  /** The time source for metadata stamps. */
  private final Clock clock;

  /**
   * Creates a new mutation layer.
   *
   * @param root   the catalog root, never null
   * @param store  the document store, never null
   * @param cache  the document cache, never null
   * @param locks  the per-document locks, never null
   * @param index  supplies the current index, never null
   * @param rescan rebuilds the index, never null
   * @param clock  the time source, never null
   */
  public CatalogMutations(final Path root, final JsonDocumentStore store,
      final DocumentCache cache, final DocumentLocks locks,
      final Supplier<CatalogIndex> index, final Runnable rescan,
      final Clock clock) {
    sanitizer = new PathSanitizer(root);
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.cache = Objects.requireNonNull(cache, "cache must not be null");
    this.locks = Objects.requireNonNull(locks, "locks must not be null");
    this.index = Objects.requireNonNull(index, "index must not be null");
    this.rescan = Objects.requireNonNull(rescan, "rescan must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /**
   * Creates a manufacturer directory.
   *
   * @param name the manufacturer name, never null
   *
   * @return the result, carrying the created directory on success
   */
  public OperationResult createManufacturer(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    return run("creating manufacturer", () -> {
      final Path dir = sanitizer.resolve(name);
      if (Files.exists(dir)) {
        return OperationResult.failure(
            "Manufacturer '" + name + "' already exists");
      }
      Files.createDirectories(dir);
      log.info("Created manufacturer {} at {}", name, dir);
      rescan.run();
      return OperationResult.created(
          "Manufacturer '" + name + "' created successfully", dir);
    });
  }

  /**
   * Deletes a manufacturer directory with all its devices.
   *
   * @param name the manufacturer name, never null
   *
   * @return the result
   */
  public OperationResult deleteManufacturer(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    return run("deleting manufacturer", () -> {
      final Path dir = manufacturerDir(name);
      if (!Files.isDirectory(dir)) {
        return OperationResult.failure(
            "Manufacturer '" + name + "' not found");
      }
      FileTrees.delete(dir);
      cache.clear();
      log.info("Deleted manufacturer {}", name);
      rescan.run();
      return OperationResult.ok(
          "Manufacturer '" + name + "' deleted successfully");
    });
  }

  /**
   * Creates a device document under an existing manufacturer, at
   * {@code <manufacturer>/<device>/<manufacturer>_<device>.json}.
   *
   * @param request the device to create, never null
   *
   * @return the result, carrying the document path on success
   */
  public OperationResult createDevice(final DeviceRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    if (isBlank(request.name()) || isBlank(request.manufacturer())) {
      return OperationResult.failure(
          "Device name and manufacturer are required");
    }
    final String name = request.name();
    final String manufacturer = request.manufacturer();
    return run("creating device", () -> {
      final Path manufacturerDir = manufacturerDir(manufacturer);
      if (!Files.isDirectory(manufacturerDir)) {
        return OperationResult.failure(
            "Manufacturer '" + manufacturer + "' not found");
      }
      if (index.get().device(name).isPresent()) {
        return OperationResult.failure("Device '" + name + "' already exists");
      }
      final Path deviceDir = sanitizer.requireWithinRoot(
          manufacturerDir.resolve(sanitizer.sanitize(name)));
      if (firstDocument(deviceDir).isPresent()) {
        return OperationResult.failure("Device '" + name + "' already exists");
      }
      final Path file = writeNewDevice(deviceDir, request);
      rescan.run();
      return OperationResult.created(
          "Device '" + name + "' created successfully", file);
    });
  }

  /**
   * Deletes a device. Devices stored in their own directory have the
   * whole directory removed; flat documents lying directly under the
   * manufacturer have only the document removed.
   *
   * @param manufacturer the manufacturer name, never null
   * @param device       the device name, never null
   *
   * @return the result
   */
  public OperationResult deleteDevice(final String manufacturer,
      final String device) {
    Objects.requireNonNull(manufacturer, "manufacturer must not be null");
    Objects.requireNonNull(device, "device must not be null");
    final Optional<Device> located = index.get().device(
        manufacturerKey(manufacturer), device);
    if (located.isEmpty()) {
      return deviceNotFound(manufacturer, device);
    }
    return run("deleting device", () -> {
      final Path document = sanitizer.requireWithinRoot(
          located.get().documentPath());
      final Path manufacturerDir = manufacturerDir(manufacturer);
      final Path parent = document.getParent();
      if (parent.equals(manufacturerDir)) {
        Files.deleteIfExists(document);
      } else {
        FileTrees.delete(parent);
      }
      cache.invalidate(document);
      log.info("Deleted device {} of {}", device, manufacturer);
      rescan.run();
      return OperationResult.ok("Device '" + device + "' deleted successfully");
    });
  }

  /**
   * Adds a preset to a collection of a device, creating the collection
   * if the device does not have it yet.
   *
   * <p>The preset id is derived once from the name and the position of
   * the preset in its collection, for example {@code lead_1_1}.
   *
   * @param request the preset to create, never null
   *
   * @return the result, carrying the device document path on success
   */
  public OperationResult createPreset(final PresetRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    final Optional<OperationResult> invalid = validate(request);
    if (invalid.isPresent()) {
      return invalid.get();
    }
    final String key = collectionKey(request.collection());
    final String name = request.presetName();

    return editDevice(request.manufacturer(), request.device(),
        "creating preset", document -> {
          final Instant now = clock.instant();
          final PresetCollection collection = document.collection(key)
              .orElseGet(() -> PresetCollection.empty(key, request.device(),
                  now));
          if (collection.preset(name).isPresent()) {
            return Edit.reject("Preset '" + name
                + "' already exists in collection '" + key + "'");
          }
          final String id = presetId(name, collection);

          final List<Preset> presets = new ArrayList<>(collection.presets());
          presets.add(request.toPreset(id));

          final Map<String, JsonNode> metadata =
              new LinkedHashMap<>(collection.presetMetadata());
          metadata.put(id, presetMetadata(now, now));

          return Edit.apply(document.withCollection(key,
              collection.withPresets(presets, metadata, now)),
              "Preset '" + name + "' created successfully");
        });
  }

  /**
   * Replaces the fields of an existing preset. The preset keeps its id
   * and any field it carries outside the preset model.
   *
   * @param request the new preset values, looked up by name, never null
   *
   * @return the result
   */
  public OperationResult updatePreset(final PresetRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    final Optional<OperationResult> invalid = validate(request);
    if (invalid.isPresent()) {
      return invalid.get();
    }
    final String key = collectionKey(request.collection());
    final String name = request.presetName();

    return editDevice(request.manufacturer(), request.device(),
        "updating preset", document -> {
          final Optional<PresetCollection> found = document.collection(key);
          if (found.isEmpty()) {
            return Edit.reject("Collection '" + key + "' not found");
          }
          final PresetCollection collection = found.get();
          final Optional<Preset> existing = collection.preset(name);
          if (existing.isEmpty()) {
            return Edit.reject("Preset '" + name
                + "' not found in collection '" + key + "'");
          }
          final Instant now = clock.instant();
          final String id = existing.get().presetId();

          final List<Preset> presets = new ArrayList<>(collection.presets());
          presets.set(presets.indexOf(existing.get()), request.toPreset(id));

          final Map<String, JsonNode> metadata =
              new LinkedHashMap<>(collection.presetMetadata());
          if (id != null) {
            metadata.put(id, touchedMetadata(metadata.get(id), now));
          }

          return Edit.apply(document.withCollection(key,
              collection.withPresets(presets, metadata, now)),
              "Preset '" + name + "' updated successfully");
        });
  }

  /**
   * Removes a preset from a collection.
   *
   * @param manufacturer the manufacturer name, never null
   * @param device       the device name, never null
   * @param collection   the collection key, never null
   * @param presetName   the preset name, never null
   *
   * @return the result
   */
  public OperationResult deletePreset(final String manufacturer,
      final String device, final String collection, final String presetName) {
    Objects.requireNonNull(collection, "collection must not be null");
    Objects.requireNonNull(presetName, "presetName must not be null");
    return editDevice(manufacturer, device, "deleting preset", document -> {
      final Optional<PresetCollection> found = document.collection(collection);
      if (found.isEmpty()) {
        return Edit.reject("Collection '" + collection + "' not found");
      }
      final Optional<Preset> existing = found.get().preset(presetName);
      if (existing.isEmpty()) {
        return Edit.reject("Preset '" + presetName
            + "' not found in collection '" + collection + "'");
      }
      final List<Preset> presets = new ArrayList<>(found.get().presets());
      presets.remove(existing.get());

      final Map<String, JsonNode> metadata =
          new LinkedHashMap<>(found.get().presetMetadata());
      if (existing.get().presetId() != null) {
        metadata.remove(existing.get().presetId());
      }

      return Edit.apply(document.withCollection(collection,
          found.get().withPresets(presets, metadata, clock.instant())),
          "Preset '" + presetName + "' deleted successfully");
    });
  }

  /**
   * Adds an empty collection to a device. Creating a collection that
   * already exists succeeds without touching the document.
   *
   * @param manufacturer the manufacturer name, never null
   * @param device       the device name, never null
   * @param collection   the collection key, never null
   *
   * @return the result
   */
  public OperationResult createCollection(final String manufacturer,
      final String device, final String collection) {
    Objects.requireNonNull(collection, "collection must not be null");
    if (isBlank(collection)) {
      return OperationResult.failure("Collection name is required");
    }
    return editDevice(manufacturer, device, "creating collection",
        document -> {
          if (document.collection(collection).isPresent()) {
            return Edit.unchanged(
                "Collection '" + collection + "' already exists");
          }
          return Edit.apply(document.withCollection(collection,
              PresetCollection.empty(collection, device, clock.instant())),
              "Collection '" + collection + "' created successfully");
        });
  }

  /**
   * Renames a collection: its content moves to the new key and its
   * display name is replaced.
   *
   * @param manufacturer the manufacturer name, never null
   * @param device       the device name, never null
   * @param collection   the current collection key, never null
   * @param newName      the new key, never null
   *
   * @return the result
   */
  public OperationResult renameCollection(final String manufacturer,
      final String device, final String collection, final String newName) {
    Objects.requireNonNull(collection, "collection must not be null");
    Objects.requireNonNull(newName, "newName must not be null");
    if (isBlank(newName)) {
      return OperationResult.failure("New collection name is required");
    }
    return editDevice(manufacturer, device, "renaming collection",
        document -> {
          final Optional<PresetCollection> found =
              document.collection(collection);
          if (found.isEmpty()) {
            return Edit.reject("Collection '" + collection + "' not found");
          }
          if (collection.equals(newName)) {
            return Edit.unchanged("Collection '" + collection
                + "' already has that name");
          }
          if (document.collection(newName).isPresent()) {
            return Edit.reject("Collection with name '" + newName
                + "' already exists");
          }
          final PresetCollection renamed = found.get().renamed(newName,
              device, clock.instant());
          return new Edit(document.withCollection(newName, renamed)
              .withoutCollection(collection),
              OperationResult.ok("Collection '" + collection
                  + "' renamed to '" + newName + "'"),
              Map.of(newName, collection));
        });
  }

  /**
   * Removes a collection with all its presets.
   *
   * @param manufacturer the manufacturer name, never null
   * @param device       the device name, never null
   * @param collection   the collection key, never null
   *
   * @return the result
   */
  public OperationResult deleteCollection(final String manufacturer,
      final String device, final String collection) {
    Objects.requireNonNull(collection, "collection must not be null");
    return editDevice(manufacturer, device, "deleting collection",
        document -> {
          if (document.collection(collection).isEmpty()) {
            return Edit.reject("Collection '" + collection + "' not found");
          }
          return Edit.apply(document.withoutCollection(collection),
              "Collection '" + collection + "' deleted successfully");
        });
  }

  /**
   * Reports whether the directories and document of a device exist and,
   * when asked to, creates whatever is missing.
   *
   * @param manufacturer    the manufacturer name, never null
   * @param device          the device name, never null
   * @param createIfMissing whether to create missing parts
   *
   * @return the structure after any creation; all false when the names
   *         are unsafe
   */
  public DirectoryStructure checkDirectoryStructure(final String manufacturer,
      final String device, final boolean createIfMissing) {
    Objects.requireNonNull(manufacturer, "manufacturer must not be null");
    Objects.requireNonNull(device, "device must not be null");

    final Optional<Device> known = index.get().device(
        manufacturerKey(manufacturer), device);
    if (known.isPresent() && Files.isRegularFile(known.get().documentPath())) {
      return new DirectoryStructure(true, true, true,
          known.get().documentPath().toAbsolutePath().normalize(), false);
    }

    final Path manufacturerDir;
    final Path deviceDir;
    try {
      manufacturerDir = manufacturerDir(manufacturer);
      deviceDir = sanitizer.requireWithinRoot(
          manufacturerDir.resolve(sanitizer.sanitize(device)));
    } catch (final UnsafePathException e) {
      log.warn("Rejected directory check for {}/{}: {}", manufacturer,
          device, e.getMessage());
      return new DirectoryStructure(false, false, false, null, false);
    }

    boolean manufacturerExists = Files.isDirectory(manufacturerDir);
    boolean deviceExists = Files.isDirectory(deviceDir);
    Optional<Path> document = Optional.empty();
    boolean created = false;

    try {
      document = firstDocument(deviceDir);
      if (createIfMissing) {
        if (!manufacturerExists) {
          Files.createDirectories(manufacturerDir);
          manufacturerExists = true;
          created = true;
        }
        if (!deviceExists) {
          Files.createDirectories(deviceDir);
          deviceExists = true;
          created = true;
        }
        if (document.isEmpty()) {
          document = Optional.of(writeNewDevice(deviceDir,
              DeviceRequest.of(manufacturer, device)));
          created = true;
        }
        if (created) {
          log.info("Created missing structure for {}/{}", manufacturer,
              device);
          rescan.run();
        }
      }
    } catch (final IOException | UncheckedIOException e) {
      log.error("Error checking directory structure for {}/{}: {}",
          manufacturer, device, e.getMessage());
    }

    return new DirectoryStructure(manufacturerExists, deviceExists,
        document.isPresent(), document.orElse(null), created);
  }

  /**
   * Loads a device document under its lock, applies the edit and writes
   * the result back. Rejected and unchanged edits write nothing.
   */
  private OperationResult editDevice(final String manufacturer,
      final String device, final String action,
      final Function<DeviceDocument, Edit> edit) {
    Objects.requireNonNull(manufacturer, "manufacturer must not be null");
    Objects.requireNonNull(device, "device must not be null");

    final Optional<Device> located = index.get().device(
        manufacturerKey(manufacturer), device);
    if (located.isEmpty()) {
      return deviceNotFound(manufacturer, device);
    }
    return run(action, () -> {
      final Path path = sanitizer.requireWithinRoot(
          located.get().documentPath());

      final Edit result = locks.withLock(path, () -> {
        try {
          final JsonNode original = store.read(path);
          final Edit applied = edit.apply(store.toDevice(original));
          if (applied.document() != null) {
            store.rewriteDevice(path, original,
                applied.document().touched(clock.instant()),
                applied.renamed());
          }
          return applied;
        } catch (final IOException e) {
          throw new UncheckedIOException(e);
        }
      });

      if (result.document() == null) {
        return result.result();
      }
      cache.invalidate(path);
      log.info("{} on {}: {}", action, path, result.result().message());
      rescan.run();
      return OperationResult.created(result.result().message(), path);
    });
  }

  private Path writeNewDevice(final Path deviceDir,
      final DeviceRequest request) {
    final String fileName = sanitizer.sanitize(request.manufacturer()) + "_"
        + sanitizer.sanitize(request.name()) + JSON_EXTENSION;
    final Path file = sanitizer.requireWithinRoot(deviceDir.resolve(fileName));

    final DeviceInfo info = new DeviceInfo(request.name(),
        request.version() == null ? "1.0" : request.version(),
        request.manufacturer(), request.manufacturerId(),
        request.deviceId(), null, request.midiChannels(),
        request.midiPorts());
    final DeviceDocument document = DeviceDocument.create(info,
        clock.instant());

    locks.withLock(file, () -> {
      try {
        store.write(file, document);
        return file;
      } catch (final IOException e) {
        throw new UncheckedIOException(e);
      }
    });
    cache.invalidate(file);
    log.info("Created device {} at {}", request.name(), file);
    return file;
  }

  /**
   * Maps a manufacturer name to the key the index stores it under. A name
   * found by the last scan is returned as is; any other name is mapped the
   * way {@link #createManufacturer(String)} names its directory, so
   * "Dave Smith" finds {@code Dave_Smith}. Unsafe names are returned
   * unchanged and match nothing.
   *
   * @param name the manufacturer name, never null
   *
   * @return the index key, never null
   */
  public String manufacturerKey(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    if (index.get().hasManufacturer(name)) {
      return name;
    }
    try {
      return sanitizer.sanitize(name);
    } catch (final UnsafePathException e) {
      log.debug("Manufacturer name {} is not a valid key: {}", name,
          e.getMessage());
      return name;
    }
  }

  /**
   * Resolves a manufacturer directory. Names found by the last scan are
   * used verbatim so existing directories with unusual characters stay
   * reachable; anything else goes through the sanitizer.
   */
  private Path manufacturerDir(final String name) {
    if (index.get().hasManufacturer(name)) {
      return sanitizer.requireWithinRoot(sanitizer.root().resolve(name));
    }
    return sanitizer.resolve(name);
  }

  private static Optional<Path> firstDocument(final Path dir)
      throws IOException {
    if (!Files.isDirectory(dir)) {
      return Optional.empty();
    }
    try (Stream<Path> entries = Files.list(dir)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().endsWith(JSON_EXTENSION))
          .sorted()
          .findFirst();
    }
  }

  private static Optional<OperationResult> validate(
      final PresetRequest request) {
    if (isBlank(request.manufacturer()) || isBlank(request.device())) {
      return Optional.of(OperationResult.failure(
          "Manufacturer and device are required"));
    }
    if (isBlank(request.presetName())) {
      return Optional.of(OperationResult.failure("Preset name is required"));
    }
    if (request.pgm() == null) {
      return Optional.of(OperationResult.failure(
          "Program change value (pgm) is required"));
    }
    return Optional.empty();
  }

  private static String collectionKey(final String collection) {
    return isBlank(collection) ? PresetCollection.FACTORY_PRESETS : collection;
  }

  /**
   * Derives a preset id: the lower-cased name with every run of other
   * characters collapsed into an underscore, followed by the position the
   * preset takes in its collection. The position is bumped past any id
   * already in use.
   */
  static String presetId(final String name,
      final PresetCollection collection) {
    String slug = name.toLowerCase(Locale.ROOT)
        .replaceAll("[^a-z0-9]+", "_")
        .replaceAll("^_+|_+$", "");
    if (slug.isEmpty()) {
      slug = "preset";
    }
    int ordinal = collection.presets().size() + 1;
    while (hasId(collection, slug + "_" + ordinal)) {
      ordinal++;
    }
    return slug + "_" + ordinal;
  }

  private static boolean hasId(final PresetCollection collection,
      final String id) {
    return collection.presetMetadata().containsKey(id)
        || collection.presets().stream()
            .anyMatch(p -> id.equals(p.presetId()));
  }

  private static ObjectNode presetMetadata(final Instant createdAt,
      final Instant modifiedAt) {
    final ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("created_at", createdAt.toString());
    node.put("modified_at", modifiedAt.toString());
    return node;
  }

  private static JsonNode touchedMetadata(final JsonNode existing,
      final Instant now) {
    if (existing == null || !existing.isObject()) {
      return presetMetadata(now, now);
    }
    final ObjectNode copy = ((ObjectNode) existing).deepCopy();
    copy.put("modified_at", now.toString());
    return copy;
  }

  private static OperationResult deviceNotFound(final String manufacturer,
      final String device) {
    return OperationResult.failure("Device '" + device
        + "' not found for manufacturer '" + manufacturer + "'");
  }

  private static boolean isBlank(final String value) {
    return value == null || value.isBlank();
  }

  /** Runs a mutation, turning expected failures into failed results. */
  private static OperationResult run(final String action,
      final Mutation mutation) {
    try {
      return mutation.apply();
    } catch (final UnsafePathException e) {
      log.warn("Rejected {}: {}", action, e.getMessage());
      return OperationResult.failure(e.getMessage());
    } catch (final IOException | UncheckedIOException
        | DocumentParseException e) {
      log.error("Error {}: {}", action, e.getMessage(), e);
      return OperationResult.failure("Error " + action + ": "
          + e.getMessage());
    }
  }

  /** A mutation body that may fail with an I/O error. */
  @FunctionalInterface
  private interface Mutation {
    OperationResult apply() throws IOException;
  }

  /** The outcome of editing a document in memory.
   *
   * <p>A null document means nothing is written; the result is returned
   * as is. Renamed maps new collection keys to the keys they replace.
   */
  private record Edit(DeviceDocument document, OperationResult result,
      Map<String, String> renamed) {

    static Edit apply(final DeviceDocument document, final String message) {
      return new Edit(document, OperationResult.ok(message), Map.of());
    }

    static Edit reject(final String message) {
      return new Edit(null, OperationResult.failure(message), Map.of());
    }

    static Edit unchanged(final String message) {
      return new Edit(null, OperationResult.ok(message), Map.of());
    }
  }
}
