package org.waabox.presetcat.document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizes parsed JSON documents by path, with a time-to-live.
 *
 * <p>A lookup made within the TTL of the previous load returns the stored
 * tree without touching the disk. Entries are not invalidated when files
 * change underneath; writers read their documents through
 * {@link JsonDocumentStore} and call {@link #invalidate(Path)} for the
 * paths they wrote.
 *
 * <p>Missing or unreadable files never raise: they produce an empty object
 * tree and a warning, and are not stored.
 *
 * <p>Returned trees are shared with other callers and must not be
 * modified.
 *
 * <p>This class is thread-safe; the scanner's workers populate it
 * concurrently.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DocumentCache {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      DocumentCache.class);

  /** The TTL used when callers do not have a better one. */
  public static final Duration DEFAULT_TTL = Duration.ofHours(1);

  /** The loaded documents, keyed by absolute normalized path. */
  private final Map<Path, Entry> entries = new ConcurrentHashMap<>();

  /** The codec used to read files. */
  private final DocumentCodec codec;

  /** The time source for expiry. */
  private final Clock clock;

  /**
   * Creates a new cache on the system clock.
   *
   * @param codec the codec used to read files, never null
   */
  public DocumentCache(final DocumentCodec codec) {
    this(codec, Clock.systemUTC());
  }

  /**
   * Creates a new cache.
   *
   * @param codec the codec used to read files, never null
   * @param clock the time source for expiry, never null
   */
  public DocumentCache(final DocumentCodec codec, final Clock clock) {
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /**
   * Returns the parsed document at the given path.
   *
   * @param path the document path, never null
   * @param ttl  how long a loaded document stays fresh, never null
   *
   * @return the document tree, or an empty object tree when the file is
   *         missing or malformed; never null
   */
  public JsonNode get(final Path path, final Duration ttl) {
    Objects.requireNonNull(path, "path must not be null");
    Objects.requireNonNull(ttl, "ttl must not be null");

    final Path key = key(path);
    final Instant now = clock.instant();

    final Entry cached = entries.get(key);
    if (cached != null && cached.isFresh(now, ttl)) {
      log.debug("Cache hit for {}", key);
      return cached.value();
    }

    if (!Files.exists(key)) {
      log.warn("File not found: {}", key);
      return JsonNodeFactory.instance.objectNode();
    }

    try {
      final JsonNode value = codec.read(key);
      entries.put(key, new Entry(now, value));
      log.debug("Loaded {}", key);
      return value;
    } catch (final NoSuchFileException e) {
      log.warn("File not found: {}", key);
    } catch (final IOException | DocumentParseException e) {
      log.warn("Could not parse JSON file {}: {}", key, e.getMessage());
    }
    return JsonNodeFactory.instance.objectNode();
  }

  /**
   * Drops the entry for the given path, if any.
   *
   * @param path the document path, never null
   */
  public void invalidate(final Path path) {
    Objects.requireNonNull(path, "path must not be null");
    entries.remove(key(path));
  }

  /** Drops every entry. */
  public void clear() {
    entries.clear();
    log.debug("Document cache cleared");
  }

  /**
   * Returns the number of stored entries.
   *
   * @return the number of entries
   */
  public int size() {
    return entries.size();
  }

  private static Path key(final Path path) {
    return path.toAbsolutePath().normalize();
  }

  /** A loaded document and the time it was loaded. */
  private record Entry(Instant loadedAt, JsonNode value) {

    boolean isFresh(final Instant now, final Duration ttl) {
      return Duration.between(loadedAt, now).compareTo(ttl) < 0;
    }
  }
}
