package org.waabox.presetcat.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.presetcat.CatalogFixtures;
import org.waabox.presetcat.MutableClock;

/**
 * Tests for {@link DocumentCache}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DocumentCacheTest {

  private static final Duration TTL = Duration.ofHours(1);

  @TempDir
  Path tempDir;

  private MutableClock clock;

  private DocumentCache cache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-15T10:00:00Z"));
    cache = new DocumentCache(new DocumentCodec(), clock);
  }

  @Test
  void whenGetting_givenEntryWithinTtl_shouldNotReadTheDiskAgain() {
    final Path file = CatalogFixtures.writeText(
        tempDir.resolve("doc.json"), "{\"value\": 1}");

    assertEquals(1, cache.get(file, TTL).path("value").asInt());

    CatalogFixtures.writeText(file, "{\"value\": 2}");
    clock.advance(Duration.ofMinutes(59));

    assertEquals(1, cache.get(file, TTL).path("value").asInt(),
        "A load within the TTL must come from the cache");
  }

  @Test
  void whenGetting_givenExpiredEntry_shouldReloadFromDisk() {
    final Path file = CatalogFixtures.writeText(
        tempDir.resolve("doc.json"), "{\"value\": 1}");
    cache.get(file, TTL);

    CatalogFixtures.writeText(file, "{\"value\": 2}");
    clock.advance(Duration.ofHours(1));

    assertEquals(2, cache.get(file, TTL).path("value").asInt());
  }

  @Test
  void whenGetting_givenEquivalentPaths_shouldShareOneEntry() {
    final Path file = CatalogFixtures.writeText(
        tempDir.resolve("doc.json"), "{\"value\": 1}");

    cache.get(file, TTL);
    cache.get(tempDir.resolve("sub").resolve("..").resolve("doc.json"), TTL);

    assertEquals(1, cache.size());
  }

  @Test
  void whenGetting_givenMissingFile_shouldReturnEmptyObject() {
    final JsonNode node = cache.get(tempDir.resolve("missing.json"), TTL);

    assertTrue(node.isObject());
    assertTrue(node.isEmpty());
    assertEquals(0, cache.size());
  }

  @Test
  void whenGetting_givenMalformedJson_shouldReturnEmptyObjectWithoutCaching() {
    final Path file = CatalogFixtures.writeText(
        tempDir.resolve("broken.json"), "{\"value\": ");

    final JsonNode node = cache.get(file, TTL);

    assertTrue(node.isObject());
    assertTrue(node.isEmpty());
    assertEquals(0, cache.size(), "Failed loads must not be cached");
  }

  @Test
  void whenGetting_givenJsonArray_shouldReturnEmptyObject() {
    final Path file = CatalogFixtures.writeText(
        tempDir.resolve("array.json"), "[1, 2, 3]");

    assertTrue(cache.get(file, TTL).isEmpty());
  }

  @Test
  void whenInvalidating_givenCachedPath_shouldReloadOnNextGet() {
    final Path file = CatalogFixtures.writeText(
        tempDir.resolve("doc.json"), "{\"value\": 1}");
    cache.get(file, TTL);

    CatalogFixtures.writeText(file, "{\"value\": 2}");
    cache.invalidate(file);

    assertEquals(2, cache.get(file, TTL).path("value").asInt());
  }

  @Test
  void whenClearing_givenSeveralEntries_shouldDropThemAll() {
    cache.get(CatalogFixtures.writeText(tempDir.resolve("a.json"), "{}"),
        TTL);
    cache.get(CatalogFixtures.writeText(tempDir.resolve("b.json"), "{}"),
        TTL);
    assertEquals(2, cache.size());

    cache.clear();

    assertEquals(0, cache.size());
  }
}
