package org.waabox.presetcat.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.presetcat.CatalogFixtures;

/**
 * Tests for {@link JsonDocumentStore}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JsonDocumentStoreTest {

  private final JsonDocumentStore store =
      new JsonDocumentStore(new DocumentCodec());

  @Test
  void whenWriting_givenMissingParentDirectories_shouldCreateThem(
      @TempDir final Path tempDir) throws IOException {
    final Path file = tempDir.resolve("Moog/Sub37/Moog_Sub37.json");

    store.write(file, sub37());

    assertTrue(Files.isRegularFile(file));
    assertFalse(Files.exists(file.resolveSibling(
        "Moog_Sub37.json" + JsonDocumentStore.TEMP_SUFFIX)),
        "The temporary file must be moved over the target");
  }

  @Test
  void whenWriting_givenExistingDocument_shouldReplaceItWhole(
      @TempDir final Path tempDir) throws IOException {
    final Path file = CatalogFixtures.write(tempDir.resolve("Moog_Sub37.json"),
        CatalogFixtures.deviceDocument("Old name", "Moog")
            .put("extra", "dropped"));

    store.write(file, sub37());

    final DeviceDocument read = store.readDevice(file);
    assertEquals("Sub37", read.deviceInfo().name());
    assertFalse(CatalogFixtures.read(file).has("extra"));
  }

  @Test
  void whenRewritingDevice_givenTreeItWasReadFrom_shouldKeepUnknownKeys(
      @TempDir final Path tempDir) throws IOException {
    final Path file = CatalogFixtures.write(tempDir.resolve("Moog_Sub37.json"),
        CatalogFixtures.deviceDocument("Sub37", "Moog").put("extra", "kept"));
    final JsonNode tree = store.read(file);
    final DeviceDocument edited = store.toDevice(tree)
        .touched(Instant.parse("2026-01-15T10:00:00Z"));

    store.rewriteDevice(file, tree, edited, Map.of());

    final JsonNode written = CatalogFixtures.read(file);
    assertEquals("kept", written.path("extra").asText());
    assertEquals(1, written.at("/_metadata/file_revision").asInt());
    assertEquals("Port A", written.at("/device_info/midi_ports/IN").asText());
  }

  @Test
  void whenReading_givenDocumentWithoutDeviceName_shouldThrowParseException(
      @TempDir final Path tempDir) {
    final Path file = CatalogFixtures.writeText(tempDir.resolve("x.json"),
        "{\"device_info\": {}}");

    assertThrows(DocumentParseException.class, () -> store.readDevice(file));
  }

  private static DeviceDocument sub37() {
    return DeviceDocument.create(new DeviceInfo("Sub37", "1.0", "Moog", null,
        null, null, Map.of("IN", 1), Map.of("IN", "")),
        Instant.parse("2026-01-15T10:00:00Z"));
  }
}
