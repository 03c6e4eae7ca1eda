package org.waabox.presetcat;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds catalog documents on disk for tests.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogFixtures {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private CatalogFixtures() {
  }

  /** A device document with ports, channels and no collections. */
  public static ObjectNode deviceDocument(final String name,
      final String manufacturer) {
    final ObjectNode root = MAPPER.createObjectNode();
    final ObjectNode info = root.putObject("device_info");
    info.put("name", name);
    info.put("manufacturer", manufacturer);
    info.put("version", "1.0");
    info.putObject("midi_ports").put("IN", "Port A").put("OUT", "Port B");
    info.putObject("midi_channels").put("IN", 1).put("OUT", 10);
    root.putObject("preset_collections");
    return root;
  }

  /** A preset node. */
  public static ObjectNode preset(final String name, final int pgm) {
    final ObjectNode preset = MAPPER.createObjectNode();
    preset.put("preset_name", name);
    preset.put("category", "Lead");
    preset.put("pgm", pgm);
    preset.putArray("characters").add("Bright");
    return preset;
  }

  /** Adds a collection holding the given presets to a device document. */
  public static ObjectNode withCollection(final ObjectNode device,
      final String key, final ObjectNode... presets) {
    final ObjectNode collection = ((ObjectNode) device
        .get("preset_collections")).putObject(key);
    collection.putObject("metadata").put("name", key)
        .put("preset_count", presets.length);
    final ArrayNode list = collection.putArray("presets");
    for (final ObjectNode preset : presets) {
      list.add(preset);
    }
    return device;
  }

  /** A community document holding the given presets. */
  public static ObjectNode communityDocument(final ObjectNode... presets) {
    final ObjectNode root = MAPPER.createObjectNode();
    final ArrayNode list = root.putArray("presets");
    for (final ObjectNode preset : presets) {
      list.add(preset);
    }
    return root;
  }

  /** Writes a tree to the given file, creating its directories. */
  public static Path write(final Path file, final JsonNode content) {
    try {
      Files.createDirectories(file.getParent());
      MAPPER.writeValue(file.toFile(), content);
      return file;
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Writes raw text to the given file, creating its directories. */
  public static Path writeText(final Path file, final String content) {
    try {
      Files.createDirectories(file.getParent());
      Files.writeString(file, content);
      return file;
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Reads a file as a tree. */
  public static JsonNode read(final Path file) {
    try {
      return MAPPER.readTree(file.toFile());
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
