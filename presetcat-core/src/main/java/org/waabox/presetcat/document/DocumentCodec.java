package org.waabox.presetcat.document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts catalog documents between files, Jackson trees and records.
 *
 * <p>Fields that are not part of the record schema are ignored on read,
 * and null record fields are not written. Documents are written pretty
 * printed. Rewrites of an existing device document go through
 * {@link #overlay(JsonNode, DeviceDocument, Map)} so the content the
 * records do not model is kept.
 *
 * <p>Instances are thread-safe and can be shared.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DocumentCodec {

  /** The preset keys owned by {@link Preset}, legacy alias included. */
  private static final List<String> PRESET_FIELDS = List.of("preset_id",
      "preset_name", "category", "characters", "cc_0", "pgm",
      "sendmidi_command", "command");

  /** The Jackson mapper, configured once at construction. */
  private final ObjectMapper mapper;

  /** Creates a new codec. */
  public DocumentCodec() {
    mapper = new ObjectMapper();
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL);
  }

  /**
   * Reads a file as a JSON object tree.
   *
   * @param path the file to read, never null
   *
   * @return the tree, never null
   *
   * @throws IOException if the file cannot be read or is not valid JSON
   * @throws DocumentParseException if the content is not a JSON object
   */
  public JsonNode read(final Path path) throws IOException {
    Objects.requireNonNull(path, "path must not be null");
    final JsonNode node = mapper.readTree(Files.readAllBytes(path));
    if (node == null || !node.isObject()) {
      throw new DocumentParseException(
          "Document is not a JSON object: " + path);
    }
    return node;
  }

  /**
   * Converts a tree into a device document.
   *
   * @param node the tree, never null
   *
   * @return the device document, never null
   *
   * @throws DocumentParseException if {@code device_info.name} is missing
   *                                or the tree does not match the schema
   */
  public DeviceDocument toDevice(final JsonNode node) {
    Objects.requireNonNull(node, "node must not be null");
    final JsonNode name = node.path("device_info").path("name");
    if (!name.isTextual() || name.asText().isBlank()) {
      throw new DocumentParseException(
          "Device document does not have a device_info.name field");
    }
    return convert(node, DeviceDocument.class);
  }

  /**
   * Converts a tree into a community document.
   *
   * @param node the tree, never null
   *
   * @return the community document, never null
   *
   * @throws DocumentParseException if the tree does not match the schema
   */
  public CommunityDocument toCommunity(final JsonNode node) {
    Objects.requireNonNull(node, "node must not be null");
    return convert(node, CommunityDocument.class);
  }

  /**
   * Serializes a document to pretty printed JSON.
   *
   * @param document the document, never null
   *
   * @return the UTF-8 bytes, never null
   *
   * @throws JsonProcessingException if the document cannot be serialized
   */
  public byte[] write(final Object document) throws JsonProcessingException {
    Objects.requireNonNull(document, "document must not be null");
    return mapper.writeValueAsBytes(document);
  }

  /**
   * Lays an edited device document over the tree it was read from.
   *
   * <p>Only {@code _metadata} and {@code preset_collections} are taken
   * from the edited document; every other top-level section, including
   * {@code device_info}, is kept exactly as read. Inside each collection,
   * the keys of the original collection, its metadata and its presets
   * survive unless the edited document sets them. Presets are matched by
   * id, or by name when they have none. Collections and presets missing
   * from the edited document are dropped.
   *
   * @param original the tree the document was read from, never null
   * @param updated  the edited document, never null
   * @param renamed  new collection key to the key it had in the original
   *                 tree, never null
   *
   * @return a new tree, the original is left untouched
   */
  public ObjectNode overlay(final JsonNode original,
      final DeviceDocument updated, final Map<String, String> renamed) {
    Objects.requireNonNull(original, "original must not be null");
    Objects.requireNonNull(updated, "updated must not be null");
    Objects.requireNonNull(renamed, "renamed must not be null");

    final ObjectNode model = mapper.valueToTree(updated);
    final ObjectNode result = original.isObject()
        ? ((ObjectNode) original).deepCopy()
        : mapper.createObjectNode();

    if (model.has("_metadata")) {
      result.set("_metadata", overlayObject(original.get("_metadata"),
          model.get("_metadata")));
    }

    final JsonNode before = original.path("preset_collections");
    final ObjectNode collections = mapper.createObjectNode();
    final Iterator<Map.Entry<String, JsonNode>> entries =
        model.path("preset_collections").fields();
    while (entries.hasNext()) {
      final Map.Entry<String, JsonNode> entry = entries.next();
      final String from = renamed.getOrDefault(entry.getKey(),
          entry.getKey());
      collections.set(entry.getKey(),
          overlayCollection(before.get(from), entry.getValue()));
    }
    result.set("preset_collections", collections);
    return result;
  }

  private JsonNode overlayCollection(final JsonNode original,
      final JsonNode model) {
    if (original == null || !original.isObject()) {
      return model;
    }
    final ObjectNode result = ((ObjectNode) original).deepCopy();
    if (model.has("metadata")) {
      result.set("metadata", overlayObject(original.get("metadata"),
          model.get("metadata")));
    }
    result.set("presets", overlayPresets(original.get("presets"),
        model.get("presets")));
    if (model.has("preset_metadata")) {
      result.set("preset_metadata", model.get("preset_metadata"));
    }
    return result;
  }

  private ArrayNode overlayPresets(final JsonNode original,
      final JsonNode model) {
    final ArrayNode result = mapper.createArrayNode();
    final ArrayNode remaining = original != null && original.isArray()
        ? ((ArrayNode) original).deepCopy()
        : mapper.createArrayNode();
    for (final JsonNode preset : model) {
      final int match = indexOf(remaining, preset);
      if (match < 0) {
        result.add(preset);
        continue;
      }
      final JsonNode before = remaining.remove(match);
      if (!before.isObject() || preset.equals(normalized(before))) {
        result.add(before.isObject() ? before : preset);
        continue;
      }
      final ObjectNode merged = (ObjectNode) before;
      for (final String field : PRESET_FIELDS) {
        if (preset.has(field)) {
          merged.set(field, preset.get(field));
        } else {
          merged.remove(field);
        }
      }
      result.add(merged);
    }
    return result;
  }

  /** Reads a preset through its record and back, or null if it cannot. */
  private JsonNode normalized(final JsonNode preset) {
    try {
      return mapper.valueToTree(mapper.treeToValue(preset, Preset.class));
    } catch (final JsonProcessingException | IllegalArgumentException e) {
      return null;
    }
  }

  private static int indexOf(final ArrayNode presets, final JsonNode preset) {
    final String field = preset.hasNonNull("preset_id")
        ? "preset_id" : "preset_name";
    final JsonNode value = preset.get(field);
    for (int i = 0; i < presets.size(); i++) {
      if (value != null && value.equals(presets.get(i).get(field))) {
        return i;
      }
    }
    return -1;
  }

  private static JsonNode overlayObject(final JsonNode original,
      final JsonNode model) {
    if (original == null || !original.isObject() || !model.isObject()) {
      return model;
    }
    final ObjectNode result = ((ObjectNode) original).deepCopy();
    result.setAll((ObjectNode) model);
    return result;
  }

  private <T> T convert(final JsonNode node, final Class<T> type) {
    try {
      return mapper.treeToValue(node, type);
    } catch (final JsonProcessingException | IllegalArgumentException e) {
      throw new DocumentParseException("Document does not match the "
          + type.getSimpleName() + " schema: " + e.getMessage(), e);
    }
  }
}
