package org.waabox.presetcat.document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * A device document as stored on disk.
 *
 * <p>Instances are immutable. Every change produces a new document that
 * the mutation layer writes back as a whole.
 *
 * @param metadata          the {@code _metadata} block, may be null on
 *                          legacy files
 * @param deviceInfo        the {@code device_info} block, never null
 * @param capabilities      free-form capabilities, never null
 * @param presetCollections collection key to collection, in document
 *                          order, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DeviceDocument(
    @JsonProperty("_metadata") DocumentMetadata metadata,
    @JsonProperty("device_info") DeviceInfo deviceInfo,
    @JsonProperty("capabilities") JsonNode capabilities,
    @JsonProperty("preset_collections")
    Map<String, PresetCollection> presetCollections
) {

  /** Creates a new device document. */
  public DeviceDocument {
    if (capabilities == null || capabilities.isNull()) {
      capabilities = JsonNodeFactory.instance.objectNode();
    }
    presetCollections = Copies.map(presetCollections);
  }

  /**
   * Creates a new device document with no collections.
   *
   * @param info the device info, never null
   * @param now  the creation time, never null
   *
   * @return the document, never null
   */
  public static DeviceDocument create(final DeviceInfo info,
      final Instant now) {
    return new DeviceDocument(DocumentMetadata.initial(now), info,
        JsonNodeFactory.instance.objectNode(), Map.of());
  }

  /**
   * Finds a collection by its key.
   *
   * @param key the collection key, never null
   *
   * @return the collection, or empty if the document has no such key
   */
  public Optional<PresetCollection> collection(final String key) {
    return Optional.ofNullable(presetCollections.get(key));
  }

  /**
   * Returns the collection keys in document order.
   *
   * @return the keys, never null
   */
  public List<String> collectionNames() {
    return List.copyOf(presetCollections.keySet());
  }

  /**
   * Returns a copy where the given collection is stored under the key,
   * replacing any previous value in place or appending it at the end.
   *
   * @param key        the collection key, never null
   * @param collection the collection, never null
   *
   * @return the new document, never null
   */
  public DeviceDocument withCollection(final String key,
      final PresetCollection collection) {
    final Map<String, PresetCollection> copy =
        new LinkedHashMap<>(presetCollections);
    copy.put(key, collection);
    return new DeviceDocument(metadata, deviceInfo, capabilities, copy);
  }

  /**
   * Returns a copy without the given collection.
   *
   * @param key the collection key, never null
   *
   * @return the new document, never null
   */
  public DeviceDocument withoutCollection(final String key) {
    final Map<String, PresetCollection> copy =
        new LinkedHashMap<>(presetCollections);
    copy.remove(key);
    return new DeviceDocument(metadata, deviceInfo, capabilities, copy);
  }

  /**
   * Returns a copy stamped for one more rewrite. Legacy documents without
   * a {@code _metadata} block get a fresh one.
   *
   * @param now the modification time, never null
   *
   * @return the new document, never null
   */
  public DeviceDocument touched(final Instant now) {
    final DocumentMetadata stamped = metadata == null
        ? DocumentMetadata.initial(now)
        : metadata.touched(now);
    return new DeviceDocument(stamped, deviceInfo, capabilities,
        presetCollections);
  }
}
