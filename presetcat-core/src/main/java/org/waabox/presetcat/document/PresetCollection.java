package org.waabox.presetcat.document;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A named group of presets inside a device document.
 *
 * @param metadata       the collection metadata, may be null on hand
 *                       written files
 * @param presets        the presets in document order, never null
 * @param presetMetadata preset id to free-form metadata, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PresetCollection(
    @JsonProperty("metadata") CollectionMetadata metadata,
    @JsonProperty("presets") List<Preset> presets,
    @JsonProperty("preset_metadata") Map<String, JsonNode> presetMetadata
) {

  /** The key of the collection that holds a device's built-in presets. */
  public static final String FACTORY_PRESETS = "factory_presets";

  /** Creates a new collection, normalizing absent parts to empty ones. */
  public PresetCollection {
    presets = Copies.list(presets);
    presetMetadata = Copies.map(presetMetadata);
  }

  /**
   * Creates an empty collection.
   *
   * @param key    the collection key, never null
   * @param device the owning device name, never null
   * @param now    the creation time, never null
   *
   * @return the collection, never null
   */
  public static PresetCollection empty(final String key, final String device,
      final Instant now) {
    return new PresetCollection(CollectionMetadata.initial(key, device, now),
        List.of(), Map.of());
  }

  /**
   * Finds a preset by its name.
   *
   * @param presetName the name, never null
   *
   * @return the preset, or empty when there is none with that name
   */
  public Optional<Preset> preset(final String presetName) {
    return presets.stream()
        .filter(p -> presetName.equals(p.presetName()))
        .findFirst();
  }

  /**
   * Returns a copy holding the given presets and metadata, with the
   * collection metadata stamped with the new count.
   *
   * @param newPresets  the presets, never null
   * @param newMetadata preset id to metadata, never null
   * @param now         the modification time, never null
   *
   * @return the new collection, never null
   */
  public PresetCollection withPresets(final List<Preset> newPresets,
      final Map<String, JsonNode> newMetadata, final Instant now) {
    final CollectionMetadata current = metadata != null
        ? metadata
        : CollectionMetadata.initial("", "", now);
    return new PresetCollection(
        current.withPresetCount(newPresets.size(), now), newPresets,
        newMetadata);
  }

  /**
   * Returns a copy whose metadata carries a new display name.
   *
   * @param newName the display name, never null
   * @param device  the owning device name, used when metadata is absent
   * @param now     the modification time, never null
   *
   * @return the new collection, never null
   */
  public PresetCollection renamed(final String newName, final String device,
      final Instant now) {
    final CollectionMetadata current = metadata != null
        ? metadata
        : CollectionMetadata.initial(newName, device, now);
    return new PresetCollection(current.renamed(newName, now), presets,
        presetMetadata);
  }
}
