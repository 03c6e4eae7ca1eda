package org.waabox.presetcat.document;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The {@code metadata} block of a preset collection.
 *
 * @param name              the display name
 * @param version           the collection version
 * @param revision          the collection revision, may be null
 * @param author            the author
 * @param description       a free text description
 * @param readonly          whether editors should refuse changes, may be
 *                          null
 * @param presetCount       the number of presets, kept equal to the size
 *                          of the preset list
 * @param parentCollections collections this one derives from, never null
 * @param syncStatus        the sync status label
 * @param createdAt         ISO-8601 creation time
 * @param modifiedAt        ISO-8601 modification time
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CollectionMetadata(
    @JsonProperty("name") String name,
    @JsonProperty("version") String version,
    @JsonProperty("revision") Integer revision,
    @JsonProperty("author") String author,
    @JsonProperty("description") String description,
    @JsonProperty("readonly") Boolean readonly,
    @JsonProperty("preset_count") int presetCount,
    @JsonProperty("parent_collections") List<String> parentCollections,
    @JsonProperty("sync_status") String syncStatus,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("modified_at") String modifiedAt
) {

  /** Creates new collection metadata. */
  public CollectionMetadata {
    parentCollections = Copies.list(parentCollections);
  }

  /**
   * Creates the metadata of a new, empty collection.
   *
   * <p>The well known {@code factory_presets} key is displayed as
   * "Factory Presets"; any other key is displayed as is.
   *
   * @param key    the collection key, never null
   * @param device the owning device name, never null
   * @param now    the creation time, never null
   *
   * @return the metadata, never null
   */
  public static CollectionMetadata initial(final String key,
      final String device, final Instant now) {
    final String name = PresetCollection.FACTORY_PRESETS.equals(key)
        ? "Factory Presets" : key;
    final String timestamp = now.toString();
    return new CollectionMetadata(name, "1.0", 1, DocumentMetadata.AUTHOR,
        name + " for " + device, false, 0, List.of(), "synced", timestamp,
        timestamp);
  }

  /**
   * Returns a copy with a new preset count and modification time.
   *
   * @param count the preset count
   * @param now   the modification time, never null
   *
   * @return the new metadata, never null
   */
  public CollectionMetadata withPresetCount(final int count,
      final Instant now) {
    return new CollectionMetadata(name, version, revision, author,
        description, readonly, count, parentCollections, syncStatus,
        createdAt, now.toString());
  }

  /**
   * Returns a copy with a new display name and modification time.
   *
   * @param newName the display name, never null
   * @param now     the modification time, never null
   *
   * @return the new metadata, never null
   */
  public CollectionMetadata renamed(final String newName,
      final Instant now) {
    return new CollectionMetadata(newName, version, revision, author,
        description, readonly, presetCount, parentCollections, syncStatus,
        createdAt, now.toString());
  }
}
