package org.waabox.presetcat.document;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The {@code _metadata} block of a device document.
 *
 * <p>Only the version stamp is interpreted; {@code migration_path} and
 * {@code compatibility} are carried through as free-form JSON.
 *
 * @param schemaVersion the schema version, may be null on legacy files
 * @param fileRevision  the revision, bumped on every rewrite
 * @param createdBy     who created the document, may be null
 * @param modifiedBy    who last modified the document, may be null
 * @param createdAt     ISO-8601 creation time, may be null
 * @param modifiedAt    ISO-8601 modification time, may be null
 * @param migrationPath applied migrations, may be null
 * @param compatibility reader compatibility hints, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DocumentMetadata(
    @JsonProperty("schema_version") String schemaVersion,
    @JsonProperty("file_revision") long fileRevision,
    @JsonProperty("created_by") String createdBy,
    @JsonProperty("modified_by") String modifiedBy,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("modified_at") String modifiedAt,
    @JsonProperty("migration_path") JsonNode migrationPath,
    @JsonProperty("compatibility") JsonNode compatibility
) {

  /** The schema version written to new documents. */
  public static final String SCHEMA_VERSION = "1.0";

  /** The author stamped on documents this engine writes. */
  public static final String AUTHOR = "presetcat";

  /**
   * Creates the metadata of a brand new document.
   *
   * @param now the creation time, never null
   *
   * @return the metadata at revision 1, never null
   */
  public static DocumentMetadata initial(final Instant now) {
    final String timestamp = now.toString();
    final ObjectNode compatibility = JsonNodeFactory.instance.objectNode();
    compatibility.put("min_reader_version", SCHEMA_VERSION);
    return new DocumentMetadata(SCHEMA_VERSION, 1, AUTHOR, AUTHOR,
        timestamp, timestamp, JsonNodeFactory.instance.arrayNode(),
        compatibility);
  }

  /**
   * Returns a copy stamped for one more rewrite: the revision is bumped
   * and the modification time and author are replaced.
   *
   * @param now the modification time, never null
   *
   * @return the new metadata, never null
   */
  public DocumentMetadata touched(final Instant now) {
    return new DocumentMetadata(schemaVersion, fileRevision + 1, createdBy,
        AUTHOR, createdAt, now.toString(), migrationPath, compatibility);
  }
}
