package org.waabox.presetcat.document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads and rewrites catalog documents on disk, bypassing the cache.
 *
 * <p>Writes are whole-document replacements: the content goes to a
 * sibling temporary file which is then atomically moved over the target,
 * so readers see either the previous document or the new one.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JsonDocumentStore {

  /** The suffix of the temporary file used during writes. */
  static final String TEMP_SUFFIX = ".tmp";

  /** The codec used to read and write documents. */
  private final DocumentCodec codec;

  /**
   * Creates a new store.
   *
   * @param codec the codec, never null
   */
  public JsonDocumentStore(final DocumentCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
  }

  /**
   * Reads a document straight from disk as a JSON tree.
   *
   * @param path the document path, never null
   *
   * @return the tree, never null
   *
   * @throws IOException if the file cannot be read or is not valid JSON
   * @throws DocumentParseException if the content is not a JSON object
   */
  public JsonNode read(final Path path) throws IOException {
    return codec.read(path);
  }

  /**
   * Converts a tree read by {@link #read(Path)} into a device document.
   *
   * @param tree the tree, never null
   *
   * @return the document, never null
   *
   * @throws DocumentParseException if the tree is not a device document
   */
  public DeviceDocument toDevice(final JsonNode tree) {
    return codec.toDevice(tree);
  }

  /**
   * Reads a device document straight from disk.
   *
   * @param path the document path, never null
   *
   * @return the document, never null
   *
   * @throws IOException if the file cannot be read or is not valid JSON
   * @throws DocumentParseException if the content is not a device document
   */
  public DeviceDocument readDevice(final Path path) throws IOException {
    return codec.toDevice(codec.read(path));
  }

  /**
   * Rewrites an existing device document, keeping whatever the tree it
   * was read from holds outside the edited parts.
   *
   * @param path     the document path, never null
   * @param original the tree read from the path, never null
   * @param updated  the edited document, never null
   * @param renamed  new collection key to its previous key, never null
   *
   * @throws IOException if writing or moving fails
   *
   * @see DocumentCodec#overlay(JsonNode, DeviceDocument, Map)
   */
  public void rewriteDevice(final Path path, final JsonNode original,
      final DeviceDocument updated, final Map<String, String> renamed)
      throws IOException {
    write(path, codec.overlay(original, updated, renamed));
  }

  /**
   * Atomically replaces the file at the given path with the document.
   *
   * <p>Missing parent directories are created.
   *
   * @param path     the target path, never null
   * @param document the document to write, never null
   *
   * @throws IOException if writing or moving fails
   */
  public void write(final Path path, final Object document)
      throws IOException {
    Objects.requireNonNull(path, "path must not be null");
    Objects.requireNonNull(document, "document must not be null");

    final Path target = path.toAbsolutePath();
    Files.createDirectories(target.getParent());

    final Path temp = target.resolveSibling(
        target.getFileName() + TEMP_SUFFIX);
    Files.write(temp, codec.write(document));
    Files.move(temp, target,
        StandardCopyOption.REPLACE_EXISTING,
        StandardCopyOption.ATOMIC_MOVE);
  }
}
