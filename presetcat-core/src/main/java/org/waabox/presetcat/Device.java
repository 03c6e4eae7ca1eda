package org.waabox.presetcat;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.waabox.presetcat.document.DeviceDocument;
import org.waabox.presetcat.document.PresetCollection;

/**
 * A device discovered by the scanner.
 *
 * <p>Devices are owned by the {@link CatalogIndex} that produced them and
 * are replaced wholesale on every rescan.
 *
 * @param name             the device name, unique in the catalog, never
 *                         null
 * @param manufacturer     the manufacturer directory the device was found
 *                         under, never null
 * @param documentPath     the backing document, never null
 * @param midiPorts        direction to port name, never null
 * @param midiChannels     direction to channel, never null
 * @param communityFolders names of the manufacturer's community folders,
 *                         sorted, never null
 * @param document         the parsed document, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Device(
    String name,
    String manufacturer,
    Path documentPath,
    Map<String, String> midiPorts,
    Map<String, Integer> midiChannels,
    List<String> communityFolders,
    DeviceDocument document
) {

  /** Creates a new device. */
  public Device {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(manufacturer, "manufacturer must not be null");
    Objects.requireNonNull(documentPath, "documentPath must not be null");
    Objects.requireNonNull(document, "document must not be null");
    midiPorts = midiPorts == null ? Map.of() : midiPorts;
    midiChannels = midiChannels == null ? Map.of() : midiChannels;
    communityFolders = communityFolders == null
        ? List.of() : List.copyOf(communityFolders);
  }

  /**
   * Creates a device from its parsed document.
   *
   * @param manufacturer     the manufacturer directory, never null
   * @param documentPath     the backing document, never null
   * @param document         the parsed document, never null
   * @param communityFolders the community folder names, never null
   *
   * @return the device, never null
   */
  public static Device of(final String manufacturer, final Path documentPath,
      final DeviceDocument document, final List<String> communityFolders) {
    return new Device(document.deviceInfo().name(), manufacturer,
        documentPath, document.deviceInfo().midiPorts(),
        document.deviceInfo().midiChannels(), communityFolders, document);
  }

  /**
   * Returns the collection keys of this device in document order.
   *
   * @return the keys, never null
   */
  public List<String> collectionNames() {
    return document.collectionNames();
  }

  /**
   * Finds a collection by key.
   *
   * @param key the collection key, never null
   *
   * @return the collection, or empty if there is none with that key
   */
  public Optional<PresetCollection> collection(final String key) {
    return document.collection(key);
  }
}
