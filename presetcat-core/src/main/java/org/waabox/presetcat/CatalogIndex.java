package org.waabox.presetcat;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * An immutable point-in-time view of the catalog tree.
 *
 * <p>The index holds the sorted list of manufacturers, the sorted device
 * names of each manufacturer and the devices themselves keyed by their
 * globally unique name. It is rebuilt from scratch on every scan and held
 * via an {@link java.util.concurrent.atomic.AtomicReference} by
 * {@link PresetCatalog}, so reads never lock.
 *
 * <p>All collections returned by this class are unmodifiable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogIndex {

  /** The manufacturers, sorted. */
  private final List<String> manufacturers;

  /** Manufacturer to its sorted device names. */
  private final Map<String, List<String>> deviceStructure;

  /** Device name to device, sorted by name. */
  private final Map<String, Device> devices;

  /** The scanned root, null for the empty index. */
  private final Path root;

  /** The version number of this index. */
  private final long version;

  /** The instant when this index was created. */
  private final Instant createdAt;

  private CatalogIndex(final List<String> manufacturers,
      final Map<String, List<String>> deviceStructure,
      final Map<String, Device> devices, final Path root,
      final long version, final Instant createdAt) {
    this.manufacturers = manufacturers;
    this.deviceStructure = deviceStructure;
    this.devices = devices;
    this.root = root;
    this.version = version;
    this.createdAt = createdAt;
  }

  /**
   * Creates a new index. Lists are sorted and every collection is copied
   * into an unmodifiable structure.
   *
   * @param root            the scanned root, never null
   * @param manufacturers   the manufacturer names, never null
   * @param deviceStructure manufacturer to device names, never null
   * @param devices         device name to device, never null
   * @param version         the version number of this index
   *
   * @return the index, never null
   */
  public static CatalogIndex of(final Path root,
      final List<String> manufacturers,
      final Map<String, List<String>> deviceStructure,
      final Map<String, Device> devices, final long version) {
    Objects.requireNonNull(root, "root must not be null");
    Objects.requireNonNull(manufacturers, "manufacturers must not be null");
    Objects.requireNonNull(deviceStructure,
        "deviceStructure must not be null");
    Objects.requireNonNull(devices, "devices must not be null");

    final List<String> sortedManufacturers = new ArrayList<>(manufacturers);
    Collections.sort(sortedManufacturers);

    final Map<String, List<String>> structure = new TreeMap<>();
    deviceStructure.forEach((manufacturer, names) -> {
      final List<String> sorted = new ArrayList<>(names);
      Collections.sort(sorted);
      structure.put(manufacturer, List.copyOf(sorted));
    });

    return new CatalogIndex(List.copyOf(sortedManufacturers),
        Collections.unmodifiableMap(structure),
        Collections.unmodifiableMap(new TreeMap<>(devices)), root, version,
        Instant.now());
  }

  /**
   * Creates an empty index with version 0.
   *
   * @return an empty index, never null
   */
  public static CatalogIndex empty() {
    return new CatalogIndex(List.of(), Map.of(), Map.of(), null, 0L,
        Instant.now());
  }

  /**
   * Returns the manufacturer names, sorted.
   *
   * @return the manufacturers, never null
   */
  public List<String> manufacturers() {
    return manufacturers;
  }

  /**
   * Whether a manufacturer directory was found.
   *
   * @param manufacturer the manufacturer name, never null
   *
   * @return true if the manufacturer is in the index
   */
  public boolean hasManufacturer(final String manufacturer) {
    return deviceStructure.containsKey(manufacturer)
        || manufacturers.contains(manufacturer);
  }

  /**
   * Returns the device names of a manufacturer, sorted.
   *
   * @param manufacturer the manufacturer name, never null
   *
   * @return the device names, empty if the manufacturer is unknown
   */
  public List<String> deviceNames(final String manufacturer) {
    Objects.requireNonNull(manufacturer, "manufacturer must not be null");
    return deviceStructure.getOrDefault(manufacturer, List.of());
  }

  /**
   * Returns the devices of a manufacturer, sorted by name.
   *
   * @param manufacturer the manufacturer name, never null
   *
   * @return the devices, empty if the manufacturer is unknown
   */
  public List<Device> devicesOf(final String manufacturer) {
    Objects.requireNonNull(manufacturer, "manufacturer must not be null");
    final List<Device> result = new ArrayList<>();
    for (final Device device : devices.values()) {
      if (manufacturer.equals(device.manufacturer())) {
        result.add(device);
      }
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Finds a device by its name.
   *
   * @param name the device name, never null
   *
   * @return the device, or empty if there is none with that name
   */
  public Optional<Device> device(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    return Optional.ofNullable(devices.get(name));
  }

  /**
   * Finds a device by name, only if it belongs to the given manufacturer.
   *
   * @param manufacturer the manufacturer name, never null
   * @param name         the device name, never null
   *
   * @return the device, or empty
   */
  public Optional<Device> device(final String manufacturer,
      final String name) {
    Objects.requireNonNull(manufacturer, "manufacturer must not be null");
    return device(name).filter(d -> manufacturer.equals(d.manufacturer()));
  }

  /**
   * Returns every device keyed by name, sorted by name.
   *
   * @return the devices, never null
   */
  public Map<String, Device> devices() {
    return devices;
  }

  /**
   * Returns the manufacturer to device names structure.
   *
   * @return the structure, never null
   */
  public Map<String, List<String>> deviceStructure() {
    return deviceStructure;
  }

  /**
   * Returns the scanned root.
   *
   * @return the root, empty for the initial empty index
   */
  public Optional<Path> root() {
    return Optional.ofNullable(root);
  }

  /**
   * Returns the version of this index.
   *
   * @return the version, 0 for the empty index
   */
  public long version() {
    return version;
  }

  /**
   * Returns when this index was built.
   *
   * @return the creation instant, never null
   */
  public Instant createdAt() {
    return createdAt;
  }
}
