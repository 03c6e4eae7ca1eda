package org.waabox.presetcat;

import java.util.Objects;

import org.waabox.presetcat.document.Preset;

/**
 * A preset as returned by listings, together with where it came from.
 *
 * @param preset       the preset, never null
 * @param manufacturer the manufacturer, never null
 * @param device       the device name, never null
 * @param collection   the collection key, null for community presets
 * @param source       {@value #DEFAULT_SOURCE} for the device's own
 *                     collections, or the community folder name
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PresetEntry(
    Preset preset,
    String manufacturer,
    String device,
    String collection,
    String source
) {

  /** The source of presets stored in the device document itself. */
  public static final String DEFAULT_SOURCE = "default";

  /** Creates a new entry. */
  public PresetEntry {
    Objects.requireNonNull(preset, "preset must not be null");
    Objects.requireNonNull(manufacturer, "manufacturer must not be null");
    Objects.requireNonNull(device, "device must not be null");
    Objects.requireNonNull(source, "source must not be null");
  }

  /**
   * Shortcut for the preset name.
   *
   * @return the preset name, may be null on hand written files
   */
  public String presetName() {
    return preset.presetName();
  }
}
