package org.waabox.presetcat.mutation;

import java.util.List;

import org.waabox.presetcat.document.Preset;

/**
 * The fields of a preset to create or update.
 *
 * @param manufacturer the manufacturer, required
 * @param device       the device, required
 * @param collection   the collection key, defaults to factory presets
 * @param presetName   the preset name, required
 * @param category     the category, may be null
 * @param characters   descriptive tags, may be null
 * @param cc0          the bank select value, may be null
 * @param pgm          the program change value, required
 * @param command      a pre-rendered command line, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PresetRequest(
    String manufacturer,
    String device,
    String collection,
    String presetName,
    String category,
    List<String> characters,
    Integer cc0,
    Integer pgm,
    String command
) {

  /**
   * Builds the preset described by this request.
   *
   * @param presetId the id to give it, may be null
   *
   * @return the preset, never null
   */
  public Preset toPreset(final String presetId) {
    return new Preset(presetId, presetName, category, characters, cc0, pgm,
        command);
  }
}
