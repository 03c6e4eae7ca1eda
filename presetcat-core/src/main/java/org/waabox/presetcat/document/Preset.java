package org.waabox.presetcat.document;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single preset: the program and bank values that select a sound on a
 * device.
 *
 * @param presetId    the id derived when the preset was created, may be
 *                    null on hand written files
 * @param presetName  the name, unique within its collection
 * @param category    the category, may be null
 * @param characters  descriptive tags, never null
 * @param cc0         the bank select value, may be null
 * @param pgm         the program change value, may be null on hand written
 *                    files
 * @param command     a pre-rendered command line, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Preset(
    @JsonProperty("preset_id") String presetId,
    @JsonProperty("preset_name") String presetName,
    @JsonProperty("category") String category,
    @JsonProperty("characters") List<String> characters,
    @JsonProperty("cc_0") Integer cc0,
    @JsonProperty("pgm") Integer pgm,
    @JsonProperty("sendmidi_command") @JsonAlias("command") String command
) {

  /** Creates a new preset, normalizing absent tags to an empty list. */
  public Preset {
    characters = Copies.list(characters);
  }

  /**
   * Returns a copy carrying the given id.
   *
   * @param id the preset id, never null
   *
   * @return the new preset, never null
   */
  public Preset withId(final String id) {
    return new Preset(id, presetName, category, characters, cc0, pgm,
        command);
  }
}
