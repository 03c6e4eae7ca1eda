package org.waabox.presetcat.document;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A community folder document: an overlay list of presets contributed
 * outside the device's own collections.
 *
 * @param presets the presets, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CommunityDocument(
    @JsonProperty("presets") List<Preset> presets
) {

  /** Creates a new community document. */
  public CommunityDocument {
    presets = Copies.list(presets);
  }
}
