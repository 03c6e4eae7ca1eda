package org.waabox.presetcat.document;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The {@code device_info} block of a device document.
 *
 * <p>Identifiers are kept as text; numeric values in the file are
 * coerced on read. Rewrites never serialize this block, the file keeps
 * its own values.
 *
 * @param name           the device name, unique in the catalog
 * @param version        the device document version, may be null
 * @param manufacturer   the manufacturer as written in the file, may be null
 * @param manufacturerId the MIDI manufacturer id, may be null
 * @param deviceId       the MIDI device id, may be null
 * @param ports          free-form port description, may be null
 * @param midiChannels   direction to channel, never null
 * @param midiPorts      direction to port name, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DeviceInfo(
    @JsonProperty("name") String name,
    @JsonProperty("version") String version,
    @JsonProperty("manufacturer") String manufacturer,
    @JsonProperty("manufacturer_id") String manufacturerId,
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("ports") JsonNode ports,
    @JsonProperty("midi_channels") Map<String, Integer> midiChannels,
    @JsonProperty("midi_ports") Map<String, String> midiPorts
) {

  /** Creates a new device info, normalizing absent maps to empty ones. */
  public DeviceInfo {
    midiChannels = Copies.map(midiChannels);
    midiPorts = Copies.map(midiPorts);
  }
}
