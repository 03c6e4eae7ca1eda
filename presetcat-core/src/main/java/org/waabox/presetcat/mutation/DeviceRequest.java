package org.waabox.presetcat.mutation;

import java.util.Map;

/**
 * The fields of a device to create.
 *
 * @param name           the device name, required
 * @param manufacturer   the manufacturer, required
 * @param version        the document version, may be null
 * @param manufacturerId the MIDI manufacturer id, may be null
 * @param deviceId       the MIDI device id, may be null
 * @param midiPorts      direction to port name, may be null
 * @param midiChannels   direction to channel, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DeviceRequest(
    String name,
    String manufacturer,
    String version,
    String manufacturerId,
    String deviceId,
    Map<String, String> midiPorts,
    Map<String, Integer> midiChannels
) {

  /**
   * A request with only the required fields and unassigned ports on
   * channel 1.
   *
   * @param manufacturer the manufacturer, never null
   * @param name         the device name, never null
   *
   * @return the request, never null
   */
  public static DeviceRequest of(final String manufacturer,
      final String name) {
    return new DeviceRequest(name, manufacturer, "1.0", null, null,
        Map.of("IN", "", "OUT", ""), Map.of("IN", 1, "OUT", 1));
  }
}
