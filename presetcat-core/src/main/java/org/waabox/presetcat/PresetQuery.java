package org.waabox.presetcat;

/**
 * Filters for {@link PresetCatalog#presets(PresetQuery)}.
 *
 * <p>A null manufacturer or device matches every value. The community
 * folder, when set, adds that folder's presets for every matched device.
 *
 * @param manufacturer    the manufacturer filter, may be null
 * @param device          the device filter, may be null
 * @param communityFolder the community folder to merge in, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PresetQuery(
    String manufacturer,
    String device,
    String communityFolder
) {

  /**
   * Matches every preset of every device.
   *
   * @return the query, never null
   */
  public static PresetQuery all() {
    return new PresetQuery(null, null, null);
  }

  /**
   * Matches the presets of one device of one manufacturer.
   *
   * @param manufacturer the manufacturer, may be null
   * @param device       the device, may be null
   *
   * @return the query, never null
   */
  public static PresetQuery of(final String manufacturer,
      final String device) {
    return new PresetQuery(manufacturer, device, null);
  }

  /**
   * Returns a copy that also merges the given community folder.
   *
   * @param folder the folder name, may be null
   *
   * @return the query, never null
   */
  public PresetQuery withCommunityFolder(final String folder) {
    return new PresetQuery(manufacturer, device, folder);
  }
}
