package org.waabox.presetcat.mutation;

import org.waabox.presetcat.PresetCatalogException;

/**
 * Thrown when a name supplied by a caller cannot be turned into a path
 * component that stays inside the catalog root.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class UnsafePathException extends PresetCatalogException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public UnsafePathException(final String message) {
    super(message);
  }
}
