package org.waabox.presetcat.document;

import org.waabox.presetcat.PresetCatalogException;

/**
 * Thrown when a JSON document does not match the catalog schema, for
 * example a device document without {@code device_info.name}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DocumentParseException extends PresetCatalogException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public DocumentParseException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public DocumentParseException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
