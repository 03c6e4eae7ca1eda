package org.waabox.presetcat;

/**
 * Base exception for all presetcat errors.
 *
 * <p>This is an unchecked exception. Public entry points of the catalog
 * translate it into a failed result, so it only reaches callers that use
 * the lower level components directly.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class PresetCatalogException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public PresetCatalogException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public PresetCatalogException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
