package org.waabox.presetcat.sync;

/**
 * How the catalog root relates to the remote preset repository.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SyncMode {

  /** The catalog root is an independent clone of the remote. */
  CLONE,

  /** The catalog root is a git submodule of a parent repository. */
  SUBMODULE;

  /** The role that selects submodule mode. */
  private static final String DEV_ROLE = "dev";

  /**
   * Resolves the mode from a deployment role.
   *
   * <p>The {@code dev} role works against a submodule checkout. Any other
   * role, including a null or blank one, uses an independent clone.
   *
   * @param role the deployment role, may be null
   *
   * @return the sync mode, never null
   */
  public static SyncMode fromRole(final String role) {
    if (role != null && DEV_ROLE.equalsIgnoreCase(role.trim())) {
      return SUBMODULE;
    }
    return CLONE;
  }
}
