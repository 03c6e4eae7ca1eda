package org.waabox.presetcat.sync.git;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for the git sync engine.
 *
 * <p>Holds the catalog root, the parent repository and submodule path used
 * in submodule mode, the remote url and whether sync runs at all. The
 * catalog root is always {@code parentRepository/submodulePath}.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create(Path)} and
 * {@link #create(Path, Path, String, String, boolean)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GitSyncConfig {

  /** The remote holding the community preset catalog. */
  public static final String DEFAULT_REMOTE_URL =
      "https://github.com/tirans/midi-presets.git";

  /** The catalog root, absolute and normalized, never null. */
  private final Path catalogRoot;

  /** The parent repository working tree, never null. */
  private final Path parentRepository;

  /** The submodule path relative to the parent, never null. */
  private final String submodulePath;

  /** The remote url, never null. */
  private final String remoteUrl;

  /** Whether sync is enabled. */
  private final boolean syncEnabled;

  /** Private constructor; use static factories.
   *
   * @param theCatalogRoot      the catalog root
   * @param theParentRepository the parent repository
   * @param theSubmodulePath    the submodule path
   * @param theRemoteUrl        the remote url
   * @param isSyncEnabled       whether sync is enabled
   */
  private GitSyncConfig(final Path theCatalogRoot,
      final Path theParentRepository, final String theSubmodulePath,
      final String theRemoteUrl, final boolean isSyncEnabled) {
    catalogRoot = theCatalogRoot;
    parentRepository = theParentRepository;
    submodulePath = theSubmodulePath;
    remoteUrl = theRemoteUrl;
    syncEnabled = isSyncEnabled;
  }

  /**
   * Creates a configuration with all custom values.
   *
   * @param catalogRoot      the catalog root, never null
   * @param parentRepository the parent repository, never null
   * @param submodulePath    the submodule path inside the parent, never
   *                         null or blank
   * @param remoteUrl        the remote url, never null or blank
   * @param syncEnabled      whether sync runs at all
   *
   * @return a new configuration instance, never null
   *
   * @throws IllegalArgumentException if the catalog root is not the
   * submodule path inside the parent repository
   */
  public static GitSyncConfig create(final Path catalogRoot,
      final Path parentRepository, final String submodulePath,
      final String remoteUrl, final boolean syncEnabled) {
    Objects.requireNonNull(catalogRoot, "catalogRoot cannot be null");
    Objects.requireNonNull(parentRepository,
        "parentRepository cannot be null");
    Objects.requireNonNull(submodulePath, "submodulePath cannot be null");
    Objects.requireNonNull(remoteUrl, "remoteUrl cannot be null");

    if (submodulePath.isBlank()) {
      throw new IllegalArgumentException("submodulePath cannot be blank");
    }
    if (remoteUrl.isBlank()) {
      throw new IllegalArgumentException("remoteUrl cannot be blank");
    }

    final Path root = catalogRoot.toAbsolutePath().normalize();
    final Path parent = parentRepository.toAbsolutePath().normalize();
    if (Path.of(submodulePath).normalize().startsWith("..")
        || !parent.resolve(submodulePath).normalize().equals(root)) {
      throw new IllegalArgumentException("catalogRoot " + root
          + " is not " + submodulePath + " inside " + parent);
    }
    return new GitSyncConfig(root, parent,
        submodulePath.replace('\\', '/'), remoteUrl, syncEnabled);
  }

  /**
   * Creates an enabled configuration with default values.
   *
   * <p>Defaults:
   * <ul>
   *   <li>Parent repository: the directory holding the catalog root</li>
   *   <li>Submodule path: the catalog root's directory name</li>
   *   <li>Remote url: {@value #DEFAULT_REMOTE_URL}</li>
   * </ul>
   *
   * @param catalogRoot the catalog root, never null
   *
   * @return a new configuration instance, never null
   */
  public static GitSyncConfig create(final Path catalogRoot) {
    Objects.requireNonNull(catalogRoot, "catalogRoot cannot be null");
    final Path root = catalogRoot.toAbsolutePath().normalize();
    if (root.getParent() == null) {
      throw new IllegalArgumentException(
          "catalogRoot cannot be a file system root");
    }
    return create(root, root.getParent(), root.getFileName().toString(),
        DEFAULT_REMOTE_URL, true);
  }

  /**
   * Returns the catalog root.
   *
   * @return the absolute catalog root, never null
   */
  public Path catalogRoot() {
    return catalogRoot;
  }

  /**
   * Returns the parent repository working tree.
   *
   * @return the parent repository, never null
   */
  public Path parentRepository() {
    return parentRepository;
  }

  /**
   * Returns the submodule path inside the parent repository.
   *
   * @return the submodule path, never null
   */
  public String submodulePath() {
    return submodulePath;
  }

  /**
   * Returns the remote url.
   *
   * @return the remote url, never null
   */
  public String remoteUrl() {
    return remoteUrl;
  }

  /**
   * Whether sync is enabled.
   *
   * @return false if every sync entry point should be skipped
   */
  public boolean syncEnabled() {
    return syncEnabled;
  }
}
