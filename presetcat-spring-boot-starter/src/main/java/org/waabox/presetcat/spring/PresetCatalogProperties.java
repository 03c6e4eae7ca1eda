package org.waabox.presetcat.spring;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.presetcat.sync.git.GitSyncConfig;

/**
 * Configuration properties for the preset catalog, mapped from the
 * {@code presetcat.*} prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code presetcat.root} - the catalog root directory.</li>
 *   <li>{@code presetcat.role} - {@code dev} keeps the root as a git
 *       submodule, any other value as an independent clone.</li>
 *   <li>{@code presetcat.sync-enabled} - whether git sync runs at all.</li>
 *   <li>{@code presetcat.cache-ttl} - how long parsed documents are
 *       reused.</li>
 *   <li>{@code presetcat.remote-url} - the remote preset repository.</li>
 *   <li>{@code presetcat.parent-repository} and
 *       {@code presetcat.submodule-path} - where the submodule lives in
 *       submodule mode. Both default to the root's parent directory and
 *       name.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "presetcat")
public class PresetCatalogProperties {

  /** The catalog root directory. */
  private String root = "./midi-presets";

  /** The deployment role that selects the sync mode. */
  private String role = "release";

  /** Whether git sync runs. */
  private boolean syncEnabled = true;

  /** How long a parsed document stays cached. */
  private Duration cacheTtl = Duration.ofHours(1);

  /** The remote preset repository. */
  private String remoteUrl = GitSyncConfig.DEFAULT_REMOTE_URL;

  /** The parent repository for submodule mode, null to derive it. */
  private String parentRepository;

  /** The submodule path inside the parent, null to derive it. */
  private String submodulePath;

  /**
   * Returns the catalog root directory.
   *
   * @return the root, never null
   */
  public String getRoot() {
    return root;
  }

  /**
   * Sets the catalog root directory.
   *
   * @param root the root directory, never null
   */
  public void setRoot(final String root) {
    this.root = root;
  }

  /**
   * Returns the deployment role.
   *
   * @return the role, may be null
   */
  public String getRole() {
    return role;
  }

  /**
   * Sets the deployment role.
   *
   * @param role the role, may be null
   */
  public void setRole(final String role) {
    this.role = role;
  }

  /**
   * Whether git sync runs.
   *
   * @return true if sync is enabled
   */
  public boolean isSyncEnabled() {
    return syncEnabled;
  }

  /**
   * Turns git sync on or off.
   *
   * @param syncEnabled whether sync runs
   */
  public void setSyncEnabled(final boolean syncEnabled) {
    this.syncEnabled = syncEnabled;
  }

  /**
   * Returns the document cache time to live.
   *
   * @return the ttl, never null
   */
  public Duration getCacheTtl() {
    return cacheTtl;
  }

  /**
   * Sets the document cache time to live.
   *
   * @param cacheTtl the ttl, never null
   */
  public void setCacheTtl(final Duration cacheTtl) {
    this.cacheTtl = cacheTtl;
  }

  /**
   * Returns the remote preset repository url.
   *
   * @return the url, never null
   */
  public String getRemoteUrl() {
    return remoteUrl;
  }

  /**
   * Sets the remote preset repository url.
   *
   * @param remoteUrl the url, never null
   */
  public void setRemoteUrl(final String remoteUrl) {
    this.remoteUrl = remoteUrl;
  }

  /**
   * Returns the parent repository used in submodule mode.
   *
   * @return the parent repository, or null to use the root's parent
   */
  public String getParentRepository() {
    return parentRepository;
  }

  /**
   * Sets the parent repository used in submodule mode.
   *
   * @param parentRepository the parent repository, may be null
   */
  public void setParentRepository(final String parentRepository) {
    this.parentRepository = parentRepository;
  }

  /**
   * Returns the submodule path inside the parent repository.
   *
   * @return the path, or null to use the root's directory name
   */
  public String getSubmodulePath() {
    return submodulePath;
  }

  /**
   * Sets the submodule path inside the parent repository.
   *
   * @param submodulePath the path, may be null
   */
  public void setSubmodulePath(final String submodulePath) {
    this.submodulePath = submodulePath;
  }
}
