package org.waabox.presetcat.sync.git;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Objects;

import org.eclipse.jgit.api.errors.JGitInternalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.presetcat.document.FileTrees;
import org.waabox.presetcat.sync.CatalogSync;
import org.waabox.presetcat.sync.SyncMode;
import org.waabox.presetcat.sync.SyncResult;

/**
 * A {@link CatalogSync} that keeps the catalog root in line with a remote
 * git repository.
 *
 * <p>In {@link SyncMode#CLONE} the root is an independent clone of the
 * remote. In {@link SyncMode#SUBMODULE} it is a submodule of a parent
 * repository, and {@link #repair()} walks a ladder of increasingly
 * aggressive recoveries until one of them succeeds:
 * <ol>
 *   <li>commit local edits, then sync and update the submodule</li>
 *   <li>force a deinit, then update again</li>
 *   <li>back up the working tree, register the submodule from scratch
 *   and restore the files the fresh clone lacks</li>
 * </ol>
 *
 * <p>No entry point throws for a git failure; the outcome is always a
 * {@link SyncResult}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GitCatalogSync implements CatalogSync {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(GitCatalogSync.class);

  /** Commit message used before pulling a dirty clone. */
  static final String CLONE_AUTO_COMMIT =
      "Auto-commit of local changes before pull";

  /** Commit message used before updating a dirty submodule. */
  static final String SUBMODULE_AUTO_COMMIT =
      "Auto-commit of local changes before submodule update";

  /** Commit message for local edits uploaded to the remote. */
  static final String PUSH_COMMIT = "new presets";

  /** Returned by a remote sync that found nothing to upload. */
  static final String NOTHING_TO_COMMIT = "No changes to commit";

  /** The git metadata entry of a working tree. */
  private static final String GIT_ENTRY = ".git";

  /** The configuration, never null. */
  private final GitSyncConfig config;

  /** The git operations, never null. */
  private final GitClient git;

  /**
   * Creates a sync engine backed by JGit.
   *
   * @param theConfig the configuration, never null
   */
  public GitCatalogSync(final GitSyncConfig theConfig) {
    this(theConfig, new JGitClient());
  }

  /**
   * Creates a sync engine with the given git client.
   *
   * @param theConfig the configuration, never null
   * @param theGit    the git client, never null
   */
  public GitCatalogSync(final GitSyncConfig theConfig, final GitClient theGit) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    git = Objects.requireNonNull(theGit, "git must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public SyncResult ensureHealthy(final SyncMode mode) {
    Objects.requireNonNull(mode, "mode must not be null");
    if (!config.syncEnabled()) {
      return SyncResult.disabled();
    }
    return mode == SyncMode.SUBMODULE ? ensureSubmodule() : ensureClone();
  }

  /** {@inheritDoc} */
  @Override
  public SyncResult sync(final SyncMode mode) {
    Objects.requireNonNull(mode, "mode must not be null");
    if (!config.syncEnabled()) {
      return SyncResult.disabled();
    }
    return mode == SyncMode.SUBMODULE ? repair() : ensureClone();
  }

  /** {@inheritDoc} */
  @Override
  public SyncResult repair() {
    if (!config.syncEnabled()) {
      return SyncResult.disabled();
    }
    final Path parent = config.parentRepository();
    if (!git.isRepository(parent)) {
      final String message = "Not a valid git repository: " + parent;
      log.error(message);
      return SyncResult.failure(message, 500);
    }

    log.info("Repairing submodule {} of {}", config.submodulePath(), parent);
    try {
      updateSubmodule();
      log.info("Submodule update completed with the standard approach");
      return SyncResult.ok("Git submodule sync completed successfully");
    } catch (final GitSyncException | JGitInternalException e) {
      log.warn("Standard submodule update failed: {}", e.getMessage());
    }

    try {
      forceUpdateSubmodule();
      log.info("Submodule update completed with the force approach");
      return SyncResult.ok("Git submodule sync completed successfully");
    } catch (final GitSyncException | JGitInternalException e) {
      log.warn("Force submodule update failed: {}", e.getMessage());
    }

    try {
      reinitializeSubmodule();
      return SyncResult.ok("Git submodule sync completed successfully"
          + " with complete re-initialization");
    } catch (final GitSyncException | JGitInternalException
        | IOException e) {
      log.error("Complete re-initialization failed: {}", e.getMessage(), e);
      return SyncResult.failure("All git sync approaches failed. Last error: "
          + e.getMessage(), 500);
    }
  }

  /** {@inheritDoc} */
  @Override
  public SyncResult pushLocalChanges(final SyncMode mode) {
    Objects.requireNonNull(mode, "mode must not be null");
    if (!config.syncEnabled()) {
      return SyncResult.disabled();
    }
    final Path root = config.catalogRoot();
    if (!Files.exists(root)) {
      final String message = "Catalog directory not found at " + root;
      log.error(message);
      return SyncResult.failure(message, 404);
    }
    if (!Files.isDirectory(root)) {
      final String message = "Path exists but is not a directory: " + root;
      log.error(message);
      return SyncResult.failure(message, 400);
    }
    if (!git.isRepository(root)) {
      final String message = "Not a git repository: " + root;
      log.error(message);
      return SyncResult.failure(message, 400);
    }

    try {
      git.stageAll(root);
      if (git.isClean(root)) {
        log.info("No changes to commit in {}", root);
        return SyncResult.ok(NOTHING_TO_COMMIT);
      }
      git.commit(root, PUSH_COMMIT);
      git.push(root);
      if (mode == SyncMode.SUBMODULE) {
        log.info("Updating submodule reference in {}",
            config.parentRepository());
        git.stage(config.parentRepository(), config.submodulePath());
      }
      log.info("Pushed local changes from {}", root);
      return SyncResult.ok("Successfully added, committed, and pushed"
          + " changes to the catalog repository");
    } catch (final GitSyncException | JGitInternalException e) {
      log.error("Git remote sync failed: {}", e.getMessage(), e);
      return SyncResult.failure("Git remote sync failed: " + e.getMessage(),
          500);
    }
  }

  /** Makes the catalog root an up to date independent clone. */
  private SyncResult ensureClone() {
    final Path root = config.catalogRoot();
    log.info("Ensuring {} is a clone of {}", root, config.remoteUrl());
    try {
      if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
        cloneFresh(root);
        return SyncResult.ok("Catalog repository cloned successfully");
      }
      if (Files.isRegularFile(root.resolve(GIT_ENTRY))) {
        log.info("Found a submodule checkout at {}, replacing it with a"
            + " clone", root);
        FileTrees.delete(root);
        cloneFresh(root);
        return SyncResult.ok("Catalog repository cloned successfully");
      }
      if (!git.isRepository(root)) {
        log.warn("{} exists but is not a git repository, cloning fresh",
            root);
        FileTrees.delete(root);
        cloneFresh(root);
        return SyncResult.ok("Catalog repository cloned successfully");
      }

      if (!git.isClean(root)) {
        log.info("Committing local changes in {} before pulling", root);
        git.stageAll(root);
        git.commit(root, CLONE_AUTO_COMMIT);
      }
      try {
        git.pull(root);
      } catch (final GitConflictException e) {
        log.warn("Pull failed due to conflicts: {}", e.getMessage());
        final boolean stashed = git.stash(root);
        git.pull(root);
        if (stashed) {
          git.stashPop(root);
          log.info("Applied stashed changes in {}", root);
        }
      }
      log.info("Updated catalog repository {}", root);
      return SyncResult.ok("Catalog repository ready");
    } catch (final GitSyncException | JGitInternalException
        | IOException e) {
      final String message = "Error ensuring catalog clone: " + e.getMessage();
      log.error(message, e);
      return SyncResult.failure(message, 500);
    }
  }

  /** Makes the catalog root a registered, checked out submodule. */
  private SyncResult ensureSubmodule() {
    final Path parent = config.parentRepository();
    final Path root = config.catalogRoot();
    final String path = config.submodulePath();
    log.info("Ensuring {} is a submodule of {}", path, parent);
    if (!git.isRepository(parent)) {
      final String message = "Not a valid git repository: " + parent;
      log.error(message);
      return SyncResult.failure(message, 500);
    }
    try {
      final boolean declared =
          git.declaredSubmoduleUrl(parent, path).isPresent();
      final boolean plainClone = Files.isDirectory(root.resolve(GIT_ENTRY));
      if (!declared || plainClone) {
        log.info("Registering {} as a submodule of {}", path, parent);
        FileTrees.delete(root);
        if (!declared) {
          git.submoduleAdd(parent, path, config.remoteUrl());
        }
      }
      git.submoduleUpdate(parent);
      log.info("Submodule {} is up to date", path);
      return SyncResult.ok("Catalog submodule ready");
    } catch (final GitSyncException | JGitInternalException
        | IOException e) {
      final String message = "Error ensuring catalog submodule: "
          + e.getMessage();
      log.error(message, e);
      return SyncResult.failure(message, 500);
    }
  }

  private void cloneFresh(final Path root) {
    log.info("Cloning {} to {}", config.remoteUrl(), root);
    git.cloneRepository(config.remoteUrl(), root);
    log.info("Cloned catalog repository into {}", root);
  }

  /** First rung: commit local edits, then a plain sync and update. */
  private void updateSubmodule() {
    final Path parent = config.parentRepository();
    final Path root = config.catalogRoot();
    try {
      if (git.isRepository(root) && !git.isClean(root)) {
        log.info("Committing local changes in {} before the update", root);
        git.stageAll(root);
        git.commit(root, SUBMODULE_AUTO_COMMIT);
      }
    } catch (final GitSyncException | JGitInternalException e) {
      log.warn("Error checking submodule repository: {}", e.getMessage());
    }

    git.submoduleSync(parent);
    try {
      git.submoduleUpdate(parent);
    } catch (final GitConflictException e) {
      log.warn("Submodule update failed due to local changes: {}",
          e.getMessage());
      final boolean stashed = git.stash(root);
      git.submoduleUpdate(parent);
      if (stashed) {
        git.stashPop(root);
        log.info("Applied stashed changes in {}", root);
      }
    }
  }

  /** Second rung: force a deinit and update again. */
  private void forceUpdateSubmodule() {
    final Path parent = config.parentRepository();
    git.submoduleDeinit(parent, config.submodulePath());
    git.submoduleUpdate(parent);
  }

  /** Third rung: register the submodule again, keeping local files. */
  private void reinitializeSubmodule() throws IOException {
    final Path parent = config.parentRepository();
    final Path root = config.catalogRoot();
    final String path = config.submodulePath();
    final String url = resolveRemoteUrl();

    Path backup = null;
    if (Files.isDirectory(root)) {
      backup = Files.createTempDirectory("presetcat-repair-");
      FileTrees.copy(root, backup);
      log.info("Copied {} to {}", root, backup);
    }
    try {
      FileTrees.delete(root);
      try {
        git.removeFromIndex(parent, path);
        log.info("Removed {} from the index of {}", path, parent);
      } catch (final GitSyncException | JGitInternalException e) {
        log.warn("Error removing {} from the index: {}", path,
            e.getMessage());
      }

      log.info("Registering submodule {} from {}", path, url);
      git.submoduleAdd(parent, path, url);
      git.submoduleUpdate(parent);
      if (!Files.isDirectory(root)) {
        throw new GitSyncException("Submodule directory not found after"
            + " re-initialization: " + root);
      }
      log.info("Submodule {} re-initialized", path);

    } catch (final GitSyncException | JGitInternalException
        | IOException e) {
      if (backup != null) {
        log.warn("Local files of {} are kept in {}", root, backup);
      }
      throw e;
    }

    if (backup != null) {
      restore(backup, root);
      deleteBackup(backup);
    }
  }

  /** Resolves the submodule url, preferring the configured one. */
  private String resolveRemoteUrl() {
    final Path parent = config.parentRepository();
    final String path = config.submodulePath();
    final String expected = config.remoteUrl();
    String url;
    try {
      url = git.configuredSubmoduleUrl(parent, path)
          .or(() -> git.declaredSubmoduleUrl(parent, path))
          .orElse(null);
    } catch (final GitSyncException | JGitInternalException e) {
      log.warn("Error reading the submodule url: {}", e.getMessage());
      url = null;
    }
    if (url == null) {
      log.warn("Could not find the submodule url, using {}", expected);
      return expected;
    }
    if (!url.equals(expected)) {
      log.warn("Submodule url {} does not match {}, using {}", url,
          expected, expected);
      return expected;
    }
    return url;
  }

  private void restore(final Path backup, final Path root) {
    try {
      final int restored = FileTrees.restoreMissing(backup, root);
      log.info("Restored {} local files into {}", restored, root);
    } catch (final IOException e) {
      log.warn("Error restoring content from {}: {}", backup,
          e.getMessage());
    }
  }

  private void deleteBackup(final Path backup) {
    try {
      FileTrees.delete(backup);
    } catch (final IOException e) {
      log.warn("Could not delete the repair backup {}: {}", backup,
          e.getMessage());
    }
  }
}
