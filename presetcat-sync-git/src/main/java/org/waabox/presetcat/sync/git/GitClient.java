package org.waabox.presetcat.sync.git;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The git operations the sync engine relies on.
 *
 * <p>Every method works on a repository identified by its working tree
 * directory and reports failures as {@link GitSyncException}. Conflicts
 * that local changes cause are reported as {@link GitConflictException}
 * so the caller can stash and retry.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface GitClient {

  /**
   * Whether the directory is the working tree of a usable repository.
   * Submodule checkouts, whose {@code .git} entry is a file, count too.
   *
   * @param directory the directory to inspect, never null
   *
   * @return true if a repository can be opened there
   */
  boolean isRepository(Path directory);

  /**
   * Clones a remote repository into the given directory.
   *
   * @param url       the remote url, never null
   * @param directory the target directory, never null
   */
  void cloneRepository(String url, Path directory);

  /**
   * Whether the working tree has no changes, tracked or untracked.
   *
   * @param repository the working tree, never null
   *
   * @return true if there is nothing to commit
   */
  boolean isClean(Path repository);

  /**
   * Stages every change of the working tree, including deletions.
   *
   * @param repository the working tree, never null
   */
  void stageAll(Path repository);

  /**
   * Stages a single path.
   *
   * @param repository the working tree, never null
   * @param path       the path relative to the working tree, never null
   */
  void stage(Path repository, String path);

  /**
   * Commits the staged changes.
   *
   * @param repository the working tree, never null
   * @param message    the commit message, never null
   */
  void commit(Path repository, String message);

  /**
   * Pulls from the tracked remote branch.
   *
   * @param repository the working tree, never null
   *
   * @throws GitConflictException if local changes block the pull
   */
  void pull(Path repository);

  /**
   * Stashes local changes, untracked files included.
   *
   * @param repository the working tree, never null
   *
   * @return true if something was stashed
   */
  boolean stash(Path repository);

  /**
   * Applies the latest stash and drops it.
   *
   * @param repository the working tree, never null
   */
  void stashPop(Path repository);

  /**
   * Pushes the current branch to its remote.
   *
   * @param repository the working tree, never null
   */
  void push(Path repository);

  /**
   * Copies the submodule urls from {@code .gitmodules} into the parent's
   * configuration.
   *
   * @param parent the parent working tree, never null
   */
  void submoduleSync(Path parent);

  /**
   * Initializes and updates every submodule, recursing into nested ones.
   *
   * @param parent the parent working tree, never null
   *
   * @throws GitConflictException if a submodule checkout conflicts with
   * local changes
   */
  void submoduleUpdate(Path parent);

  /**
   * Forcibly deinitializes a submodule, discarding its working tree.
   *
   * @param parent the parent working tree, never null
   * @param path   the submodule path, never null
   */
  void submoduleDeinit(Path parent, String path);

  /**
   * Registers and clones a submodule.
   *
   * @param parent the parent working tree, never null
   * @param path   the submodule path, never null
   * @param url    the submodule remote url, never null
   */
  void submoduleAdd(Path parent, String path, String url);

  /**
   * Removes a path from the parent's index, leaving the files alone.
   *
   * @param parent the parent working tree, never null
   * @param path   the path to remove, never null
   */
  void removeFromIndex(Path parent, String path);

  /**
   * The url the parent's configuration holds for a submodule.
   *
   * @param parent the parent working tree, never null
   * @param path   the submodule path, never null
   *
   * @return the url, empty if the submodule is not initialized
   */
  Optional<String> configuredSubmoduleUrl(Path parent, String path);

  /**
   * The url {@code .gitmodules} declares for a submodule path.
   *
   * @param parent the parent working tree, never null
   * @param path   the submodule path, never null
   *
   * @return the url, empty if the path is not declared
   */
  Optional<String> declaredSubmoduleUrl(Path parent, String path);
}
