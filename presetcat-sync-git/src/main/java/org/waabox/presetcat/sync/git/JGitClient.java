package org.waabox.presetcat.sync.git;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.MergeResult;
import org.eclipse.jgit.api.PullResult;
import org.eclipse.jgit.api.RebaseCommand;
import org.eclipse.jgit.api.RebaseResult;
import org.eclipse.jgit.api.ResetCommand;
import org.eclipse.jgit.api.errors.CheckoutConflictException;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.eclipse.jgit.api.errors.WrongRepositoryStateException;
import org.eclipse.jgit.errors.ConfigInvalidException;
import org.eclipse.jgit.lib.ConfigConstants;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.storage.file.FileBasedConfig;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.submodule.SubmoduleWalk;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.eclipse.jgit.util.FS;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.presetcat.document.FileTrees;

/**
 * {@link GitClient} backed by JGit.
 *
 * <p>Repositories are opened from their working tree on every call, so a
 * {@code .git} file pointing into the parent's module store works the
 * same as a {@code .git} directory. Nothing is kept open between calls.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JGitClient implements GitClient {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(JGitClient.class);

  /** {@inheritDoc} */
  @Override
  public boolean isRepository(final Path directory) {
    Objects.requireNonNull(directory, "directory must not be null");
    if (!Files.isDirectory(directory)) {
      return false;
    }
    try (Repository repository = open(directory)) {
      return repository.getObjectDatabase().exists();
    } catch (final IOException | IllegalArgumentException e) {
      log.debug("{} is not a git repository: {}", directory, e.getMessage());
      return false;
    }
  }

  /** {@inheritDoc} */
  @Override
  public void cloneRepository(final String url, final Path directory) {
    Objects.requireNonNull(url, "url must not be null");
    Objects.requireNonNull(directory, "directory must not be null");
    try {
      Git.cloneRepository()
          .setURI(url)
          .setDirectory(directory.toFile())
          .call()
          .close();
    } catch (final GitAPIException | JGitInternalException e) {
      throw new GitSyncException("Failed to clone " + url + " into "
          + directory + ": " + e.getMessage(), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean isClean(final Path repository) {
    try (Repository repo = open(repository)) {
      return Git.wrap(repo).status().call().isClean();
    } catch (final IOException | GitAPIException | JGitInternalException e) {
      throw failure("read the status of", repository, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void stageAll(final Path repository) {
    try (Repository repo = open(repository)) {
      final Git git = Git.wrap(repo);
      git.add().addFilepattern(".").call();
      git.add().addFilepattern(".").setUpdate(true).call();
    } catch (final IOException | GitAPIException | JGitInternalException e) {
      throw failure("stage changes in", repository, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void stage(final Path repository, final String path) {
    Objects.requireNonNull(path, "path must not be null");
    try (Repository repo = open(repository)) {
      Git.wrap(repo).add().addFilepattern(path).call();
    } catch (final IOException | GitAPIException | JGitInternalException e) {
      throw failure("stage " + path + " in", repository, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void commit(final Path repository, final String message) {
    Objects.requireNonNull(message, "message must not be null");
    try (Repository repo = open(repository)) {
      final RevCommit commit = Git.wrap(repo).commit()
          .setMessage(message)
          .setSign(false)
          .call();
      log.debug("Committed {} in {}", commit.getId().abbreviate(7).name(),
          repository);
    } catch (final IOException | GitAPIException | JGitInternalException e) {
      throw failure("commit in", repository, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void pull(final Path repository) {
    try (Repository repo = open(repository)) {
      final Git git = Git.wrap(repo);
      final PullResult result = git.pull().call();
      if (result.isSuccessful()) {
        return;
      }
      abortIncompletePull(git, result);
      throw new GitConflictException("Pull into " + repository
          + " did not complete: " + describe(result));
    } catch (final CheckoutConflictException
        | WrongRepositoryStateException e) {
      throw new GitConflictException("Pull into " + repository
          + " conflicts with local changes: " + e.getMessage(), e);
    } catch (final JGitInternalException e) {
      if (isCheckoutConflict(e)) {
        throw new GitConflictException("Pull into " + repository
            + " conflicts with local changes: " + e.getMessage(), e);
      }
      throw failure("pull into", repository, e);
    } catch (final IOException | GitAPIException e) {
      throw failure("pull into", repository, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean stash(final Path repository) {
    try (Repository repo = open(repository)) {
      final RevCommit stashed = Git.wrap(repo).stashCreate()
          .setIncludeUntracked(true)
          .call();
      return stashed != null;
    } catch (final IOException | GitAPIException | JGitInternalException e) {
      throw failure("stash changes in", repository, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void stashPop(final Path repository) {
    try (Repository repo = open(repository)) {
      final Git git = Git.wrap(repo);
      git.stashApply().call();
      git.stashDrop().call();
    } catch (final IOException | GitAPIException | JGitInternalException e) {
      throw failure("restore stashed changes in", repository, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void push(final Path repository) {
    try (Repository repo = open(repository)) {
      for (PushResult result : Git.wrap(repo).push().call()) {
        for (RemoteRefUpdate update : result.getRemoteUpdates()) {
          final RemoteRefUpdate.Status status = update.getStatus();
          if (status != RemoteRefUpdate.Status.OK
              && status != RemoteRefUpdate.Status.UP_TO_DATE) {
            throw new GitSyncException("Push of " + update.getRemoteName()
                + " from " + repository + " was rejected: " + status
                + messageOf(update));
          }
        }
      }
    } catch (final IOException | GitAPIException | JGitInternalException e) {
      throw failure("push from", repository, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void submoduleSync(final Path parent) {
    try (Repository repo = open(parent)) {
      Git.wrap(repo).submoduleSync().call();
    } catch (final IOException | GitAPIException | JGitInternalException e) {
      throw failure("sync submodules of", parent, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void submoduleUpdate(final Path parent) {
    try (Repository repo = open(parent)) {
      updateRecursively(repo);
    } catch (final CheckoutConflictException e) {
      throw new GitConflictException("Submodule update in " + parent
          + " conflicts with local changes: " + e.getMessage(), e);
    } catch (final JGitInternalException e) {
      if (isCheckoutConflict(e)) {
        throw new GitConflictException("Submodule update in " + parent
            + " conflicts with local changes: " + e.getMessage(), e);
      }
      throw failure("update submodules of", parent, e);
    } catch (final IOException | GitAPIException e) {
      throw failure("update submodules of", parent, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void submoduleDeinit(final Path parent, final String path) {
    Objects.requireNonNull(path, "path must not be null");
    try (Repository repo = open(parent)) {
      Git.wrap(repo).submoduleDeinit().addPath(path).setForce(true).call();
      deleteModuleStore(repo, path);
    } catch (final IOException | GitAPIException | JGitInternalException e) {
      throw failure("deinit submodule " + path + " of", parent, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void submoduleAdd(final Path parent, final String path,
      final String url) {
    Objects.requireNonNull(path, "path must not be null");
    Objects.requireNonNull(url, "url must not be null");
    try (Repository repo = open(parent)) {
      Git.wrap(repo).submoduleAdd()
          .setPath(path)
          .setURI(url)
          .call()
          .close();
    } catch (final IOException | GitAPIException | JGitInternalException e) {
      throw failure("add submodule " + path + " to", parent, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void removeFromIndex(final Path parent, final String path) {
    Objects.requireNonNull(path, "path must not be null");
    try (Repository repo = open(parent)) {
      Git.wrap(repo).rm().setCached(true).addFilepattern(path).call();
      deleteModuleStore(repo, path);
    } catch (final IOException | GitAPIException | JGitInternalException e) {
      throw failure("remove " + path + " from the index of", parent, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Optional<String> configuredSubmoduleUrl(final Path parent,
      final String path) {
    Objects.requireNonNull(path, "path must not be null");
    try (Repository repo = open(parent)) {
      return Optional.ofNullable(repo.getConfig().getString(
          ConfigConstants.CONFIG_SUBMODULE_SECTION, path,
          ConfigConstants.CONFIG_KEY_URL));
    } catch (final IOException e) {
      throw failure("read the configuration of", parent, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Optional<String> declaredSubmoduleUrl(final Path parent,
      final String path) {
    Objects.requireNonNull(parent, "parent must not be null");
    Objects.requireNonNull(path, "path must not be null");
    final File modulesFile = parent.resolve(Constants.DOT_GIT_MODULES)
        .toFile();
    if (!modulesFile.isFile()) {
      return Optional.empty();
    }
    final FileBasedConfig modules = new FileBasedConfig(modulesFile,
        FS.DETECTED);
    try {
      modules.load();
    } catch (final IOException | ConfigInvalidException e) {
      throw new GitSyncException("Cannot read " + modulesFile + ": "
          + e.getMessage(), e);
    }
    for (String name : modules.getSubsections(
        ConfigConstants.CONFIG_SUBMODULE_SECTION)) {
      final String declaredPath = modules.getString(
          ConfigConstants.CONFIG_SUBMODULE_SECTION, name,
          ConfigConstants.CONFIG_KEY_PATH);
      if (path.equals(declaredPath)) {
        return Optional.ofNullable(modules.getString(
            ConfigConstants.CONFIG_SUBMODULE_SECTION, name,
            ConfigConstants.CONFIG_KEY_URL));
      }
    }
    return Optional.empty();
  }

  /** Opens the repository whose working tree is the given directory.
   *
   * @param workTree the working tree, never null.
   *
   * @return the repository, never null. Callers close it.
   *
   * @throws IOException if no repository can be opened.
   */
  private static Repository open(final Path workTree) throws IOException {
    Objects.requireNonNull(workTree, "workTree must not be null");
    return new FileRepositoryBuilder()
        .setWorkTree(workTree.toFile())
        .setMustExist(true)
        .build();
  }

  private static void updateRecursively(final Repository repository)
      throws GitAPIException, IOException {
    final Git git = Git.wrap(repository);
    git.submoduleInit().call();
    git.submoduleUpdate().call();
    try (SubmoduleWalk walk = SubmoduleWalk.forIndex(repository)) {
      while (walk.next()) {
        try (Repository submodule = walk.getRepository()) {
          if (submodule != null) {
            updateRecursively(submodule);
          }
        }
      }
    }
  }

  /** Deletes the stored repository of a submodule, so that the next
   * update or add clones it again.
   */
  private static void deleteModuleStore(final Repository repository,
      final String path) throws IOException {
    final Path store = repository.getDirectory().toPath()
        .resolve(Constants.MODULES).resolve(path);
    if (Files.exists(store)) {
      FileTrees.delete(store);
      log.debug("Deleted module store {}", store);
    }
  }

  /** Leaves the repository as it was before a failed pull. */
  private static void abortIncompletePull(final Git git,
      final PullResult result) throws GitAPIException {
    final MergeResult merge = result.getMergeResult();
    if (merge != null
        && merge.getMergeStatus() == MergeResult.MergeStatus.CONFLICTING) {
      git.reset().setMode(ResetCommand.ResetType.HARD).call();
    }
    final RebaseResult rebase = result.getRebaseResult();
    if (rebase != null && rebase.getStatus() == RebaseResult.Status.STOPPED) {
      git.rebase().setOperation(RebaseCommand.Operation.ABORT).call();
    }
  }

  private static String describe(final PullResult result) {
    if (result.getMergeResult() != null) {
      return "merge " + result.getMergeResult().getMergeStatus();
    }
    if (result.getRebaseResult() != null) {
      return "rebase " + result.getRebaseResult().getStatus();
    }
    return "fetch from " + result.getFetchedFrom();
  }

  private static String messageOf(final RemoteRefUpdate update) {
    return update.getMessage() == null ? "" : " (" + update.getMessage() + ")";
  }

  private static boolean isCheckoutConflict(final Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof CheckoutConflictException
          || current
              instanceof org.eclipse.jgit.errors.CheckoutConflictException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static GitSyncException failure(final String action,
      final Path repository, final Exception cause) {
    return new GitSyncException("Failed to " + action + " " + repository
        + ": " + cause.getMessage(), cause);
  }
}
