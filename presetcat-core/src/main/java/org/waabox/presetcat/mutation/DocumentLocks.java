package org.waabox.presetcat.mutation;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-document advisory locks.
 *
 * <p>Every read-modify-write of a document runs while holding the lock of
 * its absolute path, so two writers in this process never interleave on
 * the same file. Other processes are not coordinated.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DocumentLocks {

  /** The locks, keyed by absolute normalized path. */
  private final Map<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

  /**
   * Runs the action while holding the lock of the given document.
   *
   * @param path   the document path, never null
   * @param action the action to run, never null
   * @param <T>    the result type
   *
   * @return the action result
   */
  public <T> T withLock(final Path path, final Supplier<T> action) {
    Objects.requireNonNull(action, "action must not be null");
    final ReentrantLock lock = lockFor(path);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the lock for the given document, creating it if needed.
   *
   * @param path the document path, never null
   *
   * @return the lock, never null
   */
  ReentrantLock lockFor(final Path path) {
    Objects.requireNonNull(path, "path must not be null");
    return locks.computeIfAbsent(path.toAbsolutePath().normalize(),
        p -> new ReentrantLock());
  }
}
