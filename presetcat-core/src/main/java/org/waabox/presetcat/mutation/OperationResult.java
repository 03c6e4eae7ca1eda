package org.waabox.presetcat.mutation;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of a mutation.
 *
 * @param success whether the mutation was applied
 * @param message a human readable description, never null
 * @param path    the written path for successful creates, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record OperationResult(boolean success, String message, Path path) {

  /** Creates a new result. */
  public OperationResult {
    Objects.requireNonNull(message, "message must not be null");
  }

  /**
   * A successful result without a path.
   *
   * @param message the message, never null
   *
   * @return the result, never null
   */
  public static OperationResult ok(final String message) {
    return new OperationResult(true, message, null);
  }

  /**
   * A successful result carrying the written path.
   *
   * @param message the message, never null
   * @param path    the written path, never null
   *
   * @return the result, never null
   */
  public static OperationResult created(final String message,
      final Path path) {
    Objects.requireNonNull(path, "path must not be null");
    return new OperationResult(true, message, path);
  }

  /**
   * A failed result.
   *
   * @param message the message, never null
   *
   * @return the result, never null
   */
  public static OperationResult failure(final String message) {
    return new OperationResult(false, message, null);
  }

  /**
   * The written path, if any.
   *
   * @return the path, or empty
   */
  public Optional<Path> writtenPath() {
    return Optional.ofNullable(path);
  }
}
