package org.waabox.presetcat.mutation;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns untrusted names into path components that stay inside the
 * catalog root.
 *
 * <p>Names containing {@code ..}, {@code /} or {@code \} are rejected
 * outright. Other names have spaces replaced with underscores, characters
 * outside {@code [A-Za-z0-9_.-]} removed, and a leading dot prefixed with
 * {@code x}. A name that ends up empty is rejected too.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PathSanitizer {

  /** Characters that are not allowed in a component. */
  private static final Pattern DISALLOWED = Pattern.compile("[^a-zA-Z0-9_.\\-]");

  /** The catalog root, absolute and normalized. */
  private final Path root;

  /**
   * Creates a new sanitizer for the given root.
   *
   * @param root the catalog root, never null
   */
  public PathSanitizer(final Path root) {
    Objects.requireNonNull(root, "root must not be null");
    this.root = root.toAbsolutePath().normalize();
  }

  /**
   * Normalizes a single name component.
   *
   * @param name the untrusted name, never null
   *
   * @return the safe component, never null or empty
   *
   * @throws UnsafePathException if the name contains a traversal or a
   *                             separator, or is empty after normalization
   */
  public String sanitize(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    if (name.contains("..") || name.contains("/") || name.contains("\\")) {
      throw new UnsafePathException("Invalid name: " + name);
    }
    String safe = DISALLOWED.matcher(name.replace(' ', '_')).replaceAll("");
    if (safe.startsWith(".")) {
      safe = "x" + safe;
    }
    if (safe.isEmpty()) {
      throw new UnsafePathException("Invalid name: " + name);
    }
    return safe;
  }

  /**
   * Resolves the given names, each one sanitized, under the root.
   *
   * @param names the untrusted components, never null
   *
   * @return the resolved absolute path, never null
   *
   * @throws UnsafePathException if any component is unsafe or the result
   *                             escapes the root
   */
  public Path resolve(final String... names) {
    Path path = root;
    for (final String name : names) {
      path = path.resolve(sanitize(name));
    }
    return requireWithinRoot(path);
  }

  /**
   * Checks that a path lies inside the root.
   *
   * @param path the path, never null
   *
   * @return the absolute normalized path, never null
   *
   * @throws UnsafePathException if the path is outside the root
   */
  public Path requireWithinRoot(final Path path) {
    Objects.requireNonNull(path, "path must not be null");
    final Path normalized = path.toAbsolutePath().normalize();
    if (!normalized.startsWith(root) || normalized.equals(root)) {
      throw new UnsafePathException("Path is outside the catalog root: "
          + path);
    }
    return normalized;
  }

  /**
   * Returns the catalog root.
   *
   * @return the absolute normalized root, never null
   */
  public Path root() {
    return root;
  }
}
