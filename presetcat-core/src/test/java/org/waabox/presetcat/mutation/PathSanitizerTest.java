package org.waabox.presetcat.mutation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link PathSanitizer}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PathSanitizerTest {

  @TempDir
  Path root;

  @Test
  void whenSanitizing_givenTraversal_shouldReject() {
    final PathSanitizer sanitizer = new PathSanitizer(root);

    assertThrows(UnsafePathException.class,
        () -> sanitizer.sanitize("../../etc"));
    assertThrows(UnsafePathException.class, () -> sanitizer.sanitize(".."));
    assertThrows(UnsafePathException.class,
        () -> sanitizer.sanitize("Moog/Sub37"));
    assertThrows(UnsafePathException.class,
        () -> sanitizer.sanitize("Moog\\Sub37"));
  }

  @Test
  void whenSanitizing_givenSpacesAndSymbols_shouldNormalize() {
    final PathSanitizer sanitizer = new PathSanitizer(root);

    assertEquals("Moog_Music", sanitizer.sanitize("Moog Music"));
    assertEquals("Sub37-v2.1", sanitizer.sanitize("Sub37-v2.1"));
    assertEquals("Korg", sanitizer.sanitize("K*o:r?g"));
  }

  @Test
  void whenSanitizing_givenLeadingDot_shouldPrefixIt() {
    final PathSanitizer sanitizer = new PathSanitizer(root);

    assertEquals("x.hidden", sanitizer.sanitize(".hidden"));
  }

  @Test
  void whenSanitizing_givenNothingLeft_shouldReject() {
    final PathSanitizer sanitizer = new PathSanitizer(root);

    assertThrows(UnsafePathException.class, () -> sanitizer.sanitize(""));
    assertThrows(UnsafePathException.class, () -> sanitizer.sanitize("*?:"));
  }

  @Test
  void whenResolving_givenSeveralComponents_shouldStayUnderRoot() {
    final PathSanitizer sanitizer = new PathSanitizer(root);

    final Path resolved = sanitizer.resolve("Moog Music", "Sub 37");

    assertEquals(root.toAbsolutePath().normalize()
        .resolve("Moog_Music").resolve("Sub_37"), resolved);
    assertTrue(resolved.startsWith(sanitizer.root()));
  }

  @Test
  void whenCheckingRoot_givenPathOutsideRoot_shouldReject() {
    final PathSanitizer sanitizer = new PathSanitizer(root);

    assertThrows(UnsafePathException.class,
        () -> sanitizer.requireWithinRoot(root.resolve("../outside")));
    assertThrows(UnsafePathException.class,
        () -> sanitizer.requireWithinRoot(root));
  }
}
