package org.waabox.presetcat.sync.git;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link GitSyncConfig}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class GitSyncConfigTest {

  @Test
  void whenCreate_givenOnlyRoot_shouldDeriveParentAndSubmodulePath() {
    final Path root = Path.of("/srv/r2midi/server/midi-presets");

    final GitSyncConfig config = GitSyncConfig.create(root);

    assertEquals(root, config.catalogRoot());
    assertEquals(Path.of("/srv/r2midi/server"), config.parentRepository());
    assertEquals("midi-presets", config.submodulePath());
    assertEquals(GitSyncConfig.DEFAULT_REMOTE_URL, config.remoteUrl());
    assertTrue(config.syncEnabled());
  }

  @Test
  void whenCreate_givenNestedSubmodulePath_shouldAcceptIt() {
    final GitSyncConfig config = GitSyncConfig.create(
        Path.of("/srv/r2midi/server/midi-presets"), Path.of("/srv/r2midi"),
        "server/midi-presets", "https://example.org/presets.git", false);

    assertEquals("server/midi-presets", config.submodulePath());
    assertEquals("https://example.org/presets.git", config.remoteUrl());
  }

  @Test
  void whenCreate_givenRootOutsideParent_shouldFail() {
    assertThrows(IllegalArgumentException.class, () -> GitSyncConfig.create(
        Path.of("/srv/other/midi-presets"), Path.of("/srv/r2midi"),
        "midi-presets", GitSyncConfig.DEFAULT_REMOTE_URL, true));
  }

  @Test
  void whenCreate_givenSubmodulePathLeavingParent_shouldFail() {
    assertThrows(IllegalArgumentException.class, () -> GitSyncConfig.create(
        Path.of("/srv/other/midi-presets"), Path.of("/srv/r2midi"),
        "../other/midi-presets", GitSyncConfig.DEFAULT_REMOTE_URL, true));
  }

  @Test
  void whenCreate_givenBlankRemoteUrl_shouldFail() {
    assertThrows(IllegalArgumentException.class, () -> GitSyncConfig.create(
        Path.of("/srv/r2midi/midi-presets"), Path.of("/srv/r2midi"),
        "midi-presets", " ", true));
  }
}
