package org.waabox.presetcat;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.presetcat.mutation.DeviceRequest;
import org.waabox.presetcat.mutation.DirectoryStructure;
import org.waabox.presetcat.mutation.OperationResult;
import org.waabox.presetcat.mutation.PresetRequest;
import org.waabox.presetcat.sync.CatalogSync;
import org.waabox.presetcat.sync.SyncMode;
import org.waabox.presetcat.sync.SyncResult;

/**
 * Tests for {@link PresetCatalog}, driving mutations end to end against a
 * catalog root on disk.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PresetCatalogTest {

  @TempDir
  Path tempDir;

  private Path root;

  private MutableClock clock;

  private PresetCatalog catalog;

  @BeforeEach
  void setUp() throws IOException {
    root = Files.createDirectories(tempDir.resolve("midi-presets"));
    clock = new MutableClock(Instant.parse("2026-01-15T10:00:00Z"));
    catalog = PresetCatalog.builder()
        .root(root)
        .clock(clock)
        .build();
    catalog.start();
  }

  @AfterEach
  void tearDown() {
    catalog.stop();
  }

  @Test
  void whenCreatingPreset_givenNewManufacturerAndDevice_shouldListIt() {
    assertTrue(catalog.createManufacturer("Moog").success());
    assertTrue(catalog.createDevice(DeviceRequest.of("Moog", "Sub37"))
        .success());

    final OperationResult result = catalog.createPreset(
        lead("Lead1", 5, "factory_presets"));

    assertTrue(result.success(), result.message());
    final List<PresetEntry> presets = catalog.presets(
        PresetQuery.of("Moog", "Sub37"));
    assertEquals(1, presets.size());
    assertEquals("Lead1", presets.get(0).presetName());
    assertEquals(5, presets.get(0).preset().pgm());
    assertEquals(PresetEntry.DEFAULT_SOURCE, presets.get(0).source());
    assertEquals("factory_presets", presets.get(0).collection());
  }

  @Test
  void whenCreatingDevice_givenValidRequest_shouldWriteVersionedDocument() {
    catalog.createManufacturer("Moog");

    final OperationResult result = catalog.createDevice(
        DeviceRequest.of("Moog", "Sub37"));

    final Path expected = root.toAbsolutePath().normalize()
        .resolve("Moog/Sub37/Moog_Sub37.json");
    assertEquals(expected, result.writtenPath().orElseThrow());
    final JsonNode written = CatalogFixtures.read(expected);
    assertEquals("1.0", written.at("/_metadata/schema_version").asText());
    assertEquals(1, written.at("/_metadata/file_revision").asInt());
    assertEquals("presetcat", written.at("/_metadata/created_by").asText());
    assertEquals("Sub37", written.at("/device_info/name").asText());
    assertEquals(List.of("Sub37"), catalog.devicesByManufacturer("Moog"));
    assertEquals(Map.of("IN", 1, "OUT", 1),
        catalog.deviceInfo("Moog").get(0).midiChannels());
  }

  @Test
  void whenCreatingDevice_givenMissingManufacturer_shouldFail() {
    final OperationResult result = catalog.createDevice(
        DeviceRequest.of("Moog", "Sub37"));

    assertFalse(result.success());
    assertTrue(result.message().contains("not found"), result.message());
  }

  @Test
  void whenCreatingDevice_givenExistingDevice_shouldFail() {
    sub37();

    final OperationResult result = catalog.createDevice(
        DeviceRequest.of("Moog", "Sub37"));

    assertFalse(result.success());
    assertTrue(result.message().contains("already exists"));
  }

  @Test
  void whenCreatingPresets_givenSeveralWrites_shouldKeepPresetCountInSync() {
    sub37();

    catalog.createPreset(lead("Lead 1", 1, "factory_presets"));
    catalog.createPreset(lead("Bass", 2, "factory_presets"));

    final JsonNode collection = CatalogFixtures.read(sub37Document())
        .at("/preset_collections/factory_presets");
    assertEquals(2, collection.at("/metadata/preset_count").asInt());
    assertEquals(2, collection.path("presets").size());
    assertEquals("lead_1_1", collection.at("/presets/0/preset_id").asText());
    assertEquals("bass_2", collection.at("/presets/1/preset_id").asText());
    assertTrue(collection.at("/preset_metadata/bass_2").has("created_at"));

    catalog.rescan();
    assertEquals(2, catalog.index().device("Sub37").orElseThrow()
        .collection("factory_presets").orElseThrow().metadata().presetCount());
  }

  @Test
  void whenCreatingPreset_givenMissingCollection_shouldCreateIt() {
    sub37();

    catalog.createPreset(lead("Lead1", 5, "factory_presets"));

    final JsonNode metadata = CatalogFixtures.read(sub37Document())
        .at("/preset_collections/factory_presets/metadata");
    assertEquals("Factory Presets", metadata.path("name").asText());
    assertEquals("Factory Presets for Sub37",
        metadata.path("description").asText());
    assertEquals(List.of("factory_presets"),
        catalog.collections("Moog", "Sub37"));
  }

  @Test
  void whenCreatingPreset_givenDuplicateName_shouldFail() {
    sub37();
    catalog.createPreset(lead("Lead1", 5, "factory_presets"));

    final OperationResult result = catalog.createPreset(
        lead("Lead1", 6, "factory_presets"));

    assertFalse(result.success());
    assertTrue(result.message().contains("already exists"));
    assertEquals(1, catalog.presets(PresetQuery.of("Moog", "Sub37")).size());
  }

  @Test
  void whenCreatingPreset_givenMissingDevice_shouldFailWithNotFound() {
    final OperationResult result = catalog.createPreset(
        lead("Lead1", 5, "factory_presets"));

    assertFalse(result.success());
    assertTrue(result.message().contains("not found"));
  }

  @Test
  void whenCreatingPreset_givenNoProgramChange_shouldFail() {
    sub37();

    final OperationResult result = catalog.createPreset(new PresetRequest(
        "Moog", "Sub37", null, "Lead1", null, null, null, null, null));

    assertFalse(result.success());
    assertTrue(result.message().contains("pgm"));
  }

  @Test
  void whenUpdatingPreset_givenMissingPreset_shouldFailWithNotFound() {
    sub37();
    catalog.createPreset(lead("Lead1", 5, "factory_presets"));

    final OperationResult result = catalog.updatePreset(
        lead("Missing", 7, "factory_presets"));

    assertFalse(result.success());
    assertTrue(result.message().contains("not found"), result.message());
  }

  @Test
  void whenUpdatingPreset_givenExistingPreset_shouldKeepIdAndBumpRevision() {
    sub37();
    catalog.createPreset(lead("Lead1", 5, "factory_presets"));
    final long revision = CatalogFixtures.read(sub37Document())
        .at("/_metadata/file_revision").asLong();
    clock.advance(Duration.ofMinutes(5));

    final OperationResult result = catalog.updatePreset(new PresetRequest(
        "Moog", "Sub37", "factory_presets", "Lead1", "Pad", List.of("Warm"),
        1, 9, null));

    assertTrue(result.success(), result.message());
    final JsonNode document = CatalogFixtures.read(sub37Document());
    assertEquals(revision + 1, document.at("/_metadata/file_revision")
        .asLong());
    assertEquals("2026-01-15T10:05:00Z",
        document.at("/_metadata/modified_at").asText());
    final JsonNode preset = document.at(
        "/preset_collections/factory_presets/presets/0");
    assertEquals("lead1_1", preset.path("preset_id").asText());
    assertEquals(9, preset.path("pgm").asInt());
    assertEquals("Pad", preset.path("category").asText());
    assertEquals("Pad", catalog.presetByName("Lead1").orElseThrow()
        .preset().category());
  }

  @Test
  void whenDeletingPreset_givenExistingPreset_shouldRemoveItAndItsMetadata() {
    sub37();
    catalog.createPreset(lead("Lead1", 5, "factory_presets"));
    catalog.createPreset(lead("Lead2", 6, "factory_presets"));

    final OperationResult result = catalog.deletePreset("Moog", "Sub37",
        "factory_presets", "Lead1");

    assertTrue(result.success());
    final JsonNode collection = CatalogFixtures.read(sub37Document())
        .at("/preset_collections/factory_presets");
    assertEquals(1, collection.at("/metadata/preset_count").asInt());
    assertFalse(collection.path("preset_metadata").has("lead1_1"));
    assertTrue(catalog.presetByName("Lead1").isEmpty());
  }

  @Test
  void whenDeleting_givenMissingEntities_shouldFailWithIdentifyingMessage() {
    sub37();

    final OperationResult preset = catalog.deletePreset("Moog", "Sub37",
        "factory_presets", "Ghost");
    final OperationResult device = catalog.deleteDevice("Moog", "Ghost");
    final OperationResult manufacturer = catalog.deleteManufacturer("Ghost");

    assertFalse(preset.success());
    assertTrue(preset.message().contains("factory_presets"));
    assertFalse(device.success());
    assertTrue(device.message().contains("'Ghost' not found"));
    assertFalse(manufacturer.success());
    assertTrue(manufacturer.message().contains("'Ghost' not found"));
  }

  @Test
  void whenCreatingManufacturer_givenTraversal_shouldRejectWithoutWriting()
      throws IOException {
    final long entriesBefore = countEntries(tempDir);

    final OperationResult traversal = catalog.createManufacturer("../../etc");
    final OperationResult separator = catalog.createManufacturer("Moog/x");

    assertFalse(traversal.success());
    assertFalse(separator.success());
    assertEquals(entriesBefore, countEntries(tempDir));
    assertFalse(Files.exists(tempDir.resolve("etc")));
  }

  @Test
  void whenCreatingManufacturer_givenSpaces_shouldSanitizeDirectoryName() {
    final OperationResult result = catalog.createManufacturer("Moog Music");

    assertTrue(result.success());
    assertTrue(Files.isDirectory(root.resolve("Moog_Music")));
    assertEquals(List.of("Moog_Music"), catalog.manufacturers());
  }

  @Test
  void whenCreatingManufacturer_givenExistingOne_shouldFail() {
    catalog.createManufacturer("Moog");

    assertFalse(catalog.createManufacturer("Moog").success());
  }

  @Test
  void whenDeletingDevice_givenExistingDevice_shouldRemoveItsDirectory() {
    sub37();

    final OperationResult result = catalog.deleteDevice("Moog", "Sub37");

    assertTrue(result.success());
    assertFalse(Files.exists(root.resolve("Moog/Sub37")));
    assertTrue(Files.isDirectory(root.resolve("Moog")));
    assertTrue(catalog.devicesByManufacturer("Moog").isEmpty());
  }

  @Test
  void whenDeletingManufacturer_givenDevices_shouldRemoveEverything() {
    sub37();

    final OperationResult result = catalog.deleteManufacturer("Moog");

    assertTrue(result.success());
    assertFalse(Files.exists(root.resolve("Moog")));
    assertTrue(catalog.manufacturers().isEmpty());
    assertTrue(catalog.index().device("Sub37").isEmpty());
  }

  @Test
  void whenCreatingCollection_givenExistingCollection_shouldSucceedUnchanged() {
    sub37();
    assertTrue(catalog.createCollection("Moog", "Sub37", "leads").success());
    final long revision = CatalogFixtures.read(sub37Document())
        .at("/_metadata/file_revision").asLong();

    final OperationResult result = catalog.createCollection("Moog", "Sub37",
        "leads");

    assertTrue(result.success());
    assertTrue(result.message().contains("already exists"));
    assertEquals(revision, CatalogFixtures.read(sub37Document())
        .at("/_metadata/file_revision").asLong());
  }

  @Test
  void whenRenamingCollection_givenFreeName_shouldMoveContentAndName() {
    sub37();
    catalog.createPreset(lead("Lead1", 5, "leads"));

    final OperationResult result = catalog.renameCollection("Moog", "Sub37",
        "leads", "mono_leads");

    assertTrue(result.success(), result.message());
    assertEquals(List.of("mono_leads"), catalog.collections("Moog", "Sub37"));
    final JsonNode collection = CatalogFixtures.read(sub37Document())
        .at("/preset_collections/mono_leads");
    assertEquals("mono_leads", collection.at("/metadata/name").asText());
    assertEquals(1, collection.path("presets").size());
  }

  @Test
  void whenRenamingCollection_givenTakenName_shouldFail() {
    sub37();
    catalog.createCollection("Moog", "Sub37", "leads");
    catalog.createCollection("Moog", "Sub37", "pads");

    final OperationResult result = catalog.renameCollection("Moog", "Sub37",
        "leads", "pads");

    assertFalse(result.success());
    assertEquals(List.of("leads", "pads"),
        catalog.collections("Moog", "Sub37"));
  }

  @Test
  void whenDeletingCollection_givenMissingCollection_shouldFailWithNotFound() {
    sub37();

    final OperationResult result = catalog.deleteCollection("Moog", "Sub37",
        "ghost");

    assertFalse(result.success());
    assertTrue(result.message().contains("not found"));
  }

  @Test
  void whenDeletingCollection_givenExistingCollection_shouldRemoveIt() {
    sub37();
    catalog.createCollection("Moog", "Sub37", "leads");

    assertTrue(catalog.deleteCollection("Moog", "Sub37", "leads").success());
    assertTrue(catalog.collections("Moog", "Sub37").isEmpty());
  }

  @Test
  void whenListingPresets_givenCommunityFolder_shouldMergeWithSource() {
    CatalogFixtures.write(root.resolve("Moog/Sub37/Moog_Sub37.json"),
        CatalogFixtures.withCollection(
            CatalogFixtures.deviceDocument("Sub37", "Moog"),
            "factory_presets", CatalogFixtures.preset("Lead1", 5)));
    CatalogFixtures.write(root.resolve("Moog/community/joe.json"),
        CatalogFixtures.communityDocument(CatalogFixtures.preset("Joe Bass",
            12)));
    catalog.rescan();

    final List<PresetEntry> withoutFolder = catalog.presets(
        PresetQuery.of("Moog", "Sub37"));
    final List<PresetEntry> withFolder = catalog.presets(
        PresetQuery.of("Moog", "Sub37").withCommunityFolder("joe"));

    assertEquals(List.of("joe"), catalog.communityFolders("Sub37"));
    assertEquals(1, withoutFolder.size());
    assertEquals(2, withFolder.size());
    assertEquals("joe", withFolder.get(1).source());
    assertEquals("Joe Bass", withFolder.get(1).presetName());
  }

  @Test
  void whenListingPresets_givenManufacturerOnly_shouldCoverItsDevices() {
    sub37();
    catalog.createDevice(DeviceRequest.of("Moog", "Grandmother"));
    catalog.createPreset(lead("Lead1", 5, "factory_presets"));
    catalog.createPreset(new PresetRequest("Moog", "Grandmother", null,
        "Pluck", null, null, null, 3, null));

    assertEquals(2, catalog.presets(new PresetQuery("Moog", null, null))
        .size());
    assertEquals(2, catalog.presets(PresetQuery.all()).size());
    assertTrue(catalog.presets(new PresetQuery("Korg", null, null)).isEmpty());
  }

  @Test
  void whenReading_givenUnknownKeys_shouldReturnEmptyResults() {
    assertTrue(catalog.devicesByManufacturer("Nobody").isEmpty());
    assertTrue(catalog.deviceInfo("Nobody").isEmpty());
    assertTrue(catalog.communityFolders("Nothing").isEmpty());
    assertTrue(catalog.collections("Nobody", "Nothing").isEmpty());
    assertTrue(catalog.presetByName("Nothing").isEmpty());
  }

  @Test
  void whenCheckingStructure_givenCreateIfMissing_shouldCreateDocument() {
    final DirectoryStructure before = catalog.checkDirectoryStructure(
        "Moog", "Sub37", false);
    final DirectoryStructure after = catalog.checkDirectoryStructure(
        "Moog", "Sub37", true);
    final DirectoryStructure again = catalog.checkDirectoryStructure(
        "Moog", "Sub37", true);

    assertFalse(before.manufacturerExists());
    assertFalse(before.jsonExists());
    assertTrue(after.created());
    assertTrue(after.jsonExists());
    assertTrue(Files.isRegularFile(after.jsonPath()));
    assertFalse(again.created());
    assertEquals(List.of("Sub37"), catalog.devicesByManufacturer("Moog"));
  }

  @Test
  void whenCheckingStructure_givenUnsafeName_shouldReportNothing() {
    final DirectoryStructure structure = catalog.checkDirectoryStructure(
        "../x", "Sub37", true);

    assertFalse(structure.created());
    assertFalse(structure.manufacturerExists());
  }

  @Test
  void whenStarting_givenSyncEngine_shouldSyncThenScan() {
    CatalogFixtures.write(root.resolve("Moog/Sub37/Moog_Sub37.json"),
        CatalogFixtures.deviceDocument("Sub37", "Moog"));

    final CatalogSync sync = createMock(CatalogSync.class);
    expect(sync.ensureHealthy(SyncMode.SUBMODULE))
        .andReturn(SyncResult.ok("ready"));
    expect(sync.sync(SyncMode.SUBMODULE))
        .andReturn(SyncResult.failure("boom", 500));
    replay(sync);

    final PresetCatalog synced = PresetCatalog.builder()
        .root(root)
        .sync(sync)
        .syncMode(SyncMode.SUBMODULE)
        .build();
    try {
      assertTrue(synced.start().succeeded());
      assertEquals(List.of("Sub37"), synced.devicesByManufacturer("Moog"));
      assertFalse(synced.sync().succeeded());
      assertThrows(IllegalStateException.class, synced::start);
    } finally {
      synced.stop();
    }
    verify(sync);
  }

  @Test
  void whenRescanning_givenStoppedCatalog_shouldThrow() {
    catalog.stop();

    assertThrows(IllegalStateException.class, catalog::rescan);
  }

  @Test
  void whenBuilding_givenNoRoot_shouldThrow() {
    assertThrows(IllegalStateException.class,
        () -> PresetCatalog.builder().build());
  }

  @Test
  void whenIndexSwaps_givenMutation_shouldPublishNewVersion() {
    final long before = catalog.index().version();

    catalog.createManufacturer("Moog");

    assertNotEquals(before, catalog.index().version());
  }

  @Test
  void whenCreatingPreset_givenFieldsOutsideTheModel_shouldKeepThemOnRewrite() {
    final ObjectNode seeded = CatalogFixtures.withCollection(
        CatalogFixtures.deviceDocument("Sub37", "Moog"), "factory_presets",
        CatalogFixtures.preset("Lead1", 5).put("source", "factory"));
    seeded.put("extra_top", "keep me");
    ((ObjectNode) seeded.get("device_info")).put("notes", "serial 42")
        .put("manufacturer_id", 4);
    ((ObjectNode) seeded.at("/preset_collections/factory_presets/metadata"))
        .put("curator", "ops");
    CatalogFixtures.write(sub37Document(), seeded);
    catalog.rescan();

    final OperationResult result = catalog.createPreset(
        lead("Lead2", 6, "factory_presets"));

    assertTrue(result.success(), result.message());
    final JsonNode written = CatalogFixtures.read(sub37Document());
    assertEquals("keep me", written.path("extra_top").asText());
    assertEquals("serial 42", written.at("/device_info/notes").asText());
    assertTrue(written.at("/device_info/manufacturer_id").isInt());
    assertEquals(4, written.at("/device_info/manufacturer_id").asInt());
    assertFalse(written.path("device_info").has("ports"));

    final JsonNode collection = written.at(
        "/preset_collections/factory_presets");
    assertEquals("ops", collection.at("/metadata/curator").asText());
    assertFalse(collection.path("metadata").has("version"));
    assertFalse(collection.path("metadata").has("sync_status"));
    assertEquals(2, collection.at("/metadata/preset_count").asInt());
    assertEquals("factory", collection.at("/presets/0/source").asText());
    assertFalse(collection.at("/presets/0").has("cc_0"));
    assertEquals("lead2_2", collection.at("/presets/1/preset_id").asText());
  }

  @Test
  void whenUpdatingPreset_givenUnmodeledFields_shouldReplaceOnlyModeled() {
    final ObjectNode lead = CatalogFixtures.preset("Lead1", 5)
        .put("preset_id", "lead1_1")
        .put("source", "factory")
        .put("command", "sendmidi dev Sub37 pc 5");
    CatalogFixtures.write(sub37Document(), CatalogFixtures.withCollection(
        CatalogFixtures.deviceDocument("Sub37", "Moog"), "factory_presets",
        lead, CatalogFixtures.preset("Lead2", 6).putNull("cc_0")));
    catalog.rescan();

    final OperationResult result = catalog.updatePreset(new PresetRequest(
        "Moog", "Sub37", "factory_presets", "Lead1", "Pad", List.of("Warm"),
        1, 9, null));

    assertTrue(result.success(), result.message());
    final JsonNode presets = CatalogFixtures.read(sub37Document())
        .at("/preset_collections/factory_presets/presets");
    assertEquals("lead1_1", presets.at("/0/preset_id").asText());
    assertEquals("factory", presets.at("/0/source").asText());
    assertEquals(9, presets.at("/0/pgm").asInt());
    assertEquals("Pad", presets.at("/0/category").asText());
    assertFalse(presets.get(0).has("command"));
    assertTrue(presets.get(1).has("cc_0"));
    assertTrue(presets.at("/1/cc_0").isNull());
  }

  @Test
  void whenRenamingCollection_givenFieldsOutsideTheModel_shouldMoveThem() {
    final ObjectNode seeded = CatalogFixtures.withCollection(
        CatalogFixtures.deviceDocument("Sub37", "Moog"), "leads",
        CatalogFixtures.preset("Lead1", 5).put("source", "factory"));
    ((ObjectNode) seeded.at("/preset_collections/leads"))
        .put("notes", "mono only");
    CatalogFixtures.write(sub37Document(), seeded);
    catalog.rescan();

    final OperationResult result = catalog.renameCollection("Moog", "Sub37",
        "leads", "mono_leads");

    assertTrue(result.success(), result.message());
    final JsonNode collection = CatalogFixtures.read(sub37Document())
        .at("/preset_collections/mono_leads");
    assertEquals("mono only", collection.path("notes").asText());
    assertEquals("factory", collection.at("/presets/0/source").asText());
    assertEquals("mono_leads", collection.at("/metadata/name").asText());
  }

  @Test
  void whenEditingDevice_givenManufacturerWithSpaces_shouldFindItsDirectory() {
    assertTrue(catalog.createManufacturer("Dave Smith").success());
    assertTrue(catalog.createDevice(DeviceRequest.of("Dave Smith", "OB6"))
        .success());

    final OperationResult result = catalog.createPreset(new PresetRequest(
        "Dave Smith", "OB6", "factory_presets", "Brass", "Brass", List.of(),
        null, 3, null));

    assertTrue(result.success(), result.message());
    assertEquals(List.of("Dave_Smith"), catalog.manufacturers());
    assertEquals(List.of("OB6"), catalog.devicesByManufacturer("Dave Smith"));
    assertEquals(1, catalog.deviceInfo("Dave Smith").size());
    assertEquals(List.of("factory_presets"),
        catalog.collections("Dave Smith", "OB6"));
    assertEquals(1, catalog.presets(PresetQuery.of("Dave Smith", "OB6"))
        .size());
    assertTrue(catalog.checkDirectoryStructure("Dave Smith", "OB6", false)
        .jsonExists());
    assertTrue(catalog.deleteDevice("Dave Smith", "OB6").success());
    assertTrue(catalog.devicesByManufacturer("Dave_Smith").isEmpty());
  }

  private void sub37() {
    assertTrue(catalog.createManufacturer("Moog").success());
    assertTrue(catalog.createDevice(DeviceRequest.of("Moog", "Sub37"))
        .success());
  }

  private Path sub37Document() {
    return root.resolve("Moog/Sub37/Moog_Sub37.json");
  }

  private static PresetRequest lead(final String name, final int pgm,
      final String collection) {
    return new PresetRequest("Moog", "Sub37", collection, name, "Lead",
        List.of("Bright"), null, pgm, null);
  }

  private static long countEntries(final Path dir) throws IOException {
    try (Stream<Path> entries = Files.walk(dir)) {
      return entries.count();
    }
  }
}
