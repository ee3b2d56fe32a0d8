package com.modporter.logic;

import com.modporter.logic.mapping.MappingModel.ApiMapping;
import com.modporter.logic.mapping.MappingModel.ConversionType;
import com.modporter.logic.mapping.MappingModel.ImportResult;
import com.modporter.logic.mapping.MappingModel.MappingDraft;
import com.modporter.logic.mapping.MappingModel.MappingFilter;
import com.modporter.logic.mapping.MappingModel.MappingUpdate;
import com.modporter.logic.mapping.MappingStore;
import com.modporter.logic.mapping.MappingStore.DuplicateSignatureException;
import com.modporter.logic.mapping.MappingStore.MappingNotFoundException;
import com.modporter.logic.mapping.MappingStore.MappingStoreException;
import com.modporter.logic.mapping.MappingStore.MappingValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class MappingStoreTest {

    private MappingStore store;

    @BeforeEach
    void setUp() {
        store = new MappingStore();
    }

    private static MappingDraft draft(String signature) {
        return MappingDraft.of(signature, "bedrock." + signature, ConversionType.DIRECT, "note");
    }

    @Test
    void createAssignsIdentityAndVersion() {
        ApiMapping created = store.create(draft("a.b.C.m"));

        assertNotNull(created.id());
        assertEquals(1, created.version());
        assertEquals(created.createdAt(), created.lastUpdated());
        assertEquals(created, store.get(created.id()).orElseThrow());
        assertEquals(created, store.getBySignature("a.b.C.m").orElseThrow());
    }

    @Test
    void duplicateSignatureIsRejected() {
        store.create(draft("a.b.C.m"));
        assertThrows(DuplicateSignatureException.class, () -> store.create(draft("a.b.C.m")));
        assertEquals(1, store.count());
    }

    @Test
    void blankFieldsAreRejected() {
        assertThrows(MappingValidationException.class,
                () -> store.create(MappingDraft.of(" ", "x", ConversionType.DIRECT, "")));
        assertThrows(MappingValidationException.class,
                () -> store.create(MappingDraft.of("a.b", "", ConversionType.DIRECT, "")));
        assertThrows(MappingValidationException.class,
                () -> store.create(MappingDraft.of("a.b", "x", null, "")));
        assertEquals(0, store.count());
    }

    @Test
    void updateBumpsVersionAndKeepsIdentity() {
        ApiMapping created = store.create(draft("a.b.C.m"));
        ApiMapping updated = store.update(created.id(), MappingUpdate.bedrockEquivalent("world.other"));

        assertEquals(created.id(), updated.id());
        assertEquals(created.createdAt(), updated.createdAt());
        assertEquals(2, updated.version());
        assertTrue(updated.lastUpdated().isAfter(created.lastUpdated()));
        assertEquals("world.other", updated.bedrockEquivalent());
        assertEquals("note", updated.notes());
    }

    @Test
    void signatureChangeReindexes() {
        ApiMapping created = store.create(draft("old.Sig"));
        store.update(created.id(), MappingUpdate.javaSignature("new.Sig"));

        assertTrue(store.getBySignature("old.Sig").isEmpty());
        assertEquals(created.id(), store.getBySignature("new.Sig").orElseThrow().id());
    }

    @Test
    void updateCannotStealAnotherSignature() {
        store.create(draft("first.Sig"));
        ApiMapping second = store.create(draft("second.Sig"));

        assertThrows(DuplicateSignatureException.class,
                () -> store.update(second.id(), MappingUpdate.javaSignature("first.Sig")));
        assertEquals(1, store.getBySignature("second.Sig").orElseThrow().version());
    }

    @Test
    void unknownIdsAreNamedErrors() {
        assertThrows(MappingNotFoundException.class, () -> store.update("missing", MappingUpdate.bedrockEquivalent("x")));
        assertThrows(MappingNotFoundException.class, () -> store.delete("missing"));
    }

    @Test
    void deleteRemovesBothIndexes() {
        ApiMapping created = store.create(draft("a.b.C.m"));
        store.delete(created.id());
        assertTrue(store.get(created.id()).isEmpty());
        assertTrue(store.getBySignature("a.b.C.m").isEmpty());
        store.create(draft("a.b.C.m"));
    }

    @Test
    void bulkImportCreatesUpdatesAndReportsFailures() {
        store.create(draft("existing.Sig"));
        ImportResult result = store.bulkImport(List.of(
                draft("existing.Sig"),
                draft("fresh.Sig"),
                MappingDraft.of("", "x", ConversionType.WRAPPER, "")));

        assertEquals(1, result.added());
        assertEquals(1, result.updated());
        assertEquals(1, result.failed());
        assertEquals(1, result.failures().size());
        assertEquals(2, store.getBySignature("existing.Sig").orElseThrow().version());
    }

    @Test
    void bulkImportSeesItsOwnEarlierDrafts() {
        ImportResult result = store.bulkImport(List.of(
                draft("twice.Sig"),
                MappingDraft.of("twice.Sig", "bedrock.second", ConversionType.WRAPPER, "again")));

        assertEquals(1, result.added());
        assertEquals(1, result.updated());
        ApiMapping m = store.getBySignature("twice.Sig").orElseThrow();
        assertEquals(2, m.version());
        assertEquals("bedrock.second", m.bedrockEquivalent());
        assertEquals(1, store.count());
    }

    @Test
    void filterMatchesTypeAndSearch() {
        store.create(MappingDraft.of("a.World.setBlockState", "dimension.setBlock", ConversionType.WRAPPER, ""));
        store.create(MappingDraft.of("a.Player.sendMessage", "player.sendMessage", ConversionType.DIRECT, ""));

        assertEquals(1, store.getAll(new MappingFilter(ConversionType.WRAPPER, null, null)).size());
        assertEquals(1, store.getAll(new MappingFilter(null, null, "sendmessage")).size());
        assertEquals(2, store.getAll(MappingFilter.ALL).size());
    }

    @Test
    void signaturesStayUniqueUnderRandomOperations() {
        Random random = new Random(7);
        String[] signatures = {"s.A", "s.B", "s.C", "s.D", "s.E"};
        for (int i = 0; i < 500; i++) {
            String sig = signatures[random.nextInt(signatures.length)];
            List<ApiMapping> all = store.getAll();
            try {
                switch (random.nextInt(3)) {
                    case 0 -> store.create(draft(sig));
                    case 1 -> {
                        if (!all.isEmpty()) {
                            store.update(all.get(random.nextInt(all.size())).id(), MappingUpdate.javaSignature(sig));
                        }
                    }
                    default -> {
                        if (!all.isEmpty()) store.delete(all.get(random.nextInt(all.size())).id());
                    }
                }
            } catch (MappingStoreException expected) {
                // conflicts are expected outcomes here
            }
            Set<String> seen = new HashSet<>();
            for (ApiMapping m : store.getAll()) {
                assertTrue(seen.add(m.javaSignature()), "duplicate signature " + m.javaSignature());
                assertEquals(m, store.getBySignature(m.javaSignature()).orElseThrow());
            }
        }
    }

    @Test
    void concurrentCreatesKeepOneOwnerPerSignature() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String sig = "c.Sig" + (i % 20);
                futures.add(pool.submit(() -> {
                    try {
                        store.create(draft(sig));
                    } catch (DuplicateSignatureException expected) {
                        // another thread won
                    }
                }));
            }
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }
        assertEquals(20, store.count());
    }

    // --- persistence ---

    @Test
    void writesPersistAndReload(@TempDir Path tmp) {
        Path file = tmp.resolve("mappings.json");
        MappingStore persistent = new MappingStore(file);
        ApiMapping created = persistent.create(draft("a.b.C.m"));
        assertTrue(Files.exists(file));

        MappingStore reloaded = new MappingStore(file);
        assertEquals(1, reloaded.load());
        ApiMapping loaded = reloaded.get(created.id()).orElseThrow();
        assertEquals(created, loaded);
    }

    @Test
    void missingFileStartsEmpty(@TempDir Path tmp) {
        MappingStore persistent = new MappingStore(tmp.resolve("absent.json"));
        assertEquals(0, persistent.load());
        assertEquals(0, persistent.count());
    }

    @Test
    void malformedFileIsAnError(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("mappings.json");
        Files.writeString(file, "{ not json");
        assertThrows(MappingStoreException.class, () -> new MappingStore(file).load());

        Files.writeString(file, "{\"mappings\": []}");
        assertThrows(MappingStoreException.class, () -> new MappingStore(file).load());
    }

    @Test
    void loadToleratesLegacyRecords(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("mappings.json");
        Files.writeString(file, """
                [
                  {
                    "id": "m1",
                    "javaSignature": "net.minecraft.world.World.setBlockState",
                    "bedrockEquivalent": "dimension.getBlock().setPermutation",
                    "conversionType": "wrapper",
                    "notes": "legacy record",
                    "version": "1.0.0",
                    "lastUpdated": "2023-05-01T10:00:00.000Z"
                  },
                  {
                    "id": "m2",
                    "javaSignature": "",
                    "bedrockEquivalent": "x",
                    "conversionType": "direct",
                    "version": 1,
                    "createdAt": "2023-05-01T10:00:00Z",
                    "lastUpdated": "2023-05-01T10:00:00Z"
                  },
                  {
                    "id": "m3",
                    "javaSignature": "a.b.C.m",
                    "bedrockEquivalent": "y",
                    "conversionType": "teleport",
                    "version": 1,
                    "createdAt": "2023-05-01T10:00:00Z",
                    "lastUpdated": "2023-05-01T10:00:00Z"
                  },
                  "not a record"
                ]
                """);

        MappingStore persistent = new MappingStore(file);
        assertEquals(1, persistent.load());

        ApiMapping m1 = persistent.get("m1").orElseThrow();
        assertEquals(1, m1.version());
        assertEquals(m1.lastUpdated(), m1.createdAt());
        assertEquals(ConversionType.WRAPPER, m1.conversionType());
    }

    @Test
    void failedPersistPublishesNothing(@TempDir Path tmp) throws IOException {
        // the store path is a directory, so every write fails
        Path dir = Files.createDirectory(tmp.resolve("store.json"));
        Files.writeString(dir.resolve("keep"), "x");
        MappingStore broken = new MappingStore(dir);

        assertThrows(MappingStoreException.class, () -> broken.create(draft("a.b.C.m")));
        assertEquals(0, broken.count());
    }

    @Test
    void largeBulkImportPersistsEveryDraft(@TempDir Path tmp) {
        Path file = tmp.resolve("mappings.json");
        MappingStore persistent = new MappingStore(file);
        persistent.create(draft("seed.Sig"));

        List<MappingDraft> drafts = new ArrayList<>();
        for (int i = 0; i < 2000; i++) drafts.add(draft("bulk.Sig" + i));
        drafts.add(draft("seed.Sig"));
        drafts.add(MappingDraft.of("bad.Sig", "", ConversionType.DIRECT, ""));

        ImportResult result = persistent.bulkImport(drafts);
        assertEquals(2000, result.added());
        assertEquals(1, result.updated());
        assertEquals(1, result.failed());
        assertTrue(result.failures().get(0).reason().startsWith("Invalid mapping: "));
        assertFalse(Files.exists(tmp.resolve("mappings.json.tmp")));

        MappingStore reloaded = new MappingStore(file);
        assertEquals(2001, reloaded.load());
        assertEquals(2, reloaded.getBySignature("seed.Sig").orElseThrow().version());
        assertTrue(reloaded.getBySignature("bulk.Sig1999").isPresent());
    }

    @Test
    void failedBulkPersistAppliesNothing(@TempDir Path tmp) throws IOException {
        Path dir = Files.createDirectory(tmp.resolve("store.json"));
        Files.writeString(dir.resolve("keep"), "x");
        MappingStore broken = new MappingStore(dir);

        assertThrows(MappingStoreException.class,
                () -> broken.bulkImport(List.of(draft("a.b.C.m"), draft("a.b.C.n"))));
        assertEquals(0, broken.count());
        assertTrue(broken.getBySignature("a.b.C.m").isEmpty());
    }

    @Test
    void bulkImportWithOnlyFailuresWritesNothing(@TempDir Path tmp) {
        Path file = tmp.resolve("mappings.json");
        MappingStore persistent = new MappingStore(file);

        ImportResult result = persistent.bulkImport(List.of(MappingDraft.of("", "x", ConversionType.DIRECT, "")));
        assertEquals(1, result.failed());
        assertFalse(Files.exists(file));
    }
}
