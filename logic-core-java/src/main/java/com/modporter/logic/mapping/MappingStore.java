package com.modporter.logic.mapping;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.modporter.logic.mapping.MappingModel.ApiMapping;
import com.modporter.logic.mapping.MappingModel.ImportFailure;
import com.modporter.logic.mapping.MappingModel.ImportResult;
import com.modporter.logic.mapping.MappingModel.MappingDraft;
import com.modporter.logic.mapping.MappingModel.MappingFilter;
import com.modporter.logic.mapping.MappingModel.MappingUpdate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mapping storage keyed by id with a unique signature index.
 *
 * Both indexes live in one immutable {@link Snapshot} behind a volatile reference: readers
 * never lock and always see a consistent pair. Writers serialize on a fair lock, build the
 * next snapshot, persist it and only then publish it, so a failed write changes nothing.
 */
public class MappingStore {

    private static final String LOG_PREFIX = "[modporter-logic] ";

    private record Snapshot(Map<String, ApiMapping> byId, Map<String, String> idBySignature) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());

        static Snapshot of(LinkedHashMap<String, ApiMapping> byId) {
            LinkedHashMap<String, String> bySig = new LinkedHashMap<>();
            for (ApiMapping m : byId.values()) bySig.put(m.javaSignature(), m.id());
            return new Snapshot(Collections.unmodifiableMap(byId), Collections.unmodifiableMap(bySig));
        }

        LinkedHashMap<String, ApiMapping> mutableCopy() {
            return new LinkedHashMap<>(byId);
        }
    }

    private final Path storePath;
    private final ReentrantLock writeLock = new ReentrantLock(true);
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    /** In-memory store; nothing is persisted. */
    public MappingStore() {
        this(null);
    }

    /** File-backed store. Call {@link #load()} to read existing records. */
    public MappingStore(Path storePath) {
        this.storePath = storePath;
    }

    public Optional<Path> storePath() {
        return Optional.ofNullable(storePath);
    }

    /**
     * Replaces the contents with the records in the backing file. A missing file leaves an
     * empty store. Invalid records are skipped with a warning.
     *
     * @throws MappingStoreException if the file cannot be read or is not a JSON array
     * @return number of mappings loaded
     */
    public int load() {
        if (storePath == null) return count();
        writeLock.lock();
        try {
            if (!Files.exists(storePath)) {
                System.err.println(LOG_PREFIX + "Mapping store " + storePath + " not found, starting empty");
                snapshot = Snapshot.EMPTY;
                return 0;
            }
            JsonArray array;
            try {
                String text = Files.readString(storePath, StandardCharsets.UTF_8);
                JsonElement root = JsonParser.parseString(text);
                if (!root.isJsonArray()) {
                    throw new MappingStoreException("Mapping store is not a JSON array: " + storePath);
                }
                array = root.getAsJsonArray();
            } catch (IOException e) {
                throw new MappingStoreException("Failed to read mapping store: " + storePath + ": " + e.getMessage(), e);
            } catch (JsonParseException e) {
                throw new MappingStoreException("Malformed mapping store: " + storePath + ": " + e.getMessage(), e);
            }

            List<ApiMapping> records = MappingJson.parseRecords(array,
                    reason -> System.err.println(LOG_PREFIX + "WARNING: Skipping invalid mapping " + reason));
            LinkedHashMap<String, ApiMapping> byId = new LinkedHashMap<>();
            Map<String, String> seenSignatures = new LinkedHashMap<>();
            for (ApiMapping m : records) {
                if (byId.containsKey(m.id()) || seenSignatures.containsKey(m.javaSignature())) {
                    System.err.println(LOG_PREFIX + "WARNING: Skipping duplicate mapping " + m.id()
                            + " (" + m.javaSignature() + ")");
                    continue;
                }
                byId.put(m.id(), m);
                seenSignatures.put(m.javaSignature(), m.id());
            }
            snapshot = Snapshot.of(byId);
            System.err.println(LOG_PREFIX + "Loaded " + byId.size() + " mappings from " + storePath);
            return byId.size();
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<ApiMapping> get(String id) {
        return Optional.ofNullable(snapshot.byId().get(id));
    }

    public Optional<ApiMapping> getBySignature(String javaSignature) {
        Snapshot current = snapshot;
        String id = current.idBySignature().get(javaSignature);
        return id == null ? Optional.empty() : Optional.ofNullable(current.byId().get(id));
    }

    public List<ApiMapping> getAll() {
        return List.copyOf(snapshot.byId().values());
    }

    public List<ApiMapping> getAll(MappingFilter filter) {
        List<ApiMapping> result = new ArrayList<>();
        for (ApiMapping m : snapshot.byId().values()) {
            if (filter == null || filter.matches(m)) result.add(m);
        }
        return result;
    }

    public int count() {
        return snapshot.byId().size();
    }

    /**
     * @throws MappingValidationException if a core field is missing
     * @throws DuplicateSignatureException if another mapping already owns the signature
     */
    public ApiMapping create(MappingDraft draft) {
        List<String> errors = MappingValidator.coreErrors(
                draft.javaSignature(), draft.bedrockEquivalent(), draft.conversionType());
        if (!errors.isEmpty()) throw new MappingValidationException(String.join("; ", errors));

        writeLock.lock();
        try {
            Snapshot current = snapshot;
            if (current.idBySignature().containsKey(draft.javaSignature())) {
                throw new DuplicateSignatureException(draft.javaSignature());
            }
            ApiMapping mapping = newMapping(draft);
            LinkedHashMap<String, ApiMapping> next = current.mutableCopy();
            next.put(mapping.id(), mapping);
            commit(Snapshot.of(next));
            return mapping;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Applies the non-null fields of {@code update}. Bumps the version and refreshes
     * lastUpdated; id and createdAt are preserved.
     */
    public ApiMapping update(String id, MappingUpdate update) {
        List<String> errors = updateErrors(update);
        if (!errors.isEmpty()) throw new MappingValidationException(String.join("; ", errors));

        writeLock.lock();
        try {
            Snapshot current = snapshot;
            ApiMapping existing = current.byId().get(id);
            if (existing == null) throw new MappingNotFoundException(id);
            ApiMapping updated = applyUpdate(existing, update, current.idBySignature());

            LinkedHashMap<String, ApiMapping> next = current.mutableCopy();
            next.put(id, updated);
            commit(Snapshot.of(next));
            return updated;
        } finally {
            writeLock.unlock();
        }
    }

    /** @return the removed mapping */
    public ApiMapping delete(String id) {
        writeLock.lock();
        try {
            Snapshot current = snapshot;
            if (!current.byId().containsKey(id)) throw new MappingNotFoundException(id);
            LinkedHashMap<String, ApiMapping> next = current.mutableCopy();
            ApiMapping removed = next.remove(id);
            commit(Snapshot.of(next));
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Creates or updates (by signature) each draft in order. Failures are collected and the
     * import carries on. The whole batch is persisted and published once.
     *
     * @throws MappingStoreException if the batch cannot be written; nothing is applied then
     */
    public ImportResult bulkImport(List<MappingDraft> drafts) {
        int added = 0;
        int updated = 0;
        List<ImportFailure> failures = new ArrayList<>();
        writeLock.lock();
        try {
            LinkedHashMap<String, ApiMapping> next = snapshot.mutableCopy();
            Map<String, String> idBySignature = new HashMap<>(snapshot.idBySignature());
            for (MappingDraft draft : drafts) {
                String existingId = draft.javaSignature() == null ? null : idBySignature.get(draft.javaSignature());
                List<String> errors = existingId != null
                        ? updateErrors(MappingUpdate.fromDraft(draft))
                        : MappingValidator.coreErrors(draft.javaSignature(), draft.bedrockEquivalent(), draft.conversionType());
                if (!errors.isEmpty()) {
                    failures.add(new ImportFailure(draft.javaSignature(),
                            new MappingValidationException(String.join("; ", errors)).getMessage()));
                    continue;
                }
                if (existingId != null) {
                    ApiMapping changed = applyUpdate(next.get(existingId), MappingUpdate.fromDraft(draft), idBySignature);
                    next.put(existingId, changed);
                    updated++;
                } else {
                    ApiMapping mapping = newMapping(draft);
                    next.put(mapping.id(), mapping);
                    idBySignature.put(mapping.javaSignature(), mapping.id());
                    added++;
                }
            }
            if (added + updated > 0) commit(Snapshot.of(next));
        } finally {
            writeLock.unlock();
        }
        return new ImportResult(added, updated, failures.size(), failures);
    }

    private static List<String> updateErrors(MappingUpdate update) {
        List<String> errors = new ArrayList<>();
        if (update.javaSignature() != null && update.javaSignature().isBlank()) {
            errors.add("javaSignature must not be blank");
        }
        if (update.bedrockEquivalent() != null && update.bedrockEquivalent().isBlank()) {
            errors.add("bedrockEquivalent must not be blank");
        }
        return errors;
    }

    private static ApiMapping newMapping(MappingDraft draft) {
        Instant now = Instant.now();
        return new ApiMapping(
                UUID.randomUUID().toString(),
                draft.javaSignature(),
                draft.bedrockEquivalent(),
                draft.conversionType(),
                draft.notes(),
                draft.exampleUsage(),
                draft.minecraftVersions(),
                draft.modLoaders(),
                1,
                now,
                now,
                draft.deprecated());
    }

    /**
     * @param idBySignature signature owners to check the (possibly new) signature against
     * @throws DuplicateSignatureException if another mapping owns the new signature
     */
    private static ApiMapping applyUpdate(ApiMapping existing, MappingUpdate update, Map<String, String> idBySignature) {
        String signature = update.javaSignature() != null ? update.javaSignature() : existing.javaSignature();
        String owner = idBySignature.get(signature);
        if (owner != null && !owner.equals(existing.id())) {
            throw new DuplicateSignatureException(signature);
        }

        Instant now = Instant.now();
        if (!now.isAfter(existing.lastUpdated())) {
            now = existing.lastUpdated().plusMillis(1);
        }
        return new ApiMapping(
                existing.id(),
                signature,
                orElse(update.bedrockEquivalent(), existing.bedrockEquivalent()),
                orElse(update.conversionType(), existing.conversionType()),
                orElse(update.notes(), existing.notes()),
                orElse(update.exampleUsage(), existing.exampleUsage()),
                orElse(update.minecraftVersions(), existing.minecraftVersions()),
                orElse(update.modLoaders(), existing.modLoaders()),
                existing.version() + 1,
                existing.createdAt(),
                now,
                orElse(update.deprecated(), existing.deprecated()));
    }

    // Caller holds writeLock.
    private void commit(Snapshot next) {
        if (storePath != null) persist(next);
        snapshot = next;
    }

    private void persist(Snapshot next) {
        try {
            Path parent = storePath.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = storePath.resolveSibling(storePath.getFileName() + ".tmp");
            Files.writeString(tmp, MappingJson.toJson(new ArrayList<>(next.byId().values())), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, storePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, storePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new MappingStoreException("Failed to write mapping store: " + storePath + ": " + e.getMessage(), e);
        }
    }

    private static <T> T orElse(T value, T fallback) {
        return value != null ? value : fallback;
    }

    public static class MappingStoreException extends RuntimeException {
        public MappingStoreException(String message) { super(message); }
        public MappingStoreException(String message, Throwable cause) { super(message, cause); }
    }

    public static class MappingValidationException extends MappingStoreException {
        public MappingValidationException(String message) { super("Invalid mapping: " + message); }
    }

    public static class DuplicateSignatureException extends MappingStoreException {
        public DuplicateSignatureException(String javaSignature) {
            super("Mapping already exists for signature: " + javaSignature);
        }
    }

    public static class MappingNotFoundException extends MappingStoreException {
        public MappingNotFoundException(String id) { super("Mapping not found: " + id); }
    }
}
