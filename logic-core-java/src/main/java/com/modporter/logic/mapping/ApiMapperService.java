package com.modporter.logic.mapping;

import com.modporter.logic.config.LogicConfig;
import com.modporter.logic.mapping.MappingCache.CacheStats;
import com.modporter.logic.mapping.MappingModel.ApiMapping;
import com.modporter.logic.mapping.MappingModel.ConversionType;
import com.modporter.logic.mapping.MappingModel.ImportResult;
import com.modporter.logic.mapping.MappingModel.MappingDraft;
import com.modporter.logic.mapping.MappingModel.MappingFilter;
import com.modporter.logic.mapping.MappingModel.MappingUpdate;

import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resolves Java API signatures to Bedrock equivalents.
 *
 * Resolution order: cache, exact store match, fuzzy match, legacy table, then a
 * synthesized IMPOSSIBLE mapping. {@link #resolve} therefore always returns a mapping.
 * Only exact matches are cached; fuzzy and legacy answers are recomputed on each call
 * so they never shadow a later exact mapping.
 *
 * Mutations made through this service hold {@code cacheLock} across the store write and
 * the cache maintenance. A reader that caches an exact hit re-reads the store afterwards
 * and drops the entry if a write has replaced it in between.
 */
public class ApiMapperService {

    private static final String LOG_PREFIX = "[modporter-logic] ";
    public static final String UNSUPPORTED = "UNSUPPORTED";

    private final MappingStore store;
    private final MappingCache cache;
    private final LegacyMappings legacy;
    private final double fuzzyThreshold;
    private final ReentrantLock cacheLock = new ReentrantLock();

    public ApiMapperService(MappingStore store, MappingCache cache, LegacyMappings legacy, double fuzzyThreshold) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.legacy = Objects.requireNonNull(legacy, "legacy");
        if (fuzzyThreshold < 0.0 || fuzzyThreshold > 1.0) {
            throw new IllegalArgumentException("fuzzyThreshold must be within [0, 1]: " + fuzzyThreshold);
        }
        this.fuzzyThreshold = fuzzyThreshold;
    }

    /**
     * Builds a service from configuration: loads the configured store (if any) and the
     * bundled legacy table.
     */
    public static ApiMapperService fromConfig(LogicConfig config) {
        MappingStore store = config.getMappingStore() != null
                ? new MappingStore(Paths.get(config.getMappingStore()))
                : new MappingStore();
        store.load();
        return new ApiMapperService(store, new MappingCache(config.getCacheMaxSize()),
                LegacyMappings.fromClasspath(), config.getFuzzyThreshold());
    }

    public ApiMapping resolve(String javaSignature) {
        Objects.requireNonNull(javaSignature, "javaSignature");

        Optional<ApiMapping> exact = findMapping(javaSignature);
        if (exact.isPresent()) {
            ApiMapping mapping = exact.get();
            if (mapping.deprecated()) {
                System.err.println(LOG_PREFIX + "WARNING: Using deprecated mapping for " + javaSignature);
            }
            return mapping;
        }

        Optional<ApiMapping> fuzzy = fuzzyMatch(javaSignature);
        if (fuzzy.isPresent()) return fuzzy.get();

        Optional<ApiMapping> legacyMapping = legacy.lookup(javaSignature);
        if (legacyMapping.isPresent()) {
            System.err.println(LOG_PREFIX + "WARNING: Using deprecated legacy mapping for " + javaSignature);
            return legacyMapping.get();
        }

        return unsupported(javaSignature);
    }

    /** Exact lookup through the cache. Exact store hits are cached. */
    public Optional<ApiMapping> findMapping(String javaSignature) {
        Optional<ApiMapping> cached = cache.get(javaSignature);
        if (cached.isPresent()) return cached;
        Optional<ApiMapping> stored = store.getBySignature(javaSignature);
        stored.ifPresent(m -> {
            cache.put(javaSignature, m);
            if (!isCurrent(m, store.getBySignature(javaSignature))) {
                cache.invalidate(javaSignature);
            }
        });
        return stored;
    }

    public Optional<String> mapJavaToBedrock(String javaSignature) {
        return findMapping(javaSignature).map(ApiMapping::bedrockEquivalent);
    }

    public ApiMapping addMapping(MappingDraft draft) {
        cacheLock.lock();
        try {
            ApiMapping created = store.create(draft);
            cache.put(created.javaSignature(), created);
            return created;
        } finally {
            cacheLock.unlock();
        }
    }

    public ApiMapping updateMapping(String id, MappingUpdate update) {
        cacheLock.lock();
        try {
            Optional<ApiMapping> before = store.get(id);
            ApiMapping updated = store.update(id, update);
            before.ifPresent(old -> cache.invalidate(old.javaSignature()));
            cache.put(updated.javaSignature(), updated);
            return updated;
        } finally {
            cacheLock.unlock();
        }
    }

    public ApiMapping deleteMapping(String id) {
        cacheLock.lock();
        try {
            ApiMapping removed = store.delete(id);
            cache.invalidate(removed.javaSignature());
            return removed;
        } finally {
            cacheLock.unlock();
        }
    }

    public ImportResult importMappings(List<MappingDraft> drafts) {
        ImportResult result;
        cacheLock.lock();
        try {
            result = store.bulkImport(drafts);
            cache.clear();
        } finally {
            cacheLock.unlock();
        }
        System.err.println(LOG_PREFIX + "Imported mappings: " + result.added() + " added, "
                + result.updated() + " updated, " + result.failed() + " failed");
        return result;
    }

    public List<ApiMapping> getMappings(MappingFilter filter) {
        return store.getAll(filter);
    }

    public void clearCache() {
        cache.clear();
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public MappingStore store() {
        return store;
    }

    /**
     * Seeds the bundled default mappings when the store is empty.
     *
     * @return number of mappings added
     */
    public int initializeDefaults() {
        ImportResult result;
        cacheLock.lock();
        try {
            if (store.count() > 0) return 0;
            result = store.bulkImport(LegacyMappings.readDrafts(LegacyMappings.DEFAULTS_RESOURCE));
            cache.clear();
        } finally {
            cacheLock.unlock();
        }
        System.err.println(LOG_PREFIX + "Seeded " + result.added() + " default mappings");
        return result.added();
    }

    private static boolean isCurrent(ApiMapping cached, Optional<ApiMapping> current) {
        return current.isPresent()
                && current.get().id().equals(cached.id())
                && current.get().version() == cached.version();
    }

    private Optional<ApiMapping> fuzzyMatch(String javaSignature) {
        ApiMapping best = null;
        double bestScore = -1.0;
        for (ApiMapping candidate : store.getAll()) {
            double score = SignatureSimilarity.similarity(javaSignature, candidate.javaSignature());
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        if (best == null || bestScore < fuzzyThreshold) return Optional.empty();
        return Optional.of(best.withNotes(MappingModel.PARTIAL_MATCH_PREFIX + best.notes()));
    }

    private static ApiMapping unsupported(String javaSignature) {
        Instant now = Instant.now();
        return new ApiMapping(
                "unmapped-" + UUID.nameUUIDFromBytes(javaSignature.getBytes(StandardCharsets.UTF_8)),
                javaSignature,
                UNSUPPORTED,
                ConversionType.IMPOSSIBLE,
                "No Bedrock equivalent is known for " + javaSignature + "; manual translation required",
                null,
                List.of(),
                List.of(),
                1,
                now,
                now,
                false);
    }
}
