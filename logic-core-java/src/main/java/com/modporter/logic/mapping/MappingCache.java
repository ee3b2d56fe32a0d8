package com.modporter.logic.mapping;

import com.modporter.logic.mapping.MappingModel.ApiMapping;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded signature → mapping cache. Eviction is by insertion order: at capacity the
 * oldest entry goes first. A max size of 0 disables caching.
 */
public class MappingCache {

    public record CacheStats(int size, int maxSize, long hits, long misses, long evictions) {
        public double hitRate() {
            long lookups = hits + misses;
            return lookups == 0 ? 0.0 : (double) hits / lookups;
        }
    }

    private final int maxSize;
    private final LinkedHashMap<String, ApiMapping> entries = new LinkedHashMap<>();
    private long hits;
    private long misses;
    private long evictions;

    public MappingCache(int maxSize) {
        if (maxSize < 0) throw new IllegalArgumentException("maxSize must be >= 0: " + maxSize);
        this.maxSize = maxSize;
    }

    public synchronized Optional<ApiMapping> get(String javaSignature) {
        ApiMapping mapping = entries.get(javaSignature);
        if (mapping == null) {
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(mapping);
    }

    public synchronized void put(String javaSignature, ApiMapping mapping) {
        if (maxSize == 0) return;
        if (!entries.containsKey(javaSignature) && entries.size() >= maxSize) {
            Iterator<Map.Entry<String, ApiMapping>> oldest = entries.entrySet().iterator();
            oldest.next();
            oldest.remove();
            evictions++;
        }
        entries.put(javaSignature, mapping);
    }

    public synchronized void invalidate(String javaSignature) {
        entries.remove(javaSignature);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats stats() {
        return new CacheStats(entries.size(), maxSize, hits, misses, evictions);
    }
}
