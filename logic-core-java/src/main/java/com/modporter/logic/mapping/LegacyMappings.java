package com.modporter.logic.mapping;

import com.google.gson.JsonParseException;
import com.modporter.logic.mapping.MappingModel.ApiMapping;
import com.modporter.logic.mapping.MappingModel.MappingDraft;
import com.modporter.logic.mapping.MappingStore.MappingStoreException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only table of mappings kept for older Minecraft APIs. Answers are returned
 * deprecated, with notes marked {@link MappingModel#LEGACY_PREFIX}.
 */
public class LegacyMappings {

    public static final String RESOURCE = "/legacy-mappings.json";
    static final String DEFAULTS_RESOURCE = "/default-mappings.json";

    private final Map<String, ApiMapping> bySignature;

    public LegacyMappings(List<MappingDraft> drafts) {
        Instant loadedAt = Instant.now();
        Map<String, ApiMapping> table = new LinkedHashMap<>();
        for (MappingDraft d : drafts) {
            if (!MappingValidator.coreErrors(d.javaSignature(), d.bedrockEquivalent(), d.conversionType()).isEmpty()) {
                continue;
            }
            String notes = d.notes() == null ? "" : d.notes();
            table.put(d.javaSignature(), new ApiMapping(
                    "legacy-" + UUID.nameUUIDFromBytes(d.javaSignature().getBytes(StandardCharsets.UTF_8)),
                    d.javaSignature(),
                    d.bedrockEquivalent(),
                    d.conversionType(),
                    MappingModel.LEGACY_PREFIX + notes,
                    d.exampleUsage(),
                    d.minecraftVersions(),
                    d.modLoaders(),
                    1,
                    loadedAt,
                    loadedAt,
                    true));
        }
        this.bySignature = Map.copyOf(table);
    }

    public static LegacyMappings empty() {
        return new LegacyMappings(List.of());
    }

    /** Loads the bundled legacy table from the classpath. */
    public static LegacyMappings fromClasspath() {
        return new LegacyMappings(readDrafts(RESOURCE));
    }

    public Optional<ApiMapping> lookup(String javaSignature) {
        return Optional.ofNullable(bySignature.get(javaSignature));
    }

    public int size() {
        return bySignature.size();
    }

    static List<MappingDraft> readDrafts(String resource) {
        InputStream in = LegacyMappings.class.getResourceAsStream(resource);
        if (in == null) {
            throw new MappingStoreException("Bundled mapping resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            MappingDraft[] drafts = MappingJson.GSON.fromJson(reader, MappingDraft[].class);
            return drafts == null ? List.of() : new ArrayList<>(Arrays.asList(drafts));
        } catch (IOException | JsonParseException e) {
            throw new MappingStoreException("Failed to read mapping resource " + resource + ": " + e.getMessage(), e);
        }
    }
}
