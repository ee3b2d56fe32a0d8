package com.modporter.logic.mapping;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.modporter.logic.mapping.MappingModel.ApiMapping;
import com.modporter.logic.mapping.MappingModel.ConversionType;
import com.modporter.logic.mapping.MappingModel.ImportFailure;
import com.modporter.logic.mapping.MappingModel.ImportResult;
import com.modporter.logic.mapping.MappingModel.MappingDraft;
import com.modporter.logic.mapping.MappingModel.MappingFilter;
import com.modporter.logic.mapping.MappingStore.MappingStoreException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Administrative operations over the mapping store: validation reports, statistics and
 * JSON export/import.
 */
public class MappingAdmin {

    private static final String LOG_PREFIX = "[modporter-logic] ";
    static final String EXPORT_FORMAT_VERSION = "1.0.0";
    private static final int RECENT_LIMIT = 10;

    public record ValidationReport(boolean valid, List<String> errors, List<String> warnings) {}

    public record MappingStatistics(
            int totalMappings,
            Map<ConversionType, Integer> byConversionType,
            Map<Integer, Integer> byVersion,
            List<ApiMapping> recentlyUpdated
    ) {}

    record ExportDocument(Instant exportedAt, String version, List<ApiMapping> mappings) {}

    private final ApiMapperService mapper;

    public MappingAdmin(ApiMapperService mapper) {
        this.mapper = mapper;
    }

    /**
     * Checks a draft without storing it. Passing the id of an existing mapping allows
     * that mapping to keep its own signature.
     */
    public ValidationReport validate(MappingDraft draft, String existingId) {
        List<String> errors = new ArrayList<>(MappingValidator.draftErrors(draft));
        List<String> warnings = MappingValidator.draftWarnings(draft);
        if (draft.javaSignature() != null) {
            Optional<ApiMapping> owner = mapper.store().getBySignature(draft.javaSignature());
            if (owner.isPresent() && !owner.get().id().equals(existingId)) {
                errors.add("A mapping with the signature \"" + draft.javaSignature()
                        + "\" already exists (ID: " + owner.get().id() + ")");
            }
        }
        return new ValidationReport(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings));
    }

    public ValidationReport validate(MappingDraft draft) {
        return validate(draft, null);
    }

    public MappingStatistics statistics() {
        List<ApiMapping> all = mapper.getMappings(MappingFilter.ALL);
        Map<ConversionType, Integer> byType = new EnumMap<>(ConversionType.class);
        Map<Integer, Integer> byVersion = new TreeMap<>();
        for (ApiMapping m : all) {
            byType.merge(m.conversionType(), 1, Integer::sum);
            byVersion.merge(m.version(), 1, Integer::sum);
        }
        List<ApiMapping> recent = all.stream()
                .sorted(Comparator.comparing(ApiMapping::lastUpdated).reversed())
                .limit(RECENT_LIMIT)
                .toList();
        return new MappingStatistics(all.size(), byType, byVersion, recent);
    }

    public String exportJson(MappingFilter filter) {
        return MappingJson.toJson(new ExportDocument(Instant.now(), EXPORT_FORMAT_VERSION,
                mapper.getMappings(filter == null ? MappingFilter.ALL : filter)));
    }

    /**
     * Imports a document produced by {@link #exportJson}. Entries are validated first;
     * invalid ones and duplicates within the document are reported as failures.
     *
     * @throws MappingStoreException if the document is malformed or has no mappings array
     */
    public ImportResult importJson(String json) {
        JsonArray entries;
        try {
            JsonElement root = JsonParser.parseString(json);
            JsonElement mappings = root.isJsonObject() ? root.getAsJsonObject().get("mappings") : null;
            if (mappings == null || !mappings.isJsonArray()) {
                throw new MappingStoreException("Invalid import format: mappings array not found");
            }
            entries = mappings.getAsJsonArray();
        } catch (JsonParseException e) {
            throw new MappingStoreException("Malformed import document: " + e.getMessage(), e);
        }

        List<MappingDraft> valid = new ArrayList<>();
        List<ImportFailure> failures = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonElement entry : entries) {
            MappingDraft draft;
            try {
                draft = entry.isJsonObject() ? toDraft(entry.getAsJsonObject()) : null;
            } catch (JsonParseException e) {
                failures.add(new ImportFailure(null, "Unreadable entry: " + e.getMessage()));
                continue;
            }
            if (draft == null) {
                failures.add(new ImportFailure(null, "Entry is not an object"));
                continue;
            }
            List<String> errors = new ArrayList<>(MappingValidator.draftErrors(draft));
            if (draft.javaSignature() != null && !seen.add(draft.javaSignature())) {
                errors.add("Duplicate Java signature \"" + draft.javaSignature() + "\" in the import document");
            }
            if (errors.isEmpty()) {
                valid.add(draft);
            } else {
                failures.add(new ImportFailure(draft.javaSignature(), String.join(", ", errors)));
            }
        }
        if (!failures.isEmpty()) {
            System.err.println(LOG_PREFIX + "WARNING: " + failures.size() + " invalid mappings in import document");
        }

        ImportResult imported = mapper.importMappings(valid);
        List<ImportFailure> allFailures = new ArrayList<>(imported.failures());
        allFailures.addAll(failures);
        return new ImportResult(imported.added(), imported.updated(), allFailures.size(), allFailures);
    }

    private static MappingDraft toDraft(JsonObject entry) {
        // Exported records carry store-assigned fields a draft does not have.
        JsonObject copy = entry.deepCopy();
        for (String key : List.of("id", "version", "createdAt", "lastUpdated")) copy.remove(key);
        return MappingJson.GSON.fromJson(copy, MappingDraft.class);
    }
}
