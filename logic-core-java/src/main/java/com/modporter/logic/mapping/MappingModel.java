package com.modporter.logic.mapping;

import com.google.gson.annotations.SerializedName;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Java-to-Bedrock API mapping records and the request/result types of the mapping store.
 */
public final class MappingModel {

    private MappingModel() {}

    public static final String PARTIAL_MATCH_PREFIX = "[partial match] ";
    public static final String LEGACY_PREFIX = "[legacy] ";

    /** How directly a Java API maps to the Bedrock scripting API. */
    public enum ConversionType {
        @SerializedName("direct")     DIRECT,
        @SerializedName("wrapper")    WRAPPER,
        @SerializedName("complex")    COMPLEX,
        @SerializedName("impossible") IMPOSSIBLE
    }

    public record ExampleUsage(String java, String bedrock) {}

    /**
     * One mapping. Identity is {@code id}; {@code javaSignature} is unique among live mappings.
     * {@code version} starts at 1 and is bumped on every update.
     */
    public record ApiMapping(
            String id,
            String javaSignature,
            String bedrockEquivalent,
            ConversionType conversionType,
            String notes,
            ExampleUsage exampleUsage,
            List<String> minecraftVersions,
            List<String> modLoaders,
            int version,
            Instant createdAt,
            Instant lastUpdated,
            boolean deprecated
    ) {
        public ApiMapping {
            notes = notes == null ? "" : notes;
            minecraftVersions = minecraftVersions == null ? List.of() : List.copyOf(minecraftVersions);
            modLoaders = modLoaders == null ? List.of() : List.copyOf(modLoaders);
        }

        public ApiMapping withNotes(String newNotes) {
            return new ApiMapping(id, javaSignature, bedrockEquivalent, conversionType, newNotes, exampleUsage,
                    minecraftVersions, modLoaders, version, createdAt, lastUpdated, deprecated);
        }

        /** True for fuzzy-match answers, which are approximate rather than authoritative. */
        public boolean isPartialMatch() {
            return notes.startsWith(PARTIAL_MATCH_PREFIX);
        }

        public boolean isLegacy() {
            return notes.startsWith(LEGACY_PREFIX);
        }
    }

    /** Input for creating a mapping; the store assigns id, version and timestamps. */
    public record MappingDraft(
            String javaSignature,
            String bedrockEquivalent,
            ConversionType conversionType,
            String notes,
            ExampleUsage exampleUsage,
            List<String> minecraftVersions,
            List<String> modLoaders,
            boolean deprecated
    ) {
        public static MappingDraft of(String javaSignature, String bedrockEquivalent,
                                      ConversionType conversionType, String notes) {
            return new MappingDraft(javaSignature, bedrockEquivalent, conversionType, notes,
                    null, List.of(), List.of(), false);
        }
    }

    /** Partial update; null components are left unchanged. */
    public record MappingUpdate(
            String javaSignature,
            String bedrockEquivalent,
            ConversionType conversionType,
            String notes,
            ExampleUsage exampleUsage,
            List<String> minecraftVersions,
            List<String> modLoaders,
            Boolean deprecated
    ) {
        public static MappingUpdate fromDraft(MappingDraft draft) {
            return new MappingUpdate(draft.javaSignature(), draft.bedrockEquivalent(), draft.conversionType(),
                    draft.notes(), draft.exampleUsage(), draft.minecraftVersions(), draft.modLoaders(),
                    draft.deprecated());
        }

        public static MappingUpdate bedrockEquivalent(String bedrockEquivalent) {
            return new MappingUpdate(null, bedrockEquivalent, null, null, null, null, null, null);
        }

        public static MappingUpdate javaSignature(String javaSignature) {
            return new MappingUpdate(javaSignature, null, null, null, null, null, null, null);
        }
    }

    /** Filter for listing mappings; null components match everything. */
    public record MappingFilter(ConversionType conversionType, Integer version, String search) {

        public static final MappingFilter ALL = new MappingFilter(null, null, null);

        public boolean matches(ApiMapping m) {
            if (conversionType != null && m.conversionType() != conversionType) return false;
            if (version != null && m.version() != version) return false;
            if (search != null && !search.isBlank()) {
                String needle = search.toLowerCase(Locale.ROOT);
                return m.javaSignature().toLowerCase(Locale.ROOT).contains(needle)
                        || m.bedrockEquivalent().toLowerCase(Locale.ROOT).contains(needle)
                        || m.notes().toLowerCase(Locale.ROOT).contains(needle);
            }
            return true;
        }
    }

    public record ImportFailure(String javaSignature, String reason) {}

    public record ImportResult(int added, int updated, int failed, List<ImportFailure> failures) {
        public ImportResult {
            failures = List.copyOf(Objects.requireNonNull(failures));
        }

        public int total() {
            return added + updated + failed;
        }
    }
}
