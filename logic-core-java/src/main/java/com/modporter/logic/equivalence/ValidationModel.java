package com.modporter.logic.equivalence;

import com.google.gson.annotations.SerializedName;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Result and input types of functional equivalence validation.
 */
public final class ValidationModel {

    private ValidationModel() {}

    /** Declared most severe first; {@link #ORDER} sorts in this order. */
    public enum Severity {
        @SerializedName("critical") CRITICAL,
        @SerializedName("high")     HIGH,
        @SerializedName("medium")   MEDIUM,
        @SerializedName("low")      LOW
    }

    /** Declared in report order. */
    public enum DifferenceCategory {
        @SerializedName("behavior")    BEHAVIOR,
        @SerializedName("api")         API,
        @SerializedName("logic")       LOGIC,
        @SerializedName("performance") PERFORMANCE
    }

    public record FunctionalDifference(
            DifferenceCategory category,
            String description,
            Severity severity,
            String location,
            String suggestion
    ) {
        /** Severity (critical first), then category. Stable sorts keep analyzer order otherwise. */
        public static final Comparator<FunctionalDifference> ORDER =
                Comparator.comparing(FunctionalDifference::severity)
                        .thenComparing(FunctionalDifference::category);

        public FunctionalDifference {
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(severity, "severity");
            description = description == null ? "" : description;
            location = location == null ? "" : location;
            suggestion = suggestion == null ? "" : suggestion;
        }
    }

    /** Per-lens scores in [0, 1] that fed the fused confidence. */
    public record ValidationMetrics(
            @SerializedName("structural_similarity") double structuralSimilarity,
            @SerializedName("semantic_similarity")   double semanticSimilarity,
            @SerializedName("behavioral_similarity") double behavioralSimilarity,
            @SerializedName("api_compatibility")     double apiCompatibility
    ) {
        public static final ValidationMetrics ZERO = new ValidationMetrics(0, 0, 0, 0);
    }

    public record ValidationVerdict(
            @SerializedName("is_equivalent") boolean isEquivalent,
            double confidence,
            List<FunctionalDifference> differences,
            List<String> recommendations,
            ValidationMetrics metrics
    ) {
        public ValidationVerdict {
            differences = List.copyOf(differences);
            recommendations = List.copyOf(recommendations);
        }
    }

    /** What one analyzer lens found. Similarity is clamped to [0, 1]. */
    public record AnalyzerResult(double similarity, List<FunctionalDifference> differences, List<String> recommendations) {
        public AnalyzerResult {
            similarity = clamp(similarity);
            differences = List.copyOf(differences);
            recommendations = List.copyOf(recommendations);
        }

        public static AnalyzerResult disabled() {
            return new AnalyzerResult(0.0, List.of(), List.of());
        }
    }

    public enum CompromiseLevel {
        @SerializedName("minimal")    MINIMAL,
        @SerializedName("moderate")   MODERATE,
        @SerializedName("aggressive") AGGRESSIVE
    }

    /** Describes the mod being translated. Only the compromise level affects validation. */
    public record TranslationContext(String modId, String modLoader, String minecraftVersion,
                                     CompromiseLevel compromiseLevel) {
        public TranslationContext {
            compromiseLevel = compromiseLevel == null ? CompromiseLevel.MODERATE : compromiseLevel;
        }

        public static TranslationContext defaults() {
            return new TranslationContext("unknown", "forge", "1.20", CompromiseLevel.MODERATE);
        }
    }

    /** Validator settings; defaults match the stock configuration. */
    public record ValidatorOptions(
            double confidenceThreshold,
            long timeoutMs,
            boolean structuralEnabled,
            boolean semanticEnabled,
            boolean behavioralEnabled
    ) {
        public ValidatorOptions {
            if (timeoutMs <= 0) throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }

        public static ValidatorOptions defaults() {
            return new ValidatorOptions(0.8, 60_000L, true, true, true);
        }

        public ValidatorOptions withTimeoutMs(long newTimeoutMs) {
            return new ValidatorOptions(confidenceThreshold, newTimeoutMs,
                    structuralEnabled, semanticEnabled, behavioralEnabled);
        }
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
