package com.modporter.logic.config;

import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of modporter.json. Every key is optional.
 */
public class LogicConfig {

    /** Path of the JSON mapping store. Null keeps mappings in memory only. */
    @SerializedName("mapping_store")
    private String mappingStore;

    /** Minimum signature similarity for a fuzzy match (default: 0.7). */
    @SerializedName("fuzzy_threshold")
    private Double fuzzyThreshold;

    @SerializedName("cache_max_size")
    private Integer cacheMaxSize;

    /** Minimum fused confidence for an equivalent verdict (default: 0.8). */
    @SerializedName("confidence_threshold")
    private Double confidenceThreshold;

    @SerializedName("validation_timeout_ms")
    private Long validationTimeoutMs;

    @SerializedName("enable_structural")
    private Boolean enableStructural;

    @SerializedName("enable_semantic")
    private Boolean enableSemantic;

    @SerializedName("enable_behavioral")
    private Boolean enableBehavioral;

    public static LogicConfig defaults() {
        return new LogicConfig();
    }

    public String getMappingStore()         { return mappingStore; }
    public double getFuzzyThreshold()       { return fuzzyThreshold != null ? fuzzyThreshold : 0.7; }
    public int getCacheMaxSize()            { return cacheMaxSize != null ? cacheMaxSize : 1000; }
    public double getConfidenceThreshold()  { return confidenceThreshold != null ? confidenceThreshold : 0.8; }
    public long getValidationTimeoutMs()    { return validationTimeoutMs != null ? validationTimeoutMs : 60_000L; }
    public boolean isStructuralEnabled()    { return enableStructural == null || enableStructural; }
    public boolean isSemanticEnabled()      { return enableSemantic == null || enableSemantic; }
    public boolean isBehavioralEnabled()    { return enableBehavioral == null || enableBehavioral; }
}
