package com.modporter.logic.equivalence;

import com.modporter.logic.config.LogicConfig;
import com.modporter.logic.equivalence.ValidationModel.AnalyzerResult;
import com.modporter.logic.equivalence.ValidationModel.CompromiseLevel;
import com.modporter.logic.equivalence.ValidationModel.DifferenceCategory;
import com.modporter.logic.equivalence.ValidationModel.FunctionalDifference;
import com.modporter.logic.equivalence.ValidationModel.Severity;
import com.modporter.logic.equivalence.ValidationModel.TranslationContext;
import com.modporter.logic.equivalence.ValidationModel.ValidationMetrics;
import com.modporter.logic.equivalence.ValidationModel.ValidationVerdict;
import com.modporter.logic.equivalence.ValidationModel.ValidatorOptions;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Judges whether translated JavaScript behaves like the original Java.
 *
 * The structural, semantic and behavioral lenses run concurrently on a private pool and
 * are fused into one confidence score:
 * {@code 0.2 * structural + 0.3 * semantic + 0.4 * behavioral + 0.1 * api}.
 * {@link #validate} never throws; timeouts and analyzer failures come back as a
 * non-equivalent verdict with a single CRITICAL difference.
 */
public class EquivalenceValidator implements AutoCloseable {

    private static final String LOG_PREFIX = "[modporter-logic] ";

    static final double STRUCTURAL_WEIGHT = 0.2;
    static final double SEMANTIC_WEIGHT = 0.3;
    static final double BEHAVIORAL_WEIGHT = 0.4;
    static final double API_WEIGHT = 0.1;

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final ValidatorOptions options;
    private final EquivalenceAnalyzer structural;
    private final EquivalenceAnalyzer semantic;
    private final EquivalenceAnalyzer behavioral;
    private final ExecutorService executor;

    public EquivalenceValidator() {
        this(ValidatorOptions.defaults());
    }

    public EquivalenceValidator(ValidatorOptions options) {
        this(options, new StructuralAnalyzer(), new SemanticAnalyzer(), new BehavioralAnalyzer());
    }

    public EquivalenceValidator(ValidatorOptions options, EquivalenceAnalyzer structural,
                                EquivalenceAnalyzer semantic, EquivalenceAnalyzer behavioral) {
        this.options = Objects.requireNonNull(options, "options");
        this.structural = Objects.requireNonNull(structural, "structural");
        this.semantic = Objects.requireNonNull(semantic, "semantic");
        this.behavioral = Objects.requireNonNull(behavioral, "behavioral");
        int pool = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(3, r -> {
            Thread t = new Thread(r, "equivalence-" + pool + "-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public static EquivalenceValidator fromConfig(LogicConfig config) {
        return new EquivalenceValidator(new ValidatorOptions(
                config.getConfidenceThreshold(),
                config.getValidationTimeoutMs(),
                config.isStructuralEnabled(),
                config.isSemanticEnabled(),
                config.isBehavioralEnabled()));
    }

    public ValidatorOptions options() {
        return options;
    }

    public ValidationVerdict validate(String originalJava, String translatedJs, TranslationContext context) {
        if (originalJava == null || translatedJs == null) {
            return failure("Validation failed: source text is missing");
        }
        TranslationContext ctx = context != null ? context : TranslationContext.defaults();

        List<EquivalenceAnalyzer> analyzers = List.of(structural, semantic, behavioral);
        List<Callable<AnalyzerResult>> tasks = List.of(
                task(structural, options.structuralEnabled(), originalJava, translatedJs, ctx),
                task(semantic, options.semanticEnabled(), originalJava, translatedJs, ctx),
                task(behavioral, options.behavioralEnabled(), originalJava, translatedJs, ctx));

        try {
            List<Future<AnalyzerResult>> futures = executor.invokeAll(tasks, options.timeoutMs(), TimeUnit.MILLISECONDS);
            List<AnalyzerResult> results = new ArrayList<>(tasks.size());
            for (int i = 0; i < futures.size(); i++) {
                Future<AnalyzerResult> future = futures.get(i);
                String lens = analyzers.get(i).name();
                if (future.isCancelled()) {
                    System.err.println(LOG_PREFIX + "WARNING: Validation timed out after " + options.timeoutMs()
                            + " ms waiting for the " + lens + " analyzer");
                    return failure("Validation timeout", lens);
                }
                AnalyzerResult result;
                try {
                    result = future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    System.err.println(LOG_PREFIX + "ERROR: The " + lens + " analyzer failed: " + cause.getMessage());
                    return failure("Validation failed: " + cause.getMessage(), lens);
                }
                if (result == null) {
                    System.err.println(LOG_PREFIX + "ERROR: The " + lens + " analyzer returned no result");
                    return failure("Validation failed: analyzer returned no result", lens);
                }
                results.add(result);
            }
            return fuse(results.get(0), results.get(1), results.get(2), ctx, options.confidenceThreshold());
        } catch (CancellationException e) {
            System.err.println(LOG_PREFIX + "WARNING: Validation timed out after " + options.timeoutMs() + " ms");
            return failure("Validation timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure("Validation failed: interrupted");
        } catch (RuntimeException e) {
            System.err.println(LOG_PREFIX + "ERROR: Validation failed: " + e.getMessage());
            return failure("Validation failed: " + e.getMessage());
        }
    }

    static ValidationVerdict fuse(AnalyzerResult structuralResult, AnalyzerResult semanticResult,
                                  AnalyzerResult behavioralResult, TranslationContext context,
                                  double confidenceThreshold) {
        List<FunctionalDifference> differences = new ArrayList<>();
        differences.addAll(structuralResult.differences());
        differences.addAll(semanticResult.differences());
        differences.addAll(behavioralResult.differences());
        differences.sort(FunctionalDifference.ORDER);

        ValidationMetrics metrics = new ValidationMetrics(
                structuralResult.similarity(),
                semanticResult.similarity(),
                behavioralResult.similarity(),
                apiCompatibility(differences));

        double confidence = ValidationModel.clamp(
                STRUCTURAL_WEIGHT * metrics.structuralSimilarity()
                        + SEMANTIC_WEIGHT * metrics.semanticSimilarity()
                        + BEHAVIORAL_WEIGHT * metrics.behavioralSimilarity()
                        + API_WEIGHT * metrics.apiCompatibility());

        boolean anyCritical = differences.stream().anyMatch(d -> d.severity() == Severity.CRITICAL);
        boolean anyHigh = differences.stream().anyMatch(d -> d.severity() == Severity.HIGH);
        boolean equivalent = !anyCritical && !anyHigh && confidence >= confidenceThreshold;

        Set<String> recommendations = new LinkedHashSet<>();
        recommendations.addAll(structuralResult.recommendations());
        recommendations.addAll(semanticResult.recommendations());
        recommendations.addAll(behavioralResult.recommendations());
        if (metrics.structuralSimilarity() < 0.7) {
            recommendations.add("Consider refactoring to maintain similar code structure");
        }
        if (metrics.semanticSimilarity() < 0.8) {
            recommendations.add("Review semantic equivalence of key operations");
        }
        if (metrics.behavioralSimilarity() < 0.8) {
            recommendations.add("Verify behavioral equivalence through testing");
        }
        if (metrics.apiCompatibility() < 0.9) {
            recommendations.add("Review API mappings for better compatibility");
        }
        if (hasCategory(differences, DifferenceCategory.BEHAVIOR)) {
            recommendations.add("Test behavioral differences in Minecraft environment");
        }
        if (hasCategory(differences, DifferenceCategory.API)) {
            recommendations.add("Validate API usage against Bedrock documentation");
        }
        if (context.compromiseLevel() == CompromiseLevel.MINIMAL) {
            recommendations.add("Consider more conservative translation approach");
        }
        if (!differences.isEmpty() && recommendations.isEmpty()) {
            recommendations.add("Manual code review recommended for the reported differences");
        }

        return new ValidationVerdict(equivalent, confidence, differences, new ArrayList<>(recommendations), metrics);
    }

    /** 1 minus the critical share of API differences; 1 when there are none. */
    static double apiCompatibility(List<FunctionalDifference> differences) {
        long api = differences.stream().filter(d -> d.category() == DifferenceCategory.API).count();
        if (api == 0) return 1.0;
        long critical = differences.stream()
                .filter(d -> d.category() == DifferenceCategory.API && d.severity() == Severity.CRITICAL)
                .count();
        return 1.0 - (double) critical / api;
    }

    static ValidationVerdict failure(String description) {
        return failure(description, "overall");
    }

    /** Non-equivalent verdict with one CRITICAL difference; {@code location} names the lens at fault. */
    static ValidationVerdict failure(String description, String location) {
        FunctionalDifference difference = new FunctionalDifference(
                DifferenceCategory.BEHAVIOR,
                description,
                Severity.CRITICAL,
                location,
                "Manual review required due to validation failure");
        return new ValidationVerdict(false, 0.0, List.of(difference),
                List.of("Manual code review required", "Consider alternative translation approach"),
                ValidationMetrics.ZERO);
    }

    private static boolean hasCategory(List<FunctionalDifference> differences, DifferenceCategory category) {
        return differences.stream().anyMatch(d -> d.category() == category);
    }

    private static Callable<AnalyzerResult> task(EquivalenceAnalyzer analyzer, boolean enabled,
                                                 String original, String translated, TranslationContext context) {
        if (!enabled) return AnalyzerResult::disabled;
        return () -> analyzer.analyze(original, translated, context);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
