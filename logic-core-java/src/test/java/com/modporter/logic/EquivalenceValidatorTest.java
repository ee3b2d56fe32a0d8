package com.modporter.logic;

import com.modporter.logic.equivalence.EquivalenceAnalyzer;
import com.modporter.logic.equivalence.EquivalenceValidator;
import com.modporter.logic.equivalence.ValidationModel.AnalyzerResult;
import com.modporter.logic.equivalence.ValidationModel.CompromiseLevel;
import com.modporter.logic.equivalence.ValidationModel.DifferenceCategory;
import com.modporter.logic.equivalence.ValidationModel.FunctionalDifference;
import com.modporter.logic.equivalence.ValidationModel.Severity;
import com.modporter.logic.equivalence.ValidationModel.TranslationContext;
import com.modporter.logic.equivalence.ValidationModel.ValidationVerdict;
import com.modporter.logic.equivalence.ValidationModel.ValidatorOptions;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EquivalenceValidatorTest {

    private static final Path FIXTURE_DIR = Paths.get(System.getProperty("user.dir"))
            .getParent().resolve("test-fixtures/sample-mod");

    private static String original;
    private static String translated;
    private static String partial;
    private static EquivalenceValidator validator;

    @BeforeAll
    static void setUp() throws Exception {
        original = Files.readString(FIXTURE_DIR.resolve("RubyBlock.java"));
        translated = Files.readString(FIXTURE_DIR.resolve("rubyBlock.js"));
        partial = Files.readString(FIXTURE_DIR.resolve("rubyBlock_partial.js"));
        validator = new EquivalenceValidator();
    }

    @AfterAll
    static void tearDown() {
        validator.close();
    }

    /** Returns a fixed result, optionally after a delay or by throwing. */
    private static class StubAnalyzer implements EquivalenceAnalyzer {
        private final String name;
        private final AnalyzerResult result;
        private final long delayMs;
        private final RuntimeException failure;

        StubAnalyzer(double similarity, FunctionalDifference... differences) {
            this("stub", new AnalyzerResult(similarity, List.of(differences), List.of()), 0, null);
        }

        StubAnalyzer(String name, AnalyzerResult result, long delayMs, RuntimeException failure) {
            this.name = name;
            this.result = result;
            this.delayMs = delayMs;
            this.failure = failure;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public AnalyzerResult analyze(String originalJava, String translatedJs, TranslationContext context) {
            if (failure != null) throw failure;
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return result;
        }
    }

    private static ValidationVerdict validateWith(ValidatorOptions options, EquivalenceAnalyzer structural,
                                                  EquivalenceAnalyzer semantic, EquivalenceAnalyzer behavioral,
                                                  TranslationContext context) {
        try (EquivalenceValidator v = new EquivalenceValidator(options, structural, semantic, behavioral)) {
            return v.validate("class A {}", "class A {}", context);
        }
    }

    private static ValidationVerdict validateWith(double structural, double semantic, double behavioral) {
        return validateWith(ValidatorOptions.defaults(), new StubAnalyzer(structural), new StubAnalyzer(semantic),
                new StubAnalyzer(behavioral), TranslationContext.defaults());
    }

    private static FunctionalDifference difference(DifferenceCategory category, Severity severity) {
        return new FunctionalDifference(category, "stub " + severity, severity, "overall", "");
    }

    // --- Fixture translations ---

    @Test
    void faithfulTranslationIsEquivalent() {
        ValidationVerdict verdict = validator.validate(original, translated, TranslationContext.defaults());

        assertTrue(verdict.isEquivalent(), verdict.differences().toString());
        assertEquals(1.0, verdict.confidence(), 1e-9);
        assertTrue(verdict.differences().isEmpty());
        assertEquals(1.0, verdict.metrics().structuralSimilarity(), 1e-9);
    }

    @Test
    void missingMethodsMakeTranslationNonEquivalent() {
        ValidationVerdict verdict = validator.validate(original, partial, TranslationContext.defaults());

        assertFalse(verdict.isEquivalent());
        assertTrue(verdict.differences().stream().anyMatch(d ->
                d.severity() == Severity.HIGH && d.description().contains("'tick'")));
        assertTrue(verdict.differences().stream().anyMatch(d ->
                d.severity() == Severity.HIGH && d.description().contains("'getUses'")));
        assertFalse(verdict.recommendations().isEmpty());
    }

    @Test
    void differencesAreOrderedBySeverity() {
        ValidationVerdict verdict = validator.validate(original, partial, TranslationContext.defaults());
        List<FunctionalDifference> differences = verdict.differences();
        for (int i = 1; i < differences.size(); i++) {
            assertTrue(differences.get(i - 1).severity().compareTo(differences.get(i).severity()) <= 0);
        }
    }

    @Test
    void validationIsDeterministic() {
        ValidationVerdict first = validator.validate(original, partial, TranslationContext.defaults());
        ValidationVerdict second = validator.validate(original, partial, TranslationContext.defaults());
        assertEquals(first, second);
    }

    @Test
    void confidenceStaysInUnitRange() {
        for (String js : List.of("", "}", partial, translated, original)) {
            double confidence = validator.validate(original, js, TranslationContext.defaults()).confidence();
            assertTrue(confidence >= 0.0 && confidence <= 1.0, js);
        }
    }

    // --- Fusion ---

    @Test
    void perfectScoresGiveFullConfidence() {
        ValidationVerdict verdict = validateWith(1.0, 1.0, 1.0);
        assertTrue(verdict.isEquivalent());
        assertEquals(1.0, verdict.confidence(), 1e-9);
        assertEquals(1.0, verdict.metrics().apiCompatibility(), 1e-9);
    }

    @Test
    void confidenceUsesLensWeights() {
        ValidationVerdict verdict = validateWith(0.5, 0.0, 1.0);
        assertEquals(0.2 * 0.5 + 0.4 + 0.1, verdict.confidence(), 1e-9);
    }

    @Test
    void raisingALensNeverLowersConfidence() {
        double previous = -1.0;
        for (double behavioral = 0.0; behavioral <= 1.0; behavioral += 0.25) {
            double confidence = validateWith(0.6, 0.6, behavioral).confidence();
            assertTrue(confidence >= previous);
            previous = confidence;
        }
    }

    @Test
    void highDifferenceBlocksEquivalenceDespiteConfidence() {
        ValidationVerdict verdict = validateWith(ValidatorOptions.defaults(),
                new StubAnalyzer(1.0, difference(DifferenceCategory.LOGIC, Severity.HIGH)),
                new StubAnalyzer(1.0), new StubAnalyzer(1.0), TranslationContext.defaults());

        assertFalse(verdict.isEquivalent());
        assertEquals(1.0, verdict.confidence(), 1e-9);
    }

    @Test
    void mediumDifferencesDoNotBlockEquivalence() {
        ValidationVerdict verdict = validateWith(ValidatorOptions.defaults(),
                new StubAnalyzer(1.0, difference(DifferenceCategory.LOGIC, Severity.MEDIUM)),
                new StubAnalyzer(1.0), new StubAnalyzer(1.0, difference(DifferenceCategory.BEHAVIOR, Severity.LOW)),
                TranslationContext.defaults());

        assertTrue(verdict.isEquivalent());
        assertTrue(verdict.recommendations().contains("Test behavioral differences in Minecraft environment"));
    }

    @Test
    void thresholdIsConfigurable() {
        assertFalse(validateWith(0.7, 0.7, 0.7).isEquivalent());

        ValidatorOptions lenient = new ValidatorOptions(0.7, 60_000L, true, true, true);
        ValidationVerdict verdict = validateWith(lenient, new StubAnalyzer(0.7), new StubAnalyzer(0.7),
                new StubAnalyzer(0.7), TranslationContext.defaults());
        assertTrue(verdict.isEquivalent());
    }

    @Test
    void criticalApiDifferenceLowersApiCompatibility() {
        ValidationVerdict verdict = validateWith(ValidatorOptions.defaults(),
                new StubAnalyzer(1.0),
                new StubAnalyzer(1.0, difference(DifferenceCategory.API, Severity.CRITICAL),
                        difference(DifferenceCategory.API, Severity.LOW)),
                new StubAnalyzer(1.0), TranslationContext.defaults());

        assertEquals(0.5, verdict.metrics().apiCompatibility(), 1e-9);
        assertFalse(verdict.isEquivalent());
        assertEquals(Severity.CRITICAL, verdict.differences().get(0).severity());
        assertTrue(verdict.recommendations().contains("Validate API usage against Bedrock documentation"));
    }

    @Test
    void minimalCompromiseAddsConservativeRecommendation() {
        TranslationContext minimal = new TranslationContext("ruby", "forge", "1.20", CompromiseLevel.MINIMAL);
        ValidationVerdict verdict = validateWith(ValidatorOptions.defaults(), new StubAnalyzer(1.0),
                new StubAnalyzer(1.0), new StubAnalyzer(1.0), minimal);

        assertTrue(verdict.recommendations().contains("Consider more conservative translation approach"));
    }

    @Test
    void disabledLensContributesNothing() {
        ValidatorOptions noBehavior = new ValidatorOptions(0.8, 60_000L, true, true, false);
        ValidationVerdict verdict = validateWith(noBehavior, new StubAnalyzer(1.0), new StubAnalyzer(1.0),
                new StubAnalyzer(1.0), TranslationContext.defaults());

        assertEquals(0.0, verdict.metrics().behavioralSimilarity(), 1e-9);
        assertEquals(0.6, verdict.confidence(), 1e-9);
        assertFalse(verdict.isEquivalent());
    }

    // --- Failures ---

    @Test
    void slowAnalyzerTimesOut() {
        AnalyzerResult perfect = new AnalyzerResult(1.0, List.of(), List.of());
        ValidationVerdict verdict = validateWith(ValidatorOptions.defaults().withTimeoutMs(100),
                new StubAnalyzer(1.0), new StubAnalyzer(1.0), new StubAnalyzer("slow", perfect, 5_000, null),
                TranslationContext.defaults());

        assertFalse(verdict.isEquivalent());
        assertEquals(0.0, verdict.confidence());
        assertEquals(1, verdict.differences().size());
        assertEquals(Severity.CRITICAL, verdict.differences().get(0).severity());
        assertEquals("Validation timeout", verdict.differences().get(0).description());
        assertEquals("slow", verdict.differences().get(0).location());
        assertTrue(verdict.recommendations().contains("Manual code review required"));
    }

    @Test
    void throwingAnalyzerBecomesCriticalDifference() {
        ValidationVerdict verdict = validateWith(ValidatorOptions.defaults(), new StubAnalyzer(1.0),
                new StubAnalyzer("broken", null, 0, new IllegalStateException("boom")), new StubAnalyzer(1.0),
                TranslationContext.defaults());

        assertFalse(verdict.isEquivalent());
        assertEquals(DifferenceCategory.BEHAVIOR, verdict.differences().get(0).category());
        assertEquals("Validation failed: boom", verdict.differences().get(0).description());
        assertEquals("broken", verdict.differences().get(0).location());
    }

    @Test
    void analyzerReturningNothingBecomesCriticalDifference() {
        ValidationVerdict verdict = assertDoesNotThrow(() -> validateWith(ValidatorOptions.defaults(),
                new StubAnalyzer("empty", null, 0, null), new StubAnalyzer(1.0), new StubAnalyzer(1.0), null));

        assertFalse(verdict.isEquivalent());
        assertEquals(0.0, verdict.confidence());
        assertEquals(1, verdict.differences().size());
        assertEquals(Severity.CRITICAL, verdict.differences().get(0).severity());
        assertEquals("Validation failed: analyzer returned no result", verdict.differences().get(0).description());
        assertEquals("empty", verdict.differences().get(0).location());
    }

    @Test
    void missingSourceIsAFailureVerdict() {
        ValidationVerdict verdict = validator.validate(null, translated, TranslationContext.defaults());
        assertFalse(verdict.isEquivalent());
        assertEquals(Severity.CRITICAL, verdict.differences().get(0).severity());
    }

    @Test
    void nonPositiveTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ValidatorOptions.defaults().withTimeoutMs(0));
    }
}
