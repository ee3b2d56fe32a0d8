package com.modporter.logic.equivalence;

import com.modporter.logic.equivalence.ValidationModel.AnalyzerResult;
import com.modporter.logic.equivalence.ValidationModel.DifferenceCategory;
import com.modporter.logic.equivalence.ValidationModel.FunctionalDifference;
import com.modporter.logic.equivalence.ValidationModel.Severity;
import com.modporter.logic.equivalence.ValidationModel.TranslationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Scores behavior with fixed scenarios derived from what the original code does. The
 * outcome depends only on the two sources.
 */
public class BehavioralAnalyzer implements EquivalenceAnalyzer {

    private static final Pattern WORLD_STATE = Pattern.compile(
            "\\b(?:world|World|getWorld|getEntityWorld|level|getLevel|dimension|getDimension"
                    + "|setBlockState|getBlockState|setBlock|getBlock|setPermutation)\\b");
    private static final Pattern JAVA_EXCEPTIONS = Pattern.compile("\\b(?:try|catch|throw|throws)\\b");
    private static final Pattern EXCEPTION_HANDLING = Pattern.compile("\\b(?:try|catch)\\b");
    private static final Pattern JS_ERROR_HANDLING = Pattern.compile("\\b(?:try|catch|throw)\\b|\\.catch\\s*\\(");
    private static final Pattern ASYNC = Pattern.compile(
            "\\b(?:async|await|Promise|CompletableFuture|Thread|ExecutorService|Executors"
                    + "|setTimeout|setInterval|runTimeout|runInterval|runJob)\\b");

    record Scenario(String name, boolean passed) {}

    @Override
    public String name() {
        return "behavioral";
    }

    @Override
    public AnalyzerResult analyze(String originalJava, String translatedJs, TranslationContext context) {
        String original = SourceText.stripComments(originalJava);
        String translated = SourceText.stripComments(translatedJs);

        List<Scenario> scenarios = scenarios(original, translated);
        long passed = scenarios.stream().filter(Scenario::passed).count();
        double similarity = (double) passed / scenarios.size();

        List<FunctionalDifference> differences = new ArrayList<>();
        if (SourceText.contains(ASYNC, original) != SourceText.contains(ASYNC, translated)) {
            differences.add(new FunctionalDifference(
                    DifferenceCategory.BEHAVIOR,
                    "Asynchronous behavior patterns differ between Java and JavaScript versions",
                    Severity.MEDIUM,
                    "overall",
                    "Ensure consistent async/sync behavior patterns"));
        }
        if (SourceText.contains(EXCEPTION_HANDLING, original) && !SourceText.contains(EXCEPTION_HANDLING, translated)) {
            differences.add(new FunctionalDifference(
                    DifferenceCategory.BEHAVIOR,
                    "Java code has exception handling that may not be present in JavaScript",
                    Severity.MEDIUM,
                    "overall",
                    "Implement equivalent error handling in JavaScript"));
        }

        List<String> recommendations = new ArrayList<>();
        if (similarity < 0.8) {
            recommendations.add("Conduct thorough behavioral testing in Minecraft environment");
        }
        return new AnalyzerResult(similarity, differences, recommendations);
    }

    static List<Scenario> scenarios(String original, String translated) {
        List<Scenario> scenarios = new ArrayList<>();
        scenarios.add(new Scenario("baseline", !translated.isBlank() || original.isBlank()));

        boolean originalWorld = SourceText.contains(WORLD_STATE, original);
        boolean translatedWorld = SourceText.contains(WORLD_STATE, translated);
        if (originalWorld || translatedWorld) {
            scenarios.add(new Scenario("world-interaction", originalWorld && translatedWorld));
        }
        if (SourceText.contains(JAVA_EXCEPTIONS, original)) {
            scenarios.add(new Scenario("error-handling", SourceText.contains(JS_ERROR_HANDLING, translated)));
        }
        return scenarios;
    }
}
