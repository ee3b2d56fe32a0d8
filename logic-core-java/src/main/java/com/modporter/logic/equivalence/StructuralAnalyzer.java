package com.modporter.logic.equivalence;

import com.modporter.logic.equivalence.ValidationModel.AnalyzerResult;
import com.modporter.logic.equivalence.ValidationModel.DifferenceCategory;
import com.modporter.logic.equivalence.ValidationModel.FunctionalDifference;
import com.modporter.logic.equivalence.ValidationModel.Severity;
import com.modporter.logic.equivalence.ValidationModel.TranslationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares method inventory, class inventory and branch complexity of the two sources.
 */
public class StructuralAnalyzer implements EquivalenceAnalyzer {

    static final int COMPLEXITY_TOLERANCE = 3;
    private static final double CLASS_ONE_SIDED = 0.5;

    @Override
    public String name() {
        return "structural";
    }

    @Override
    public AnalyzerResult analyze(String originalJava, String translatedJs, TranslationContext context) {
        String original = SourceText.stripComments(originalJava);
        String translated = SourceText.stripComments(translatedJs);

        Map<String, Integer> originalMethods = SourceText.methods(original);
        Map<String, Integer> translatedMethods = SourceText.methods(translated);
        Set<String> originalClasses = SourceText.classes(original);
        Set<String> translatedClasses = SourceText.classes(translated);
        int originalComplexity = SourceText.complexity(original);
        int translatedComplexity = SourceText.complexity(translated);

        double methodSimilarity = SourceText.overlap(originalMethods.keySet(), translatedMethods.keySet(), 0.0);
        double classSimilarity = SourceText.overlap(originalClasses, translatedClasses, CLASS_ONE_SIDED);
        int delta = Math.abs(originalComplexity - translatedComplexity);
        double complexitySimilarity = 1.0 - (double) delta / Math.max(Math.max(originalComplexity, translatedComplexity), 1);
        double similarity = (methodSimilarity + classSimilarity + complexitySimilarity) / 3.0;

        List<FunctionalDifference> differences = new ArrayList<>();
        for (Map.Entry<String, Integer> method : originalMethods.entrySet()) {
            if (!translatedMethods.containsKey(method.getKey())) {
                differences.add(new FunctionalDifference(
                        DifferenceCategory.LOGIC,
                        "Method '" + method.getKey() + "' not found in translated code",
                        Severity.HIGH,
                        "line " + method.getValue(),
                        "Implement equivalent method in JavaScript"));
            }
        }
        if (delta > COMPLEXITY_TOLERANCE) {
            differences.add(new FunctionalDifference(
                    DifferenceCategory.LOGIC,
                    "Significant complexity difference (Java: " + originalComplexity
                            + ", JS: " + translatedComplexity + ")",
                    Severity.MEDIUM,
                    "overall",
                    "Review code complexity and ensure equivalent logic"));
        }

        List<String> recommendations = new ArrayList<>();
        if (similarity < 0.7) {
            recommendations.add("Consider maintaining similar code structure for better maintainability");
        }
        return new AnalyzerResult(similarity, differences, recommendations);
    }
}
