package com.modporter.logic;

import com.modporter.logic.equivalence.StructuralAnalyzer;
import com.modporter.logic.equivalence.ValidationModel.AnalyzerResult;
import com.modporter.logic.equivalence.ValidationModel.DifferenceCategory;
import com.modporter.logic.equivalence.ValidationModel.FunctionalDifference;
import com.modporter.logic.equivalence.ValidationModel.Severity;
import com.modporter.logic.equivalence.ValidationModel.TranslationContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StructuralAnalyzerTest {

    private final StructuralAnalyzer analyzer = new StructuralAnalyzer();

    private AnalyzerResult analyze(String java, String js) {
        return analyzer.analyze(java, js, TranslationContext.defaults());
    }

    @Test
    void matchingStructureScoresOne() {
        String java = "class Counter {\n"
                + "    void run() {\n"
                + "        if (ready) { step(); }\n"
                + "    }\n"
                + "}\n";
        String js = "class Counter {\n"
                + "  run() {\n"
                + "    if (ready) { step(); }\n"
                + "  }\n"
                + "}\n";

        AnalyzerResult result = analyze(java, js);
        assertEquals(1.0, result.similarity(), 1e-9);
        assertTrue(result.differences().isEmpty());
        assertTrue(result.recommendations().isEmpty());
    }

    @Test
    void missingMethodIsHighWithLine() {
        String java = "class Counter {\n"
                + "    void run() {\n"
                + "    }\n"
                + "    void stop() {\n"
                + "    }\n"
                + "}\n";
        String js = "class Counter {\n"
                + "  run() {\n"
                + "  }\n"
                + "}\n";

        AnalyzerResult result = analyze(java, js);
        assertEquals(1, result.differences().size());
        FunctionalDifference missing = result.differences().get(0);
        assertEquals(Severity.HIGH, missing.severity());
        assertEquals(DifferenceCategory.LOGIC, missing.category());
        assertEquals("Method 'stop' not found in translated code", missing.description());
        assertEquals("line 4", missing.location());
        // methods 1/2, classes 1, complexity 1
        assertEquals((0.5 + 1.0 + 1.0) / 3.0, result.similarity(), 1e-9);
    }

    @Test
    void largeComplexityGapIsReported() {
        String java = "class A {\n"
                + "    void f() {\n"
                + "        if (a) x(); if (b) x(); if (c) x(); if (d) x(); if (e) x();\n"
                + "    }\n"
                + "}\n";
        String js = "class A {\n"
                + "  f() {\n"
                + "    x();\n"
                + "  }\n"
                + "}\n";

        AnalyzerResult result = analyze(java, js);
        assertTrue(result.differences().stream().anyMatch(d ->
                d.severity() == Severity.MEDIUM && d.description().startsWith("Significant complexity difference")));
    }

    @Test
    void commentsDoNotCount() {
        String java = "class A {\n    /* void ghost() { if (x) {} } */\n    void f() {\n    }\n}\n";
        String js = "class A {\n  // ghost() {\n  f() {\n  }\n}\n";

        AnalyzerResult result = analyze(java, js);
        assertTrue(result.differences().isEmpty(), result.differences().toString());
    }

    @Test
    void emptyTranslationIsLowSimilarity() {
        AnalyzerResult result = analyze("class A {\n    void f() {\n    }\n}\n", "");
        assertTrue(result.similarity() < 0.7);
        assertFalse(result.recommendations().isEmpty());
    }
}
