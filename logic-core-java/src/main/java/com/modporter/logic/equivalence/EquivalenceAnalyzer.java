package com.modporter.logic.equivalence;

import com.modporter.logic.equivalence.ValidationModel.AnalyzerResult;
import com.modporter.logic.equivalence.ValidationModel.TranslationContext;

/**
 * One lens of equivalence validation. Implementations are stateless and build their
 * result in a local buffer, so one instance may serve concurrent validations.
 */
public interface EquivalenceAnalyzer {

    String name();

    AnalyzerResult analyze(String originalJava, String translatedJs, TranslationContext context);
}
