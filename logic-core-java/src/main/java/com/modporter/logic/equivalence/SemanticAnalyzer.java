package com.modporter.logic.equivalence;

import com.modporter.logic.equivalence.ValidationModel.AnalyzerResult;
import com.modporter.logic.equivalence.ValidationModel.DifferenceCategory;
import com.modporter.logic.equivalence.ValidationModel.FunctionalDifference;
import com.modporter.logic.equivalence.ValidationModel.Severity;
import com.modporter.logic.equivalence.ValidationModel.TranslationContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compares operation patterns (loops, conditions, assignments, calls, returns) and checks
 * that the original's call targets survive translation, directly or via a known Bedrock
 * equivalent.
 */
public class SemanticAnalyzer implements EquivalenceAnalyzer {

    static final double PATTERN_WEIGHT = 0.7;
    static final double COVERAGE_WEIGHT = 0.3;
    static final double DIVERGENCE_RATIO = 0.3;
    static final double MIN_COVERAGE = 0.5;
    private static final int LISTED_TARGETS = 5;

    private static final Map<String, Pattern> PATTERNS = new LinkedHashMap<>();
    static {
        PATTERNS.put("loop", Pattern.compile("\\b(?:for|while)\\s*\\("));
        PATTERNS.put("condition", Pattern.compile("\\bif\\s*\\("));
        PATTERNS.put("assignment", Pattern.compile("[\\w$\\]]\\s*=(?![=>])"));
        PATTERNS.put("call", Pattern.compile("\\b(?!(?:if|for|while|switch|catch|return|function)\\b)[A-Za-z_$][\\w$]*\\s*\\("));
        PATTERNS.put("return", Pattern.compile("\\breturn\\b"));
    }

    /** Java call target → names that stand for it in Bedrock scripts. */
    static final Map<String, Set<String>> KNOWN_EQUIVALENTS = Map.ofEntries(
            Map.entry("println", Set.of("log", "warn", "error")),
            Map.entry("print", Set.of("log")),
            Map.entry("info", Set.of("log", "info")),
            Map.entry("getWorld", Set.of("dimension", "getDimension")),
            Map.entry("getEntityWorld", Set.of("dimension", "getDimension")),
            Map.entry("getLevel", Set.of("dimension", "getDimension")),
            Map.entry("sendMessage", Set.of("sendMessage")),
            Map.entry("sendSystemMessage", Set.of("sendMessage")),
            Map.entry("broadcastMessage", Set.of("sendMessage")),
            Map.entry("setBlockState", Set.of("setPermutation", "setType")),
            Map.entry("getBlockState", Set.of("getBlock", "permutation")),
            Map.entry("getPlayer", Set.of("getPlayers", "player")),
            Map.entry("getPlayers", Set.of("getPlayers")),
            Map.entry("getName", Set.of("name", "nameTag")),
            Map.entry("getHealth", Set.of("getComponent")),
            Map.entry("playSound", Set.of("playSound")),
            Map.entry("spawnEntity", Set.of("spawnEntity")),
            Map.entry("addEntity", Set.of("spawnEntity")),
            Map.entry("getPosition", Set.of("location")),
            Map.entry("getBlockPos", Set.of("location")),
            Map.entry("equals", Set.of("===", "equals")),
            Map.entry("size", Set.of("length")),
            Map.entry("add", Set.of("push", "add")),
            Map.entry("put", Set.of("set")),
            Map.entry("get", Set.of("get")));

    @Override
    public String name() {
        return "semantic";
    }

    @Override
    public AnalyzerResult analyze(String originalJava, String translatedJs, TranslationContext context) {
        String original = SourceText.stripComments(originalJava);
        String translated = SourceText.stripComments(translatedJs);

        List<FunctionalDifference> differences = new ArrayList<>();
        double patternTotal = 0.0;
        int patternKinds = 0;
        for (Map.Entry<String, Pattern> pattern : PATTERNS.entrySet()) {
            int a = SourceText.count(pattern.getValue(), original);
            int b = SourceText.count(pattern.getValue(), translated);
            int max = Math.max(a, b);
            if (max == 0) continue;
            patternKinds++;
            patternTotal += 1.0 - (double) Math.abs(a - b) / max;
            if (Math.abs(a - b) > DIVERGENCE_RATIO * max) {
                differences.add(new FunctionalDifference(
                        DifferenceCategory.LOGIC,
                        "Significant difference in " + pattern.getKey() + " patterns (Java: " + a + ", JS: " + b + ")",
                        Severity.MEDIUM,
                        "overall",
                        "Review " + pattern.getKey() + " logic for semantic equivalence"));
            }
        }
        double patternSimilarity = patternKinds == 0 ? 1.0 : patternTotal / patternKinds;

        Set<String> targets = SourceText.callTargets(original);
        Set<String> translatedNames = SourceText.identifiers(translated);
        List<String> unexplained = new ArrayList<>();
        for (String target : targets) {
            if (!covered(target, translatedNames, translated)) unexplained.add(target);
        }
        double coverage = targets.isEmpty() ? 1.0 : 1.0 - (double) unexplained.size() / targets.size();

        List<String> recommendations = new ArrayList<>();
        if (coverage < MIN_COVERAGE) {
            List<String> listed = unexplained.subList(0, Math.min(LISTED_TARGETS, unexplained.size()));
            differences.add(new FunctionalDifference(
                    DifferenceCategory.API,
                    "Calls without a Bedrock counterpart in the translation: " + String.join(", ", listed)
                            + (unexplained.size() > LISTED_TARGETS ? " and " + (unexplained.size() - LISTED_TARGETS) + " more" : ""),
                    Severity.MEDIUM,
                    "overall",
                    "Map these calls through the API mapping table"));
            recommendations.add("Check API mappings for the unmatched calls");
        }

        double similarity = PATTERN_WEIGHT * patternSimilarity + COVERAGE_WEIGHT * coverage;
        if (similarity < 0.8) {
            recommendations.add("Review semantic equivalence of key operations");
        }
        return new AnalyzerResult(similarity, differences, recommendations);
    }

    private static boolean covered(String target, Set<String> translatedNames, String translated) {
        if (translatedNames.contains(target)) return true;
        Set<String> equivalents = KNOWN_EQUIVALENTS.get(target);
        if (equivalents == null) return false;
        for (String equivalent : equivalents) {
            if (translatedNames.contains(equivalent) || translated.contains(equivalent)) return true;
        }
        return false;
    }
}
