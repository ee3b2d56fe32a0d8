package com.modporter.logic.equivalence;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight, regex-level reading of Java or JavaScript source shared by the analyzers.
 * Nothing here parses; it only has to be consistent for both sides of a comparison.
 */
final class SourceText {

    private SourceText() {}

    static final Set<String> CONTROL_KEYWORDS = Set.of(
            "if", "else", "for", "while", "do", "switch", "case", "catch", "try", "finally",
            "return", "new", "throw", "throws", "synchronized", "function", "typeof", "await",
            "super", "this", "instanceof", "assert", "yield", "delete", "void");

    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern LINE_COMMENT = Pattern.compile("//[^\\n]*");

    // "type name(" covers Java declarations and "function name(".
    private static final Pattern TYPED_DECLARATION = Pattern.compile("\\b([A-Za-z_$][\\w$<>\\[\\]]*)\\s+([A-Za-z_$][\\w$]*)\\s*\\(");
    // "name(...) {" at line start: JS class methods, optionally async/static/get/set.
    private static final Pattern CLASS_METHOD = Pattern.compile(
            "^\\s*(?:(?:async|static|get|set)\\s+)*([A-Za-z_$][\\w$]*)\\s*\\([^)]*\\)\\s*\\{");
    // "name: function(", "name = (a) =>", "name: async x =>".
    private static final Pattern FUNCTION_PROPERTY = Pattern.compile(
            "\\b([A-Za-z_$][\\w$]*)\\s*[:=]\\s*(?:async\\s+)?(?:function\\b|\\([^)]*\\)\\s*=>|[A-Za-z_$][\\w$]*\\s*=>)");
    private static final Pattern CLASS_DECLARATION = Pattern.compile("\\bclass\\s+([A-Za-z_$][\\w$]*)");
    private static final Pattern COMPLEXITY_KEYWORD = Pattern.compile("\\b(?:if|else|for|while|switch|case|catch)\\b");
    private static final Pattern CALL = Pattern.compile("\\b([A-Za-z_$][\\w$]*)\\s*\\(");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");

    static String stripComments(String code) {
        String withoutBlocks = BLOCK_COMMENT.matcher(code).replaceAll(m -> {
            // keep line numbers stable
            StringBuilder blank = new StringBuilder();
            for (char c : m.group().toCharArray()) if (c == '\n') blank.append('\n');
            return blank.toString();
        });
        return LINE_COMMENT.matcher(withoutBlocks).replaceAll("");
    }

    /** Declared method and function names with the line of their first declaration. */
    static Map<String, Integer> methods(String code) {
        Map<String, Integer> methods = new LinkedHashMap<>();
        String[] lines = code.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNumber = i + 1;
            Matcher typed = TYPED_DECLARATION.matcher(line);
            while (typed.find()) {
                String type = typed.group(1);
                String name = typed.group(2);
                if (!CONTROL_KEYWORDS.contains(name)
                        && (type.equals("function") || !CONTROL_KEYWORDS.contains(type))
                        && !type.equals("class")) {
                    methods.putIfAbsent(name, lineNumber);
                }
            }
            Matcher classMethod = CLASS_METHOD.matcher(line);
            if (classMethod.find() && !CONTROL_KEYWORDS.contains(classMethod.group(1))) {
                methods.putIfAbsent(classMethod.group(1), lineNumber);
            }
            Matcher property = FUNCTION_PROPERTY.matcher(line);
            while (property.find()) {
                if (!CONTROL_KEYWORDS.contains(property.group(1))) {
                    methods.putIfAbsent(property.group(1), lineNumber);
                }
            }
        }
        return methods;
    }

    static Set<String> classes(String code) {
        Set<String> classes = new LinkedHashSet<>();
        Matcher m = CLASS_DECLARATION.matcher(code);
        while (m.find()) classes.add(m.group(1));
        return classes;
    }

    static int complexity(String code) {
        return 1 + count(COMPLEXITY_KEYWORD, code);
    }

    /** Distinct names that appear in call position, keywords excluded. */
    static Set<String> callTargets(String code) {
        Set<String> targets = new LinkedHashSet<>();
        Matcher m = CALL.matcher(code);
        while (m.find()) {
            if (!CONTROL_KEYWORDS.contains(m.group(1))) targets.add(m.group(1));
        }
        return targets;
    }

    static Set<String> identifiers(String code) {
        Set<String> identifiers = new LinkedHashSet<>();
        Matcher m = IDENTIFIER.matcher(code);
        while (m.find()) identifiers.add(m.group());
        return identifiers;
    }

    static int count(Pattern pattern, String code) {
        int n = 0;
        Matcher m = pattern.matcher(code);
        while (m.find()) n++;
        return n;
    }

    static boolean contains(Pattern pattern, String code) {
        return pattern.matcher(code).find();
    }

    /** Shared-name ratio: matches over the larger set; 1 when both are empty, {@code oneEmpty} when only one is. */
    static double overlap(Set<String> original, Set<String> translated, double oneEmpty) {
        if (original.isEmpty() && translated.isEmpty()) return 1.0;
        if (original.isEmpty() || translated.isEmpty()) return oneEmpty;
        int matches = 0;
        for (String name : original) {
            if (translated.contains(name)) matches++;
        }
        return (double) matches / Math.max(original.size(), translated.size());
    }
}
