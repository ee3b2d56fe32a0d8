package com.modporter.logic.static_analysis;

import com.modporter.logic.ir.IrModel.Dependency;
import com.modporter.logic.ir.IrModel.DependencyClassifier;
import com.modporter.logic.ir.IrModel.ImportDeclaration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads import statements straight from raw source text (independently of the syntax tree)
 * and classifies each imported package by mod platform.
 */
public class ImportExtractor {

    private static final Pattern IMPORT = Pattern.compile(
            "\\bimport\\s+(static\\s+)?([a-zA-Z_$][a-zA-Z0-9_$.]*?)(\\.\\*)?\\s*;");

    public List<ImportDeclaration> extractImports(String source) {
        List<ImportDeclaration> imports = new ArrayList<>();
        Matcher m = IMPORT.matcher(source);
        while (m.find()) {
            boolean isStatic = m.group(1) != null;
            boolean isWildcard = m.group(3) != null;
            String path = m.group(2);

            String packageName;
            String className;
            if (isWildcard) {
                packageName = path;
                className = "*";
            } else {
                int dot = path.lastIndexOf('.');
                packageName = dot < 0 ? "" : path.substring(0, dot);
                className = dot < 0 ? path : path.substring(dot + 1);
            }
            imports.add(new ImportDeclaration(packageName, className, isStatic, isWildcard));
        }
        return imports;
    }

    /** One dependency per distinct import statement; repeated identical imports collapse. */
    public List<Dependency> analyzeDependencies(List<ImportDeclaration> imports) {
        Set<ImportDeclaration> distinct = new LinkedHashSet<>(imports);
        List<Dependency> dependencies = new ArrayList<>();
        for (ImportDeclaration decl : distinct) {
            DependencyClassifier classifier = classify(decl.packageName());
            dependencies.add(new Dependency(decl.packageName(), classifier, classifier.isPlatform()));
        }
        return dependencies;
    }

    /** net.minecraftforge is checked before net.minecraft, which is its prefix. */
    static DependencyClassifier classify(String packageName) {
        if (packageName.startsWith("net.minecraftforge")) return DependencyClassifier.FORGE;
        if (packageName.startsWith("net.fabricmc")) return DependencyClassifier.FABRIC;
        if (packageName.startsWith("net.minecraft")) return DependencyClassifier.MINECRAFT;
        return DependencyClassifier.EXTERNAL;
    }
}
