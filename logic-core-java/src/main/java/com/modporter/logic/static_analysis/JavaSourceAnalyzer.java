package com.modporter.logic.static_analysis;

import com.modporter.logic.ir.IrModel.*;

import java.util.List;
import java.util.Objects;

/**
 * Orchestrates the full source analysis pass: lex, build the tree, harvest declarations
 * and imports, compute complexity. Produces one IntermediateRepresentation per source unit.
 *
 * Instances hold no parse state and may be shared between threads.
 */
public class JavaSourceAnalyzer {

    public static class AnalysisException extends RuntimeException {
        public AnalysisException(String message, Throwable cause) { super(message, cause); }
    }

    private final JavaLexer lexer = new JavaLexer();
    private final SyntaxTreeBuilder treeBuilder = new SyntaxTreeBuilder();
    private final DeclarationExtractor declarationExtractor = new DeclarationExtractor();
    private final ImportExtractor importExtractor = new ImportExtractor();
    private final ComplexityCalculator complexityCalculator = new ComplexityCalculator();

    /**
     * Analyzes Java source text. Malformed input degrades to generic nodes rather than failing.
     *
     * @throws AnalysisException if analysis fails for a reason unrelated to the input's syntax
     */
    public IntermediateRepresentation analyze(String javaSource) {
        Objects.requireNonNull(javaSource, "javaSource");
        try {
            // 1. Tokenize and build the tree
            List<Token> tokens = lexer.tokenize(javaSource);
            List<SyntaxNode> tree = treeBuilder.build(tokens);

            // 2. Declarations and imports
            List<ImportDeclaration> imports = importExtractor.extractImports(javaSource);
            List<ClassSummary> classes = declarationExtractor.extractClasses(tree);
            List<MethodSummary> methods = declarationExtractor.extractMethods(tree);

            // 3. Complexity and dependencies
            ComplexityMetrics complexity = complexityCalculator.calculate(tree);
            List<Dependency> dependencies = importExtractor.analyzeDependencies(imports);

            CodeMetadata metadata = new CodeMetadata(
                    javaSource.split("\n", -1).length,
                    complexity,
                    imports,
                    classes,
                    methods);
            return new IntermediateRepresentation(tree, metadata, dependencies);
        } catch (RuntimeException e) {
            throw new AnalysisException("Failed to analyze Java source: " + e.getMessage(), e);
        }
    }
}
