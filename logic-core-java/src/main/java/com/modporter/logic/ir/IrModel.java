package com.modporter.logic.ir;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Objects;

/**
 * Intermediate representation produced by the source analyzer.
 * Every type here is immutable; list components are defensive copies.
 * Enum constants carry @SerializedName so ir.json uses the lower-case wire names.
 */
public final class IrModel {

    private IrModel() {}

    /** 1-based line and column (in chars); byteOffset counts UTF-8 bytes from the start of the source. */
    public record SourcePosition(int line, int column, @SerializedName("byte_offset") int byteOffset) {}

    public enum TokenKind {
        @SerializedName("keyword")        KEYWORD,
        @SerializedName("identifier")     IDENTIFIER,
        @SerializedName("string_literal") STRING_LITERAL,
        @SerializedName("number")         NUMBER,
        @SerializedName("operator")       OPERATOR,
        @SerializedName("punctuation")    PUNCTUATION,
        @SerializedName("comment")        COMMENT,
        @SerializedName("unknown")        UNKNOWN
    }

    public record Token(TokenKind kind, String text, SourcePosition position) {
        public boolean is(String value) { return text.equals(value); }
    }

    public enum NodeKind {
        @SerializedName("ClassDeclaration")  CLASS_DECLARATION,
        @SerializedName("MethodDeclaration") METHOD_DECLARATION,
        @SerializedName("FieldDeclaration")  FIELD_DECLARATION,
        @SerializedName("IfStatement")       IF_STATEMENT,
        @SerializedName("ForLoop")           FOR_LOOP,
        @SerializedName("WhileLoop")         WHILE_LOOP,
        @SerializedName("SwitchStatement")   SWITCH_STATEMENT,
        @SerializedName("TryStatement")      TRY_STATEMENT,
        @SerializedName("MethodCall")        METHOD_CALL,
        @SerializedName("Assignment")        ASSIGNMENT,
        @SerializedName("Comment")           COMMENT,
        @SerializedName("GenericStatement")  GENERIC_STATEMENT;

        /** Kinds whose bodies count as one more level of nesting. */
        public boolean isNesting() {
            return switch (this) {
                case CLASS_DECLARATION, METHOD_DECLARATION, IF_STATEMENT, FOR_LOOP,
                     WHILE_LOOP, SWITCH_STATEMENT, TRY_STATEMENT -> true;
                case FIELD_DECLARATION, METHOD_CALL, ASSIGNMENT, COMMENT, GENERIC_STATEMENT -> false;
            };
        }

        /** Kinds that add a path through the code (cyclomatic decision points). */
        public boolean isDecisionPoint() {
            return switch (this) {
                case IF_STATEMENT, FOR_LOOP, WHILE_LOOP, SWITCH_STATEMENT, TRY_STATEMENT -> true;
                case CLASS_DECLARATION, METHOD_DECLARATION, FIELD_DECLARATION, METHOD_CALL,
                     ASSIGNMENT, COMMENT, GENERIC_STATEMENT -> false;
            };
        }
    }

    public record NodeMetadata(
            @SerializedName("java_category")     String javaCategory,
            @SerializedName("complexity_weight") int complexityWeight,
            @SerializedName("is_mappable")       boolean mappable,
            @SerializedName("return_type")       String returnType,      // methods only, "" for constructors
            @SerializedName("parameter_names")   List<String> parameterNames,
            @SerializedName("modifiers")         List<String> modifiers
    ) {
        public NodeMetadata {
            parameterNames = parameterNames == null ? List.of() : List.copyOf(parameterNames);
            modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        }
    }

    public record SyntaxNode(
            NodeKind kind,
            String label,
            List<SyntaxNode> children,
            SourcePosition position,
            NodeMetadata metadata
    ) {
        public SyntaxNode {
            Objects.requireNonNull(kind, "kind");
            children = children == null ? List.of() : List.copyOf(children);
        }
    }

    public record ComplexityMetrics(
            @SerializedName("cyclomatic_complexity") int cyclomaticComplexity,
            @SerializedName("cognitive_complexity")  int cognitiveComplexity,
            @SerializedName("lines_of_code")         int linesOfCode,
            @SerializedName("max_nesting_depth")     int maxNestingDepth
    ) {}

    public record ImportDeclaration(
            @SerializedName("package_name") String packageName,
            @SerializedName("class_name")   String className,      // "*" for wildcard imports
            @SerializedName("is_static")    boolean isStatic,
            @SerializedName("is_wildcard")  boolean isWildcard
    ) {}

    public enum DependencyClassifier {
        @SerializedName("minecraft") MINECRAFT,
        @SerializedName("forge")     FORGE,
        @SerializedName("fabric")    FABRIC,
        @SerializedName("external")  EXTERNAL;

        public boolean isPlatform() {
            return this != EXTERNAL;
        }
    }

    public record Dependency(
            @SerializedName("package_name") String packageName,
            @SerializedName("classifier")   DependencyClassifier classifier,
            @SerializedName("required")     boolean required
    ) {}

    public record MethodSummary(
            String name,
            @SerializedName("return_type")     String returnType,
            @SerializedName("parameter_names") List<String> parameterNames,
            List<String> modifiers,
            int line,
            boolean mappable
    ) {
        public MethodSummary {
            parameterNames = List.copyOf(parameterNames);
            modifiers = List.copyOf(modifiers);
        }
    }

    public record FieldSummary(String name, List<String> modifiers, int line) {
        public FieldSummary {
            modifiers = List.copyOf(modifiers);
        }
    }

    public record ClassSummary(
            String name,
            List<String> modifiers,
            List<MethodSummary> methods,
            List<FieldSummary> fields,
            int line
    ) {
        public ClassSummary {
            modifiers = List.copyOf(modifiers);
            methods = List.copyOf(methods);
            fields = List.copyOf(fields);
        }
    }

    public record CodeMetadata(
            @SerializedName("source_line_count") int sourceLineCount,
            ComplexityMetrics complexity,
            List<ImportDeclaration> imports,
            List<ClassSummary> classes,
            List<MethodSummary> methods
    ) {
        public CodeMetadata {
            imports = List.copyOf(imports);
            classes = List.copyOf(classes);
            methods = List.copyOf(methods);
        }
    }

    public record IntermediateRepresentation(
            @SerializedName("syntax_tree")  List<SyntaxNode> syntaxTree,
            CodeMetadata metadata,
            List<Dependency> dependencies
    ) {
        public IntermediateRepresentation {
            syntaxTree = List.copyOf(syntaxTree);
            dependencies = List.copyOf(dependencies);
        }
    }
}
