package com.modporter.logic.static_analysis;

import com.modporter.logic.ir.IrModel.NodeKind;
import com.modporter.logic.ir.IrModel.SyntaxNode;
import com.modporter.logic.ir.IrModel.Token;
import com.modporter.logic.ir.IrModel.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds a shallow syntax tree from a token list by recursive descent.
 *
 * The tree models declarations, control-flow shape and call sites only; conditions and
 * expressions are skipped, not parsed. Malformed input degrades to GENERIC_STATEMENT
 * nodes. Every parse step consumes at least one token, so building always terminates.
 */
public class SyntaxTreeBuilder {

    /** Recursion guard; blocks nested deeper than this are skipped as balanced regions. */
    static final int MAX_NESTING = 200;

    private static final Set<String> MODIFIERS = Set.of(
            "public", "private", "protected", "static", "final", "abstract",
            "synchronized", "native", "transient", "volatile", "strictfp");

    private static final Set<String> PRIMITIVE_TYPES = Set.of(
            "void", "boolean", "byte", "char", "short", "int", "long", "float", "double");

    public List<SyntaxNode> build(List<Token> tokens) {
        return new Cursor(tokens).parseAll();
    }

    /** Parse state for one build call; never shared between calls. */
    private static final class Cursor {

        private final List<Token> tokens;
        private int pos;
        private int depth;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        List<SyntaxNode> parseAll() {
            List<SyntaxNode> nodes = new ArrayList<>();
            while (pos < tokens.size()) {
                int before = pos;
                SyntaxNode node = parseStatement();
                if (node != null) nodes.add(node);
                if (pos == before) pos++;
            }
            return nodes;
        }

        // --- Statement dispatch ---

        /** Parses one statement at the cursor. Returns null for tokens that produce no node. */
        private SyntaxNode parseStatement() {
            Token token = tokens.get(pos);
            return switch (token.kind()) {
                case KEYWORD -> parseKeywordStatement();
                case IDENTIFIER -> parseIdentifierStatement();
                case COMMENT -> {
                    pos++;
                    yield node(NodeKind.COMMENT, token.text(), token, List.of());
                }
                case PUNCTUATION -> {
                    if (token.is(";") || token.is("{") || token.is("}")) {
                        pos++;
                        yield null;
                    }
                    yield parseGenericStatement();
                }
                case UNKNOWN -> {
                    if (token.is("@")) {
                        skipAnnotation();
                        yield null;
                    }
                    yield parseGenericStatement();
                }
                case STRING_LITERAL, NUMBER, OPERATOR -> parseGenericStatement();
            };
        }

        private SyntaxNode parseKeywordStatement() {
            Token token = tokens.get(pos);
            switch (token.text()) {
                case "class", "interface", "enum":
                    return parseClassDeclaration(List.of(), pos);
                case "public", "private", "protected", "static", "final", "abstract", "synchronized":
                    return parseModifiedDeclaration();
                case "if":
                    return parseIfStatement();
                case "for":
                    return parseControlFlow(NodeKind.FOR_LOOP);
                case "while":
                    return parseControlFlow(NodeKind.WHILE_LOOP);
                case "switch":
                    return parseControlFlow(NodeKind.SWITCH_STATEMENT);
                case "try":
                    return parseTryStatement();
                case "package", "import":
                    return parseDirective();
                case "this", "super":
                    return isAt(pos + 1, ".") ? parseIdentifierStatement() : parseGenericStatement();
                default:
                    if (PRIMITIVE_TYPES.contains(token.text()) && looksLikeMethod(pos)) {
                        return parseMethodDeclaration(List.of(), pos);
                    }
                    return parseGenericStatement();
            }
        }

        // --- Declarations ---

        private SyntaxNode parseModifiedDeclaration() {
            int start = pos;
            List<String> modifiers = new ArrayList<>();
            while (pos < tokens.size()) {
                Token t = tokens.get(pos);
                if (t.kind() == TokenKind.KEYWORD && MODIFIERS.contains(t.text())) {
                    modifiers.add(t.text());
                    pos++;
                } else if (t.is("@")) {
                    skipAnnotation();
                } else {
                    break;
                }
            }
            if (pos >= tokens.size()) {
                return node(NodeKind.GENERIC_STATEMENT, String.join(" ", modifiers), tokens.get(start), List.of());
            }

            Token next = tokens.get(pos);
            if (next.is("class") || next.is("interface") || next.is("enum")) {
                return parseClassDeclaration(modifiers, start);
            }
            if (next.is("{") || next.is("(")) {
                // static initializer or synchronized block
                if (next.is("(")) skipParens();
                return node(NodeKind.GENERIC_STATEMENT, String.join(" ", modifiers), tokens.get(start), parseBlock());
            }
            if (looksLikeMethod(pos)) {
                return parseMethodDeclaration(modifiers, start);
            }
            return parseFieldDeclaration(modifiers, start);
        }

        private SyntaxNode parseClassDeclaration(List<String> modifiers, int start) {
            pos++; // class / interface / enum
            while (pos < tokens.size() && tokens.get(pos).kind() != TokenKind.IDENTIFIER && !isAt(pos, "{")) {
                pos++;
            }
            String name = "UnknownClass";
            if (pos < tokens.size() && tokens.get(pos).kind() == TokenKind.IDENTIFIER) {
                name = tokens.get(pos).text();
                pos++;
            }
            List<SyntaxNode> children = parseBlock();
            return new SyntaxNode(NodeKind.CLASS_DECLARATION, name, children, tokens.get(start).position(),
                    NodeRules.declarationMetadata(NodeKind.CLASS_DECLARATION, name, null, List.of(), modifiers));
        }

        private SyntaxNode parseMethodDeclaration(List<String> modifiers, int start) {
            if (isAt(pos, "<")) {
                int afterTypeParams = skipAngles(pos);
                if (afterTypeParams > pos) pos = afterTypeParams;
            }

            String returnType;
            if (isKind(pos, TokenKind.IDENTIFIER) && isAt(pos + 1, "(")) {
                returnType = ""; // constructor
            } else {
                int typeEnd = skipType(pos);
                returnType = joinTexts(pos, typeEnd);
                pos = typeEnd;
            }

            String name = pos < tokens.size() ? tokens.get(pos).text() : "unknownMethod";
            pos++;
            List<String> parameterNames = parseParameterNames();

            if (isAt(pos, "throws")) {
                while (pos < tokens.size() && !isAt(pos, "{") && !isAt(pos, ";")) pos++;
            }

            List<SyntaxNode> body;
            if (isAt(pos, ";")) {
                pos++; // abstract or interface method
                body = List.of();
            } else {
                body = parseBlock();
            }
            return new SyntaxNode(NodeKind.METHOD_DECLARATION, name, body, tokens.get(start).position(),
                    NodeRules.declarationMetadata(NodeKind.METHOD_DECLARATION, name, returnType, parameterNames, modifiers));
        }

        private SyntaxNode parseFieldDeclaration(List<String> modifiers, int start) {
            int typeEnd = skipType(pos);
            String name = isKind(typeEnd, TokenKind.IDENTIFIER) ? tokens.get(typeEnd).text() : "unknownField";
            pos = typeEnd;
            skipToStatementEnd(null);
            return new SyntaxNode(NodeKind.FIELD_DECLARATION, name, List.of(), tokens.get(start).position(),
                    NodeRules.declarationMetadata(NodeKind.FIELD_DECLARATION, name, null, List.of(), modifiers));
        }

        /** Reads {@code ( ... )} at the cursor; each comma-separated parameter contributes its last identifier. */
        private List<String> parseParameterNames() {
            List<String> names = new ArrayList<>();
            if (!isAt(pos, "(")) return names;
            pos++;
            int parens = 1;
            int angles = 0;
            String lastIdentifier = null;
            while (pos < tokens.size() && parens > 0) {
                Token t = tokens.get(pos);
                if (t.is("(")) {
                    parens++;
                } else if (t.is(")")) {
                    parens--;
                } else if (t.is("<")) {
                    angles++;
                } else if (t.is(">") && angles > 0) {
                    angles--;
                } else if (t.is(",") && parens == 1 && angles == 0) {
                    if (lastIdentifier != null) names.add(lastIdentifier);
                    lastIdentifier = null;
                } else if (t.kind() == TokenKind.IDENTIFIER && parens == 1) {
                    lastIdentifier = t.text();
                }
                pos++;
            }
            if (lastIdentifier != null) names.add(lastIdentifier);
            return names;
        }

        // --- Control flow ---

        private SyntaxNode parseControlFlow(NodeKind kind) {
            Token keyword = tokens.get(pos);
            pos++;
            if (isAt(pos, "(")) skipParens();
            return node(kind, keyword.text(), keyword, parseBody());
        }

        /** If statements keep their else / else-if branches as further children. */
        private SyntaxNode parseIfStatement() {
            Token keyword = tokens.get(pos);
            pos++;
            if (isAt(pos, "(")) skipParens();
            List<SyntaxNode> children = new ArrayList<>(parseBody());
            if (isAt(pos, "else")) {
                pos++;
                children.addAll(parseBody());
            }
            return node(NodeKind.IF_STATEMENT, "if", keyword, children);
        }

        private SyntaxNode parseTryStatement() {
            Token keyword = tokens.get(pos);
            pos++;
            if (isAt(pos, "(")) skipParens(); // try-with-resources
            List<SyntaxNode> children = new ArrayList<>(parseBlock());
            while (isAt(pos, "catch")) {
                pos++;
                if (isAt(pos, "(")) skipParens();
                children.addAll(parseBlock());
            }
            if (isAt(pos, "finally")) {
                pos++;
                children.addAll(parseBlock());
            }
            return node(NodeKind.TRY_STATEMENT, "try", keyword, children);
        }

        /** Body of a control-flow statement: a braced block or one statement. */
        private List<SyntaxNode> parseBody() {
            if (pos >= tokens.size()) return List.of();
            if (isAt(pos, "{")) return parseBlock();
            if (isAt(pos, ";")) {
                pos++;
                return List.of();
            }
            if (isAt(pos, "}")) return List.of();
            if (depth >= MAX_NESTING) {
                skipToStatementEnd(null);
                return List.of();
            }
            depth++;
            try {
                int before = pos;
                SyntaxNode single = parseStatement();
                if (pos == before) pos++;
                return single == null ? List.of() : List.of(single);
            } finally {
                depth--;
            }
        }

        /**
         * Locates the next {@code {} and parses statements until its matching {@code }}.
         * Nested anonymous blocks are flattened into the enclosing block.
         */
        private List<SyntaxNode> parseBlock() {
            while (pos < tokens.size() && !isAt(pos, "{")) pos++;
            if (pos >= tokens.size()) return List.of();
            pos++;

            if (depth >= MAX_NESTING) {
                skipBalancedBraces();
                return List.of();
            }
            depth++;
            try {
                List<SyntaxNode> children = new ArrayList<>();
                int braces = 1;
                while (pos < tokens.size()) {
                    if (isAt(pos, "{")) {
                        braces++;
                        pos++;
                        continue;
                    }
                    if (isAt(pos, "}")) {
                        braces--;
                        pos++;
                        if (braces == 0) break;
                        continue;
                    }
                    int before = pos;
                    SyntaxNode child = parseStatement();
                    if (child != null) children.add(child);
                    if (pos == before) pos++;
                }
                return children;
            } finally {
                depth--;
            }
        }

        // --- Identifier-led statements ---

        private SyntaxNode parseIdentifierStatement() {
            int start = pos;

            int typeEnd = skipType(pos);
            if (typeEnd > pos && isKind(typeEnd, TokenKind.IDENTIFIER) && isAt(typeEnd + 1, "(")) {
                return parseMethodDeclaration(List.of(), start);
            }

            StringBuilder name = new StringBuilder(tokens.get(pos).text());
            int j = pos + 1;
            while (isAt(j, ".") && isKind(j + 1, TokenKind.IDENTIFIER)) {
                name.append('.').append(tokens.get(j + 1).text());
                j += 2;
            }

            if (isAt(j, "(")) {
                pos = j;
                skipParens();
                List<SyntaxNode> chained = new ArrayList<>();
                while (isAt(pos, ".") && isKind(pos + 1, TokenKind.IDENTIFIER) && isAt(pos + 2, "(")) {
                    Token segment = tokens.get(pos + 1);
                    pos += 2;
                    skipParens();
                    chained.add(node(NodeKind.METHOD_CALL, segment.text(), segment, List.of()));
                }
                if (isAt(pos, ";")) pos++;
                return node(NodeKind.METHOD_CALL, name.toString(), tokens.get(start), chained);
            }

            pos = j;
            List<SyntaxNode> calls = new ArrayList<>();
            skipToStatementEnd(calls);
            return node(NodeKind.ASSIGNMENT, name.toString(), tokens.get(start), calls);
        }

        private SyntaxNode parseDirective() {
            Token keyword = tokens.get(pos);
            pos++;
            StringBuilder label = new StringBuilder(keyword.text()).append(' ');
            while (pos < tokens.size() && !isAt(pos, ";") && !isAt(pos, "{") && !isAt(pos, "}")) {
                Token t = tokens.get(pos);
                label.append(t.text());
                if (t.kind() == TokenKind.KEYWORD) label.append(' ');
                pos++;
            }
            if (isAt(pos, ";")) pos++;
            return node(NodeKind.GENERIC_STATEMENT, label.toString().trim(), keyword, List.of());
        }

        private SyntaxNode parseGenericStatement() {
            Token token = tokens.get(pos);
            pos++;
            return node(NodeKind.GENERIC_STATEMENT, token.text(), token, List.of());
        }

        // --- Scanning helpers ---

        /**
         * Advances past the terminating {@code ;} of the current statement. Braces opened inside
         * the statement are balanced; an unmatched {@code }} ends the scan without being consumed.
         * When {@code calls} is non-null, call sites met on the way are collected into it.
         */
        private void skipToStatementEnd(List<SyntaxNode> calls) {
            int braces = 0;
            while (pos < tokens.size()) {
                Token t = tokens.get(pos);
                if (t.is("{")) {
                    braces++;
                } else if (t.is("}")) {
                    if (braces == 0) return;
                    braces--;
                } else if (t.is(";") && braces == 0) {
                    pos++;
                    return;
                } else if (t.is("new")) {
                    int typeEnd = skipType(pos + 1);
                    pos = Math.max(pos + 1, typeEnd);
                    continue;
                } else if (calls != null && t.kind() == TokenKind.IDENTIFIER && !isAt(pos - 1, ".")) {
                    int j = pos + 1;
                    StringBuilder name = new StringBuilder(t.text());
                    while (isAt(j, ".") && isKind(j + 1, TokenKind.IDENTIFIER)) {
                        name.append('.').append(tokens.get(j + 1).text());
                        j += 2;
                    }
                    if (isAt(j, "(")) {
                        calls.add(node(NodeKind.METHOD_CALL, name.toString(), t, List.of()));
                    }
                    pos = j;
                    continue;
                }
                pos++;
            }
        }

        private void skipParens() {
            if (!isAt(pos, "(")) return;
            int parens = 0;
            while (pos < tokens.size()) {
                Token t = tokens.get(pos);
                if (t.is("(")) parens++;
                if (t.is(")")) parens--;
                pos++;
                if (parens == 0) return;
            }
        }

        private void skipBalancedBraces() {
            int braces = 1;
            while (pos < tokens.size() && braces > 0) {
                if (isAt(pos, "{")) braces++;
                if (isAt(pos, "}")) braces--;
                pos++;
            }
        }

        /** Skips {@code @Name}, {@code @a.b.Name} and {@code @Name(...)}. */
        private void skipAnnotation() {
            pos++;
            if (isKind(pos, TokenKind.IDENTIFIER) || isKind(pos, TokenKind.KEYWORD)) pos++;
            while (isAt(pos, ".") && isKind(pos + 1, TokenKind.IDENTIFIER)) pos += 2;
            if (isAt(pos, "(")) skipParens();
        }

        /** True when the tokens at {@code i} read as {@code [<T>] Type name (} or {@code Name (}. */
        private boolean looksLikeMethod(int i) {
            int j = i;
            if (isAt(j, "<")) {
                j = skipAngles(j);
                if (j < 0) return false;
            }
            if (isKind(j, TokenKind.IDENTIFIER) && isAt(j + 1, "(")) return true;
            int typeEnd = skipType(j);
            return typeEnd > j && isKind(typeEnd, TokenKind.IDENTIFIER) && isAt(typeEnd + 1, "(");
        }

        /**
         * Skips a type reference ({@code int}, {@code a.b.C}, {@code List<String>}, {@code int[]})
         * starting at {@code i}. Returns {@code i} unchanged when no type starts there.
         */
        private int skipType(int i) {
            if (!(isKind(i, TokenKind.IDENTIFIER)
                    || (isKind(i, TokenKind.KEYWORD) && PRIMITIVE_TYPES.contains(tokens.get(i).text())))) {
                return i;
            }
            int j = i + 1;
            while (isAt(j, ".") && isKind(j + 1, TokenKind.IDENTIFIER)) j += 2;
            if (isAt(j, "<")) {
                int afterArgs = skipAngles(j);
                if (afterArgs < 0) return i;
                j = afterArgs;
            }
            while (isAt(j, "[") && isAt(j + 1, "]")) j += 2;
            return j;
        }

        /** Returns the index after the {@code >} matching the {@code <} at {@code i}, or -1. */
        private int skipAngles(int i) {
            int angles = 0;
            int j = i;
            while (j < tokens.size()) {
                Token t = tokens.get(j);
                if (t.is("<")) {
                    angles++;
                } else if (t.is(">")) {
                    angles--;
                    if (angles == 0) return j + 1;
                } else if (t.is(";") || t.is("{") || t.is("}") || t.is("(") || t.is(")") || t.is("=")) {
                    return -1;
                }
                j++;
            }
            return -1;
        }

        private String joinTexts(int from, int to) {
            StringBuilder sb = new StringBuilder();
            for (int i = from; i < to && i < tokens.size(); i++) sb.append(tokens.get(i).text());
            return sb.toString();
        }

        private boolean isAt(int i, String text) {
            return i >= 0 && i < tokens.size() && tokens.get(i).is(text);
        }

        private boolean isKind(int i, TokenKind kind) {
            return i >= 0 && i < tokens.size() && tokens.get(i).kind() == kind;
        }

        private static SyntaxNode node(NodeKind kind, String label, Token at, List<SyntaxNode> children) {
            return new SyntaxNode(kind, label, children, at.position(), NodeRules.metadataFor(kind, label));
        }
    }
}
