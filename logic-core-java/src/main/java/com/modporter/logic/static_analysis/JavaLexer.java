package com.modporter.logic.static_analysis;

import com.modporter.logic.ir.IrModel.SourcePosition;
import com.modporter.logic.ir.IrModel.Token;
import com.modporter.logic.ir.IrModel.TokenKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Approximate Java tokenizer.
 *
 * Block comments are cut out first and replaced by blanks of the same length, so the
 * line/column of every other token is unchanged; they come back as COMMENT tokens.
 * The rest is scanned line by line. Multi-character operators come out as single
 * characters ({@code ==} is two {@code =} tokens).
 */
public class JavaLexer {

    // Strings and line comments are scanned by hand; see scanLine.
    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9_$]+|[{}();,.\\[\\]<>=!&|+\\-*/%@]");

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:[lLfFdD])?|0[xX][0-9a-fA-F]+");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    static final Set<String> KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char",
            "class", "const", "continue", "default", "do", "double", "else", "enum",
            "extends", "final", "finally", "float", "for", "goto", "if", "implements",
            "import", "instanceof", "int", "interface", "long", "native", "new",
            "package", "private", "protected", "public", "return", "short", "static",
            "strictfp", "super", "switch", "synchronized", "this", "throw", "throws",
            "transient", "try", "void", "volatile", "while");

    private static final Set<String> OPERATORS = Set.of(
            "+", "-", "*", "/", "%", "=", "!", "&", "|", "<", ">");

    private static final Set<String> PUNCTUATION = Set.of(
            "{", "}", "(", ")", "[", "]", ";", ",", ".");

    /**
     * Tokenizes {@code source}. Never throws on malformed input; unrecognized characters
     * are dropped and unrecognized words become UNKNOWN tokens.
     */
    public List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        LineIndex lines = new LineIndex(source);

        String blanked = extractBlockComments(source, lines, tokens);

        int lineStart = 0;
        while (lineStart <= blanked.length()) {
            int lineEnd = blanked.indexOf('\n', lineStart);
            if (lineEnd < 0) lineEnd = blanked.length();
            if (!blanked.substring(lineStart, lineEnd).isBlank()) {
                scanLine(blanked, lineStart, lineEnd, lines, tokens);
            }
            lineStart = lineEnd + 1;
        }

        tokens.sort(Comparator.comparingInt(t -> t.position().byteOffset()));
        return tokens;
    }

    /**
     * Scans {@code source[start, end)} left to right. A string without a closing quote on
     * its line loses the quote and its contents are scanned as ordinary tokens.
     */
    private static void scanLine(String source, int start, int end, LineIndex lines, List<Token> out) {
        Matcher m = TOKEN.matcher(source);
        int i = start;
        while (i < end) {
            char c = source.charAt(i);
            int tokenEnd;
            if (c == '"') {
                tokenEnd = closingQuote(source, i, end);
                if (tokenEnd < 0) {
                    i++;
                    continue;
                }
            } else if (c == '/' && i + 1 < end && source.charAt(i + 1) == '/') {
                tokenEnd = end;
            } else {
                m.region(i, end);
                if (!m.lookingAt()) {
                    i++;
                    continue;
                }
                tokenEnd = m.end();
            }
            String text = source.substring(i, tokenEnd);
            out.add(new Token(classify(text), text, lines.positionOf(i)));
            i = tokenEnd;
        }
    }

    /** Index just past the quote closing the string opened at {@code quote}, or -1 if the line ends first. */
    private static int closingQuote(String source, int quote, int end) {
        int i = quote + 1;
        while (i < end) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '"') {
                return i + 1;
            } else {
                i++;
            }
        }
        return -1;
    }

    /**
     * Classifies one token text. Order matters: keyword table first, identifier regex last.
     */
    static TokenKind classify(String text) {
        if (KEYWORDS.contains(text)) return TokenKind.KEYWORD;
        if (text.startsWith("//") || (text.startsWith("/*") && text.endsWith("*/"))) return TokenKind.COMMENT;
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) return TokenKind.STRING_LITERAL;
        if (OPERATORS.contains(text)) return TokenKind.OPERATOR;
        if (PUNCTUATION.contains(text)) return TokenKind.PUNCTUATION;
        if (NUMBER.matcher(text).matches()) return TokenKind.NUMBER;
        if (IDENTIFIER.matcher(text).matches()) return TokenKind.IDENTIFIER;
        return TokenKind.UNKNOWN;
    }

    /**
     * Finds non-nested block comments outside string literals and line comments,
     * appends them to {@code out} and returns the source with each comment blanked.
     * An unterminated block comment is left in place.
     */
    private String extractBlockComments(String source, LineIndex lines, List<Token> out) {
        StringBuilder blanked = new StringBuilder(source);
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            if (c == '"') {
                i = skipString(source, i);
            } else if (c == '/' && i + 1 < n && source.charAt(i + 1) == '/') {
                int nl = source.indexOf('\n', i);
                i = nl < 0 ? n : nl;
            } else if (c == '/' && i + 1 < n && source.charAt(i + 1) == '*') {
                int close = source.indexOf("*/", i + 2);
                if (close < 0) break;
                int end = close + 2;
                out.add(new Token(TokenKind.COMMENT, source.substring(i, end), lines.positionOf(i)));
                for (int k = i; k < end; k++) {
                    if (blanked.charAt(k) != '\n') blanked.setCharAt(k, ' ');
                }
                i = end;
            } else {
                i++;
            }
        }
        return blanked.toString();
    }

    private static int skipString(String source, int quote) {
        int i = quote + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '"' || c == '\n') {
                return i + 1;
            } else {
                i++;
            }
        }
        return i;
    }

    /** Maps character offsets back to 1-based line/column and UTF-8 byte offset. */
    private static final class LineIndex {
        private final List<Integer> lineStarts = new ArrayList<>();
        private final int[] byteOffsets;

        LineIndex(String source) {
            lineStarts.add(0);
            byteOffsets = new int[source.length() + 1];
            int bytes = 0;
            for (int i = 0; i < source.length(); i++) {
                byteOffsets[i] = bytes;
                char c = source.charAt(i);
                if (c == '\n') lineStarts.add(i + 1);
                if (c < 0x80) {
                    bytes += 1;
                } else if (c < 0x800) {
                    bytes += 2;
                } else if (Character.isHighSurrogate(c) && i + 1 < source.length()
                        && Character.isLowSurrogate(source.charAt(i + 1))) {
                    // the pair is one 4-byte code point; the low half shares its offset
                    byteOffsets[i + 1] = byteOffsets[i];
                    bytes += 4;
                    i++;
                } else {
                    bytes += 3;
                }
            }
            byteOffsets[source.length()] = bytes;
        }

        SourcePosition positionOf(int offset) {
            int lo = 0;
            int hi = lineStarts.size() - 1;
            while (lo < hi) {
                int mid = (lo + hi + 1) >>> 1;
                if (lineStarts.get(mid) <= offset) lo = mid; else hi = mid - 1;
            }
            return new SourcePosition(lo + 1, offset - lineStarts.get(lo) + 1, byteOffsets[offset]);
        }
    }
}
