package com.codeflow.core.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Nesting-aware scanning over C-style source text.
 *
 * <p>All operations are best-effort: unbalanced input never raises an error, the scan
 * simply consumes to the end of the text and returns what it collected. String and
 * character literals are skipped, so delimiters inside {@code "..."} or {@code '...'}
 * never change the nesting depth.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * String text = "(x > 0) { y = 1; }";
 * BlockReader.Span condition = BlockReader.readBlock(text, 0);   // content "x > 0"
 * int bodyStart = BlockReader.skipWhitespace(text, condition.next());
 * BlockReader.Span body = BlockReader.readBlock(text, bodyStart); // content " y = 1; "
 * }</pre>
 *
 * @since 1.0.0
 */
public final class BlockReader {

    public static final char STATEMENT_TERMINATOR = ';';

    private BlockReader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Result of a scan: the text read and the index just past it.
     *
     * @param content text read (for blocks, without the delimiters)
     * @param next index of the first character after the scanned span
     */
    public record Span(String content, int next) {
    }

    /**
     * Reads a parenthesized or braced block.
     *
     * @param text source text
     * @param start index of the opening {@code (} or <code>{</code>
     * @return enclosed content and the index just past the matching closer, or the
     *         remaining text and {@code text.length()} when the block is never closed
     * @throws IllegalArgumentException if {@code start} is not at an opening delimiter
     */
    public static Span readBlock(String text, int start) {
        char open = text.charAt(start);
        if (open != '(' && open != '{') {
            throw new IllegalArgumentException("Expected '(' or '{' at index " + start + " but found '" + open + "'");
        }
        char close = open == '(' ? ')' : '}';
        int depth = 0;
        int n = text.length();
        int i = start;
        while (i < n) {
            char ch = text.charAt(i);
            if (isQuote(ch)) {
                i = skipLiteral(text, i);
                continue;
            }
            if (ch == open) {
                depth++;
            } else if (ch == close) {
                depth--;
                if (depth == 0) {
                    return new Span(text.substring(start + 1, i), i + 1);
                }
            }
            i++;
        }
        return new Span(text.substring(start + 1), n);
    }

    /**
     * Reads one statement up to and including the first {@code ;} outside parentheses.
     *
     * @param text source text
     * @param start index where the statement begins
     * @return trimmed statement text and the index after the terminator, or the trimmed
     *         rest of the text and {@code text.length()} when no terminator follows
     */
    public static Span readStatement(String text, int start) {
        int depth = 0;
        int n = text.length();
        int i = start;
        while (i < n) {
            char ch = text.charAt(i);
            if (isQuote(ch)) {
                i = skipLiteral(text, i);
                continue;
            }
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                if (depth > 0) {
                    depth--;
                }
            } else if (ch == STATEMENT_TERMINATOR && depth == 0) {
                return new Span(text.substring(start, i + 1).strip(), i + 1);
            }
            i++;
        }
        return new Span(text.substring(Math.min(start, n)).strip(), n);
    }

    /**
     * Skips a string or character literal.
     *
     * <p>An unterminated literal ends at the next line break so that a stray apostrophe
     * cannot swallow the rest of the snippet.
     *
     * @param text source text
     * @param start index of the opening quote
     * @return index just past the closing quote
     */
    public static int skipLiteral(String text, int start) {
        char quote = text.charAt(start);
        int n = text.length();
        int i = start + 1;
        while (i < n) {
            char ch = text.charAt(i);
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == quote) {
                return i + 1;
            }
            if (ch == '\n') {
                return i;
            }
            i++;
        }
        return n;
    }

    /**
     * Returns the first index at or after {@code start} that is not whitespace.
     *
     * @param text source text
     * @param start index to start from
     * @return index of the next non-whitespace character, or {@code text.length()}
     */
    public static int skipWhitespace(String text, int start) {
        int i = start;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Checks whether {@code keyword} starts at {@code index} as a whole word.
     *
     * <p>The character after the keyword must not be an identifier character, so
     * {@code iffy = 1;} is not mistaken for an {@code if}.
     *
     * @param text source text
     * @param index candidate position
     * @param keyword keyword to look for
     * @return true if the keyword starts at the index
     */
    public static boolean startsWithKeyword(String text, int index, String keyword) {
        if (!text.startsWith(keyword, index)) {
            return false;
        }
        int end = index + keyword.length();
        return end == text.length() || !isIdentifierChar(text.charAt(end));
    }

    /**
     * Splits text on a separator that appears outside any bracket or literal.
     *
     * <p>Used for declarator lists such as {@code int a = max(1, 2), b;}.
     *
     * @param text text to split
     * @param separator separator character
     * @return trimmed, non-empty parts
     */
    public static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int segmentStart = 0;
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (isQuote(ch)) {
                i = skipLiteral(text, i);
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if ((ch == ')' || ch == ']' || ch == '}') && depth > 0) {
                depth--;
            } else if (ch == separator && depth == 0) {
                addPart(parts, text.substring(segmentStart, i));
                segmentStart = i + 1;
            }
            i++;
        }
        addPart(parts, text.substring(segmentStart));
        return parts;
    }

    public static boolean isIdentifierChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
    }

    static boolean isQuote(char ch) {
        return ch == '"' || ch == '\'';
    }

    private static void addPart(List<String> parts, String part) {
        String trimmed = part.strip();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }
}
