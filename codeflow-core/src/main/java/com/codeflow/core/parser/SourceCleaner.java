package com.codeflow.core.parser;

import java.util.stream.Collectors;

/**
 * Removes comments and preprocessor-like directives before a snippet is parsed.
 *
 * <p>Comment markers inside string and character literals are left alone, so
 * {@code printf("http://x");} survives intact. Line structure is preserved: a removed
 * block comment keeps its line breaks, which matters for indentation-based front ends.
 *
 * @since 1.0.0
 */
public final class SourceCleaner {

    private SourceCleaner() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Strips {@code //} line comments and {@code /* ... *\/} block comments.
     *
     * @param source source text
     * @return text without comments
     */
    public static String stripCStyleComments(String source) {
        StringBuilder out = new StringBuilder(source.length());
        int n = source.length();
        int i = 0;
        while (i < n) {
            char ch = source.charAt(i);
            if (BlockReader.isQuote(ch)) {
                int end = BlockReader.skipLiteral(source, i);
                out.append(source, i, end);
                i = end;
            } else if (source.startsWith("//", i)) {
                i = lineEnd(source, i);
            } else if (source.startsWith("/*", i)) {
                int close = source.indexOf("*/", i + 2);
                int end = close < 0 ? n : close + 2;
                out.append(' ');
                source.substring(i, end).chars().filter(c -> c == '\n').forEach(c -> out.append('\n'));
                i = end;
            } else {
                out.append(ch);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Strips {@code #} line comments.
     *
     * @param source source text
     * @return text without comments
     */
    public static String stripHashComments(String source) {
        StringBuilder out = new StringBuilder(source.length());
        int n = source.length();
        int i = 0;
        while (i < n) {
            char ch = source.charAt(i);
            if (BlockReader.isQuote(ch)) {
                int end = BlockReader.skipLiteral(source, i);
                out.append(source, i, end);
                i = end;
            } else if (ch == '#') {
                i = lineEnd(source, i);
            } else {
                out.append(ch);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Drops preprocessor directive lines ({@code #include}, {@code #define}, ...).
     *
     * @param source source text
     * @return text without directive lines
     */
    public static String stripDirectives(String source) {
        return source.lines()
            .filter(line -> !line.strip().startsWith("#"))
            .collect(Collectors.joining("\n"));
    }

    private static int lineEnd(String source, int from) {
        int newline = source.indexOf('\n', from);
        return newline < 0 ? source.length() : newline;
    }
}
