package com.codeflow.core.frontend.impl.python;

import com.codeflow.core.parser.BlockReader;
import com.codeflow.core.parser.FlowParseException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Rewrites indentation-delimited Python into the brace form read by the shared
 * control-tree builder.
 *
 * <h2>Header Mapping</h2>
 * <table>
 *   <caption>Python headers and their brace form</caption>
 *   <tr><th>Python</th><th>Brace form</th></tr>
 *   <tr><td>{@code if c:}</td><td>{@code if (c) {}</td></tr>
 *   <tr><td>{@code elif c:}</td><td>{@code else if (c) {}</td></tr>
 *   <tr><td>{@code else:}</td><td>{@code else {}</td></tr>
 *   <tr><td>{@code while c:}</td><td>{@code while (c) {}</td></tr>
 *   <tr><td>{@code for x in xs:}</td><td>{@code for (x in xs) {}</td></tr>
 *   <tr><td>{@code match s:}</td><td>{@code switch (s) {}</td></tr>
 *   <tr><td>{@code case p:} / {@code case _:}</td><td>{@code case p: {} / {@code default: {}</td></tr>
 *   <tr><td>{@code try:}, {@code finally:}</td><td>plain block</td></tr>
 *   <tr><td>{@code with w:}</td><td>{@code with w;} followed by a plain block</td></tr>
 *   <tr><td>{@code def f(x):}, {@code class C:}</td><td>{@code def f(x);}, body dropped</td></tr>
 *   <tr><td>{@code except E:}</td><td>dropped with its body</td></tr>
 * </table>
 *
 * <p>Simple statements get a {@code ;} terminator, {@code pass} and bare string literals
 * are dropped. Logical lines spanning several physical lines (open brackets, backslash
 * continuations, triple-quoted strings) are joined first. A dedent that matches no
 * enclosing indentation level raises {@link FlowParseException}.
 *
 * @since 1.0.0
 */
public final class PythonBlockTranslator {

    private static final int TAB_WIDTH = 4;

    private PythonBlockTranslator() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /** One logical source line. */
    record LogicalLine(int number, int indent, String text) {
    }

    /** An open suite: its indentation and whether it is emitted at all. */
    private record Frame(int indent, boolean braced, boolean dropped) {
    }

    /** A header whose suite has not started yet. */
    private record PendingSuite(boolean braced, boolean dropped) {
    }

    /**
     * Translates a Python block.
     *
     * @param source Python statements (comments already removed)
     * @return equivalent brace-delimited text
     * @throws FlowParseException on inconsistent indentation
     */
    public static String translate(String source) {
        List<LogicalLine> lines = logicalLines(source);
        StringBuilder out = new StringBuilder();
        if (lines.isEmpty()) {
            return "";
        }

        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame(lines.get(0).indent(), false, false));
        PendingSuite pending = null;

        for (LogicalLine line : lines) {
            if (pending != null) {
                if (line.indent() > frames.peek().indent()) {
                    frames.push(new Frame(line.indent(), pending.braced(), pending.dropped()));
                } else {
                    // header with no indented body
                    if (pending.braced()) {
                        out.append("}\n");
                    }
                }
                pending = null;
            }
            while (line.indent() < frames.peek().indent()) {
                Frame closed = frames.pop();
                if (closed.braced()) {
                    out.append("}\n");
                }
                if (frames.isEmpty()) {
                    throw new FlowParseException("Unindent below the first line at line " + line.number());
                }
            }
            if (line.indent() != frames.peek().indent()) {
                throw new FlowParseException("Unindent does not match any outer indentation level at line "
                    + line.number());
            }
            pending = translateLine(line, frames.peek().dropped(), out);
        }

        if (pending != null && pending.braced()) {
            out.append("}\n");
        }
        while (!frames.isEmpty()) {
            if (frames.pop().braced()) {
                out.append("}\n");
            }
        }
        return out.toString();
    }

    // ==================== Line Translation ====================

    private static PendingSuite translateLine(LogicalLine line, boolean inDroppedSuite, StringBuilder out) {
        String text = line.text();
        String keyword = leadingKeyword(text);
        int colon = keyword == null ? -1 : headerColon(text);
        if (colon < 0) {
            if (!inDroppedSuite) {
                appendSimpleStatements(text, out);
            }
            return null;
        }

        String header = text.substring(keyword.length(), colon).strip();
        String inlineSuite = text.substring(colon + 1).strip();
        boolean dropped = inDroppedSuite;
        boolean braced = false;

        StringBuilder open = new StringBuilder();
        switch (keyword) {
            case "if" -> open.append("if (").append(header).append(") {");
            case "elif" -> open.append("else if (").append(header).append(") {");
            case "else" -> open.append("else {");
            case "while" -> open.append("while (").append(header).append(") {");
            case "for" -> open.append("for (").append(header).append(") {");
            case "match" -> open.append("switch (").append(header).append(") {");
            case "case" -> {
                if (header.equals("_")) {
                    open.append("default: {");
                } else {
                    open.append("case ").append(header).append(": {");
                }
            }
            case "try", "finally" -> open.append("{");
            case "with" -> open.append("with ").append(header).append(";\n{");
            case "def", "class" -> {
                if (!inDroppedSuite) {
                    out.append(keyword).append(' ').append(header).append(";\n");
                }
                dropped = true;
            }
            default -> dropped = true; // except
        }
        if (open.length() > 0) {
            braced = true;
            if (!dropped) {
                out.append(open).append('\n');
            }
        }
        boolean emitsBrace = braced && !dropped;

        if (!inlineSuite.isEmpty()) {
            if (!dropped) {
                appendSimpleStatements(inlineSuite, out);
            }
            if (emitsBrace) {
                out.append("}\n");
            }
            return null;
        }
        return new PendingSuite(emitsBrace, dropped);
    }

    private static void appendSimpleStatements(String text, StringBuilder out) {
        for (String statement : BlockReader.splitTopLevel(text, BlockReader.STATEMENT_TERMINATOR)) {
            if (statement.equals("pass") || isBareStringLiteral(statement)) {
                continue;
            }
            out.append(statement).append(BlockReader.STATEMENT_TERMINATOR).append('\n');
        }
    }

    private static final List<String> BLOCK_KEYWORDS = List.of(
        "if", "elif", "else", "while", "for", "match", "case",
        "try", "except", "finally", "with", "def", "class");

    private static String leadingKeyword(String text) {
        for (String keyword : BLOCK_KEYWORDS) {
            if (BlockReader.startsWithKeyword(text, 0, keyword)) {
                return keyword;
            }
        }
        return null;
    }

    // The first ':' outside brackets and literals; -1 when the line is not a header.
    private static int headerColon(String text) {
        int depth = 0;
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '"' || ch == '\'') {
                i = BlockReader.skipLiteral(text, i);
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if ((ch == ')' || ch == ']' || ch == '}') && depth > 0) {
                depth--;
            } else if (ch == ':' && depth == 0) {
                // walrus operator
                if (i + 1 < text.length() && text.charAt(i + 1) == '=') {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    private static boolean isBareStringLiteral(String statement) {
        String text = statement.replaceFirst("^[rRbBuU]{0,2}", "");
        if (text.isEmpty() || (text.charAt(0) != '"' && text.charAt(0) != '\'')) {
            return false;
        }
        return BlockReader.skipLiteral(text, 0) >= text.length();
    }

    // ==================== Logical Lines ====================

    /**
     * Joins physical lines into logical lines and measures their indentation.
     *
     * @param source Python text
     * @return non-blank logical lines in order
     */
    static List<LogicalLine> logicalLines(String source) {
        List<LogicalLine> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        int lineNumber = 1;
        int startLine = 1;
        int n = source.length();
        int i = 0;
        while (i < n) {
            char ch = source.charAt(i);
            if (current.length() == 0) {
                startLine = lineNumber;
            }
            if (ch == '"' || ch == '\'') {
                int end = source.startsWith(String.valueOf(ch).repeat(3), i)
                    ? tripleQuoteEnd(source, i, ch)
                    : BlockReader.skipLiteral(source, i);
                String literal = source.substring(i, end);
                lineNumber += (int) literal.chars().filter(c -> c == '\n').count();
                // a multi-line literal becomes one line
                current.append(literal.replace('\n', ' '));
                i = end;
                continue;
            }
            if (ch == '\\' && i + 1 < n && source.charAt(i + 1) == '\n') {
                current.append(' ');
                lineNumber++;
                i += 2;
                continue;
            }
            if (ch == '\n') {
                lineNumber++;
                if (depth == 0) {
                    addLine(lines, startLine, current);
                    current.setLength(0);
                } else {
                    current.append(' ');
                }
                i++;
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if ((ch == ')' || ch == ']' || ch == '}') && depth > 0) {
                depth--;
            }
            current.append(ch);
            i++;
        }
        addLine(lines, startLine, current);
        return lines;
    }

    private static int tripleQuoteEnd(String source, int start, char quote) {
        String delimiter = String.valueOf(quote).repeat(3);
        int close = source.indexOf(delimiter, start + 3);
        return close < 0 ? source.length() : close + 3;
    }

    private static void addLine(List<LogicalLine> lines, int number, StringBuilder raw) {
        String text = raw.toString();
        if (text.isBlank()) {
            return;
        }
        int indent = 0;
        int i = 0;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            indent += text.charAt(i) == '\t' ? TAB_WIDTH : 1;
            i++;
        }
        lines.add(new LogicalLine(number, indent, text.substring(i).strip()));
    }
}
