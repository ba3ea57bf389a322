package com.codeflow.core.parser;

import com.codeflow.core.classifier.StatementClassifier;
import com.codeflow.core.model.Conditional;
import com.codeflow.core.model.FlowElement;
import com.codeflow.core.model.Loop;
import com.codeflow.core.model.LoopKind;
import com.codeflow.core.model.Sequence;
import com.codeflow.core.model.Statement;
import com.codeflow.core.model.Switch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Recursive-descent builder turning a brace-delimited block into a control tree.
 *
 * <p>The builder understands the control constructs shared by the C-like families:
 * <ul>
 *   <li>{@code if (c) ... else if (c) ... else ...}</li>
 *   <li>{@code for (header) ...} and {@code while (c) ...} (pre-test loops, the
 *       {@code for} header is kept as one opaque string)</li>
 *   <li>{@code do ... while (c);} (post-test loop)</li>
 *   <li>{@code switch (x) { case ...: ... default: ... }}</li>
 * </ul>
 * Everything else is read up to its {@code ;} and classified as a {@link Statement}.
 * Bodies may be braced blocks or single statements; a single statement that is itself a
 * construct is parsed recursively.
 *
 * <p>The builder is permissive: unbalanced braces consume to the end of the text and a
 * stray {@code else} or <code>}</code> is skipped. Only an {@code if}, {@code for} or
 * {@code while} that is not followed by its parenthesized header, or a {@code switch}
 * without a braced body, raises {@link FlowParseException}.
 *
 * <h2>Switch Cases</h2>
 * <p>Each case body runs up to its first top-level {@code break;}. Statements after
 * that point, and fallthrough into the next case, are not modeled. A case body wrapped
 * in braces ({@code case 1: { a = 1; break; }}) ends at the first {@code break;}
 * directly inside the braces.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ControlTreeBuilder builder = new ControlTreeBuilder(new CStatementClassifier());
 * Sequence tree = builder.build("int x = 0; while (x < 3) { x++; } return x;");
 * }</pre>
 *
 * <p>Instances hold no per-call state and may be shared across threads.
 *
 * @since 1.0.0
 */
public final class ControlTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(ControlTreeBuilder.class);

    private static final String IF = "if";
    private static final String ELSE = "else";
    private static final String FOR = "for";
    private static final String WHILE = "while";
    private static final String DO = "do";
    private static final String SWITCH = "switch";
    private static final String CASE = "case";
    private static final String DEFAULT = "default";
    private static final String BREAK = "break";

    // "do" and "switch" are ordinary identifiers in Python; "do = 1" is not a loop.
    // "do ;" is a loop with an empty body.
    private static final String NOT_A_DO_BODY = "=.([+-*/%<>!,)";

    private final StatementClassifier classifier;

    public ControlTreeBuilder(StatementClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Parses the statements of a block (without its enclosing braces).
     *
     * @param block block content
     * @return control tree of the block
     * @throws FlowParseException if a construct keyword lacks its header
     */
    public Sequence build(String block) {
        Objects.requireNonNull(block, "block must not be null");
        Sequence tree = new Sequence(new Parser(block).parseAll());
        log.debug("Built control tree with {} top-level elements", tree.size());
        return tree;
    }

    /**
     * Cursor over one block of text. Nested blocks get their own parser.
     */
    private final class Parser {

        private final String text;
        private int pos;

        Parser(String text) {
            this.text = text;
        }

        List<FlowElement> parseAll() {
            List<FlowElement> elements = new ArrayList<>();
            while (true) {
                pos = BlockReader.skipWhitespace(text, pos);
                if (pos >= text.length()) {
                    return elements;
                }
                parseElement(elements);
            }
        }

        private void parseElement(List<FlowElement> out) {
            char ch = text.charAt(pos);
            if (ch == '{') {
                BlockReader.Span block = BlockReader.readBlock(text, pos);
                pos = block.next();
                out.addAll(new Parser(block.content()).parseAll());
            } else if (ch == '}' || ch == BlockReader.STATEMENT_TERMINATOR) {
                pos++;
            } else if (atKeyword(IF)) {
                out.add(parseConditional());
            } else if (atKeyword(FOR)) {
                out.add(parsePreTestLoop(FOR));
            } else if (atKeyword(WHILE)) {
                out.add(parsePreTestLoop(WHILE));
            } else if (atKeyword(DO) && !followedByAny(DO, NOT_A_DO_BODY)) {
                out.add(parsePostTestLoop());
            } else if (atKeyword(SWITCH) && followedByAny(SWITCH, "(")) {
                out.add(parseSwitch());
            } else if (atKeyword(ELSE)) {
                log.debug("Skipping dangling 'else' at offset {}", pos);
                pos += ELSE.length();
            } else {
                BlockReader.Span statement = BlockReader.readStatement(text, pos);
                pos = statement.next();
                String content = statement.content();
                if (!content.isEmpty() && !content.equals(String.valueOf(BlockReader.STATEMENT_TERMINATOR))) {
                    out.add(new Statement(content, classifier.classify(content)));
                }
            }
        }

        private Conditional parseConditional() {
            List<Conditional.Clause> clauses = new ArrayList<>();
            pos += IF.length();
            String condition = readHeader(IF);
            clauses.add(new Conditional.Clause(condition, parseBody()));

            Optional<Sequence> elseBody = Optional.empty();
            while (true) {
                int save = pos;
                pos = BlockReader.skipWhitespace(text, pos);
                if (!atKeyword(ELSE)) {
                    pos = save;
                    break;
                }
                pos = BlockReader.skipWhitespace(text, pos + ELSE.length());
                if (atKeyword(IF)) {
                    pos += IF.length();
                    String elseIfCondition = readHeader(IF);
                    clauses.add(new Conditional.Clause(elseIfCondition, parseBody()));
                } else {
                    elseBody = Optional.of(parseBody());
                    break;
                }
            }
            return new Conditional(clauses, elseBody);
        }

        private Loop parsePreTestLoop(String keyword) {
            pos += keyword.length();
            String header = readHeader(keyword);
            return new Loop(LoopKind.PRE_TEST, keyword, header, parseBody());
        }

        private Loop parsePostTestLoop() {
            pos += DO.length();
            Sequence body = parseBody();
            pos = BlockReader.skipWhitespace(text, pos);
            String condition = "";
            if (atKeyword(WHILE)) {
                pos += WHILE.length();
                condition = readHeader(WHILE);
                pos = BlockReader.skipWhitespace(text, pos);
                if (pos < text.length() && text.charAt(pos) == BlockReader.STATEMENT_TERMINATOR) {
                    pos++;
                }
            } else {
                log.debug("'do' block without trailing 'while' at offset {}", pos);
            }
            return new Loop(LoopKind.POST_TEST, DO, condition, body);
        }

        private Switch parseSwitch() {
            pos += SWITCH.length();
            String selector = readHeader(SWITCH);
            pos = BlockReader.skipWhitespace(text, pos);
            if (pos >= text.length() || text.charAt(pos) != '{') {
                throw new FlowParseException("Expected '{' after switch (" + selector + ") at offset " + pos);
            }
            BlockReader.Span block = BlockReader.readBlock(text, pos);
            pos = block.next();
            return new Switch(selector, splitCases(block.content()));
        }

        private Sequence parseBody() {
            pos = BlockReader.skipWhitespace(text, pos);
            if (pos >= text.length()) {
                return Sequence.empty();
            }
            char ch = text.charAt(pos);
            if (ch == '{') {
                BlockReader.Span block = BlockReader.readBlock(text, pos);
                pos = block.next();
                return new Sequence(new Parser(block.content()).parseAll());
            }
            if (ch == BlockReader.STATEMENT_TERMINATOR) {
                pos++;
                return Sequence.empty();
            }
            List<FlowElement> single = new ArrayList<>(1);
            parseElement(single);
            return new Sequence(single);
        }

        private String readHeader(String keyword) {
            pos = BlockReader.skipWhitespace(text, pos);
            if (pos >= text.length() || text.charAt(pos) != '(') {
                throw new FlowParseException("Expected '(' after '" + keyword + "' at offset " + pos);
            }
            BlockReader.Span header = BlockReader.readBlock(text, pos);
            pos = header.next();
            return header.content().strip();
        }

        private boolean atKeyword(String keyword) {
            return BlockReader.startsWithKeyword(text, pos, keyword);
        }

        private boolean followedByAny(String keyword, String chars) {
            int next = BlockReader.skipWhitespace(text, pos + keyword.length());
            return next < text.length() && chars.indexOf(text.charAt(next)) >= 0;
        }
    }

    // ==================== Switch Bodies ====================

    private List<Switch.SwitchCase> splitCases(String body) {
        List<Integer> starts = caseStarts(body);
        List<Switch.SwitchCase> cases = new ArrayList<>();
        for (int i = 0; i < starts.size(); i++) {
            int start = starts.get(i);
            int end = i + 1 < starts.size() ? starts.get(i + 1) : body.length();
            String part = body.substring(start, end);
            LabelEnd labelEnd = labelEnd(part);
            String label = part.substring(0, labelEnd.start).strip().replaceAll("\\s+", " ");
            String caseBody = truncateAtBreak(part.substring(labelEnd.next));
            cases.add(new Switch.SwitchCase(label, build(caseBody)));
        }
        return cases;
    }

    private static List<Integer> caseStarts(String body) {
        List<Integer> starts = new ArrayList<>();
        int depth = 0;
        int i = 0;
        while (i < body.length()) {
            char ch = body.charAt(i);
            if (BlockReader.isQuote(ch)) {
                i = BlockReader.skipLiteral(body, i);
                continue;
            }
            if (ch == '{' || ch == '(') {
                depth++;
            } else if ((ch == '}' || ch == ')') && depth > 0) {
                depth--;
            } else if (depth == 0 && (i == 0 || !BlockReader.isIdentifierChar(body.charAt(i - 1)))
                && (BlockReader.startsWithKeyword(body, i, CASE) || BlockReader.startsWithKeyword(body, i, DEFAULT))) {
                starts.add(i);
            }
            i++;
        }
        return starts;
    }

    private record LabelEnd(int start, int next) {
    }

    // The label stops at the first top-level ':' (not '::') or '->'.
    private static LabelEnd labelEnd(String part) {
        int depth = 0;
        int i = 0;
        while (i < part.length()) {
            char ch = part.charAt(i);
            if (BlockReader.isQuote(ch)) {
                i = BlockReader.skipLiteral(part, i);
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if ((ch == ')' || ch == ']' || ch == '}') && depth > 0) {
                depth--;
            } else if (depth == 0 && ch == ':') {
                if (i + 1 < part.length() && part.charAt(i + 1) == ':') {
                    i += 2;
                    continue;
                }
                return new LabelEnd(i, i + 1);
            } else if (depth == 0 && ch == '-' && i + 1 < part.length() && part.charAt(i + 1) == '>') {
                return new LabelEnd(i, i + 2);
            }
            i++;
        }
        return new LabelEnd(part.length(), part.length());
    }

    private static String truncateAtBreak(String caseBody) {
        String stripped = caseBody.strip();
        if (!stripped.isEmpty() && stripped.charAt(0) == '{') {
            String inner = BlockReader.readBlock(stripped, 0).content();
            String truncated = truncateAtBreak(inner);
            if (truncated.length() < inner.length()) {
                return truncated;
            }
        }
        int depth = 0;
        int i = 0;
        while (i < caseBody.length()) {
            char ch = caseBody.charAt(i);
            if (BlockReader.isQuote(ch)) {
                i = BlockReader.skipLiteral(caseBody, i);
                continue;
            }
            if (ch == '{' || ch == '(') {
                depth++;
            } else if ((ch == '}' || ch == ')') && depth > 0) {
                depth--;
            } else if (depth == 0 && (i == 0 || !BlockReader.isIdentifierChar(caseBody.charAt(i - 1)))
                && BlockReader.startsWithKeyword(caseBody, i, BREAK)) {
                int after = BlockReader.skipWhitespace(caseBody, i + BREAK.length());
                if (after >= caseBody.length() || caseBody.charAt(after) == BlockReader.STATEMENT_TERMINATOR) {
                    return caseBody.substring(0, i);
                }
            }
            i++;
        }
        return caseBody;
    }
}
