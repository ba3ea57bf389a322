package com.codeflow.core.classifier;

import com.codeflow.core.model.ClassifiedStatement;
import com.codeflow.core.model.ShapeKind;
import com.codeflow.core.model.StatementKind;
import com.codeflow.core.parser.BlockReader;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for statement classifiers providing the label helpers every syntax family
 * shares.
 *
 * <p>Subclasses recognize their family's output, input and declaration forms and call
 * {@link #fallback(String)} for everything else, which yields the trimmed statement text
 * truncated to {@value #MAX_LABEL_LENGTH} characters.
 *
 * @see StatementClassifier
 * @since 1.0.0
 */
public abstract class AbstractStatementClassifier implements StatementClassifier {

    public static final int MAX_LABEL_LENGTH = 50;
    public static final String ELLIPSIS = "...";

    protected static final String OUTPUT_LABEL = "Output";
    protected static final String INPUT_LABEL = "Input";
    protected static final String RETURN_LABEL = "Return";
    protected static final String DECLARE_LABEL = "Declare variable";
    protected static final String DECLARE_PLURAL_LABEL = "Declare variables";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // x = ..., x += ..., a[i] = ..., obj.field = ... but not x == y
    private static final Pattern ASSIGNMENT_PATTERN =
        Pattern.compile("^[A-Za-z_$][\\w$.\\[\\]]*\\s*(?:[-+*/%&|^]|<<|>>|//|\\*\\*)?=(?!=)");

    private static final Pattern ARRAY_SUFFIX = Pattern.compile("\\[.*]");

    // ==================== Classification Results ====================

    protected ClassifiedStatement output(String label, String payload) {
        return new ClassifiedStatement(StatementKind.OUTPUT, label, ShapeKind.IO, List.of(), payload);
    }

    protected ClassifiedStatement input(String label, List<String> variables, String prompt) {
        return new ClassifiedStatement(StatementKind.INPUT, label, ShapeKind.IO, variables, prompt);
    }

    protected ClassifiedStatement input(String variable, String prompt) {
        return input(INPUT_LABEL + " " + variable, List.of(variable), prompt);
    }

    protected ClassifiedStatement declaration(List<String> names) {
        String label;
        if (names.isEmpty()) {
            label = DECLARE_LABEL;
        } else if (names.size() == 1) {
            label = DECLARE_LABEL + " " + names.get(0);
        } else {
            label = DECLARE_PLURAL_LABEL + " " + String.join(", ", names);
        }
        return new ClassifiedStatement(StatementKind.DECLARATION, label, ShapeKind.PROCESS, names, null);
    }

    protected ClassifiedStatement returnStatement(String text) {
        String value = text.length() > "return".length() ? text.substring("return".length()).strip() : "";
        return new ClassifiedStatement(StatementKind.RETURN, RETURN_LABEL, ShapeKind.PROCESS, List.of(),
            value.isEmpty() ? null : value);
    }

    /**
     * Classifies a statement no family rule recognized.
     *
     * @param text statement text without terminator
     * @return assignment or generic process step labelled with the shortened text
     */
    protected ClassifiedStatement fallback(String text) {
        StatementKind kind = isAssignment(text) ? StatementKind.ASSIGNMENT : StatementKind.GENERIC;
        return ClassifiedStatement.of(kind, truncate(normalize(text)), ShapeKind.PROCESS);
    }

    // ==================== Text Utilities ====================

    /**
     * Trims the statement and removes trailing terminators.
     *
     * @param statement raw statement
     * @return statement body
     */
    protected String stripTerminator(String statement) {
        String text = statement.strip();
        while (text.endsWith(String.valueOf(BlockReader.STATEMENT_TERMINATOR))) {
            text = text.substring(0, text.length() - 1).stripTrailing();
        }
        return text;
    }

    protected String normalize(String text) {
        return WHITESPACE.matcher(text.strip()).replaceAll(" ");
    }

    /**
     * Shortens a label to {@value #MAX_LABEL_LENGTH} characters, ending in
     * {@value #ELLIPSIS} when cut.
     *
     * @param label label text
     * @return label of at most {@value #MAX_LABEL_LENGTH} characters
     */
    protected String truncate(String label) {
        if (label.length() <= MAX_LABEL_LENGTH) {
            return label;
        }
        return label.substring(0, MAX_LABEL_LENGTH - ELLIPSIS.length()) + ELLIPSIS;
    }

    protected boolean isAssignment(String text) {
        return ASSIGNMENT_PATTERN.matcher(text).find();
    }

    protected boolean isReturn(String text) {
        return BlockReader.startsWithKeyword(text, 0, "return");
    }

    /**
     * Returns the content of the first string literal in the text.
     *
     * @param text statement text
     * @param singleQuotes whether {@code '...'} also counts as a string literal
     * @return literal content without quotes, or empty if the text has none
     */
    protected Optional<String> firstStringLiteral(String text, boolean singleQuotes) {
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '"' || (singleQuotes && ch == '\'')) {
                int end = BlockReader.skipLiteral(text, i);
                int contentEnd = end > i + 1 && text.charAt(end - 1) == ch ? end - 1 : end;
                return Optional.of(text.substring(i + 1, contentEnd));
            }
            if (ch == '\'') {
                i = BlockReader.skipLiteral(text, i);
                continue;
            }
            i++;
        }
        return Optional.empty();
    }

    /**
     * Extracts declared identifiers from a declarator list such as
     * {@code a = 1, *p, buf[10]}.
     *
     * @param declarators text after the type name
     * @return declared names in order
     */
    protected List<String> declaredNames(String declarators) {
        List<String> names = new ArrayList<>();
        for (String part : BlockReader.splitTopLevel(declarators, ',')) {
            String name = part;
            int assign = name.indexOf('=');
            if (assign >= 0) {
                name = name.substring(0, assign);
            }
            name = ARRAY_SUFFIX.matcher(name.replace('*', ' ').replace('&', ' ')).replaceAll("").strip();
            if (name.isEmpty()) {
                continue;
            }
            String[] tokens = WHITESPACE.split(name);
            names.add(tokens[tokens.length - 1]);
        }
        return names;
    }

    /**
     * Convenience for subclasses matching a precompiled pattern at the start of text.
     *
     * @param pattern compiled pattern
     * @param text text to match
     * @return matcher positioned on the match, or null when there is none
     */
    protected Matcher lookingAt(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.lookingAt() ? matcher : null;
    }
}
