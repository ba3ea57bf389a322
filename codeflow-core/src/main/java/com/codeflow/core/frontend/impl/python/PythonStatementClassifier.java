package com.codeflow.core.frontend.impl.python;

import com.codeflow.core.classifier.AbstractStatementClassifier;
import com.codeflow.core.model.ClassifiedStatement;
import com.codeflow.core.model.Loop;
import com.codeflow.core.model.ShapeKind;
import com.codeflow.core.model.StatementKind;
import com.codeflow.core.model.Switch;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statement classifier for Python snippets translated by {@link PythonBlockTranslator}.
 *
 * <ul>
 *   <li>{@code print("Hi")} - {@code Output: Hi}</li>
 *   <li>{@code name = input("Name? ")} - {@code Input name: Name? }</li>
 *   <li>{@code age = int(input("Age: "))} - {@code Input age: Age:  (as int)}</li>
 *   <li>any other bare call - drawn as I/O with its own text</li>
 * </ul>
 * Python has no declarations; assignments fall back to their text.
 */
public class PythonStatementClassifier extends AbstractStatementClassifier {

    private static final String OUTPUT_PREFIX = "Output: ";
    private static final String DEFAULT_CASE_LABEL = "case (default)";

    private static final Pattern PRINT_LITERAL = Pattern.compile("^print\\s*\\(\\s*(?:\"([^\"\\\\]*)\"|'([^'\\\\]*)')\\s*\\)$");

    private static final Pattern INPUT_ASSIGNMENT = Pattern.compile(
        "^([A-Za-z_][\\w.\\[\\]]*)\\s*=\\s*input\\s*\\(\\s*(?:\"([^\"]*)\"|'([^']*)')?\\s*\\)$");

    private static final Pattern CONVERTED_INPUT_ASSIGNMENT = Pattern.compile(
        "^([A-Za-z_][\\w.\\[\\]]*)\\s*=\\s*([A-Za-z_]\\w*)\\s*\\(\\s*input\\s*\\(\\s*(?:\"([^\"]*)\"|'([^']*)')?\\s*\\)\\s*\\)$");

    private static final Pattern CALL = Pattern.compile("^[A-Za-z_][\\w.]*\\s*\\(.*\\)$", Pattern.DOTALL);

    @Override
    public ClassifiedStatement classify(String statement) {
        String text = stripTerminator(statement);

        Matcher print = PRINT_LITERAL.matcher(text);
        if (print.matches()) {
            String content = print.group(1) != null ? print.group(1) : print.group(2);
            return output(OUTPUT_PREFIX + content, content);
        }

        Matcher input = INPUT_ASSIGNMENT.matcher(text);
        if (input.matches()) {
            String prompt = input.group(2) != null ? input.group(2) : input.group(3);
            return inputWithPrompt(input.group(1), prompt, null);
        }
        Matcher converted = CONVERTED_INPUT_ASSIGNMENT.matcher(text);
        if (converted.matches()) {
            String prompt = converted.group(3) != null ? converted.group(3) : converted.group(4);
            return inputWithPrompt(converted.group(1), prompt, converted.group(2));
        }

        if (isReturn(text)) {
            return returnStatement(text);
        }
        if (!isAssignment(text) && CALL.matcher(text).matches()) {
            return ClassifiedStatement.of(StatementKind.GENERIC, truncate(normalize(text)), ShapeKind.IO);
        }
        return fallback(text);
    }

    private ClassifiedStatement inputWithPrompt(String variable, String prompt, String conversion) {
        StringBuilder label = new StringBuilder(INPUT_LABEL).append(' ').append(variable);
        if (prompt != null) {
            label.append(": ").append(prompt);
        }
        if (conversion != null) {
            label.append(" (as ").append(conversion).append(')');
        }
        return input(label.toString(), List.of(variable), prompt);
    }

    @Override
    public String loopLabel(Loop loop) {
        if ("for".equals(loop.keyword())) {
            return "For " + loop.condition().strip();
        }
        return conditionLabel(loop.condition());
    }

    @Override
    public String switchLabel(Switch switchNode) {
        return "Match " + switchNode.selector().strip();
    }

    @Override
    public String caseLabel(Switch.SwitchCase switchCase) {
        return switchCase.isDefault() ? DEFAULT_CASE_LABEL : switchCase.label();
    }
}
