package com.codeflow.core.frontend.impl.c;

import com.codeflow.core.classifier.AbstractStatementClassifier;
import com.codeflow.core.model.ClassifiedStatement;
import com.codeflow.core.parser.BlockReader;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statement classifier for C snippets.
 *
 * <p>Recognized forms:
 * <ul>
 *   <li>{@code printf("Hello")}, {@code puts("Hello")} - {@code Display Hello}, or
 *       {@code Output} when no string literal is passed</li>
 *   <li>{@code scanf("%d %d", &a, &b)} - {@code Input a, b}; {@code gets(buf)},
 *       {@code fgets(buf, n, stdin)} and {@code c = getchar()} likewise</li>
 *   <li>{@code int a = 1, *p, buf[10]} - {@code Declare variables a, p, buf}</li>
 *   <li>{@code return ...} - {@code Return}</li>
 * </ul>
 */
public class CStatementClassifier extends AbstractStatementClassifier {

    private static final String DISPLAY_PREFIX = "Display ";

    private static final Pattern OUTPUT_CALL = Pattern.compile("^(printf|puts|putchar|fprintf)\\s*\\(");
    private static final Pattern SCANF_CALL = Pattern.compile("^(scanf|fscanf)\\s*\\((.*)\\)$", Pattern.DOTALL);
    private static final Pattern GETS_CALL = Pattern.compile("^f?gets\\s*\\(\\s*([A-Za-z_]\\w*)");
    private static final Pattern GETCHAR_ASSIGNMENT = Pattern.compile("^([A-Za-z_]\\w*)\\s*=\\s*getchar\\s*\\(\\s*\\)$");

    private static final Pattern DECLARATION = Pattern.compile(
        "^(?:(?:const|static|register|volatile|unsigned|signed)\\s+)*"
            + "(?:short|long|int|char|float|double|size_t|bool|unsigned|signed)\\b(?!\\s*\\()(.*)$",
        Pattern.DOTALL);

    @Override
    public ClassifiedStatement classify(String statement) {
        String text = stripTerminator(statement);

        if (lookingAt(OUTPUT_CALL, text) != null) {
            String label = firstStringLiteral(text, false)
                .map(payload -> DISPLAY_PREFIX + payload)
                .orElse(OUTPUT_LABEL);
            return output(label, text);
        }

        Matcher scanf = SCANF_CALL.matcher(text);
        if (scanf.matches()) {
            return scanInput(scanf.group(1), scanf.group(2));
        }
        Matcher gets = lookingAt(GETS_CALL, text);
        if (gets != null) {
            return input(gets.group(1), null);
        }
        Matcher getchar = GETCHAR_ASSIGNMENT.matcher(text);
        if (getchar.matches()) {
            return input(getchar.group(1), null);
        }

        Matcher declaration = DECLARATION.matcher(text);
        if (declaration.matches()) {
            return declaration(declaredNames(declaration.group(1)));
        }

        if (isReturn(text)) {
            return returnStatement(text);
        }
        return fallback(text);
    }

    private ClassifiedStatement scanInput(String function, String arguments) {
        List<String> parts = BlockReader.splitTopLevel(arguments, ',');
        // fscanf takes the stream first, then the format
        int firstTarget = "fscanf".equals(function) ? 2 : 1;
        List<String> variables = new ArrayList<>();
        for (int i = firstTarget; i < parts.size(); i++) {
            String variable = parts.get(i).replace("&", "").strip();
            if (!variable.isEmpty()) {
                variables.add(variable);
            }
        }
        String prompt = parts.isEmpty() ? null : firstStringLiteral(parts.get(0), false).orElse(null);
        if (variables.isEmpty()) {
            return input(INPUT_LABEL, List.of(), prompt);
        }
        return input(INPUT_LABEL + " " + String.join(", ", variables), variables, prompt);
    }
}
