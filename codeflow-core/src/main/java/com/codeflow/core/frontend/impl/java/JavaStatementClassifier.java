package com.codeflow.core.frontend.impl.java;

import com.codeflow.core.classifier.AbstractStatementClassifier;
import com.codeflow.core.model.ClassifiedStatement;
import com.codeflow.core.model.Loop;
import com.codeflow.core.model.Switch;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statement classifier for Java snippets.
 *
 * <p>Output goes through {@code System.out.print}, {@code println} or {@code printf}
 * and is labelled {@code Print <literal>}. Reads from a {@code Scanner} or
 * {@code BufferedReader} assigned to a variable are labelled {@code Input x}. Loop and
 * switch decisions keep their keyword, e.g. {@code while (i < n)} or
 * {@code do-while (again)}.
 */
public class JavaStatementClassifier extends AbstractStatementClassifier {

    private static final String PRINT_PREFIX = "Print ";

    private static final Pattern PRINT_CALL = Pattern.compile("^System\\.(?:out|err)\\.(?:print|println|printf|format)\\s*\\(");

    private static final Pattern READ_CALL = Pattern.compile(
        "\\.(?:next(?:Int|Line|Double|Float|Long|Short|Byte|Boolean|BigInteger|BigDecimal)?|readLine|read)\\s*\\(\\s*\\)");

    // Optional type, then the target: "int n =", "String[] parts =", "n ="
    private static final Pattern ASSIGNED_VARIABLE = Pattern.compile(
        "^(?:final\\s+)?(?:[A-Za-z_$][\\w$.]*(?:<[^=]*>)?(?:\\[\\])*\\s+)?([A-Za-z_$][\\w$]*)\\s*=(?!=)");

    private static final Pattern DECLARATION = Pattern.compile(
        "^(?:final\\s+)?(?:int|long|short|byte|char|float|double|boolean|var|[A-Z][\\w$]*(?:\\.[A-Z][\\w$]*)*)"
            + "(?:<[^=;]*>)?(?:\\[\\])*\\s+([A-Za-z_$][\\w$]*(?:\\[\\])*\\s*(?:[=,;]|$).*)$",
        Pattern.DOTALL);

    @Override
    public ClassifiedStatement classify(String statement) {
        String text = stripTerminator(statement);

        if (lookingAt(PRINT_CALL, text) != null) {
            String label = firstStringLiteral(text, false)
                .map(payload -> PRINT_PREFIX + payload)
                .orElse(OUTPUT_LABEL);
            return output(label, text);
        }

        if (READ_CALL.matcher(text).find()) {
            Matcher target = lookingAt(ASSIGNED_VARIABLE, text);
            if (target != null) {
                return input(target.group(1), null);
            }
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

    @Override
    public String loopLabel(Loop loop) {
        String keyword = loop.isPostTest() ? "do-while" : loop.keyword();
        return keyword + " (" + loop.condition().strip() + ")";
    }

    @Override
    public String switchLabel(Switch switchNode) {
        return "switch (" + switchNode.selector().strip() + ")";
    }
}
