package com.codeflow.core.classifier;

import com.codeflow.core.model.ClassifiedStatement;
import com.codeflow.core.model.Loop;
import com.codeflow.core.model.Switch;

/**
 * Family-specific recognition of single statements and formatting of decision labels.
 *
 * <p>Implementations must be pure and stateless: the same text always yields the same
 * classification, and one instance may be shared by concurrent conversions.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class CStatementClassifier extends AbstractStatementClassifier {
 *     @Override
 *     public ClassifiedStatement classify(String statement) {
 *         String text = stripTerminator(statement);
 *         if (text.startsWith("printf")) {
 *             return output(firstStringLiteral(text, false).map(s -> "Display " + s).orElse(OUTPUT_LABEL), text);
 *         }
 *         return fallback(text);
 *     }
 * }
 * }</pre>
 */
public interface StatementClassifier {

    /**
     * Classifies one statement.
     *
     * @param statement raw statement text, possibly ending with its terminator
     * @return kind, label and shape of the statement
     */
    ClassifiedStatement classify(String statement);

    /**
     * Label of the decision node drawn for an {@code if} or {@code else if} condition.
     *
     * @param condition condition text without parentheses
     * @return decision label
     */
    default String conditionLabel(String condition) {
        return condition.isBlank() ? "Condition" : condition.strip();
    }

    /**
     * Label of the decision node drawn for a loop.
     *
     * @param loop the loop
     * @return decision label
     */
    default String loopLabel(Loop loop) {
        return conditionLabel(loop.condition());
    }

    /**
     * Label of the decision node drawn for a multi-way branch.
     *
     * @param switchNode the switch
     * @return decision label
     */
    default String switchLabel(Switch switchNode) {
        return switchNode.selector().isBlank() ? "Switch" : switchNode.selector().strip();
    }

    /**
     * Label of the edge leading from a switch decision into one case.
     *
     * @param switchCase the case
     * @return edge label
     */
    default String caseLabel(Switch.SwitchCase switchCase) {
        return switchCase.label();
    }
}
