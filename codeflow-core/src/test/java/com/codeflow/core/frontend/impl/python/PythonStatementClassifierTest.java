package com.codeflow.core.frontend.impl.python;

import com.codeflow.core.model.ClassifiedStatement;
import com.codeflow.core.model.Loop;
import com.codeflow.core.model.LoopKind;
import com.codeflow.core.model.Sequence;
import com.codeflow.core.model.ShapeKind;
import com.codeflow.core.model.StatementKind;
import com.codeflow.core.model.Switch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link PythonStatementClassifier}.
 */
class PythonStatementClassifierTest {

    private PythonStatementClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new PythonStatementClassifier();
    }

    @Test
    void classify_printLiteral_returnsOutputLabel() {
        ClassifiedStatement result = classifier.classify("print('Hello');");

        assertThat(result.kind()).isEqualTo(StatementKind.OUTPUT);
        assertThat(result.shape()).isEqualTo(ShapeKind.IO);
        assertThat(result.label()).isEqualTo("Output: Hello");
    }

    @Test
    void classify_printExpression_isGenericIo() {
        ClassifiedStatement result = classifier.classify("print(total);");

        assertThat(result.kind()).isEqualTo(StatementKind.GENERIC);
        assertThat(result.shape()).isEqualTo(ShapeKind.IO);
        assertThat(result.label()).isEqualTo("print(total)");
    }

    @Test
    void classify_inputWithPrompt_includesPrompt() {
        ClassifiedStatement result = classifier.classify("name = input(\"Name?\");");

        assertThat(result.kind()).isEqualTo(StatementKind.INPUT);
        assertThat(result.label()).isEqualTo("Input name: Name?");
        assertThat(result.variables()).containsExactly("name");
    }

    @Test
    void classify_inputWithoutPrompt_namesVariableOnly() {
        assertThat(classifier.classify("line = input();").label()).isEqualTo("Input line");
    }

    @Test
    void classify_convertedInput_mentionsConversion() {
        ClassifiedStatement result = classifier.classify("age = int(input('Age: '));");

        assertThat(result.label()).isEqualTo("Input age: Age:  (as int)");
        assertThat(classifier.classify("x = float(input());").label()).isEqualTo("Input x (as float)");
    }

    @Test
    void classify_assignment_fallsBackToText() {
        ClassifiedStatement result = classifier.classify("total = total + price;");

        assertThat(result.kind()).isEqualTo(StatementKind.ASSIGNMENT);
        assertThat(result.shape()).isEqualTo(ShapeKind.PROCESS);
        assertThat(result.label()).isEqualTo("total = total + price");
    }

    @Test
    void classify_return_isReturnKind() {
        assertThat(classifier.classify("return total;").isReturn()).isTrue();
    }

    @Test
    void loopLabel_prefixesForLoops() {
        Loop forLoop = new Loop(LoopKind.PRE_TEST, "for", "item in items", Sequence.empty());
        Loop whileLoop = new Loop(LoopKind.PRE_TEST, "while", "n > 0", Sequence.empty());

        assertThat(classifier.loopLabel(forLoop)).isEqualTo("For item in items");
        assertThat(classifier.loopLabel(whileLoop)).isEqualTo("n > 0");
    }

    @Test
    void switchAndCaseLabels_useMatchWording() {
        Switch.SwitchCase wildcard = new Switch.SwitchCase(Switch.SwitchCase.DEFAULT_LABEL, Sequence.empty());
        Switch.SwitchCase literal = new Switch.SwitchCase("case 1", Sequence.empty());

        assertThat(classifier.switchLabel(new Switch("command", List.of(literal, wildcard)))).isEqualTo("Match command");
        assertThat(classifier.caseLabel(wildcard)).isEqualTo("case (default)");
        assertThat(classifier.caseLabel(literal)).isEqualTo("case 1");
    }
}
