package com.codeflow.core.classifier;

import com.codeflow.core.model.ClassifiedStatement;
import com.codeflow.core.model.Loop;
import com.codeflow.core.model.LoopKind;
import com.codeflow.core.model.Sequence;
import com.codeflow.core.model.StatementKind;
import com.codeflow.core.model.Switch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the shared helpers of {@link AbstractStatementClassifier} and the defaults of
 * {@link StatementClassifier}.
 */
class AbstractStatementClassifierTest {

    /** Minimal classifier exposing the protected helpers. */
    private static final class PlainClassifier extends AbstractStatementClassifier {
        @Override
        public ClassifiedStatement classify(String statement) {
            return fallback(stripTerminator(statement));
        }
    }

    private final PlainClassifier classifier = new PlainClassifier();

    @Test
    void stripTerminator_removesTrailingSemicolons() {
        assertThat(classifier.stripTerminator("  x = 1 ;; ")).isEqualTo("x = 1");
    }

    @Test
    void truncate_keepsShortLabels() {
        String label = "a".repeat(AbstractStatementClassifier.MAX_LABEL_LENGTH);

        assertThat(classifier.truncate(label)).isEqualTo(label);
        assertThat(classifier.truncate(label + "b")).hasSize(50).endsWith("...");
    }

    @Test
    void isAssignment_distinguishesComparison() {
        assertThat(classifier.isAssignment("x = 1")).isTrue();
        assertThat(classifier.isAssignment("arr[i] += 2")).isTrue();
        assertThat(classifier.isAssignment("x //= 2")).isTrue();
        assertThat(classifier.isAssignment("x == 1")).isFalse();
        assertThat(classifier.isAssignment("f(x = 1)")).isFalse();
    }

    @Test
    void firstStringLiteral_honorsQuoteStyle() {
        assertThat(classifier.firstStringLiteral("f('c', \"text\")", false)).contains("text");
        assertThat(classifier.firstStringLiteral("print('hi')", true)).contains("hi");
        assertThat(classifier.firstStringLiteral("print(x)", true)).isEmpty();
    }

    @Test
    void declaredNames_stripsPointersArraysAndInitializers() {
        assertThat(classifier.declaredNames("*p, **q = NULL, buf[64], &ref = x"))
            .containsExactly("p", "q", "buf", "ref");
    }

    @Test
    void classify_viaFallback_marksAssignments() {
        assertThat(classifier.classify("count = count + 1;").kind()).isEqualTo(StatementKind.ASSIGNMENT);
        assertThat(classifier.classify("doWork();").kind()).isEqualTo(StatementKind.GENERIC);
    }

    @Test
    void defaultLabels_fallBackForBlankText() {
        assertThat(classifier.conditionLabel("  ")).isEqualTo("Condition");
        assertThat(classifier.conditionLabel(" x > 1 ")).isEqualTo("x > 1");
        assertThat(classifier.loopLabel(new Loop(LoopKind.POST_TEST, "do", "", Sequence.empty())))
            .isEqualTo("Condition");
        assertThat(classifier.switchLabel(new Switch("", List.of()))).isEqualTo("Switch");
        assertThat(classifier.caseLabel(new Switch.SwitchCase("case 2", Sequence.empty()))).isEqualTo("case 2");
    }
}
