package com.codeflow.core.frontend.impl.python;

import com.codeflow.core.parser.FlowParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link PythonBlockTranslator}.
 */
class PythonBlockTranslatorTest {

    @Test
    void translate_ifElifElse_producesBraceChain() {
        String translated = PythonBlockTranslator.translate("""
            if x > 0:
                print("pos")
            elif x < 0:
                print("neg")
            else:
                pass
            done = True
            """);

        assertThat(translated).isEqualTo("""
            if (x > 0) {
            print("pos");
            }
            else if (x < 0) {
            print("neg");
            }
            else {
            }
            done = True;
            """);
    }

    @Test
    void translate_nestedLoops_closesEveryLevel() {
        String translated = PythonBlockTranslator.translate("""
            for i in range(3):
                while i > 0:
                    i -= 1
            """);

        assertThat(translated).isEqualTo("""
            for (i in range(3)) {
            while (i > 0) {
            i -= 1;
            }
            }
            """);
    }

    @Test
    void translate_inlineSuiteAndSemicolons_splitStatements() {
        String translated = PythonBlockTranslator.translate("if ok: a = 1; b = 2\n");

        assertThat(translated).isEqualTo("if (ok) {\na = 1;\nb = 2;\n}\n");
    }

    @Test
    void translate_matchStatement_becomesSwitch() {
        String translated = PythonBlockTranslator.translate("""
            match cmd:
                case "go":
                    move()
                case _:
                    stop()
            """);

        assertThat(translated).isEqualTo("""
            switch (cmd) {
            case "go": {
            move();
            }
            default: {
            stop();
            }
            }
            """);
    }

    @Test
    void translate_functionDefinition_keepsOnlySignature() {
        String translated = PythonBlockTranslator.translate("""
            def helper(x):
                return x * 2
            y = helper(3)
            """);

        assertThat(translated).isEqualTo("def helper(x);\ny = helper(3);\n");
    }

    @Test
    void translate_tryExcept_keepsTryBodyAndDropsHandler() {
        String translated = PythonBlockTranslator.translate("""
            try:
                n = int(s)
            except ValueError:
                n = 0
            """);

        assertThat(translated).isEqualTo("{\nn = int(s);\n}\n");
    }

    @Test
    void translate_walrusInCondition_isNotTreatedAsHeaderColon() {
        String translated = PythonBlockTranslator.translate("while (line := read()):\n    handle(line)\n");

        assertThat(translated).startsWith("while ((line := read())) {\n");
    }

    @Test
    void translate_inconsistentDedent_throwsParseException() {
        String source = "if x:\n        a = 1\n    b = 2\n";

        assertThatThrownBy(() -> PythonBlockTranslator.translate(source))
            .isInstanceOf(FlowParseException.class)
            .hasMessage("Unindent does not match any outer indentation level at line 3");
    }

    @Test
    void translate_emptySource_returnsEmptyText() {
        assertThat(PythonBlockTranslator.translate("\n\n")).isEmpty();
    }

    @Test
    void logicalLines_joinBracketsContinuationsAndTripleQuotes() {
        List<PythonBlockTranslator.LogicalLine> lines = PythonBlockTranslator.logicalLines(
            "total = (a +\n         b)\nx = 1 + \\\n    2\ns = \"\"\"one\ntwo\"\"\"\n\tz = 0\n");

        assertThat(lines).extracting(PythonBlockTranslator.LogicalLine::text).containsExactly(
            "total = (a +          b)",
            "x = 1 +      2",
            "s = \"\"\"one two\"\"\"",
            "z = 0");
        assertThat(lines).extracting(PythonBlockTranslator.LogicalLine::number).containsExactly(1, 3, 5, 7);
        assertThat(lines.get(3).indent()).isEqualTo(4);
    }
}
