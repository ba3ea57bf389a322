package com.codeflow.core.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link SourceCleaner}.
 */
class SourceCleanerTest {

    @Test
    void stripCStyleComments_removesLineComments() {
        assertThat(SourceCleaner.stripCStyleComments("x = 1; // set x\ny = 2;"))
            .isEqualTo("x = 1; \ny = 2;");
    }

    @Test
    void stripCStyleComments_replacesBlockCommentKeepingLineBreaks() {
        String cleaned = SourceCleaner.stripCStyleComments("a = 1; /* one\ntwo */ b = 2;");

        assertThat(cleaned).isEqualTo("a = 1;  \n b = 2;");
    }

    @Test
    void stripCStyleComments_keepsCommentMarkersInsideLiterals() {
        String source = "printf(\"// not a comment /* either */\");";

        assertThat(SourceCleaner.stripCStyleComments(source)).isEqualTo(source);
    }

    @Test
    void stripCStyleComments_withUnterminatedBlockComment_dropsRest() {
        assertThat(SourceCleaner.stripCStyleComments("a = 1; /* never closed")).isEqualTo("a = 1;  ");
    }

    @Test
    void stripHashComments_removesCommentsOutsideLiterals() {
        assertThat(SourceCleaner.stripHashComments("x = 1  # counter\nprint(\"#1\")"))
            .isEqualTo("x = 1  \nprint(\"#1\")");
    }

    @Test
    void stripDirectives_removesPreprocessorLines() {
        String source = "#include <stdio.h>\n  #define N 10\nint main() {}";

        assertThat(SourceCleaner.stripDirectives(source)).isEqualTo("int main() {}");
    }
}
