package com.codeflow.core.frontend.impl.c;

import com.codeflow.core.classifier.StatementClassifier;
import com.codeflow.core.frontend.AbstractBraceFrontend;
import com.codeflow.core.parser.SourceCleaner;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Front end for C snippets.
 *
 * <p>Preprocessor lines ({@code #include}, {@code #define}, ...) are dropped together with
 * comments, and the entry block is the body of {@code int main(...)} or
 * {@code void main(...)}. Snippets without a {@code main} are read as a plain statement
 * list.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * LanguageFrontend c = new CFrontend();
 * String diagram = c.renderFlowchart("""
 *     #include <stdio.h>
 *     int main() {
 *         int n;
 *         scanf("%d", &n);
 *         if (n > 0) { printf("positive"); } else { printf("not positive"); }
 *         return 0;
 *     }
 *     """);
 * }</pre>
 */
public class CFrontend extends AbstractBraceFrontend {

    private static final Pattern MAIN_HEADER = Pattern.compile("\\b(?:int|void)\\s+main\\s*\\([^)]*\\)\\s*\\{");

    private final CStatementClassifier classifier = new CStatementClassifier();

    @Override
    public String getId() {
        return "c";
    }

    @Override
    public String getDisplayName() {
        return "C";
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("c", "h");
    }

    @Override
    public StatementClassifier getClassifier() {
        return classifier;
    }

    @Override
    protected Pattern entryPattern() {
        return MAIN_HEADER;
    }

    @Override
    protected String stripComments(String source) {
        return SourceCleaner.stripDirectives(super.stripComments(source));
    }
}
