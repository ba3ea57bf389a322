package com.codeflow.core.frontend.impl.python;

import com.codeflow.core.classifier.StatementClassifier;
import com.codeflow.core.frontend.AbstractFrontend;
import com.codeflow.core.parser.SourceCleaner;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Front end for Python snippets.
 *
 * <p>Standalone docstrings and {@code #} comments are removed, the entry block is the
 * body of {@code def main()} when the snippet defines one (otherwise the whole module),
 * and {@link PythonBlockTranslator} rewrites the indentation-based suites into brace
 * form before the shared builder runs.
 */
public class PythonFrontend extends AbstractFrontend {

    private static final Pattern DOCSTRING = Pattern.compile(
        "(?m)^[ \\t]*[rRuU]?(\"\"\"|''')[\\s\\S]*?\\1[ \\t]*$");

    private static final Pattern MAIN_HEADER = Pattern.compile(
        "(?m)^([ \\t]*)def\\s+main\\s*\\([^)]*\\)\\s*(?:->[^:]*)?:[ \\t]*$");

    private final PythonStatementClassifier classifier = new PythonStatementClassifier();

    @Override
    public String getId() {
        return "python";
    }

    @Override
    public String getDisplayName() {
        return "Python";
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("py");
    }

    @Override
    public StatementClassifier getClassifier() {
        return classifier;
    }

    @Override
    protected String stripComments(String source) {
        String withoutDocstrings = DOCSTRING.matcher(source).replaceAll("");
        return SourceCleaner.stripHashComments(withoutDocstrings);
    }

    @Override
    protected String extractEntryBlock(String source) {
        Matcher matcher = MAIN_HEADER.matcher(source);
        if (!matcher.find()) {
            return source;
        }
        int defIndent = matcher.group(1).length();
        List<String> lines = source.substring(matcher.end()).lines().toList();
        StringBuilder body = new StringBuilder();
        // skip the rest of the header line
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!line.isBlank() && indentOf(line) <= defIndent) {
                break;
            }
            body.append(line).append('\n');
        }
        log.debug("Using body of main() as entry block");
        return body.toString();
    }

    @Override
    protected String toBraceForm(String block) {
        return PythonBlockTranslator.translate(block);
    }

    private static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }
}
