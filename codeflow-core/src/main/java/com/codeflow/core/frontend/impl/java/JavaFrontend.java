package com.codeflow.core.frontend.impl.java;

import com.codeflow.core.classifier.StatementClassifier;
import com.codeflow.core.frontend.AbstractBraceFrontend;
import com.codeflow.core.parser.BlockReader;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Front end for Java snippets.
 *
 * <p>Entry block extraction is layered:
 * <ol>
 *   <li><b>AST:</b> the snippet is parsed with JavaParser and the body of the first
 *       {@code main} method is printed back statement by statement</li>
 *   <li><b>Regex fallback:</b> when JavaParser rejects the snippet (typical for
 *       fragments), the {@code main} header is located by pattern and its block read
 *       with {@link BlockReader}; failing that, the body of the first class</li>
 *   <li><b>Whole text:</b> a bare statement list is used as is</li>
 * </ol>
 */
public class JavaFrontend extends AbstractBraceFrontend {

    private static final Pattern MAIN_HEADER = Pattern.compile(
        "\\bvoid\\s+main\\s*\\([^)]*\\)\\s*(?:throws\\s+[\\w.,\\s]+)?\\{");

    private static final Pattern CLASS_HEADER = Pattern.compile("\\bclass\\s+[A-Za-z_$][\\w$]*[^{;]*\\{");

    private final JavaStatementClassifier classifier = new JavaStatementClassifier();

    @Override
    public String getId() {
        return "java";
    }

    @Override
    public String getDisplayName() {
        return "Java";
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("java");
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
    protected String extractEntryBlock(String source) {
        Optional<String> fromAst = mainBodyFromAst(source);
        if (fromAst.isPresent()) {
            return fromAst.get();
        }
        if (MAIN_HEADER.matcher(source).find()) {
            return super.extractEntryBlock(source);
        }
        Matcher classHeader = CLASS_HEADER.matcher(source);
        if (classHeader.find()) {
            log.debug("No main method found, using the body of the first class");
            return BlockReader.readBlock(source, classHeader.end() - 1).content();
        }
        return source;
    }

    private Optional<String> mainBodyFromAst(String source) {
        // A new parser per call: JavaParser instances are not safe for concurrent use
        ParseResult<CompilationUnit> result = new JavaParser().parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            log.debug("JavaParser could not parse snippet, falling back to pattern matching");
            result.getProblems().forEach(problem -> log.trace("  - {}", problem.getMessage()));
            return Optional.empty();
        }
        return result.getResult().get().findAll(MethodDeclaration.class).stream()
            .filter(method -> method.getNameAsString().equals("main"))
            .map(MethodDeclaration::getBody)
            .flatMap(Optional::stream)
            .findFirst()
            .map(JavaFrontend::printStatements);
    }

    private static String printStatements(BlockStmt body) {
        return body.getStatements().stream()
            .map(Statement::toString)
            .collect(Collectors.joining("\n"));
    }
}
