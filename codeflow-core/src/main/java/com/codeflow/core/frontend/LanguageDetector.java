package com.codeflow.core.frontend;

/**
 * Guesses the syntax family of a snippet from marker substrings.
 *
 * <p>Java wins when the text contains {@code public class} or {@code System.out}; C when
 * it contains {@code #include}, {@code printf} or {@code scanf}; everything else is
 * treated as Python. The heuristic is deliberately shallow and lives outside the
 * conversion engine.
 */
public final class LanguageDetector {

    public static final String JAVA = "java";
    public static final String C = "c";
    public static final String PYTHON = "python";

    private LanguageDetector() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Detects the language of a snippet.
     *
     * @param source snippet text (may be null)
     * @return {@value #JAVA}, {@value #C} or {@value #PYTHON}
     */
    public static String detect(String source) {
        if (source == null) {
            return PYTHON;
        }
        if (source.contains("public class") || source.contains("System.out")) {
            return JAVA;
        }
        if (source.contains("#include") || source.contains("printf") || source.contains("scanf")) {
            return C;
        }
        return PYTHON;
    }
}
