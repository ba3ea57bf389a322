package com.codeflow.core.frontend;

import com.codeflow.core.parser.BlockReader;
import com.codeflow.core.parser.SourceCleaner;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for brace-delimited families (C, Java).
 *
 * <p>Comments are {@code //} and {@code /* ... *}{@code /}; the entry block is the body
 * of the first method header matched by {@link #entryPattern()}. When no header matches,
 * the whole snippet is treated as the entry block.
 */
public abstract class AbstractBraceFrontend extends AbstractFrontend {

    /**
     * Pattern matching the entry point header up to and including its opening brace.
     *
     * @return entry header pattern
     */
    protected abstract Pattern entryPattern();

    @Override
    protected String stripComments(String source) {
        return SourceCleaner.stripCStyleComments(source);
    }

    @Override
    protected String extractEntryBlock(String source) {
        Matcher matcher = entryPattern().matcher(source);
        if (!matcher.find()) {
            log.debug("No entry point found, using the whole snippet");
            return source;
        }
        return BlockReader.readBlock(source, matcher.end() - 1).content();
    }
}
