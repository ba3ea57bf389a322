package com.codeflow.core.parser;

/**
 * Signals that a snippet cannot be turned into a control-tree at all.
 *
 * <p>Front ends catch this at their public boundary and degrade to a diagram whose
 * single content node carries the message.
 */
public class FlowParseException extends RuntimeException {

    public FlowParseException(String message) {
        super(message);
    }

    public FlowParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
