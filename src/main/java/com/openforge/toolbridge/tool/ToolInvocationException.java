package com.openforge.toolbridge.tool;

/**
 * Base of every parser-stage and registry failure.
 *
 * All subclasses are recoverable: they end the current turn with a user-visible
 * message and never reach an adapter.
 */
public abstract class ToolInvocationException extends RuntimeException {

    protected ToolInvocationException(String message) {
        super(message);
    }

    protected ToolInvocationException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Stable snake_case code reported to callers, e.g. "unknown_tool". */
    public abstract String errorType();
}
