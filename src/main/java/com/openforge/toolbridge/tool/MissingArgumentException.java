package com.openforge.toolbridge.tool;

/** A required argument is absent (or JSON null). */
public class MissingArgumentException extends ToolInvocationException {

    private final String argument;

    public MissingArgumentException(String toolName, String argument) {
        super("Tool '%s' requires argument '%s'".formatted(toolName, argument));
        this.argument = argument;
    }

    public String argument() {
        return argument;
    }

    @Override
    public String errorType() {
        return "missing_argument";
    }
}
