package com.openforge.toolbridge.tool;

/** A tool with the same name is already registered. */
public class DuplicateToolException extends ToolInvocationException {

    public DuplicateToolException(String toolName) {
        super("Tool already registered: " + toolName);
    }

    @Override
    public String errorType() {
        return "duplicate_tool";
    }
}
