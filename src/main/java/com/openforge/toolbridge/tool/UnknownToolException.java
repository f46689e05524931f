package com.openforge.toolbridge.tool;

/** No tool is registered under the name (matching is exact and case-sensitive). */
public class UnknownToolException extends ToolInvocationException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }

    @Override
    public String errorType() {
        return "unknown_tool";
    }
}
