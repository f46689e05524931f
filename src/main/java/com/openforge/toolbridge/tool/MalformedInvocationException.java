package com.openforge.toolbridge.tool;

/** The JSON object is not of the shape {"tool": <name>, "args": {...}}. */
public class MalformedInvocationException extends ToolInvocationException {

    public MalformedInvocationException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "malformed_invocation";
    }
}
