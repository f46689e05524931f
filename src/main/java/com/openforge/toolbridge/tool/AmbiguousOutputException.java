package com.openforge.toolbridge.tool;

/** Model output holds more than one well-formed JSON object. */
public class AmbiguousOutputException extends ToolInvocationException {

    private final int objectCount;

    public AmbiguousOutputException(int objectCount) {
        super("Model output contains %d JSON objects; expected exactly one".formatted(objectCount));
        this.objectCount = objectCount;
    }

    public int objectCount() {
        return objectCount;
    }

    @Override
    public String errorType() {
        return "ambiguous_output";
    }
}
