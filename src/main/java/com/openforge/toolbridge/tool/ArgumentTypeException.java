package com.openforge.toolbridge.tool;

/** An argument value does not have the type its schema declares. */
public class ArgumentTypeException extends ToolInvocationException {

    private final String argument;

    public ArgumentTypeException(String toolName, String argument, ArgumentType expected) {
        super("Argument '%s' of tool '%s' must be of type %s"
                .formatted(argument, toolName, expected.wireName()));
        this.argument = argument;
    }

    public ArgumentTypeException(String toolName, String argument, String detail) {
        super("Argument '%s' of tool '%s': %s".formatted(argument, toolName, detail));
        this.argument = argument;
    }

    public String argument() {
        return argument;
    }

    @Override
    public String errorType() {
        return "argument_type";
    }
}
