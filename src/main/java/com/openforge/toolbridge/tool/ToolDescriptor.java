package com.openforge.toolbridge.tool;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/** Catalogue entry as returned by GET /api/tools; the adapter itself is not exposed. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolDescriptor(
        String name,
        String description,
        Map<String, Argument> arguments,
        String argumentShape,
        String requiredScope
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Argument(ArgumentType type, boolean required, String entityKind) {}

    public static ToolDescriptor from(ToolSpec spec) {
        Map<String, Argument> args = new LinkedHashMap<>();
        spec.argumentSchema().forEach((name, arg) ->
                args.put(name, new Argument(arg.type(), arg.required(), arg.entityKind())));
        return new ToolDescriptor(spec.name(), spec.description(), args,
                spec.argumentShape(), spec.requiredScope());
    }
}
