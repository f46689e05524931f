package com.openforge.toolbridge.tool;

import com.openforge.toolbridge.adapter.ResourceAdapter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One invocable tool: its stable name, argument schema and the adapter that executes it.
 *
 * The schema map keeps declaration order (the prompt lists arguments in that order)
 * and is frozen at construction.
 *
 * @param name           unique, stable identifier, e.g. "post_call"
 * @param description    one-line description shown to the model
 * @param argumentSchema parameter name → type / required flag
 * @param idArgument     the argument passed to {@link ResourceAdapter#fetch(long)}
 * @param adapter        executing adapter
 * @param requiredScope  reserved for access control; carried but never enforced
 */
public record ToolSpec(
        String name,
        String description,
        Map<String, ArgumentSpec> argumentSchema,
        String idArgument,
        ResourceAdapter adapter,
        String requiredScope
) {

    public ToolSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        if (adapter == null) {
            throw new IllegalArgumentException("Tool '%s' has no adapter".formatted(name));
        }
        argumentSchema = Collections.unmodifiableMap(new LinkedHashMap<>(
                argumentSchema == null ? Map.of() : argumentSchema));
        ArgumentSpec id = argumentSchema.get(idArgument);
        if (id == null || id.type() != ArgumentType.INTEGER) {
            throw new IllegalArgumentException(
                    "Tool '%s' must declare '%s' as an integer argument".formatted(name, idArgument));
        }
    }

    public ToolSpec(String name, String description, Map<String, ArgumentSpec> argumentSchema,
                    String idArgument, ResourceAdapter adapter) {
        this(name, description, argumentSchema, idArgument, adapter, null);
    }

    /**
     * Argument shape as shown to the model, e.g. {"post_id": <integer>}.
     * Optional arguments are suffixed with "?".
     */
    public String argumentShape() {
        StringBuilder sb = new StringBuilder("{");
        argumentSchema.forEach((key, spec) -> {
            if (sb.length() > 1) sb.append(", ");
            sb.append('"').append(key).append(spec.required() ? "" : "?").append("\": <")
              .append(spec.type().wireName()).append('>');
        });
        return sb.append('}').toString();
    }
}
