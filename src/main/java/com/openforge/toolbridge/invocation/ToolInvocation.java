package com.openforge.toolbridge.invocation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool call that has passed schema validation.
 *
 * Only {@link InvocationParser} can create one, so holding an instance means every
 * argument matched its declared type and no required argument is missing. Values
 * are plain Java objects (Long, Double, String, Boolean), never raw JSON.
 *
 * A reference argument may still carry an anaphoric marker ("that post") in
 * {@link #unresolvedReferences()}; the orchestrator swaps it for a concrete id via
 * {@link #withResolvedReference(String, long)} before dispatch.
 */
@ToString
@EqualsAndHashCode
public final class ToolInvocation {

    private final String toolName;
    private final Map<String, Object> arguments;
    private final Map<String, String> unresolvedReferences;

    ToolInvocation(String toolName,
                   Map<String, Object> arguments,
                   Map<String, String> unresolvedReferences) {
        this.toolName             = toolName;
        this.arguments            = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        this.unresolvedReferences = Collections.unmodifiableMap(new LinkedHashMap<>(unresolvedReferences));
    }

    @JsonProperty("tool")
    public String toolName() {
        return toolName;
    }

    /** Validated arguments; unresolved reference arguments are absent until resolved. */
    @JsonProperty("args")
    public Map<String, Object> arguments() {
        return arguments;
    }

    /** argument name → anaphoric marker text, e.g. post_id → "that post". */
    @JsonIgnore
    public Map<String, String> unresolvedReferences() {
        return unresolvedReferences;
    }

    @JsonIgnore
    public boolean hasUnresolvedReferences() {
        return !unresolvedReferences.isEmpty();
    }

    public long longArgument(String name) {
        Object value = arguments.get(name);
        if (!(value instanceof Number number)) {
            throw new IllegalStateException("Argument '%s' of '%s' is not a resolved integer"
                    .formatted(name, toolName));
        }
        return number.longValue();
    }

    /**
     * Returns a copy with the marker of {@code argument} replaced by {@code id}.
     * Only arguments that the parser left unresolved may be rewritten.
     */
    public ToolInvocation withResolvedReference(String argument, long id) {
        if (!unresolvedReferences.containsKey(argument)) {
            throw new IllegalArgumentException("Argument '%s' of '%s' holds no unresolved reference"
                    .formatted(argument, toolName));
        }
        Map<String, Object> args = new LinkedHashMap<>(arguments);
        args.put(argument, id);
        Map<String, String> pending = new LinkedHashMap<>(unresolvedReferences);
        pending.remove(argument);
        return new ToolInvocation(toolName, args, pending);
    }
}
