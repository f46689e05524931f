package com.openforge.toolbridge.tool;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Primitive JSON types a tool argument may declare.
 *
 * The wire name is what the system prompt shows the model, e.g.
 * {"post_id": <integer>}.
 */
public enum ArgumentType {

    INTEGER("integer"),
    NUMBER("number"),
    STRING("string"),
    BOOLEAN("boolean");

    private final String wireName;

    ArgumentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** True if the JSON value is of this type. Integral values are valid NUMBERs too. */
    public boolean matches(JsonNode value) {
        if (value == null || value.isNull()) return false;
        return switch (this) {
            case INTEGER -> value.isIntegralNumber();
            case NUMBER  -> value.isNumber();
            case STRING  -> value.isTextual();
            case BOOLEAN -> value.isBoolean();
        };
    }
}
