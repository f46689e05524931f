package com.openforge.toolbridge.tool;

/**
 * Schema of one tool argument.
 *
 * @param type       expected primitive type
 * @param required   whether the argument must be present
 * @param entityKind when non-null, the argument identifies an entity of this kind
 *                   (e.g. "post") and may be given as an anaphoric reference
 *                   such as "that post" instead of a literal id
 */
public record ArgumentSpec(
        ArgumentType type,
        boolean required,
        String entityKind
) {

    public static ArgumentSpec required(ArgumentType type) {
        return new ArgumentSpec(type, true, null);
    }

    public static ArgumentSpec optional(ArgumentType type) {
        return new ArgumentSpec(type, false, null);
    }

    /** A required integer id of the given entity kind. */
    public static ArgumentSpec entityId(String entityKind) {
        return new ArgumentSpec(ArgumentType.INTEGER, true, entityKind);
    }

    public boolean isReference() {
        return entityKind != null;
    }
}
