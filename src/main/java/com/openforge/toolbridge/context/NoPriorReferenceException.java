package com.openforge.toolbridge.context;

/**
 * An anaphoric reference ("that post", "it") could not be resolved because the
 * session has not seen an entity of that kind yet.
 *
 * Recoverable: the turn ends asking the user to name the entity explicitly.
 */
public class NoPriorReferenceException extends RuntimeException {

    private final String entityKind;

    public NoPriorReferenceException(String entityKind, String surfaceText) {
        super("No earlier %s to resolve '%s' against".formatted(entityKind, surfaceText));
        this.entityKind = entityKind;
    }

    public String entityKind() {
        return entityKind;
    }

    public String errorType() {
        return "no_prior_reference";
    }
}
