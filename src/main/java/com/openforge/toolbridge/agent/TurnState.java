package com.openforge.toolbridge.agent;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of one orchestration turn.
 *
 *   AWAITING_QUERY → PROMPTING_MODEL → PARSING_OUTPUT → DISPATCHING_TOOL
 *                                          │                  │
 *                                          └──────────────────┴→ SYNTHESIZING_ANSWER → DONE
 *
 * ERROR is reachable from every non-terminal state and absorbs.
 */
public enum TurnState {

    AWAITING_QUERY,
    PROMPTING_MODEL,
    PARSING_OUTPUT,
    DISPATCHING_TOOL,
    SYNTHESIZING_ANSWER,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    public boolean canTransitionTo(TurnState next) {
        if (isTerminal()) return false;
        if (next == ERROR) return true;
        return successors().contains(next);
    }

    private Set<TurnState> successors() {
        return switch (this) {
            case AWAITING_QUERY      -> EnumSet.of(PROMPTING_MODEL);
            case PROMPTING_MODEL     -> EnumSet.of(PARSING_OUTPUT);
            case PARSING_OUTPUT      -> EnumSet.of(DISPATCHING_TOOL, SYNTHESIZING_ANSWER);
            case DISPATCHING_TOOL    -> EnumSet.of(SYNTHESIZING_ANSWER);
            case SYNTHESIZING_ANSWER -> EnumSet.of(DONE);
            case DONE, ERROR         -> EnumSet.noneOf(TurnState.class);
        };
    }
}
