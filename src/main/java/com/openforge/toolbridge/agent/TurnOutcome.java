package com.openforge.toolbridge.agent;

import com.openforge.toolbridge.context.ConversationContext;

/**
 * What a turn hands back: its result and the context to store for the next turn.
 * For an ERROR result the context is the one the turn received, unchanged.
 */
public record TurnOutcome(AgentTurnResult result, ConversationContext context) {}
