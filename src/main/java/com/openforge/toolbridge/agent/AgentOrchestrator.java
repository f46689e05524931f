package com.openforge.toolbridge.agent;

import com.openforge.toolbridge.agent.event.AgentEvent;
import com.openforge.toolbridge.context.ConversationContext;
import com.openforge.toolbridge.context.NoPriorReferenceException;
import com.openforge.toolbridge.invocation.InvocationParser;
import com.openforge.toolbridge.invocation.ToolInvocation;
import com.openforge.toolbridge.llm.LlmClient.LlmException;
import com.openforge.toolbridge.llm.ModelBackend;
import com.openforge.toolbridge.tool.ToolInvocationException;
import com.openforge.toolbridge.tool.ToolRegistry;
import com.openforge.toolbridge.tool.ToolResult;
import com.openforge.toolbridge.tool.ToolSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Runs exactly one turn through the dispatch state machine.
 *
 *   AWAITING_QUERY
 *     │  rewrite "that post" → "post 2"
 *   PROMPTING_MODEL          model call #1 (routing)
 *   PARSING_OUTPUT           no JSON at all → the model answered directly
 *     │  parse, resolve anaphoric ids, look up the adapter
 *   DISPATCHING_TOOL         adapter.fetch(id)
 *   SYNTHESIZING_ANSWER      ok → record entities + model call #2
 *     │                      not_found / adapter_error → template, no model call
 *   DONE
 *
 * Any failure ends in ERROR with an errorType code and the caller's context
 * returned untouched. The orchestrator works on its own copy of the context and
 * hands the copy back only for a DONE turn; it keeps nothing once run() returns.
 *
 * Instances are single-use and not thread-safe. AgentService creates one per turn.
 */
@Slf4j
public class AgentOrchestrator {

    private final ModelBackend          model;
    private final InvocationParser      parser;
    private final ToolRegistry          registry;
    private final PromptBuilder         prompts;
    private final Consumer<AgentEvent>  events;

    private TurnState state = TurnState.AWAITING_QUERY;
    private String    sessionId;

    public AgentOrchestrator(ModelBackend model,
                             InvocationParser parser,
                             ToolRegistry registry,
                             PromptBuilder prompts,
                             Consumer<AgentEvent> events) {
        this.model    = model;
        this.parser   = parser;
        this.registry = registry;
        this.prompts  = prompts;
        this.events   = events;
    }

    public TurnState state() {
        return state;
    }

    /**
     * Handles one query.
     *
     * @param context the session's context as of the end of the previous turn; never mutated
     * @return the result plus the context to store: an updated copy for DONE, {@code context} itself for ERROR
     */
    public TurnOutcome run(ConversationContext context, String query) {
        if (state != TurnState.AWAITING_QUERY) {
            throw new IllegalStateException("Orchestrator already used, state=" + state);
        }
        sessionId = context.sessionId();
        ConversationContext working = context.copy();

        try {
            String rewritten = working.rewriteQuery(query, registry.entityKinds());

            transition(TurnState.PROMPTING_MODEL);
            String raw = model.complete(prompts.routingMessages(working, rewritten));
            log.debug("[Agent:{}] Model output: {}", sessionId, raw);

            transition(TurnState.PARSING_OUTPUT);
            if (!parser.containsToolCall(raw)) {
                transition(TurnState.SYNTHESIZING_ANSWER);
                log.info("[Agent:{}] Direct answer, no tool call", sessionId);
                return done(working, rewritten, AgentTurnResult.done(raw.trim(), null, null));
            }

            ToolInvocation parsed = parser.parse(raw);
            ToolSpec spec = registry.lookup(parsed.toolName());
            ToolInvocation invocation = resolveReferences(parsed, spec, working);

            transition(TurnState.DISPATCHING_TOOL);
            events.accept(AgentEvent.toolCall(sessionId, invocation));
            log.info("[Agent:{}] Dispatching {} args={}", sessionId, spec.name(), invocation.arguments());
            ToolResult result = spec.adapter().fetch(invocation.longArgument(spec.idArgument()));
            events.accept(AgentEvent.toolResult(sessionId, result));
            log.info("[Agent:{}] {} → {}", sessionId, spec.name(), result.status().code());

            transition(TurnState.SYNTHESIZING_ANSWER);
            String answer;
            if (result.isOk()) {
                recordEntities(working, spec, invocation);
                answer = synthesize(rewritten, invocation, result);
            } else {
                answer = prompts.failedResultMessage(invocation, result);
            }
            return done(working, rewritten, AgentTurnResult.done(answer, invocation, result));

        } catch (ToolInvocationException e) {
            return fail(context, e.errorType(), e.getMessage());
        } catch (NoPriorReferenceException e) {
            return fail(context, e.errorType(), e.getMessage());
        } catch (LlmException e) {
            return fail(context, "model_unavailable", e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Agent:{}] Unexpected failure in state {}", sessionId, state, e);
            return fail(context, "internal_error", e.getMessage());
        }
    }

    // ── Steps ────────────────────────────────────────────────────────────────

    private ToolInvocation resolveReferences(ToolInvocation invocation,
                                             ToolSpec spec,
                                             ConversationContext working) {
        ToolInvocation resolved = invocation;
        for (Map.Entry<String, String> ref : invocation.unresolvedReferences().entrySet()) {
            String kind = spec.argumentSchema().get(ref.getKey()).entityKind();
            long id = working.resolveReference(kind, ref.getValue());
            resolved = resolved.withResolvedReference(ref.getKey(), id);
        }
        return resolved;
    }

    private static void recordEntities(ConversationContext working, ToolSpec spec, ToolInvocation invocation) {
        spec.argumentSchema().forEach((name, arg) -> {
            if (arg.isReference() && invocation.arguments().get(name) instanceof Number) {
                working.record(arg.entityKind(), invocation.longArgument(name));
            }
        });
    }

    private String synthesize(String query, ToolInvocation invocation, ToolResult result) {
        try {
            return model.complete(prompts.synthesisMessages(query, invocation, result)).trim();
        } catch (LlmException e) {
            log.warn("[Agent:{}] Synthesis failed, rendering result directly: {}", sessionId, e.getMessage());
            return prompts.renderPayload(invocation, result);
        }
    }

    // ── Terminal states ──────────────────────────────────────────────────────

    private TurnOutcome done(ConversationContext working, String query, AgentTurnResult result) {
        working.appendExchange(query, result.finalText());
        working.completeTurn();
        transition(TurnState.DONE);
        events.accept(AgentEvent.finalAnswer(sessionId, result.finalText()));
        return new TurnOutcome(result, working);
    }

    private TurnOutcome fail(ConversationContext untouched, String errorType, String detail) {
        log.warn("[Agent:{}] Turn failed in state {} [{}]: {}", sessionId, state, errorType, detail);
        state = TurnState.ERROR;
        String message = prompts.errorMessage(errorType, detail);
        events.accept(AgentEvent.stateChange(sessionId, TurnState.ERROR));
        events.accept(AgentEvent.error(sessionId, message, errorType));
        return new TurnOutcome(AgentTurnResult.error(message, errorType), untouched);
    }

    private void transition(TurnState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition %s → %s".formatted(state, next));
        }
        log.debug("[Agent:{}] {} → {}", sessionId, state, next);
        state = next;
        events.accept(AgentEvent.stateChange(sessionId, next));
    }
}
