package com.openforge.toolbridge.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.toolbridge.agent.event.AgentEvent;
import com.openforge.toolbridge.context.ConversationContext;
import com.openforge.toolbridge.context.ConversationSessionService;
import com.openforge.toolbridge.context.ConversationSessionService.SessionLease;
import com.openforge.toolbridge.invocation.InvocationParser;
import com.openforge.toolbridge.invocation.ToolInvocation;
import com.openforge.toolbridge.llm.ModelBackend;
import com.openforge.toolbridge.tool.ToolRegistry;
import com.openforge.toolbridge.tool.ToolResult;
import com.openforge.toolbridge.tool.ToolSpec;
import com.openforge.toolbridge.websocket.AgentEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-facing entry points.
 *
 *   handleTurn(sessionId, query)  - natural-language routing through the model
 *   invokeTool(toolName, args)    - direct adapter call, no model, no session
 *
 * Turns of one session are chained one after another; each runs on the
 * agentTurnExecutor under its session's lock, and a turn waiting behind its
 * predecessor occupies no worker. The caller waits at most agent.turn-timeout-seconds; a turn that is abandoned (timeout or
 * caller interrupt) is cancelled and its context copy is never committed. The
 * worker and the caller race on a single flag, so exactly one of them decides
 * whether the turn's context is kept.
 */
@Slf4j
@Service
public class AgentService {

    private final ConversationSessionService sessions;
    private final ModelBackend               model;
    private final InvocationParser           parser;
    private final ToolRegistry               registry;
    private final PromptBuilder              prompts;
    private final AgentEventPublisher        publisher;
    private final ExecutorService            agentTurnExecutor;
    private final Duration                   turnTimeout;

    private final Map<String, CompletableFuture<Void>> sessionTails = new ConcurrentHashMap<>();

    public AgentService(ConversationSessionService sessions,
                        ModelBackend model,
                        InvocationParser parser,
                        ToolRegistry registry,
                        PromptBuilder prompts,
                        AgentEventPublisher publisher,
                        ExecutorService agentTurnExecutor,
                        AgentProperties properties) {
        this.sessions          = sessions;
        this.model             = model;
        this.parser            = parser;
        this.registry          = registry;
        this.prompts           = prompts;
        this.publisher         = publisher;
        this.agentTurnExecutor = agentTurnExecutor;
        this.turnTimeout       = Duration.ofSeconds(properties.turnTimeoutSeconds());
    }

    // ── handleTurn ───────────────────────────────────────────────────────────

    public AgentTurnResult handleTurn(String sessionId, String query) {
        PendingTurn turn = new PendingTurn(sessionId, query);
        enqueue(turn);

        try {
            return turn.result.get(turnTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (!turn.settled.compareAndSet(false, true)) {
                // The worker settled first; its result is about to be returned.
                return awaitSettled(turn);
            }
            turn.cancel();
            log.warn("[Agent:{}] Turn timed out after {}s, discarded", sessionId, turnTimeout.toSeconds());
            return abandoned(sessionId, "timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!turn.settled.compareAndSet(false, true)) {
                return awaitSettled(turn);
            }
            turn.cancel();
            log.warn("[Agent:{}] Caller abandoned the turn", sessionId);
            return abandoned(sessionId, "cancelled");
        } catch (ExecutionException e) {
            log.error("[Agent:{}] Turn failed outside the orchestrator", sessionId, e.getCause());
            return abandoned(sessionId, "internal_error");
        }
    }

    /**
     * Chains the turn behind the session's previous one. A queued turn holds no
     * worker thread; it is submitted only once its predecessor has finished.
     */
    private void enqueue(PendingTurn turn) {
        sessionTails.compute(turn.sessionId, (id, tail) -> {
            CompletableFuture<Void> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            previous.whenComplete((ignored, error) -> turn.start());
            return turn.finished;
        });
        turn.finished.whenComplete((ignored, error) -> sessionTails.remove(turn.sessionId, turn.finished));
    }

    private AgentTurnResult runTurn(String sessionId, String query, AtomicBoolean settled)
            throws InterruptedException {
        try (SessionLease lease = sessions.acquire(sessionId)) {
            AgentOrchestrator orchestrator =
                    new AgentOrchestrator(model, parser, registry, prompts, publisher::publish);
            TurnOutcome outcome = orchestrator.run(lease.context(), query);

            if (!settled.compareAndSet(false, true)) {
                log.info("[Agent:{}] Turn finished after it was abandoned; result discarded", sessionId);
                return outcome.result();
            }
            if (outcome.result().isDone()) {
                lease.commit(outcome.context());
            }
            return outcome.result();
        }
    }

    /** The worker won the race, so the result is already on its way. */
    private AgentTurnResult awaitSettled(PendingTurn turn) {
        try {
            return turn.result.join();
        } catch (CompletionException | CancellationException e) {
            log.error("[Agent:{}] Turn failed outside the orchestrator", turn.sessionId, e.getCause());
            return abandoned(turn.sessionId, "internal_error");
        }
    }

    private AgentTurnResult abandoned(String sessionId, String errorType) {
        String message = prompts.errorMessage(errorType, null);
        publisher.publish(AgentEvent.error(sessionId, message, errorType));
        return AgentTurnResult.error(message, errorType);
    }

    // ── invokeTool ───────────────────────────────────────────────────────────

    /**
     * Validates {@code arguments} against the tool's schema and calls its adapter.
     * Anaphoric markers are rejected here: there is no session to resolve them against.
     *
     * @throws com.openforge.toolbridge.tool.ToolInvocationException on unknown tool or invalid arguments
     */
    public ToolResult invokeTool(String toolName, JsonNode arguments) {
        ToolInvocation invocation = parser.validateDirect(toolName, arguments);
        ToolSpec spec = registry.lookup(invocation.toolName());
        log.info("[Agent] Direct invocation {} args={}", spec.name(), invocation.arguments());
        return spec.adapter().fetch(invocation.longArgument(spec.idArgument()));
    }

    // ── Sessions ─────────────────────────────────────────────────────────────

    public Optional<ConversationContext> session(String sessionId) {
        return sessions.snapshot(sessionId);
    }

    public boolean endSession(String sessionId) {
        return sessions.endSession(sessionId);
    }

    // ── Pending turn ─────────────────────────────────────────────────────────

    /**
     * One queued or running turn. {@code finished} completes when the worker is
     * done with the session (or the turn was skipped), which releases the next
     * turn of the same session.
     */
    private final class PendingTurn {

        final String                             sessionId;
        final String                             query;
        final AtomicBoolean                      settled  = new AtomicBoolean(false);
        final CompletableFuture<AgentTurnResult> result   = new CompletableFuture<>();
        final CompletableFuture<Void>            finished = new CompletableFuture<>();

        private Thread worker;

        PendingTurn(String sessionId, String query) {
            this.sessionId = sessionId;
            this.query     = query;
        }

        void start() {
            try {
                agentTurnExecutor.execute(this::execute);
            } catch (RejectedExecutionException e) {
                result.completeExceptionally(e);
                finished.complete(null);
            }
        }

        private void execute() {
            try {
                synchronized (this) {
                    if (settled.get()) {
                        log.debug("[Agent:{}] Skipping turn abandoned while queued", sessionId);
                        return;
                    }
                    worker = Thread.currentThread();
                }
                result.complete(runTurn(sessionId, query, settled));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            } finally {
                synchronized (this) {
                    worker = null;
                    // Drop an interrupt aimed at this turn before the thread goes back to the pool.
                    Thread.interrupted();
                }
                finished.complete(null);
            }
        }

        /** Interrupts the worker if the turn is running; a queued turn skips itself. */
        synchronized void cancel() {
            if (worker != null) worker.interrupt();
        }
    }
}
