package com.openforge.toolbridge.context;

import com.openforge.toolbridge.agent.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds one ConversationContext per session and serializes turns of a session.
 *
 * Usage:
 *
 *   try (SessionLease lease = sessions.acquire(sessionId)) {
 *       ConversationContext working = lease.context();   // private copy
 *       ...
 *       lease.commit(working);                           // only on completion
 *   }
 *
 * Different sessions never contend. Sessions idle longer than the configured
 * timeout are evicted by a scheduled sweep; a session that is mid-turn is skipped.
 */
@Slf4j
@Service
public class ConversationSessionService {

    private final Map<String, SessionSlot> sessions = new ConcurrentHashMap<>();
    private final Duration idleTimeout;
    private final Clock    clock;

    public ConversationSessionService(AgentProperties properties, Clock clock) {
        this.idleTimeout = Duration.ofMinutes(properties.session().idleTimeoutMinutes());
        this.clock       = clock;
    }

    /**
     * Blocks until no other turn of this session is running, then returns a lease
     * over a working copy of the context. Creates the session on first use.
     *
     * @throws InterruptedException if the waiting turn is cancelled
     */
    public SessionLease acquire(String sessionId) throws InterruptedException {
        while (true) {
            SessionSlot slot = sessions.computeIfAbsent(sessionId,
                    id -> new SessionSlot(ConversationContext.start(id), clock.instant()));
            slot.lock.lockInterruptibly();
            // The slot may have been evicted between lookup and lock.
            if (sessions.get(sessionId) == slot) {
                return new SessionLease(slot, slot.context.copy());
            }
            slot.lock.unlock();
        }
    }

    /** Read-only copy of a session's context, if the session exists. */
    public Optional<ConversationContext> snapshot(String sessionId) {
        SessionSlot slot = sessions.get(sessionId);
        if (slot == null) return Optional.empty();
        slot.lock.lock();
        try {
            return Optional.of(slot.context.copy());
        } finally {
            slot.lock.unlock();
        }
    }

    /** Drops a session. Returns false if it did not exist. */
    public boolean endSession(String sessionId) {
        boolean removed = sessions.remove(sessionId) != null;
        if (removed) log.info("[Sessions] Ended session {}", sessionId);
        return removed;
    }

    public int activeSessions() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${agent.session.sweep-interval-ms:60000}")
    public void evictIdleSessions() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        sessions.forEach((id, slot) -> {
            if (!slot.lastActive.isBefore(cutoff) || !slot.lock.tryLock()) return;
            try {
                if (slot.lastActive.isBefore(cutoff) && sessions.remove(id, slot)) {
                    log.info("[Sessions] Evicted idle session {} (turns={})", id, slot.context.turnCount());
                }
            } finally {
                slot.lock.unlock();
            }
        });
    }

    // ── Slot & lease ─────────────────────────────────────────────────────────

    private static final class SessionSlot {
        final ReentrantLock       lock = new ReentrantLock();
        volatile ConversationContext context;
        volatile Instant             lastActive;

        SessionSlot(ConversationContext context, Instant now) {
            this.context    = context;
            this.lastActive = now;
        }
    }

    /** Exclusive access to one session for the duration of a turn. */
    public final class SessionLease implements AutoCloseable {

        private final SessionSlot         slot;
        private final ConversationContext workingCopy;
        private boolean                   closed;

        private SessionLease(SessionSlot slot, ConversationContext workingCopy) {
            this.slot        = slot;
            this.workingCopy = workingCopy;
        }

        public ConversationContext context() {
            return workingCopy;
        }

        /** Replaces the stored context with the turn's final one. */
        public void commit(ConversationContext updated) {
            if (closed) throw new IllegalStateException("Lease already released");
            slot.context = updated;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            slot.lastActive = clock.instant();
            slot.lock.unlock();
        }
    }
}
