package com.openforge.toolbridge.context;

import com.openforge.toolbridge.llm.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-session memory: the last identifier seen for each entity kind, the turn
 * counter and a short replay history for the model.
 *
 * Entities follow a most-recent-wins policy, one slot per kind, no history stack.
 *
 * Not thread-safe. ConversationSessionService hands each turn a {@link #copy()}
 * under the session lock and swaps the copy in only when the turn finishes, so
 * a failed or abandoned turn leaves the stored context untouched.
 */
@Slf4j
public class ConversationContext {

    /** Sliding window of replayed messages (user/assistant pairs). */
    static final int MAX_HISTORY_MESSAGES = 20;

    private static final Pattern LITERAL_ID = Pattern.compile("#?(\\d{1,18})");

    private static final String DETERMINERS = "that|this|the same|the last|the previous";

    private static final Pattern BARE_MARKER = Pattern.compile(
            "(it|that|this|that one|this one|the same|the same one)", Pattern.CASE_INSENSITIVE);

    private final String              sessionId;
    private final Map<String, Long>   lastEntities;
    private final List<Message>       history;
    private int                       turnCount;

    private ConversationContext(String sessionId,
                                Map<String, Long> lastEntities,
                                List<Message> history,
                                int turnCount) {
        this.sessionId    = sessionId;
        this.lastEntities = new LinkedHashMap<>(lastEntities);
        this.history      = new ArrayList<>(history);
        this.turnCount    = turnCount;
    }

    public static ConversationContext start(String sessionId) {
        return new ConversationContext(sessionId, Map.of(), List.of(), 0);
    }

    /** Independent working copy; changes to it do not affect this instance. */
    public ConversationContext copy() {
        return new ConversationContext(sessionId, lastEntities, history, turnCount);
    }

    // ── Reference resolution ────────────────────────────────────────────────

    /**
     * Resolves a surface form to an identifier.
     *
     *   "2", "#2"              → 2, verbatim
     *   "it", "that post", …   → last recorded id of {@code entityKind}
     *
     * @throws NoPriorReferenceException if the text is a reference but no entity of
     *         that kind has been recorded, or if the text is neither an id nor a
     *         recognisable reference
     */
    public long resolveReference(String entityKind, String surfaceText) {
        String text = normalize(surfaceText);
        Matcher literal = LITERAL_ID.matcher(text);
        if (literal.matches()) {
            return Long.parseLong(literal.group(1));
        }
        if (!isAnaphoric(entityKind, text)) {
            throw new NoPriorReferenceException(entityKind, surfaceText);
        }
        Long id = lastEntities.get(entityKind);
        if (id == null) {
            throw new NoPriorReferenceException(entityKind, surfaceText);
        }
        log.debug("[Context:{}] Resolved '{}' → {} {}", sessionId, surfaceText, entityKind, id);
        return id;
    }

    /** Records the most recent identifier of a kind, replacing any earlier one. */
    public void record(String entityKind, long identifier) {
        lastEntities.put(entityKind, identifier);
    }

    public Optional<Long> lastEntity(String entityKind) {
        return Optional.ofNullable(lastEntities.get(entityKind));
    }

    public Map<String, Long> lastEntities() {
        return Collections.unmodifiableMap(lastEntities);
    }

    /**
     * Replaces phrases such as "that post" with "post 2" for every known kind.
     *
     * @throws NoPriorReferenceException if a phrase names a kind nothing was recorded for
     */
    public String rewriteQuery(String query, Collection<String> entityKinds) {
        String rewritten = query;
        for (String kind : entityKinds) {
            Pattern phrase = Pattern.compile(
                    "\\b(?:" + DETERMINERS + ")\\s+" + Pattern.quote(kind) + "\\b",
                    Pattern.CASE_INSENSITIVE);
            Matcher matcher = phrase.matcher(rewritten);
            if (!matcher.find()) continue;

            Long id = lastEntities.get(kind);
            if (id == null) {
                throw new NoPriorReferenceException(kind, matcher.group());
            }
            rewritten = matcher.replaceAll(Matcher.quoteReplacement(kind + " " + id));
        }
        if (!rewritten.equals(query)) {
            log.debug("[Context:{}] Rewrote query '{}' → '{}'", sessionId, query, rewritten);
        }
        return rewritten;
    }

    /**
     * True if {@code surfaceText} refers back to an earlier entity: "it", "that one",
     * "the same", or a determiner followed by the kind ("that post", "the previous post").
     */
    public static boolean isAnaphoric(String entityKind, String surfaceText) {
        String text = normalize(surfaceText);
        if (text.isEmpty() || entityKind == null) return false;
        if (BARE_MARKER.matcher(text).matches()) return true;
        return Pattern.compile("(?:" + DETERMINERS + "|the)\\s+" + Pattern.quote(entityKind),
                Pattern.CASE_INSENSITIVE).matcher(text).matches();
    }

    private static String normalize(String text) {
        if (text == null) return "";
        return text.trim().replaceAll("[.?!]+$", "").replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    // ── History ──────────────────────────────────────────────────────────────

    /** Appends one completed exchange and trims to the sliding window. */
    public void appendExchange(String query, String answer) {
        history.add(Message.user(query));
        history.add(Message.assistant(answer));
        if (history.size() > MAX_HISTORY_MESSAGES) {
            history.subList(0, history.size() - MAX_HISTORY_MESSAGES).clear();
        }
    }

    public List<Message> history() {
        return Collections.unmodifiableList(history);
    }

    // ── Turn bookkeeping ─────────────────────────────────────────────────────

    public void completeTurn() {
        turnCount++;
    }

    public int turnCount() {
        return turnCount;
    }

    public String sessionId() {
        return sessionId;
    }
}
