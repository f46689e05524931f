package com.openforge.toolbridge.context;

import com.openforge.toolbridge.llm.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConversationContextTest {

    private static final List<String> KINDS = List.of("post");

    private ConversationContext context;

    @BeforeEach
    void setUp() {
        context = ConversationContext.start("s-1");
    }

    // ── resolveReference ─────────────────────────────────────────────────────

    @Test
    void resolveReference_literalIsReturnedVerbatim() {
        assertEquals(7L, context.resolveReference("post", "7"));
        assertEquals(7L, context.resolveReference("post", "#7"));
    }

    @Test
    void resolveReference_anaphoraUsesLastRecordedEntity() {
        context.record("post", 2);

        assertEquals(2L, context.resolveReference("post", "that post"));
        assertEquals(2L, context.resolveReference("post", "it"));
        assertEquals(2L, context.resolveReference("post", "The same post."));
        assertEquals(2L, context.resolveReference("post", "the previous post"));
        assertEquals(2L, context.resolveReference("post", "  THIS ONE "));
    }

    @Test
    void resolveReference_freshSessionHasNoPriorReference() {
        NoPriorReferenceException e = assertThrows(NoPriorReferenceException.class,
                () -> context.resolveReference("post", "that post"));
        assertEquals("post", e.entityKind());
        assertEquals("no_prior_reference", e.errorType());
    }

    @Test
    void resolveReference_otherKindDoesNotCount() {
        context.record("user", 4);

        assertThrows(NoPriorReferenceException.class, () -> context.resolveReference("post", "that post"));
    }

    @Test
    void resolveReference_unrecognisedTextFails() {
        context.record("post", 2);

        assertThrows(NoPriorReferenceException.class,
                () -> context.resolveReference("post", "the one about cats"));
    }

    @Test
    void isAnaphoric_recognisesMarkersOnly() {
        assertTrue(ConversationContext.isAnaphoric("post", "that post"));
        assertTrue(ConversationContext.isAnaphoric("post", " It. "));
        assertTrue(ConversationContext.isAnaphoric("post", "the previous post"));
        assertFalse(ConversationContext.isAnaphoric("post", "two"));
        assertFalse(ConversationContext.isAnaphoric("post", "that comment"));
        assertFalse(ConversationContext.isAnaphoric("post", ""));
        assertFalse(ConversationContext.isAnaphoric("post", null));
    }

    @Test
    void record_mostRecentWins() {
        context.record("post", 2);
        context.record("post", 5);

        assertEquals(5L, context.resolveReference("post", "that post"));
        assertEquals(Optional.of(5L), context.lastEntity("post"));
        assertEquals(Map.of("post", 5L), context.lastEntities());
    }

    // ── rewriteQuery ─────────────────────────────────────────────────────────

    @Test
    void rewriteQuery_replacesReferencePhrase() {
        context.record("post", 2);

        assertEquals("Now show me all comments for post 2",
                context.rewriteQuery("Now show me all comments for that post", KINDS));
        assertEquals("Is post 2 popular? Compare post 2 please",
                context.rewriteQuery("Is this post popular? Compare the same post please", KINDS));
    }

    @Test
    void rewriteQuery_leavesPlainQueryUnchanged() {
        assertEquals("Get me post number two", context.rewriteQuery("Get me post number two", KINDS));
    }

    @Test
    void rewriteQuery_referenceWithoutRecordedEntityFails() {
        assertThrows(NoPriorReferenceException.class,
                () -> context.rewriteQuery("show comments for that post", KINDS));
    }

    @Test
    void rewriteQuery_doesNotMatchInsideLongerWords() {
        context.record("post", 2);

        assertEquals("that poster is nice", context.rewriteQuery("that poster is nice", KINDS));
    }

    // ── copy, history, turns ─────────────────────────────────────────────────

    @Test
    void copy_isIndependent() {
        context.record("post", 2);
        ConversationContext copy = context.copy();

        copy.record("post", 9);
        copy.appendExchange("q", "a");
        copy.completeTurn();

        assertEquals(Optional.of(2L), context.lastEntity("post"));
        assertTrue(context.history().isEmpty());
        assertEquals(0, context.turnCount());
        assertEquals("s-1", copy.sessionId());
    }

    @Test
    void appendExchange_keepsSlidingWindow() {
        for (int i = 0; i < 15; i++) {
            context.appendExchange("question " + i, "answer " + i);
        }

        List<Message> history = context.history();
        assertEquals(ConversationContext.MAX_HISTORY_MESSAGES, history.size());
        assertEquals(Message.user("question 5"), history.get(0));
        assertEquals(Message.assistant("answer 14"), history.get(history.size() - 1));
    }

    @Test
    void history_isReadOnly() {
        context.appendExchange("q", "a");

        assertThrows(UnsupportedOperationException.class, () -> context.history().clear());
        assertThrows(UnsupportedOperationException.class, () -> context.lastEntities().put("post", 1L));
    }

    @Test
    void completeTurn_countsTurns() {
        context.completeTurn();
        context.completeTurn();

        assertEquals(2, context.turnCount());
    }
}
