package com.openforge.toolbridge.invocation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolbridge.adapter.ResourceAdapter;
import com.openforge.toolbridge.tool.AmbiguousOutputException;
import com.openforge.toolbridge.tool.ArgumentSpec;
import com.openforge.toolbridge.tool.ArgumentType;
import com.openforge.toolbridge.tool.ArgumentTypeException;
import com.openforge.toolbridge.tool.MalformedInvocationException;
import com.openforge.toolbridge.tool.MissingArgumentException;
import com.openforge.toolbridge.tool.ToolRegistry;
import com.openforge.toolbridge.tool.ToolSpec;
import com.openforge.toolbridge.tool.UnknownToolException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class InvocationParserTest {

    private ObjectMapper objectMapper;
    private InvocationParser parser;

    @BeforeEach
    void setUp() {
        ResourceAdapter adapter = mock(ResourceAdapter.class);
        ToolRegistry registry = new ToolRegistry();
        registry.register(new ToolSpec("post_call", "Fetch a post",
                Map.of("post_id", ArgumentSpec.entityId("post")), "post_id", adapter));
        registry.register(new ToolSpec("comments_call", "Fetch comments for a post",
                Map.of("post_id", ArgumentSpec.entityId("post")), "post_id", adapter));

        Map<String, ArgumentSpec> search = new LinkedHashMap<>();
        search.put("post_id", ArgumentSpec.required(ArgumentType.INTEGER));
        search.put("term", ArgumentSpec.required(ArgumentType.STRING));
        search.put("limit", ArgumentSpec.optional(ArgumentType.NUMBER));
        search.put("exact", ArgumentSpec.optional(ArgumentType.BOOLEAN));
        registry.register(new ToolSpec("search_call", "Search a post", search, "post_id", adapter));

        objectMapper = new ObjectMapper();
        parser = new InvocationParser(registry, objectMapper);
    }

    // ── Happy path ───────────────────────────────────────────────────────────

    @Test
    void parse_returnsExactToolAndArguments() {
        ToolInvocation invocation = parser.parse("{\"tool\":\"post_call\",\"args\":{\"post_id\":2}}");

        assertEquals("post_call", invocation.toolName());
        assertEquals(Map.of("post_id", 2L), invocation.arguments());
        assertEquals(2L, invocation.longArgument("post_id"));
        assertFalse(invocation.hasUnresolvedReferences());
    }

    @Test
    void parse_toleratesSurroundingProse() {
        String raw = """
                Sure! Here is the call:
                ```json
                {"tool": "comments_call", "args": {"post_id": 7}}
                ```
                Let me know if you need anything else.
                """;

        ToolInvocation invocation = parser.parse(raw);

        assertEquals("comments_call", invocation.toolName());
        assertEquals(7L, invocation.longArgument("post_id"));
    }

    @Test
    void parse_ignoresBracesInsideStrings() {
        ToolInvocation invocation = parser.parse(
                "{\"tool\":\"search_call\",\"args\":{\"post_id\":1,\"term\":\"a } b { c\"}}");

        assertEquals("a } b { c", invocation.arguments().get("term"));
    }

    @Test
    void parse_convertsEachDeclaredType() {
        ToolInvocation invocation = parser.parse(
                "{\"tool\":\"search_call\",\"args\":{\"post_id\":3,\"term\":\"x\",\"limit\":2.5,\"exact\":true}}");

        assertEquals(3L, invocation.arguments().get("post_id"));
        assertEquals("x", invocation.arguments().get("term"));
        assertEquals(2.5, invocation.arguments().get("limit"));
        assertEquals(Boolean.TRUE, invocation.arguments().get("exact"));
    }

    @Test
    void parse_dropsUnexpectedArguments() {
        ToolInvocation invocation = parser.parse(
                "{\"tool\":\"post_call\",\"args\":{\"post_id\":2,\"include_author\":true}}");

        assertEquals(Map.of("post_id", 2L), invocation.arguments());
    }

    @Test
    void parse_optionalArgumentsMayBeAbsent() {
        ToolInvocation invocation = parser.parse(
                "{\"tool\":\"search_call\",\"args\":{\"post_id\":3,\"term\":\"x\"}}");

        assertFalse(invocation.arguments().containsKey("limit"));
        assertFalse(invocation.arguments().containsKey("exact"));
    }

    // ── Reference arguments ──────────────────────────────────────────────────

    @Test
    void parse_normalisesNumericStringForReferenceArgument() {
        ToolInvocation invocation = parser.parse("{\"tool\":\"post_call\",\"args\":{\"post_id\":\"2\"}}");

        assertEquals(2L, invocation.longArgument("post_id"));
        assertFalse(invocation.hasUnresolvedReferences());
    }

    @Test
    void parse_keepsAnaphoricMarkerUnresolved() {
        ToolInvocation invocation = parser.parse(
                "{\"tool\":\"comments_call\",\"args\":{\"post_id\":\"that post\"}}");

        assertTrue(invocation.hasUnresolvedReferences());
        assertEquals(Map.of("post_id", "that post"), invocation.unresolvedReferences());
        assertFalse(invocation.arguments().containsKey("post_id"));

        ToolInvocation resolved = invocation.withResolvedReference("post_id", 2);
        assertEquals(2L, resolved.longArgument("post_id"));
        assertFalse(resolved.hasUnresolvedReferences());
    }

    @Test
    void parse_acceptsHashPrefixedIdForReferenceArgument() {
        ToolInvocation invocation = parser.parse("{\"tool\":\"post_call\",\"args\":{\"post_id\":\"#7\"}}");

        assertEquals(7L, invocation.longArgument("post_id"));
    }

    @Test
    void parse_nonReferenceTextForReferenceArgumentIsTypeError() {
        ArgumentTypeException e = assertThrows(ArgumentTypeException.class,
                () -> parser.parse("{\"tool\":\"comments_call\",\"args\":{\"post_id\":\"two\"}}"));
        assertEquals("post_id", e.argument());
        assertEquals("argument_type", e.errorType());

        assertThrows(ArgumentTypeException.class,
                () -> parser.parse("{\"tool\":\"post_call\",\"args\":{\"post_id\":\"that comment\"}}"));
    }

    @Test
    void parse_textForPlainIntegerArgumentIsTypeError() {
        ArgumentTypeException e = assertThrows(ArgumentTypeException.class, () -> parser.parse(
                "{\"tool\":\"search_call\",\"args\":{\"post_id\":\"that post\",\"term\":\"x\"}}"));
        assertEquals("post_id", e.argument());
    }

    // ── Rejections ───────────────────────────────────────────────────────────

    @Test
    void parse_twoCompleteObjectsIsAmbiguous() {
        String raw = "{\"tool\":\"post_call\",\"args\":{\"post_id\":1}} or "
                + "{\"tool\":\"post_call\",\"args\":{\"post_id\":2}}";

        AmbiguousOutputException e = assertThrows(AmbiguousOutputException.class, () -> parser.parse(raw));
        assertEquals(2, e.objectCount());
        assertEquals("ambiguous_output", e.errorType());
    }

    @Test
    void parse_duplicateIdenticalObjectsIsAmbiguous() {
        String call = "{\"tool\":\"post_call\",\"args\":{\"post_id\":1}}";

        assertThrows(AmbiguousOutputException.class, () -> parser.parse(call + "\n" + call));
    }

    @Test
    void parse_completeObjectPlusTruncatedOneIsAmbiguous() {
        String raw = "{\"tool\":\"post_call\",\"args\":{\"post_id\":1}} then {\"tool\":\"comments_call\",\"args\":";

        assertThrows(AmbiguousOutputException.class, () -> parser.parse(raw));
    }

    @Test
    void parse_onlyTruncatedObjectIsMalformed() {
        assertThrows(MalformedInvocationException.class,
                () -> parser.parse("{\"tool\":\"post_call\",\"args\":{\"post_id\":1}"));
    }

    @Test
    void parse_noJsonIsMalformed() {
        MalformedInvocationException e = assertThrows(MalformedInvocationException.class,
                () -> parser.parse("Post 2 is about dolor sit amet."));
        assertEquals("malformed_invocation", e.errorType());
    }

    @Test
    void parse_missingToolKeyIsMalformed() {
        MalformedInvocationException e = assertThrows(MalformedInvocationException.class,
                () -> parser.parse("{\"args\":{\"post_id\":1}}"));
        assertTrue(e.getMessage().contains("'tool'"));
    }

    @Test
    void parse_missingArgsKeyIsMalformed() {
        MalformedInvocationException e = assertThrows(MalformedInvocationException.class,
                () -> parser.parse("{\"tool\":\"post_call\"}"));
        assertTrue(e.getMessage().contains("'args'"));
    }

    @Test
    void parse_extraTopLevelKeyIsMalformed() {
        assertThrows(MalformedInvocationException.class,
                () -> parser.parse("{\"tool\":\"post_call\",\"args\":{\"post_id\":1},\"reason\":\"x\"}"));
    }

    @Test
    void parse_argsMustBeObject() {
        assertThrows(MalformedInvocationException.class,
                () -> parser.parse("{\"tool\":\"post_call\",\"args\":[1]}"));
        assertThrows(MalformedInvocationException.class,
                () -> parser.parse("{\"tool\":42,\"args\":{}}"));
    }

    @Test
    void parse_unknownToolFailsAfterShapeCheck() {
        assertThrows(UnknownToolException.class,
                () -> parser.parse("{\"tool\":\"delete_everything\",\"args\":{}}"));
        assertThrows(UnknownToolException.class,
                () -> parser.parse("{\"tool\":\"POST_CALL\",\"args\":{\"post_id\":1}}"));
    }

    @Test
    void parse_wrongTypeNamesOffendingKey() {
        ArgumentTypeException e = assertThrows(ArgumentTypeException.class,
                () -> parser.parse("{\"tool\":\"post_call\",\"args\":{\"post_id\":2.5}}"));
        assertEquals("post_id", e.argument());
        assertEquals("argument_type", e.errorType());
    }

    @Test
    void parse_missingRequiredArgument() {
        MissingArgumentException e = assertThrows(MissingArgumentException.class,
                () -> parser.parse("{\"tool\":\"post_call\",\"args\":{}}"));
        assertEquals("post_id", e.argument());
    }

    @Test
    void parse_nullRequiredArgumentCountsAsMissing() {
        assertThrows(MissingArgumentException.class,
                () -> parser.parse("{\"tool\":\"post_call\",\"args\":{\"post_id\":null}}"));
    }

    @Test
    void parse_integerOutOfRangeIsTypeError() {
        assertThrows(ArgumentTypeException.class,
                () -> parser.parse("{\"tool\":\"post_call\",\"args\":{\"post_id\":123456789012345678901234567890}}"));
    }

    // ── containsToolCall ─────────────────────────────────────────────────────

    @Test
    void containsToolCall_falseForPlainProse() {
        assertFalse(parser.containsToolCall("Hello! I can fetch posts and comments for you."));
        assertFalse(parser.containsToolCall("Sets look like {1, 2, 3} in math."));
        assertFalse(parser.containsToolCall(""));
        assertFalse(parser.containsToolCall(null));
    }

    @Test
    void containsToolCall_trueForUnquotedOrSingleQuotedKeys() {
        assertTrue(parser.containsToolCall("{tool: \"post_call\", args: {post_id: 2}}"));
        assertTrue(parser.containsToolCall("Sure: {'tool': 'post_call', 'args': {'post_id': 2}}"));
    }

    @Test
    void parse_unquotedKeysIsMalformed() {
        assertThrows(MalformedInvocationException.class,
                () -> parser.parse("{tool: \"post_call\", args: {post_id: 2}}"));
        assertThrows(MalformedInvocationException.class,
                () -> parser.parse("{'tool': 'post_call', 'args': {'post_id': 2}}"));
    }

    @Test
    void parse_unquotedKeysNextToValidObjectIsAmbiguous() {
        assertThrows(AmbiguousOutputException.class, () -> parser.parse(
                "{tool: \"post_call\"} {\"tool\":\"post_call\",\"args\":{\"post_id\":2}}"));
    }

    @Test
    void containsToolCall_trueForTruncatedObject() {
        assertTrue(parser.containsToolCall("{\"tool\": \"post_call\", \"args\": {"));
    }

    @Test
    void extract_findsObjectAfterUnclosedProseBrace() {
        InvocationParser.Extraction extraction =
                parser.extract("a { b and then {\"tool\":\"post_call\",\"args\":{\"post_id\":1}}");

        assertEquals(1, extraction.objects().size());
        assertEquals(0, extraction.fragments());
    }

    // ── validateDirect ───────────────────────────────────────────────────────

    @Test
    void validateDirect_acceptsIntegerAndNumericString() throws Exception {
        assertEquals(5L, parser.validateDirect("post_call",
                objectMapper.readTree("{\"post_id\":5}")).longArgument("post_id"));
        assertEquals(5L, parser.validateDirect("post_call",
                objectMapper.readTree("{\"post_id\":\"5\"}")).longArgument("post_id"));
    }

    @Test
    void validateDirect_rejectsAnaphoricMarker() throws Exception {
        assertThrows(ArgumentTypeException.class, () -> parser.validateDirect("post_call",
                objectMapper.readTree("{\"post_id\":\"that post\"}")));
    }

    @Test
    void validateDirect_nullBodyIsMissingArgument() {
        assertThrows(MissingArgumentException.class, () -> parser.validateDirect("post_call", null));
    }

    @Test
    void validateDirect_nonObjectBodyIsMalformed() throws Exception {
        assertThrows(MalformedInvocationException.class,
                () -> parser.validateDirect("post_call", objectMapper.readTree("[1]")));
    }

    @Test
    void validateDirect_unknownTool() throws Exception {
        assertThrows(UnknownToolException.class,
                () -> parser.validateDirect("delete_everything", objectMapper.readTree("{}")));
    }
}
