package com.openforge.toolbridge.invocation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolbridge.context.ConversationContext;
import com.openforge.toolbridge.tool.AmbiguousOutputException;
import com.openforge.toolbridge.tool.ArgumentSpec;
import com.openforge.toolbridge.tool.ArgumentType;
import com.openforge.toolbridge.tool.ArgumentTypeException;
import com.openforge.toolbridge.tool.MalformedInvocationException;
import com.openforge.toolbridge.tool.MissingArgumentException;
import com.openforge.toolbridge.tool.ToolRegistry;
import com.openforge.toolbridge.tool.ToolSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw model text into a validated {@link ToolInvocation}.
 *
 * Steps, each failing with its own exception:
 *   1. EXTRACT  - find JSON objects embedded in the text. Surrounding prose is
 *                 tolerated; a second object, or an unparsable object-like
 *                 fragment next to a good one, is AmbiguousOutputException.
 *   2. SHAPE    - exactly the keys "tool" (string) and "args" (object), else
 *                 MalformedInvocationException.
 *   3. LOOKUP   - exact, case-sensitive registry lookup, else UnknownToolException.
 *   4. VALIDATE - per-argument type and presence checks (ArgumentTypeException,
 *                 MissingArgumentException). Keys outside the schema are dropped.
 *
 * Pure: depends only on the input and the registry contents.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InvocationParser {

    public static final String TOOL_FIELD = "tool";
    public static final String ARGS_FIELD = "args";

    private static final Pattern DIGITS = Pattern.compile("#?(\\d{1,18})");

    /** "{" followed by a bare or single-quoted key and a colon, as in {tool: ...} or {'tool': ...}. */
    private static final Pattern LOOSE_KEY = Pattern.compile("\\{\\s*(?:'[^']*'|[A-Za-z_$][\\w$]*)\\s*:");

    private final ToolRegistry registry;
    private final ObjectMapper objectMapper;

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * True if the text contains anything that looks like a JSON object, complete
     * or not. Plain prose (the model answering directly) returns false.
     */
    public boolean containsToolCall(String rawModelOutput) {
        Extraction extraction = extract(rawModelOutput);
        return !extraction.objects().isEmpty() || extraction.fragments() > 0;
    }

    /** Parses model output. Anaphoric markers are allowed in reference arguments. */
    public ToolInvocation parse(String rawModelOutput) {
        Extraction extraction = extract(rawModelOutput);
        int found = extraction.objects().size() + extraction.fragments();

        if (found == 0) {
            throw new MalformedInvocationException("Model output contains no JSON object");
        }
        if (extraction.objects().isEmpty()) {
            throw new MalformedInvocationException("Model output contains an incomplete or non-JSON object");
        }
        if (found > 1) {
            log.warn("[Parser] Rejecting output with {} JSON objects ({} incomplete)",
                    found, extraction.fragments());
            throw new AmbiguousOutputException(found);
        }

        JsonNode root = extraction.objects().get(0);
        if (!root.has(TOOL_FIELD)) {
            throw new MalformedInvocationException("Missing '%s' key in model output".formatted(TOOL_FIELD));
        }
        if (!root.has(ARGS_FIELD)) {
            throw new MalformedInvocationException("Missing '%s' key in model output".formatted(ARGS_FIELD));
        }
        if (root.size() != 2) {
            throw new MalformedInvocationException(
                    "Expected exactly the keys '%s' and '%s', got %d keys".formatted(TOOL_FIELD, ARGS_FIELD, root.size()));
        }
        JsonNode toolNode = root.get(TOOL_FIELD);
        if (!toolNode.isTextual() || toolNode.asText().isBlank()) {
            throw new MalformedInvocationException("'%s' must be a non-empty string".formatted(TOOL_FIELD));
        }
        JsonNode argsNode = root.get(ARGS_FIELD);
        if (!argsNode.isObject()) {
            throw new MalformedInvocationException("'%s' must be a JSON object".formatted(ARGS_FIELD));
        }

        ToolSpec spec = registry.lookup(toolNode.asText());
        ToolInvocation invocation = validate(spec, argsNode, true);
        log.debug("[Parser] Parsed {}", invocation);
        return invocation;
    }

    /**
     * Validates arguments supplied directly by a caller that bypasses the model.
     * Anaphoric markers are rejected here: there is no conversation to resolve them.
     * A null body counts as an empty argument object.
     */
    public ToolInvocation validateDirect(String toolName, JsonNode arguments) {
        ToolSpec spec = registry.lookup(toolName);
        JsonNode args = arguments == null || arguments.isNull() || arguments.isMissingNode()
                ? objectMapper.createObjectNode()
                : arguments;
        if (!args.isObject()) {
            throw new MalformedInvocationException("Arguments must be a JSON object");
        }
        return validate(spec, args, false);
    }

    // ── Validation ───────────────────────────────────────────────────────────

    private ToolInvocation validate(ToolSpec spec, JsonNode args, boolean allowReferences) {
        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, String> references = new LinkedHashMap<>();

        for (Map.Entry<String, ArgumentSpec> entry : spec.argumentSchema().entrySet()) {
            String       key      = entry.getKey();
            ArgumentSpec argument = entry.getValue();
            JsonNode     value    = args.get(key);

            if (value == null || value.isNull()) {
                if (argument.required()) throw new MissingArgumentException(spec.name(), key);
                continue;
            }

            if (argument.type().matches(value)) {
                values.put(key, toJava(spec.name(), key, argument.type(), value));
            } else if (argument.isReference() && value.isTextual()) {
                String  text    = value.asText().trim();
                Matcher literal = DIGITS.matcher(text);
                if (literal.matches()) {
                    values.put(key, Long.parseLong(literal.group(1)));
                } else if (allowReferences && ConversationContext.isAnaphoric(argument.entityKind(), text)) {
                    references.put(key, text);
                } else {
                    throw new ArgumentTypeException(spec.name(), key, argument.type());
                }
            } else {
                throw new ArgumentTypeException(spec.name(), key, argument.type());
            }
        }

        Iterator<String> names = args.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!spec.argumentSchema().containsKey(name)) {
                log.debug("[Parser] Dropping unexpected argument '{}' for tool '{}'", name, spec.name());
            }
        }
        return new ToolInvocation(spec.name(), values, references);
    }

    private static Object toJava(String tool, String key, ArgumentType type, JsonNode value) {
        return switch (type) {
            case INTEGER -> {
                if (!value.canConvertToLong()) {
                    throw new ArgumentTypeException(tool, key, "integer out of range");
                }
                yield value.longValue();
            }
            case NUMBER  -> value.doubleValue();
            case STRING  -> value.asText();
            case BOOLEAN -> value.booleanValue();
        };
    }

    // ── Extraction ───────────────────────────────────────────────────────────

    /**
     * Scans for '{'-delimited regions, honouring JSON string quoting so braces
     * inside strings do not count. A balanced region that parses as an object is
     * collected; one that looks like an object ("{" followed by a quote, "}" or a
     * bare or single-quoted key and a colon) but fails to parse or never closes
     * is counted as a fragment. Other braces are treated as prose.
     */
    Extraction extract(String text) {
        List<JsonNode> objects = new ArrayList<>();
        int fragments = 0;
        if (text == null || text.isEmpty()) {
            return new Extraction(objects, 0);
        }

        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) != '{') {
                i++;
                continue;
            }
            int end = matchingBrace(text, i);
            boolean objectLike = looksLikeObjectStart(text, i);
            if (end < 0) {
                if (objectLike) {
                    fragments++;
                    break;
                }
                i++;
                continue;
            }
            JsonNode node = readObject(text.substring(i, end + 1));
            if (node != null) {
                objects.add(node);
                i = end + 1;
            } else if (objectLike) {
                fragments++;
                i = end + 1;
            } else {
                i++;
            }
        }
        return new Extraction(objects, fragments);
    }

    private JsonNode readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static int matchingBrace(String text, int start) {
        int     depth    = 0;
        boolean inString = false;
        boolean escaped  = false;
        for (int j = start; j < text.length(); j++) {
            char c = text.charAt(j);
            if (inString) {
                if (escaped)        escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"')  inString = false;
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return j;
            }
        }
        return -1;
    }

    private static boolean looksLikeObjectStart(String text, int start) {
        for (int j = start + 1; j < text.length(); j++) {
            char c = text.charAt(j);
            if (Character.isWhitespace(c)) continue;
            if (c == '"' || c == '}') return true;
            break;
        }
        return LOOSE_KEY.matcher(text).region(start, text.length()).lookingAt();
    }

    record Extraction(List<JsonNode> objects, int fragments) {}
}
