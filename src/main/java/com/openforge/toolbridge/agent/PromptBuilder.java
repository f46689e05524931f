package com.openforge.toolbridge.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.toolbridge.context.ConversationContext;
import com.openforge.toolbridge.invocation.InvocationParser;
import com.openforge.toolbridge.invocation.ToolInvocation;
import com.openforge.toolbridge.llm.model.Message;
import com.openforge.toolbridge.tool.ToolRegistry;
import com.openforge.toolbridge.tool.ToolResult;
import com.openforge.toolbridge.tool.ToolSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds every piece of text the orchestrator sends to the model or the user.
 *
 * Two prompts per turn at most:
 *   routing   - system (tool catalogue + remembered entities) + history + query
 *   synthesis - system (phrasing instructions) + query + tool result JSON
 *
 * Failure messages are fixed templates; they never go through the model.
 */
@Component
@RequiredArgsConstructor
public class PromptBuilder {

    private static final int MAX_RENDERED_ITEMS = 5;
    private static final int MAX_FIELD_LENGTH   = 200;

    private static final String ROUTING_INSTRUCTIONS = """
            When the user asks for information one of these tools can provide:
            - Output *only* valid JSON with exactly keys "%s" and "%s".
            - "%s" must be one of: %s.
            - "%s" must follow the schema above.
            Do not output any extra text, only the JSON.

            If no tool fits the request, answer the user directly in plain text without any JSON.
            """;

    private static final String SYNTHESIS_PROMPT = """
            You are a helpful assistant. A tool was called on the user's behalf and returned
            the JSON below. Answer the user's question using only that data.
            Be concise. Do not output JSON and do not mention tools.
            """;

    private final ToolRegistry registry;

    // ── Routing ──────────────────────────────────────────────────────────────

    public List<Message> routingMessages(ConversationContext context, String rewrittenQuery) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(systemPrompt(context)));
        messages.addAll(context.history());
        messages.add(Message.user(rewrittenQuery));
        return messages;
    }

    String systemPrompt(ConversationContext context) {
        List<ToolSpec> tools = registry.catalogue();
        StringBuilder sb = new StringBuilder("You have ")
                .append(tools.size()).append(tools.size() == 1 ? " tool" : " tools")
                .append(" you can call:\n");
        List<String> quotedNames = new ArrayList<>();
        for (int i = 0; i < tools.size(); i++) {
            ToolSpec spec = tools.get(i);
            sb.append(i + 1).append(") ").append(spec.name()).append(" - ")
              .append(spec.description()).append(". Args schema: ")
              .append(spec.argumentShape()).append(".\n");
            quotedNames.add('"' + spec.name() + '"');
        }
        sb.append('\n').append(ROUTING_INSTRUCTIONS.formatted(
                InvocationParser.TOOL_FIELD, InvocationParser.ARGS_FIELD,
                InvocationParser.TOOL_FIELD, String.join(", ", quotedNames),
                InvocationParser.ARGS_FIELD));

        Map<String, Long> remembered = context.lastEntities();
        if (!remembered.isEmpty()) {
            sb.append("\nEntities from earlier in this conversation:\n");
            remembered.forEach((kind, id) ->
                    sb.append("- last ").append(kind).append(": ").append(id).append('\n'));
        }
        return sb.toString();
    }

    // ── Synthesis ────────────────────────────────────────────────────────────

    public List<Message> synthesisMessages(String query, ToolInvocation invocation, ToolResult result) {
        String data = "Tool: %s\nArguments: %s\nResult:\n%s".formatted(
                invocation.toolName(), invocation.arguments(), result.payload());
        return List.of(
                Message.system(SYNTHESIS_PROMPT),
                Message.user(query + "\n\n" + data));
    }

    // ── Deterministic text ──────────────────────────────────────────────────

    /** Message for a not_found or adapter_error result. */
    public String failedResultMessage(ToolInvocation invocation, ToolResult result) {
        String subject = describe(invocation);
        return switch (result.status()) {
            case NOT_FOUND     -> "Sorry, I couldn't find anything for %s.".formatted(subject);
            case ADAPTER_ERROR -> "Sorry, the lookup for %s failed: %s. Please try again later."
                    .formatted(subject, result.rawError() == null ? "unknown error" : result.rawError());
            case OK            -> throw new IllegalArgumentException("Result is ok");
        };
    }

    /** Plain rendering of an ok payload, used when the synthesis call fails. */
    public String renderPayload(ToolInvocation invocation, ToolResult result) {
        JsonNode payload = result.payload();
        StringBuilder sb = new StringBuilder("Here is what I found for ")
                .append(describe(invocation)).append(":\n");
        if (payload != null && payload.isArray()) {
            int shown = Math.min(payload.size(), MAX_RENDERED_ITEMS);
            for (int i = 0; i < shown; i++) {
                sb.append("- ").append(renderObject(payload.get(i))).append('\n');
            }
            if (payload.size() > shown) {
                sb.append("... and ").append(payload.size() - shown).append(" more.\n");
            }
        } else {
            sb.append(renderObject(payload)).append('\n');
        }
        return sb.toString().trim();
    }

    /** User-facing text for a turn that ended in ERROR. */
    public String errorMessage(String errorType, String detail) {
        return switch (errorType) {
            case "ambiguous_output"     -> "I couldn't tell which action to take from the model's answer. Please rephrase your request.";
            case "malformed_invocation" -> "The model produced an invalid tool call. Please rephrase your request.";
            case "unknown_tool"         -> "I can't do that: " + detail + ".";
            case "argument_type",
                 "missing_argument"     -> "The request was missing or had an invalid value: " + detail + ".";
            case "no_prior_reference"   -> detail + ". Please say which one you mean, for example by its number.";
            case "model_unavailable"    -> "The language model is currently unavailable. Please try again later.";
            case "timeout"              -> "The request took too long and was cancelled. Please try again.";
            case "cancelled"            -> "The request was cancelled.";
            default                     -> "Something went wrong while handling your request.";
        };
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String describe(ToolInvocation invocation) {
        StringBuilder sb = new StringBuilder(invocation.toolName());
        invocation.arguments().forEach((k, v) -> sb.append(' ').append(k).append('=').append(v));
        return sb.toString();
    }

    private static String renderObject(JsonNode node) {
        if (node == null || node.isNull()) return "(no data)";
        if (!node.isObject()) return truncate(node.asText());
        StringBuilder sb = new StringBuilder();
        node.fields().forEachRemaining(field -> {
            if (!sb.isEmpty()) sb.append(", ");
            JsonNode value = field.getValue();
            sb.append(field.getKey()).append(": ")
              .append(truncate(value.isValueNode() ? value.asText() : value.toString()));
        });
        return sb.toString();
    }

    private static String truncate(String text) {
        String flat = text.replaceAll("\\s+", " ");
        return flat.length() <= MAX_FIELD_LENGTH ? flat : flat.substring(0, MAX_FIELD_LENGTH) + "...";
    }
}
