package com.openforge.toolbridge.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.toolbridge.adapter.JsonPlaceholderCommentsAdapter;
import com.openforge.toolbridge.adapter.JsonPlaceholderPostAdapter;
import com.openforge.toolbridge.agent.AgentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Tool catalogue and direct invocation, bypassing the model.
 *
 * Endpoints:
 *   GET  /api/tools           - registered tools in registration order
 *   POST /api/tools/{name}    - body = arguments object, e.g. {"post_id": 2}
 *   POST /post-call           - alias for post_call
 *   POST /comments-call       - alias for comments_call
 *
 * Result status → HTTP: ok 200, not_found 404, adapter_error 502. Invalid
 * invocations are mapped by ToolExceptionHandler.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ToolController {

    private final ToolRegistry registry;
    private final AgentService agentService;

    @GetMapping("/api/tools")
    public List<ToolDescriptor> catalogue() {
        return registry.catalogue().stream().map(ToolDescriptor::from).toList();
    }

    @PostMapping("/api/tools/{toolName}")
    public ResponseEntity<ToolResult> invoke(@PathVariable String toolName,
                                             @RequestBody(required = false) JsonNode arguments) {
        return toResponse(agentService.invokeTool(toolName, arguments));
    }

    @PostMapping("/post-call")
    public ResponseEntity<ToolResult> postCall(@RequestBody(required = false) JsonNode arguments) {
        return toResponse(agentService.invokeTool(JsonPlaceholderPostAdapter.TOOL_NAME, arguments));
    }

    @PostMapping("/comments-call")
    public ResponseEntity<ToolResult> commentsCall(@RequestBody(required = false) JsonNode arguments) {
        return toResponse(agentService.invokeTool(JsonPlaceholderCommentsAdapter.TOOL_NAME, arguments));
    }

    private static ResponseEntity<ToolResult> toResponse(ToolResult result) {
        HttpStatus status = switch (result.status()) {
            case OK            -> HttpStatus.OK;
            case NOT_FOUND     -> HttpStatus.NOT_FOUND;
            case ADAPTER_ERROR -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(result);
    }
}
