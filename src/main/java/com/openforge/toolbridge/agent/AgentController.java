package com.openforge.toolbridge.agent;

import com.openforge.toolbridge.agent.dto.SessionResponse;
import com.openforge.toolbridge.agent.dto.TurnRequest;
import com.openforge.toolbridge.agent.dto.TurnResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * REST API for conversational turns.
 *
 * Endpoints:
 *   POST   /api/agent/turns            - run one turn (creates the session if needed)
 *   GET    /api/agent/sessions/{id}    - remembered entities and turn count
 *   DELETE /api/agent/sessions/{id}    - end a session
 *
 * A turn is answered synchronously; the same progress is streamed to
 * /topic/agent/{sessionId} while it runs. A turn that ends in ERROR is still a
 * 200 response with status "error": the failure belongs to the conversation,
 * not to the HTTP exchange.
 */
@Slf4j
@RestController
@RequestMapping("/api/agent")
@RequiredArgsConstructor
public class AgentController {

    private final AgentService agentService;

    @PostMapping("/turns")
    public ResponseEntity<TurnResponse> handleTurn(@Valid @RequestBody TurnRequest request) {
        String sessionId = request.sessionId() != null && !request.sessionId().isBlank()
                ? request.sessionId()
                : UUID.randomUUID().toString();

        log.info("[Controller] Turn for session {}: {}", sessionId,
                request.query().substring(0, Math.min(80, request.query().length())));

        AgentTurnResult result = agentService.handleTurn(sessionId, request.query());
        return ResponseEntity.ok(TurnResponse.from(sessionId, result));
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String sessionId) {
        return agentService.session(sessionId)
                .map(SessionResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Session not found: " + sessionId));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> endSession(@PathVariable String sessionId) {
        if (!agentService.endSession(sessionId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + sessionId);
        }
        return ResponseEntity.noContent().build();
    }
}
