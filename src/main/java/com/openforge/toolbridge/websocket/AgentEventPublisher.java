package com.openforge.toolbridge.websocket;

import com.openforge.toolbridge.agent.event.AgentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Routes AgentEvents to the STOMP topic of their session.
 *
 * Topic layout:
 *   /topic/agent/{sessionId}  → all events for one session
 *
 * SimpMessagingTemplate is thread-safe; turns of different sessions publish
 * concurrently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentEventPublisher {

    public static final String TOPIC_PREFIX = "/topic/agent/";

    private final SimpMessagingTemplate messagingTemplate;

    /** Fire-and-forget; a delivery failure is logged and never reaches the turn. */
    public void publish(AgentEvent event) {
        String destination = TOPIC_PREFIX + event.sessionId();
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (Exception e) {
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }
}
