package com.openforge.toolbridge.agent.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/agent/turns.
 *
 * @param query      the natural-language query
 * @param sessionId  optional; if null the server starts a new session
 */
public record TurnRequest(

        @NotBlank(message = "query must not be blank")
        @Size(max = 4000, message = "query must not exceed 4000 characters")
        String query,

        String sessionId
) {}
