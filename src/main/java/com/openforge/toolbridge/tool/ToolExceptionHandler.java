package com.openforge.toolbridge.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the invocation error taxonomy to HTTP for direct tool calls.
 *
 *   unknown_tool → 404, every other invocation error → 400
 *
 * Body: {"error": message, "error_type": code}.
 */
@Slf4j
@RestControllerAdvice
public class ToolExceptionHandler {

    public record ErrorResponse(String error, String errorType) {}

    @ExceptionHandler(UnknownToolException.class)
    public ResponseEntity<ErrorResponse> unknownTool(UnknownToolException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(ToolInvocationException.class)
    public ResponseEntity<ErrorResponse> invalidInvocation(ToolInvocationException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ToolInvocationException e) {
        log.info("[Tools] Rejected direct invocation [{}]: {}", e.errorType(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.getMessage(), e.errorType()));
    }
}
