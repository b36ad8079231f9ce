package com.openforge.ariste.agent;

import com.openforge.ariste.agent.dto.ErrorResponse;
import com.openforge.ariste.llm.ChatClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps loop and transport failures to JSON error bodies.
 *
 *   ChatException       → 502 (the model endpoint failed)
 *   AgentLoopException  → 422 (the turn could not complete)
 *   invalid request     → 400
 */
@Slf4j
@RestControllerAdvice
public class AgentExceptionHandler {

    @ExceptionHandler(ChatClient.ChatException.class)
    public ResponseEntity<ErrorResponse> onChatFailure(ChatClient.ChatException e) {
        log.warn("[Api] Chat endpoint failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("chat_endpoint_failure", null, e.getMessage()));
    }

    @ExceptionHandler(AgentLoopException.class)
    public ResponseEntity<ErrorResponse> onLoopFailure(AgentLoopException e) {
        log.warn("[Api] Agent loop failure ({}): {}", e.reason(), e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("agent_loop_failure", e.reason().name(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> onInvalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(new ErrorResponse("invalid_request", null, message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> onIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("invalid_request", null, e.getMessage()));
    }
}
