package com.github.spud.sample.ai.orchestrator.interfaces.rest;

import com.github.spud.sample.ai.orchestrator.domain.session.CallbackRejectedException;
import com.github.spud.sample.ai.orchestrator.domain.session.InvalidSessionTransitionException;
import com.github.spud.sample.ai.orchestrator.domain.session.MalformedRequestException;
import com.github.spud.sample.ai.orchestrator.domain.session.SessionNotFoundException;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @Data
  @Builder
  public static class ErrorResponse {

    private String code;
    private String message;
    private OffsetDateTime timestamp;
    private Map<String, Object> details;
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException e) {
    return respond(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND", e.getMessage(), null);
  }

  @ExceptionHandler(CallbackRejectedException.class)
  public ResponseEntity<ErrorResponse> handleCallbackRejected(CallbackRejectedException e) {
    return respond(HttpStatus.FORBIDDEN, "CALLBACK_REJECTED", e.getMessage(), null);
  }

  @ExceptionHandler(InvalidSessionTransitionException.class)
  public ResponseEntity<ErrorResponse> handleInvalidTransition(
      InvalidSessionTransitionException e) {
    return respond(HttpStatus.CONFLICT, "INVALID_SESSION_STATE", e.getMessage(),
        Map.of("status", e.getStatus().getValue()));
  }

  @ExceptionHandler(MalformedRequestException.class)
  public ResponseEntity<ErrorResponse> handleMalformedRequest(MalformedRequestException e) {
    return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage(), null);
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e) {
    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError error : e.getBindingResult().getFieldErrors()) {
      fieldErrors.put(error.getField(), error.getDefaultMessage());
    }
    return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed",
        Map.of("fieldErrors", fieldErrors));
  }

  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<ErrorResponse> handleServerWebInput(ServerWebInputException e) {
    log.debug("Unreadable request: {}", e.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Request body is not readable",
        null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
    log.error("Unhandled exception", e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
        "An unexpected error occurred", Map.of("exception", e.getClass().getSimpleName()));
  }

  private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
      Map<String, Object> details) {
    ErrorResponse error = ErrorResponse.builder()
        .code(code)
        .message(message)
        .timestamp(OffsetDateTime.now())
        .details(details)
        .build();
    return ResponseEntity.status(status).body(error);
  }
}
