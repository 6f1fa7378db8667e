package com.ijp.lifecycle.posting.api;

import com.ijp.lifecycle.posting.service.ConcurrentPostingUpdateException;
import com.ijp.lifecycle.posting.service.InvalidTransitionException;
import com.ijp.lifecycle.posting.service.LifecycleValidationException;
import com.ijp.lifecycle.posting.service.PostingNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class LifecycleExceptionHandler {

  @ExceptionHandler(LifecycleValidationException.class)
  public ResponseEntity<Map<String, String>> handleValidation(LifecycleValidationException ex) {
    return error(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage());
  }

  @ExceptionHandler(PostingNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(PostingNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
  }

  @ExceptionHandler(InvalidTransitionException.class)
  public ResponseEntity<Map<String, String>> handleInvalidTransition(InvalidTransitionException ex) {
    return error(HttpStatus.CONFLICT, "invalid_transition", ex.getMessage());
  }

  @ExceptionHandler(ConcurrentPostingUpdateException.class)
  public ResponseEntity<Map<String, String>> handleConcurrentUpdate(ConcurrentPostingUpdateException ex) {
    return error(HttpStatus.CONFLICT, "concurrent_modification", ex.getMessage());
  }

  private ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status)
        .body(Map.of("error", code, "message", message == null ? "" : message));
  }
}
