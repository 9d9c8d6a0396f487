package com.affiliate.autopilot.pipeline.api;

import com.affiliate.autopilot.pipeline.service.IllegalOpportunityTransitionException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PipelineExceptionHandler {

  @ExceptionHandler(IllegalOpportunityTransitionException.class)
  public ResponseEntity<Map<String, String>> handleIllegalTransition(IllegalOpportunityTransitionException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "illegal_transition", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadArgument(IllegalArgumentException ex) {
    String message = ex.getMessage() == null ? "invalid request" : ex.getMessage();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", message));
  }
}
