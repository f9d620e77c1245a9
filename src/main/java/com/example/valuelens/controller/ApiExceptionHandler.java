package com.example.valuelens.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps request-level faults to {"error": ...} bodies. Provider failures never reach here.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException ex) {
    log.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(Map.of(
        "error", "Malformed JSON request body"
    ));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, String>> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse errorResponse) {
      // Framework-level 4xx (unknown path, wrong method) keeps its own status
      return ResponseEntity.status(errorResponse.getStatusCode()).body(Map.of(
          "error", String.valueOf(errorResponse.getBody().getDetail())
      ));
    }
    log.error("Unhandled request failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
        "error", "Internal server error"
    ));
  }
}
