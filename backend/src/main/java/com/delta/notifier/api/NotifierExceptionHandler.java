package com.delta.notifier.api;

import com.delta.notifier.service.InvalidInputException;
import com.delta.notifier.service.SubscriberNotFoundException;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class NotifierExceptionHandler {

  @ExceptionHandler(SubscriberNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(SubscriberNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "subscriber_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidInputException.class)
  public ResponseEntity<Map<String, String>> handleInvalidInput(InvalidInputException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", ex.getReason().name().toLowerCase(Locale.ROOT), "message", ex.getMessage()));
  }
}
