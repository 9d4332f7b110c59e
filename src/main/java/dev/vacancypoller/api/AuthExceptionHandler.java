package dev.vacancypoller.api;

import dev.vacancypoller.service.AuthorizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class AuthExceptionHandler {

  @ExceptionHandler(AuthorizationException.class)
  public ResponseEntity<Map<String, String>> handleAuthorization(AuthorizationException ex) {
    log.error("Account linking rejected: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "authorization_failed", "message", ex.getMessage()));
  }

  @ExceptionHandler({DataAccessException.class, TransactionException.class})
  public ResponseEntity<Map<String, String>> handlePersistence(RuntimeException ex) {
    log.error("Credential store unavailable: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "persistence_failed", "message", "Could not store credential"));
  }
}
