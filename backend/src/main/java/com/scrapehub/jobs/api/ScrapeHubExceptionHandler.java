package com.scrapehub.jobs.api;

import com.scrapehub.jobs.persistence.StoreMalformedResponseException;
import com.scrapehub.jobs.persistence.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ScrapeHubExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ScrapeHubExceptionHandler.class);

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<Map<String, String>> handleStoreUnavailable(StoreUnavailableException ex) {
    log.warn("Job store unavailable: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "store_unavailable", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(StoreMalformedResponseException.class)
  public ResponseEntity<Map<String, String>> handleStoreMalformed(StoreMalformedResponseException ex) {
    log.warn("Job store returned malformed data: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "store_malformed_response", "message", String.valueOf(ex.getMessage())));
  }
}
