package com.vehicle.tracker.scrape.api;

import com.vehicle.tracker.scrape.model.TriggerResponse;
import com.vehicle.tracker.scrape.service.ActiveScrapeRunException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScrapeExceptionHandler {

  @ExceptionHandler(ActiveScrapeRunException.class)
  public ResponseEntity<TriggerResponse> handleActiveRun(ActiveScrapeRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT).body(TriggerResponse.rejected(ex.getMessage()));
  }
}
