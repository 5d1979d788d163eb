package com.componentwatch.monitor.api;

import com.componentwatch.monitor.digest.DigestNotConfiguredException;
import com.componentwatch.monitor.digest.NoRunReportException;
import com.componentwatch.monitor.notify.NotifyException;
import com.componentwatch.monitor.service.ActiveCrawlRunException;
import com.componentwatch.monitor.service.AlertNotFoundException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class MonitorExceptionHandler {

  @ExceptionHandler(ActiveCrawlRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveCrawlRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_crawl_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(NoRunReportException.class)
  public ResponseEntity<Map<String, String>> handleNoReport(NoRunReportException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "no_run_report", "message", ex.getMessage()));
  }

  @ExceptionHandler(AlertNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleAlertNotFound(AlertNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "alert_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(DigestNotConfiguredException.class)
  public ResponseEntity<Map<String, String>> handleDigestNotConfigured(DigestNotConfiguredException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "digest_not_configured", "message", ex.getMessage()));
  }

  @ExceptionHandler(NotifyException.class)
  public ResponseEntity<Map<String, Object>> handleNotify(NotifyException ex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "webhook_failed");
    body.put("message", ex.getMessage());
    body.put("status_code", ex.getStatusCode());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
  }
}
