package com.baleen.corpus.ingest.api;

import com.baleen.corpus.ingest.export.CorpusExportException;
import com.baleen.corpus.ingest.persistence.StorageUnavailableException;
import com.baleen.corpus.ingest.service.ActiveIngestionJobException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class IngestExceptionHandler {

  @ExceptionHandler(ActiveIngestionJobException.class)
  public ResponseEntity<Map<String, String>> handleActiveJob(ActiveIngestionJobException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_ingestion_job", "message", ex.getMessage()));
  }

  @ExceptionHandler(StorageUnavailableException.class)
  public ResponseEntity<Map<String, String>> handleStorage(StorageUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "storage_unavailable", "message", ex.getMessage()));
  }

  @ExceptionHandler(CorpusExportException.class)
  public ResponseEntity<Map<String, String>> handleExport(CorpusExportException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "export_failed", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }
}
