package com.cusip.refdata.load.api;

import com.cusip.refdata.load.error.LoadInProgressException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class LoadExceptionHandler {

    @ExceptionHandler(LoadInProgressException.class)
    public ResponseEntity<Map<String, String>> handleLoadInProgress(LoadInProgressException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", "load_in_progress", "message", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "invalid_request", "message", String.valueOf(ex.getMessage())));
    }
}
