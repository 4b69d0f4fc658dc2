package com.guildauction.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AuctionException.class)
    public ResponseEntity<?> handleAuction(AuctionException ex) {
        return ResponseEntity
                .status(ex instanceof ValidationException ? HttpStatus.BAD_REQUEST : HttpStatus.CONFLICT)
                .body(Map.of(
                        "timestamp", Instant.now(),
                        "error", ex.getCode(),
                        "message", ex.getMessage()
                ));
    }

    @ExceptionHandler({MissingRequestHeaderException.class, NumberFormatException.class})
    public ResponseEntity<?> handleBadCaller(Exception ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "timestamp", Instant.now(),
                        "error", "Bad Request",
                        "message", ex.getMessage()
                ));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<?> handleStorage(StorageException ex) {
        log.error("Storage failure while serving request: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of(
                        "timestamp", Instant.now(),
                        "error", "Storage Unavailable",
                        "message", ex.getMessage()
                ));
    }
}
