package com.stackpoker.ledger.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class LedgerOperationExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(LedgerOperationExceptionHandler.class);

    @ExceptionHandler(LedgerOperationException.class)
    public ResponseEntity<LedgerErrorResponse> handle(LedgerOperationException ex) {
        log.debug("Rejected ledger operation: code={}, message={}", ex.getCode(), ex.getMessage());
        return ResponseEntity
                .status(ex.getStatus())
                .body(new LedgerErrorResponse(ex.getCode(), ex.getMessage()));
    }

    public record LedgerErrorResponse(
            String code,
            String message
    ) {
    }
}
