package com.saltbet.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class BettingExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(BettingExceptionHandler.class);

    @ExceptionHandler(BettingException.class)
    public ResponseEntity<BettingErrorResponse> handle(BettingException ex) {
        if (ex.getError().getCategory() == BettingError.Category.INTEGRITY) {
            log.error("Integrity fault: {}", ex.getMessage());
        }
        return ResponseEntity
                .status(ex.getStatus())
                .body(new BettingErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(LedgerStoreUnavailableException.class)
    public ResponseEntity<BettingErrorResponse> handle(LedgerStoreUnavailableException ex) {
        log.warn("Ledger store unavailable: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new BettingErrorResponse("ledger_unavailable", ex.getMessage()));
    }

    @ExceptionHandler(MatchDataUnavailableException.class)
    public ResponseEntity<BettingErrorResponse> handle(MatchDataUnavailableException ex) {
        log.warn("Match data source unavailable: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(new BettingErrorResponse("match_data_unavailable", ex.getMessage()));
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<BettingErrorResponse> handle(OptimisticLockingFailureException ex) {
        log.warn("Concurrent match update rejected: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new BettingErrorResponse("concurrent_update", "Match was updated concurrently, please retry"));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<BettingErrorResponse> handle(MissingRequestHeaderException ex) {
        return ResponseEntity
                .badRequest()
                .body(new BettingErrorResponse("missing_caller", "Missing required header: " + ex.getHeaderName()));
    }

    public record BettingErrorResponse(
            String code,
            String message
    ) {
    }
}
