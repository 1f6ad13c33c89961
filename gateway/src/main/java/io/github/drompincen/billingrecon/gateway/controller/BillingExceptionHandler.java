package io.github.drompincen.billingrecon.gateway.controller;

import io.github.drompincen.billingrecon.runtime.lock.CompanyBusyException;
import io.github.drompincen.billingrecon.runtime.reconcile.BillingNotFoundException;
import io.github.drompincen.billingrecon.runtime.reconcile.BillingPreconditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps billing exceptions to status codes with an {@code {"error": message}} body.
 */
@RestControllerAdvice(basePackages = "io.github.drompincen.billingrecon.gateway.controller")
public class BillingExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(BillingExceptionHandler.class);

    @ExceptionHandler(BillingPreconditionException.class)
    public ResponseEntity<Map<String, String>> handlePrecondition(BillingPreconditionException ex) {
        log.warn("Billing precondition failed: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(CompanyBusyException.class)
    public ResponseEntity<Map<String, String>> handleBusy(CompanyBusyException ex) {
        log.info("Rejected billing operation: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(BillingNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(BillingNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
