package com.flowledger.controller;

import com.flowledger.exception.DefinitionValidationException;
import com.flowledger.exception.JobLeaseException;
import com.flowledger.exception.LedgerException;
import com.flowledger.exception.MissingTenantException;
import com.flowledger.exception.RunNotReconcilableException;
import com.flowledger.exception.WorkflowNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps service exceptions to JSON error bodies:
 *   {"status": 404, "error": "Not Found", "message": "Workflow not found: x"}
 * Validation failures also carry "violations".
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(DefinitionValidationException.class)
    public ResponseEntity<Map<String, Object>> handleDefinitionValidation(DefinitionValidationException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), e.getViolations());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleBeanValidation(MethodArgumentNotValidException e) {
        List<String> violations = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getDefaultMessage() == null
                        ? fieldError.getField() + " is invalid" : fieldError.getDefaultMessage())
                .collect(Collectors.toList());
        return error(HttpStatus.BAD_REQUEST, "Invalid request: " + String.join("; ", violations), violations);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, rootMessage(e), null);
    }

    @ExceptionHandler(MissingTenantException.class)
    public ResponseEntity<Map<String, Object>> handleMissingTenant(MissingTenantException e) {
        return error(HttpStatus.UNAUTHORIZED, e.getMessage(), null);
    }

    @ExceptionHandler(WorkflowNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(WorkflowNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage(), null);
    }

    @ExceptionHandler(RunNotReconcilableException.class)
    public ResponseEntity<Map<String, Object>> handleNotReconcilable(RunNotReconcilableException e) {
        return error(HttpStatus.CONFLICT, e.getMessage(), null);
    }

    @ExceptionHandler(JobLeaseException.class)
    public ResponseEntity<Map<String, Object>> handleJobLease(JobLeaseException e) {
        return error(HttpStatus.CONFLICT, e.getMessage(), null);
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, Object>> handleLedger(LedgerException e) {
        log.error("Run ledger failure surfaced to client: {}", e.getMessage(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Run ledger unavailable: " + e.getMessage(), null);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, List<String> violations) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        if (violations != null) {
            body.put("violations", violations);
        }
        return ResponseEntity.status(status).body(body);
    }

    private String rootMessage(Exception e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() == null ? e.getMessage() : cause.getMessage();
    }
}
