package com.lelantos.api.controller;

import com.lelantos.api.dto.ErrorBody;
import com.lelantos.tracker.MissingCredentialException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;

/**
 * Maps caller-level failures to ErrorBody: validation 400, missing key 401, anything else escaping an analysis 500.
 * Per-token and per-wallet tracker failures never reach here; they degrade inside the analysis.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("INVALID_REQUEST");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, userFacingMessage(error, ex)));
    }

    @ExceptionHandler(MissingCredentialException.class)
    public ResponseEntity<ErrorBody> handleMissingCredential(MissingCredentialException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorBody.of("MISSING_API_KEY", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorBody> handleStatus(ResponseStatusException ex) {
        String error = ex.getStatusCode().is4xxClientError() ? "INVALID_REQUEST" : "ANALYSIS_FAILED";
        String message = ex.getReason() != null ? ex.getReason() : ex.getStatusCode().toString();
        return ResponseEntity.status(ex.getStatusCode()).body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorBody> handleUnexpected(RuntimeException ex) {
        log.error("Analysis failed", ex);
        String message = ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred during analysis.";
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorBody.of("ANALYSIS_FAILED", message));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_ADDRESS" -> "One or more token addresses are not valid Solana addresses";
            case "INVALID_REQUEST" -> "Provide between 1 and 100 token addresses";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
