package com.kumc.anam.gateway.controller;

import com.kumc.anam.gateway.model.ErrorResponse;
import com.kumc.anam.gateway.model.ValidationErrorResponse;
import com.kumc.anam.gateway.security.TokenException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps request validation and token failures to HTTP errors.
 * Portal failures never reach here; the service turns them into envelopes.
 */
@RestControllerAdvice
@Slf4j
public class GatewayExceptionHandler {

    @ExceptionHandler(TokenException.class)
    public ResponseEntity<ErrorResponse> handleToken(TokenException e) {
        log.warn("Rejected access token: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(ErrorResponse.builder()
                        .error("UNAUTHORIZED")
                        .errorCode("E401")
                        .message(e.getDetail())
                        .timestamp(Instant.now().toString())
                        .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleInvalidRequest(MethodArgumentNotValidException e) {
        List<ValidationErrorResponse.ValidationError> errors = new ArrayList<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            errors.add(ValidationErrorResponse.ValidationError.builder()
                    .field(toJsonName(fieldError.getField()))
                    .code(fieldError.getCode())
                    .message(fieldError.getDefaultMessage())
                    .build());
        }
        e.getBindingResult().getGlobalErrors().forEach(globalError ->
                errors.add(ValidationErrorResponse.ValidationError.builder()
                        .field(globalError.getObjectName())
                        .code(globalError.getCode())
                        .message(globalError.getDefaultMessage())
                        .build()));

        log.info("Request validation failed: {} error(s)", errors.size());
        return validationFailure("Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ValidationErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.info("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return validationFailure("Request body is missing or is not valid JSON", List.of());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.builder()
                        .error("INTERNAL_SERVER_ERROR")
                        .errorCode("E500")
                        .message("An unexpected error occurred")
                        .timestamp(Instant.now().toString())
                        .build());
    }

    private ResponseEntity<ValidationErrorResponse> validationFailure(
            String message, List<ValidationErrorResponse.ValidationError> errors) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ValidationErrorResponse.builder()
                        .error("VALIDATION_FAILED")
                        .errorCode("E422")
                        .message(message)
                        .validationErrors(errors)
                        .timestamp(Instant.now().toString())
                        .build());
    }

    /**
     * startDate -> start_date, matching the request's JSON field names.
     */
    static String toJsonName(String field) {
        return field.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }
}
