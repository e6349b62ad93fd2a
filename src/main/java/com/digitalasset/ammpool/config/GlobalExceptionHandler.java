// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.config;

import com.digitalasset.ammpool.common.DomainError;
import com.digitalasset.ammpool.constants.PoolConstants;
import com.digitalasset.ammpool.controller.DomainErrorException;
import com.digitalasset.ammpool.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for all REST controllers.
 *
 * Provides standardized error responses across all endpoints:
 * - DomainErrorException (pool errors, rendered with their domain code)
 * - ResponseStatusException (other 4xx/5xx errors)
 * - Validation and request parsing errors (400 Bad Request)
 * - Generic exceptions (500 Internal Server Error)
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DomainErrorException.class)
    public ResponseEntity<ErrorResponse> handleDomainError(
            DomainErrorException ex,
            HttpServletRequest request
    ) {
        DomainError error = ex.error();
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        ErrorResponse body = build(error.code(), error.message(), status, request);

        logger.warn("Domain error on {}: {} {} - {}", request.getRequestURI(), status.value(), error.code(), error.message());

        return ResponseEntity.status(status).body(body);
    }

    /**
     * Handle ResponseStatusException thrown by controllers.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(
            ResponseStatusException ex,
            HttpServletRequest request
    ) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        ErrorResponse body = build(getErrorCodeFromStatus(status), message, status, request);

        logger.warn("ResponseStatusException: {} {} - {}", status.value(), request.getRequestURI(), message);

        return ResponseEntity.status(status).body(body);
    }

    /**
     * Handle validation errors (e.g., @Valid annotation failures).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        Map<String, String> validationErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
            validationErrors.put(error.getField(), error.getDefaultMessage())
        );

        ErrorResponse body = build("VALIDATION_ERROR", "Request validation failed", HttpStatus.BAD_REQUEST, request);
        body.setDetails(validationErrors);

        logger.warn("Validation error on {}: {}", request.getRequestURI(), validationErrors);

        return ResponseEntity.badRequest().body(body);
    }

    /**
     * Malformed JSON, non-integer amounts, missing or unparseable query parameters.
     */
    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        String message = ex instanceof HttpMessageNotReadableException
                ? "Malformed request body: amounts must be non-negative integers"
                : ex.getMessage();
        ErrorResponse body = build("VALIDATION_ERROR", message, HttpStatus.BAD_REQUEST, request);

        logger.warn("Unreadable request on {}: {}", request.getRequestURI(), ex.getMessage());

        return ResponseEntity.badRequest().body(body);
    }

    /**
     * Handle all other uncaught exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        ErrorResponse body = build(
                "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred",
                HttpStatus.INTERNAL_SERVER_ERROR,
                request
        );

        logger.error("Unhandled exception on {}: {}", request.getRequestURI(), ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ErrorResponse build(String errorCode, String message, HttpStatus status, HttpServletRequest request) {
        ErrorResponse errorResponse = new ErrorResponse(errorCode, message, status.value(), request.getRequestURI());
        String requestId = request.getHeader(PoolConstants.REQUEST_ID_HEADER);
        if (requestId != null) {
            errorResponse.setRequestId(requestId);
        }
        return errorResponse;
    }

    /**
     * Map HTTP status to error code.
     */
    private String getErrorCodeFromStatus(HttpStatus status) {
        return switch (status) {
            case BAD_REQUEST -> "BAD_REQUEST";
            case FORBIDDEN -> "FORBIDDEN";
            case NOT_FOUND -> "NOT_FOUND";
            case CONFLICT -> "CONFLICT";
            case UNPROCESSABLE_ENTITY -> "UNPROCESSABLE_ENTITY";
            case INTERNAL_SERVER_ERROR -> "INTERNAL_SERVER_ERROR";
            default -> status.name();
        };
    }
}
