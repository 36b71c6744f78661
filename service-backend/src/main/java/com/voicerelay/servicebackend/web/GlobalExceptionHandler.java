package com.voicerelay.servicebackend.web;

import com.voicerelay.servicebackend.exception.AuthenticationException;
import com.voicerelay.servicebackend.exception.ErrorCode;
import com.voicerelay.servicebackend.exception.MetadataUnavailableException;
import com.voicerelay.servicebackend.web.dto.ApiErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Converts exceptions raised by the REST endpoints into error bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Nonce exchange failures. The client has to reload the page for a new nonce.
     */
    @ExceptionHandler(AuthenticationException.class)
    ResponseEntity<ApiErrorResponse> handleAuthentication(AuthenticationException ex) {
        return ResponseEntity
                .status(HttpStatus.FORBIDDEN)
                .body(ApiErrorResponse.of(ex.getErrorType(), ex.getCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(MetadataUnavailableException.class)
    ResponseEntity<ApiErrorResponse> handleMetadataUnavailable(MetadataUnavailableException ex) {
        log.error("Metadata unavailable: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiErrorResponse.of(ex.getErrorType(), ex.getCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    ResponseEntity<ApiErrorResponse> handleNotFound(NoResourceFoundException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(ApiErrorResponse.of("NotFound", "NOT_FOUND", "Endpoint not found"));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    ResponseEntity<ApiErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity
                .status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(ApiErrorResponse.of("MethodNotAllowed", "METHOD_NOT_ALLOWED", ex.getMessage()));
    }

    /**
     * Catch-all; the exception message is logged but never returned.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiErrorResponse.of("InternalServerError", ErrorCode.INTERNAL_SERVER_ERROR.name(),
                        "An unexpected error occurred"));
    }
}
