package com.flagship.payday.api;

import com.flagship.payday.command.CommandConflictException;
import com.flagship.payday.command.CommandRejectedException;
import com.flagship.payday.command.PaymentNotFoundException;
import com.flagship.payday.eventstore.ConcurrencyConflictException;
import com.flagship.payday.eventstore.StorageException;
import com.flagship.payday.node.NodeException;
import com.flagship.payday.payment.InvalidTransitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to HTTP responses with a consistent error body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return error(HttpStatus.BAD_REQUEST, "Missing Required Header",
            "Required header '" + e.getHeaderName() + "' is missing");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed Request", "Request could not be read");
    }

    @ExceptionHandler(PaymentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(PaymentNotFoundException e) {
        log.debug("Payment not found: {}", e.getAggregateId());
        return error(HttpStatus.NOT_FOUND, "Not Found", e.getMessage());
    }

    @ExceptionHandler({CommandRejectedException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleRejected(RuntimeException e) {
        log.warn("Command rejected: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage());
    }

    @ExceptionHandler({CommandConflictException.class, ConcurrencyConflictException.class})
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException e) {
        log.warn("Concurrent modification: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, "Conflict", e.getMessage());
    }

    @ExceptionHandler({InvalidTransitionException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleInvalidState(RuntimeException e) {
        log.error("Invalid state: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, "Invalid State", e.getMessage());
    }

    @ExceptionHandler(NodeException.class)
    public ResponseEntity<ErrorResponse> handleNodeException(NodeException e) {
        log.warn("Node {} call failed: {}", e.getNodeId(), e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "Node Unavailable", e.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorageException(StorageException e) {
        log.error("Storage failure", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Storage Unavailable", "Event storage is unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
            .error(error)
            .message(message)
            .timestamp(Instant.now())
            .build());
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
