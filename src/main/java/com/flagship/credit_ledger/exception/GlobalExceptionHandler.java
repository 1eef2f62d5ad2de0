package com.flagship.credit_ledger.exception;

import com.flagship.credit_ledger.generation.GenerationLimitExceededException;
import com.flagship.credit_ledger.generation.GenerationNotFoundException;
import com.flagship.credit_ledger.ledger.InsufficientCreditsException;
import com.flagship.credit_ledger.ledger.InvariantViolationException;
import com.flagship.credit_ledger.payment.AuthenticationFailedException;
import com.flagship.credit_ledger.payment.PaymentProviderException;
import com.flagship.credit_ledger.payment.TopupNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to HTTP responses with a uniform ErrorResponse body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InsufficientCreditsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientCredits(InsufficientCreditsException e,
                                                                   HttpServletRequest request) {
        log.info("Insufficient credits: user={}, requested={}, available={}",
                e.getUserId(), e.getRequested(), e.getAvailable());

        return respond(HttpStatus.PAYMENT_REQUIRED, "Insufficient Credits", e.getMessage(), Map.of(
                "requested", String.valueOf(e.getRequested()),
                "available", String.valueOf(e.getAvailable()),
                "shortfall", String.valueOf(e.getShortfall())), request);
    }

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ErrorResponse> handleAuthenticationFailed(AuthenticationFailedException e,
                                                                    HttpServletRequest request) {
        log.warn("Authentication failed: {}", e.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "Authentication Failed", e.getMessage(), null, request);
    }

    @ExceptionHandler({GenerationNotFoundException.class, TopupNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e, HttpServletRequest request) {
        log.debug("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null, request);
    }

    @ExceptionHandler(GenerationLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleLimitExceeded(GenerationLimitExceededException e,
                                                             HttpServletRequest request) {
        log.info("Generation limit reached: {}", e.getMessage());
        return respond(HttpStatus.TOO_MANY_REQUESTS, "Generation Limit Exceeded", e.getMessage(), Map.of(
                "reason", e.getReason(),
                "limit", String.valueOf(e.getLimit())), request);
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(InvariantViolationException e,
                                                                  HttpServletRequest request) {
        // Already logged at ERROR by the ledger with full context.
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Ledger Invariant Violation",
                "The operation was refused to keep balances consistent", null, request);
    }

    @ExceptionHandler({StorageUnavailableException.class, TransientDataAccessException.class,
            DataAccessResourceFailureException.class, CannotCreateTransactionException.class})
    public ResponseEntity<ErrorResponse> handleStorageUnavailable(Exception e, HttpServletRequest request) {
        log.error("Storage unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Storage Unavailable",
                "Temporarily unable to complete the request, retry later", null, request);
    }

    @ExceptionHandler(PaymentProviderException.class)
    public ResponseEntity<ErrorResponse> handlePaymentProvider(PaymentProviderException e,
                                                               HttpServletRequest request) {
        log.error("Payment provider error: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Payment Provider Error", e.getMessage(), null, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e,
                                                                   HttpServletRequest request) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e, HttpServletRequest request) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", "Request could not be read", null, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e,
                                                               HttpServletRequest request) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null, request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e, HttpServletRequest request) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, HttpServletRequest request) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", null, request);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> details, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.builder()
            .status(status.value())
            .error(error)
            .message(message)
            .details(details)
            .path(request.getRequestURI())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        int status;
        String error;
        String message;
        Map<String, String> details;
        String path;
        Instant timestamp;
    }
}
