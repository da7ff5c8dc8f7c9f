package com.flagship.fx_ledger.wallet.exception;

import com.flagship.fx_ledger.fx.RateUnavailableException;
import com.flagship.fx_ledger.ledger.LedgerErrorCode;
import com.flagship.fx_ledger.ledger.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger and rate failures onto HTTP responses.
 *
 * Validation 400, eligibility 403, insufficient funds 409, rate or storage
 * unavailable 503, anything else 500.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerException(LedgerException e) {
        HttpStatus status = statusFor(e.getCode());
        if (status.is5xxServerError()) {
            log.error("Ledger operation failed: code={}, message={}", e.getCode(), e.getMessage());
        } else {
            log.warn("Ledger operation rejected: code={}, message={}", e.getCode(), e.getMessage());
        }

        ErrorResponse error = ErrorResponse.builder()
            .error(e.getCode().name())
            .message(status == HttpStatus.INTERNAL_SERVER_ERROR ? "An unexpected error occurred" : e.getMessage())
            .details(Map.of("retryable", String.valueOf(e.isRetryable())))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(RateUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleRateUnavailable(RateUnavailableException e) {
        log.error("Rate unavailable: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error(LedgerErrorCode.RATE_UNAVAILABLE.name())
            .message(e.getMessage())
            .details(Map.of("retryable", "true"))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
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

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Invalid request: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message(e instanceof HttpMessageNotReadableException ? "Malformed request body" : e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(LedgerErrorCode code) {
        return switch (code.getCategory()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case ELIGIBILITY -> HttpStatus.FORBIDDEN;
            case STATE -> HttpStatus.CONFLICT;
            case DEPENDENCY -> HttpStatus.SERVICE_UNAVAILABLE;
            case FATAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
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
