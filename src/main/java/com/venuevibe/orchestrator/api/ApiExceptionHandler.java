package com.venuevibe.orchestrator.api;

import com.venuevibe.orchestrator.exception.InvalidRequestException;
import com.venuevibe.orchestrator.exception.LocationNotFoundException;
import com.venuevibe.orchestrator.exception.ProviderConfigurationException;
import com.venuevibe.orchestrator.exception.QuotaExceededException;
import com.venuevibe.orchestrator.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps exceptions escaping the controllers to {@link ApiError} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiError> handleInvalidRequest(InvalidRequestException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getCode());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .map(field -> field + ": " + ex.getBindingResult().getFieldError(field).getDefaultMessage())
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "Validation failed: " + message, "VALIDATION_ERROR");
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleBadInput(Exception ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        String message = ex instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : ex.getMessage();
        return error(HttpStatus.BAD_REQUEST, message, "INVALID_REQUEST");
    }

    @ExceptionHandler(LocationNotFoundException.class)
    public ResponseEntity<ApiError> handleLocationNotFound(LocationNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage(), "LOCATION_NOT_FOUND");
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<ApiError> handleQuota(QuotaExceededException ex) {
        log.warn("Provider quota exhausted: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(ApiError.builder()
                        .error("Too many requests to " + ex.getProvider() + ". Please try again later.")
                        .code("RATE_LIMIT_EXCEEDED")
                        .retryAfter(ex.getRetryAfterSeconds())
                        .build());
    }

    @ExceptionHandler(ProviderConfigurationException.class)
    public ResponseEntity<ApiError> handleConfiguration(ProviderConfigurationException ex) {
        log.error("Provider {} is misconfigured: {}", ex.getProvider(), ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR,
                "Service configuration error: " + ex.getProvider() + " is not configured", "CONFIGURATION_ERROR");
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ApiError> handleUpstream(UpstreamException ex) {
        log.error("Upstream {} failed: {}", ex.getProvider(), ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE,
                ex.getProvider() + " is temporarily unavailable. Please try again later.", "SERVICE_UNAVAILABLE");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        // framework rejections (unknown route, wrong method, bad media type) keep their status
        if (ex instanceof ErrorResponse rejection) {
            return error(HttpStatus.valueOf(rejection.getStatusCode().value()), ex.getMessage(), "REQUEST_REJECTED");
        }
        log.error("Unexpected exception occurred: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "INTERNAL_ERROR");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String message, String code) {
        return ResponseEntity.status(status).body(ApiError.builder().error(message).code(code).build());
    }
}
