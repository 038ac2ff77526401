package com.koni.vitals.infrastructure.web.exception;

import com.koni.vitals.domain.exception.ColdStorageException;
import com.koni.vitals.domain.exception.IllegalBackfillTransitionException;
import com.koni.vitals.domain.exception.QueueUnavailableException;
import com.koni.vitals.domain.exception.StateStoreUnavailableException;
import com.koni.vitals.domain.exception.TerminalApiException;
import com.koni.vitals.domain.exception.TransientApiException;
import com.koni.vitals.domain.exception.UnknownSiteException;
import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.infrastructure.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Global exception handler for the control API.
 * Maps the pipeline's exception types to HTTP status codes with a consistent error body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }
    
    /**
     * Bean validation failures on request bodies, one detail line per rejected field.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.toList());
        log.warn("Request validation failed: errors={}", details);
        ErrorResponse body = new ErrorResponse(HttpStatus.BAD_REQUEST.value(), "Request validation failed", details);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableMessage(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body");
    }
    
    @ExceptionHandler(UnknownSiteException.class)
    public ResponseEntity<ErrorResponse> handleUnknownSite(UnknownSiteException ex) {
        log.warn("Unknown site: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }
    
    @ExceptionHandler(IllegalBackfillTransitionException.class)
    public ResponseEntity<ErrorResponse> handleIllegalTransition(IllegalBackfillTransitionException ex) {
        log.warn("Illegal backfill transition: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }
    
    /**
     * The upstream API rejected the request; retrying the same call will not help.
     */
    @ExceptionHandler(TerminalApiException.class)
    public ResponseEntity<ErrorResponse> handleTerminalApi(TerminalApiException ex) {
        log.error("Upstream API rejected request: statusCode={}, error={}", ex.getStatusCode(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Upstream API rejected the request: " + ex.getMessage());
    }
    
    @ExceptionHandler({TransientApiException.class, ColdStorageException.class})
    public ResponseEntity<ErrorResponse> handleTransientDependency(RuntimeException ex) {
        log.error("Dependency temporarily unavailable: type={}, error={}", ex.getClass().getSimpleName(),
                ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable");
    }
    
    @ExceptionHandler(StateStoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStateStoreUnavailable(StateStoreUnavailableException ex) {
        log.error("State store unavailable: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable");
    }
    
    @ExceptionHandler(QueueUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleQueueUnavailable(QueueUnavailableException ex) {
        log.error("Queue unavailable: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable");
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }
    
    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), message));
    }
}
