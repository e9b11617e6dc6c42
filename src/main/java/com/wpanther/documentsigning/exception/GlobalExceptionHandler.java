package com.wpanther.documentsigning.exception;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@ControllerAdvice
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GlobalExceptionHandler {

    @ExceptionHandler(NotYourTurnException.class)
    public ResponseEntity<ErrorResponse> handleNotYourTurn(NotYourTurnException ex) {
        log.info("Out of order signature attempt: {}", ex.getMessage());
        return createErrorResponse(ex.getMessage(), HttpStatus.CONFLICT, "NOT_YOUR_TURN");
    }

    @ExceptionHandler(AlreadySignedException.class)
    public ResponseEntity<ErrorResponse> handleAlreadySigned(AlreadySignedException ex) {
        log.info("Already signed: {}", ex.getMessage());
        return createErrorResponse(ex.getMessage(), HttpStatus.CONFLICT, "ALREADY_SIGNED");
    }

    @ExceptionHandler(InvalidOtpException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOtp(InvalidOtpException ex) {
        log.info("Verification code rejected: {}", ex.getReason());
        return createErrorResponse(ex.getMessage(), HttpStatus.BAD_REQUEST, "OTP_" + ex.getReason().name());
    }

    @ExceptionHandler(TsaException.class)
    public ResponseEntity<ErrorResponse> handleTsaException(TsaException ex) {
        log.error("Timestamp authority error", ex);
        String code = ex instanceof TsaTimeoutException ? "TSA_TIMEOUT" : "TSA_UNAVAILABLE";
        return createErrorResponse(ex.getMessage(), HttpStatus.SERVICE_UNAVAILABLE, code);
    }

    @ExceptionHandler(SigningException.class)
    public ResponseEntity<ErrorResponse> handleSigningException(SigningException ex) {
        log.error("Signing error", ex);
        return createErrorResponse(ex.getMessage(), HttpStatus.BAD_REQUEST, "SIGNING_FAILED");
    }

    @ExceptionHandler(DocumentStateException.class)
    public ResponseEntity<ErrorResponse> handleDocumentState(DocumentStateException ex) {
        log.warn("Document state conflict: {}", ex.getMessage());
        return createErrorResponse(ex.getMessage(), HttpStatus.CONFLICT, "INVALID_STATE");
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex) {
        return createErrorResponse(ex.getMessage(), HttpStatus.NOT_FOUND, "NOT_FOUND");
    }

    /**
     * A concurrent duplicate submission lost the race on the same request.
     */
    @ExceptionHandler({OptimisticLockingFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<ErrorResponse> handleConcurrentUpdate(RuntimeException ex) {
        log.warn("Concurrent modification rejected: {}", ex.getMessage());
        return createErrorResponse("The request was modified concurrently, reload and retry",
                HttpStatus.CONFLICT, "CONCURRENT_UPDATE");
    }

    @ExceptionHandler(ProofIntegrityException.class)
    public ResponseEntity<ErrorResponse> handleProofIntegrity(ProofIntegrityException ex) {
        log.error("Proof integrity violation", ex);
        return createErrorResponse(ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR, "PROOF_INTEGRITY");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        log.debug("Validation error: {}", ex.getMessage());

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        ValidationErrorResponse errorResponse = new ValidationErrorResponse(
            "Validation failed",
            HttpStatus.BAD_REQUEST.value(),
            Instant.now(),
            errors
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.debug("Bad request: {}", ex.getMessage());
        return createErrorResponse(ex.getMessage(), HttpStatus.BAD_REQUEST, "BAD_REQUEST");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception ex) {
        log.error("Unexpected error", ex);
        return createErrorResponse("An unexpected error occurred: " + ex.getMessage(),
                HttpStatus.INTERNAL_SERVER_ERROR, "SERVER_ERROR");
    }

    private ResponseEntity<ErrorResponse> createErrorResponse(String message, HttpStatus status, String code) {
        ErrorResponse errorResponse = new ErrorResponse(
            message,
            status.value(),
            Instant.now(),
            code
        );
        return new ResponseEntity<>(errorResponse, status);
    }

    // Error response classes
    public static class ErrorResponse {
        private final String message;
        private final int status;
        private final Instant timestamp;
        private final String code;

        public ErrorResponse(String message, int status, Instant timestamp, String code) {
            this.message = message;
            this.status = status;
            this.timestamp = timestamp;
            this.code = code;
        }

        public String getMessage() {
            return message;
        }

        public int getStatus() {
            return status;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public String getCode() {
            return code;
        }
    }

    public static class ValidationErrorResponse extends ErrorResponse {
        private final Map<String, String> errors;

        public ValidationErrorResponse(String message, int status, Instant timestamp, Map<String, String> errors) {
            super(message, status, timestamp, "VALIDATION_FAILED");
            this.errors = errors;
        }

        public Map<String, String> getErrors() {
            return errors;
        }
    }
}
