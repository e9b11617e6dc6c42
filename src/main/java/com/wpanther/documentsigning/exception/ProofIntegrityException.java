package com.wpanther.documentsigning.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A proof record would be incomplete or does not match the signed artifact.
 * This signals a defect, not a user error.
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class ProofIntegrityException extends RuntimeException {

    public ProofIntegrityException(String message) {
        super(message);
    }

    public ProofIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
