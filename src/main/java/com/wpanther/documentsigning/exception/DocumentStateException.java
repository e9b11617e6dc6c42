package com.wpanther.documentsigning.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The operation is not allowed in the document's current lifecycle state.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class DocumentStateException extends RuntimeException {

    public DocumentStateException(String message) {
        super(message);
    }
}
