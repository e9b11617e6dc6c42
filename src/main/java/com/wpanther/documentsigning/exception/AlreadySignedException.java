package com.wpanther.documentsigning.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class AlreadySignedException extends SigningException {

    public AlreadySignedException(String message) {
        super(message);
    }
}
