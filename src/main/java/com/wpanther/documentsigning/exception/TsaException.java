package com.wpanther.documentsigning.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class TsaException extends SigningException {

    public TsaException(String message) {
        super(message);
    }

    public TsaException(String message, Throwable cause) {
        super(message, cause);
    }
}
