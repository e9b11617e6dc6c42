package com.wpanther.documentsigning.exception;

public class DocumentAlreadyCertifiedException extends DocumentStateException {

    public DocumentAlreadyCertifiedException(String message) {
        super(message);
    }
}
