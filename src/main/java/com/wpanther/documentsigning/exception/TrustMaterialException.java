package com.wpanther.documentsigning.exception;

/**
 * Certificate or key material is missing or unreadable. Raised at startup and never recovered.
 */
public class TrustMaterialException extends RuntimeException {

    public TrustMaterialException(String message) {
        super(message);
    }

    public TrustMaterialException(String message, Throwable cause) {
        super(message, cause);
    }
}
