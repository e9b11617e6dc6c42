package com.wpanther.documentsigning.exception;

public class TsaTimeoutException extends TsaException {

    public TsaTimeoutException(long timeoutMillis) {
        super("Timestamp authority did not answer within " + timeoutMillis + " ms");
    }
}
