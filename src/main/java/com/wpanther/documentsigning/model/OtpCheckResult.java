package com.wpanther.documentsigning.model;

public enum OtpCheckResult {
    VALID,
    WRONG,
    EXPIRED,
    NOT_ISSUED;

    public boolean isValid() {
        return this == VALID;
    }
}
