package com.wpanther.documentsigning.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import com.wpanther.documentsigning.model.OtpCheckResult;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidOtpException extends SigningException {

    private final OtpCheckResult reason;

    public InvalidOtpException(OtpCheckResult reason) {
        super(describe(reason));
        this.reason = reason;
    }

    public OtpCheckResult getReason() {
        return reason;
    }

    private static String describe(OtpCheckResult reason) {
        switch (reason) {
            case EXPIRED:
                return "The verification code has expired, request a new one";
            case NOT_ISSUED:
                return "No verification code has been issued for this signature request";
            default:
                return "The verification code is incorrect";
        }
    }
}
