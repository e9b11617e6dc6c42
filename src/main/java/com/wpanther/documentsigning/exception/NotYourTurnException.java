package com.wpanther.documentsigning.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class NotYourTurnException extends SigningException {

    private final int expectedOrder;

    public NotYourTurnException(int requestOrder, int expectedOrder) {
        super("Not your turn: signer " + expectedOrder + " must sign before signer " + requestOrder);
        this.expectedOrder = expectedOrder;
    }

    public int getExpectedOrder() {
        return expectedOrder;
    }
}
