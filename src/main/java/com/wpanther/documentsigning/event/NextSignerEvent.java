package com.wpanther.documentsigning.event;

import com.wpanther.documentsigning.model.Signer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Published after a signature when another signer is still expected.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class NextSignerEvent {
    private final String documentId;
    private final String documentName;
    private final String requestId;
    private final int signingOrder;
    private final Signer signer;

    @ToString.Exclude
    private final String linkToken;
}
