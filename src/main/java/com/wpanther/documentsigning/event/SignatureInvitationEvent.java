package com.wpanther.documentsigning.event;

import com.wpanther.documentsigning.model.Signer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A signer should receive the link to their signature request.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class SignatureInvitationEvent {
    private final String documentId;
    private final String documentName;
    private final String requestId;
    private final int signingOrder;
    private final Signer signer;

    @ToString.Exclude
    private final String linkToken;
}
