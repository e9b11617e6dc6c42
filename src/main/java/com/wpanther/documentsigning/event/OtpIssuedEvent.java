package com.wpanther.documentsigning.event;

import java.time.Instant;

import com.wpanther.documentsigning.model.Signer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A fresh verification code must be delivered to the signer.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class OtpIssuedEvent {
    private final String documentId;
    private final String requestId;
    private final Signer signer;

    @ToString.Exclude
    private final String code;

    private final Instant expiresAt;
}
