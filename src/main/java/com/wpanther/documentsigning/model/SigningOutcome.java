package com.wpanther.documentsigning.model;

import java.time.Instant;

import lombok.Builder;
import lombok.Getter;

/**
 * Result of a completed signature.
 */
@Getter
@Builder
public class SigningOutcome {
    private final String documentId;
    private final String requestId;
    private final String proofId;
    private final String fieldName;
    private final Instant signedAt;
    private final DocumentStatus documentStatus;
    private final String fileName;
}
