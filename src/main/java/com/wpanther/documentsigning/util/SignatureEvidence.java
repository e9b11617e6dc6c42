package com.wpanther.documentsigning.util;

import java.math.BigInteger;
import java.security.cert.X509Certificate;
import java.time.Instant;

import lombok.Builder;
import lombok.Getter;

/**
 * What a signature field of a PDF actually contains.
 */
@Getter
@Builder
public class SignatureEvidence {

    private final String fieldName;
    private final X509Certificate signerCertificate;
    private final Instant timestampTime;
    private final BigInteger timestampSerial;
    private final byte[] timestampToken;
    private final boolean certification;

    public boolean hasTimestamp() {
        return timestampToken != null;
    }
}
