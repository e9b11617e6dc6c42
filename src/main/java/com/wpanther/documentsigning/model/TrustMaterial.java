package com.wpanther.documentsigning.model;

import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key material loaded once at startup and shared read-only by the TSA,
 * the certificate issuer and the PDF signing engine.
 */
public final class TrustMaterial {

    private final SigningIdentity certifier;
    private final SigningIdentity certificateAuthority;
    private final SigningIdentity timeStampAuthority;
    private final List<X509Certificate> validationCertificates;

    public TrustMaterial(SigningIdentity certifier, SigningIdentity certificateAuthority,
            SigningIdentity timeStampAuthority) {
        if (certifier == null || timeStampAuthority == null) {
            throw new IllegalArgumentException("Certifier and TSA identities are required");
        }
        this.certifier = certifier;
        this.certificateAuthority = certificateAuthority;
        this.timeStampAuthority = timeStampAuthority;
        this.validationCertificates = collectValidationCertificates();
    }

    public SigningIdentity getCertifier() {
        return certifier;
    }

    /**
     * The internal CA, absent when the deployment runs without one.
     */
    public Optional<SigningIdentity> getCertificateAuthority() {
        return Optional.ofNullable(certificateAuthority);
    }

    public SigningIdentity getTimeStampAuthority() {
        return timeStampAuthority;
    }

    /**
     * Certificates embedded in signed PDFs so signatures can be validated offline.
     * Duplicates across chains are removed, order is stable.
     */
    public List<X509Certificate> getValidationCertificates() {
        return validationCertificates;
    }

    private List<X509Certificate> collectValidationCertificates() {
        Map<String, X509Certificate> unique = new LinkedHashMap<>();
        addAll(unique, certifier.getChain());
        if (certificateAuthority != null) {
            addAll(unique, certificateAuthority.getChain());
        }
        addAll(unique, timeStampAuthority.getChain());
        return Collections.unmodifiableList(new ArrayList<>(unique.values()));
    }

    private static void addAll(Map<String, X509Certificate> unique, List<X509Certificate> chain) {
        for (X509Certificate certificate : chain) {
            try {
                unique.putIfAbsent(Base64.getEncoder().encodeToString(certificate.getEncoded()), certificate);
            } catch (CertificateEncodingException e) {
                throw new IllegalStateException("Unable to encode certificate " + certificate.getSubjectX500Principal(), e);
            }
        }
    }
}
