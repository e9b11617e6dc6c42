package com.wpanther.documentsigning.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import org.hibernate.annotations.Immutable;

import java.time.Instant;

import com.wpanther.documentsigning.exception.ProofIntegrityException;
import com.wpanther.documentsigning.model.SignerRole;

/**
 * Forensic evidence of one completed signature. Rows are written once and never updated.
 */
@Entity
@Immutable
@Table(name = "proof_records", indexes = {
        @Index(name = "idx_proof_records_document", columnList = "document_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ProofRecord {

    @Id
    private String id;

    @Column(name = "document_id", nullable = false, updatable = false)
    private String documentId;

    @Column(name = "document_type", nullable = false, updatable = false)
    private String documentType;

    @Column(name = "signature_request_id", nullable = false, unique = true, updatable = false)
    private String signatureRequestId;

    @Column(name = "field_name", nullable = false, updatable = false)
    private String fieldName;

    @Enumerated(EnumType.STRING)
    @Column(name = "signer_role", nullable = false, updatable = false, length = 16)
    private SignerRole signerRole;

    @Column(name = "signer_name", nullable = false, updatable = false)
    private String signerName;

    @Column(name = "signer_email", nullable = false, updatable = false)
    private String signerEmail;

    @Column(name = "otp_code", nullable = false, updatable = false, length = 6)
    private String otpCode;

    @Column(name = "otp_generated_at", nullable = false, updatable = false)
    private Instant otpGeneratedAt;

    @Column(name = "otp_validated_at", nullable = false, updatable = false)
    private Instant otpValidatedAt;

    @Column(name = "otp_validated", nullable = false, updatable = false)
    private boolean otpValidated;

    @Column(name = "ip_address", updatable = false, length = 64)
    private String ipAddress;

    @Column(name = "user_agent", updatable = false, length = 1024)
    private String userAgent;

    @Column(name = "referer", updatable = false, length = 2048)
    private String referer;

    @Column(name = "signature_timestamp", nullable = false, updatable = false)
    private Instant signatureTimestamp;

    @Column(name = "pdf_hash_before", nullable = false, updatable = false, length = 64)
    private String pdfHashBefore;

    @Column(name = "pdf_hash_after", nullable = false, updatable = false, length = 64)
    private String pdfHashAfter;

    @Lob
    @Column(name = "certificate_pem", nullable = false, updatable = false)
    private String certificatePem;

    @Column(name = "certificate_fingerprint", nullable = false, updatable = false, length = 64)
    private String certificateFingerprint;

    @Column(name = "certificate_subject", nullable = false, updatable = false, length = 1024)
    private String certificateSubject;

    @Column(name = "certificate_issuer", nullable = false, updatable = false, length = 1024)
    private String certificateIssuer;

    @Column(name = "certificate_valid_from", nullable = false, updatable = false)
    private Instant certificateValidFrom;

    @Column(name = "certificate_valid_until", nullable = false, updatable = false)
    private Instant certificateValidUntil;

    @Column(name = "tsa_timestamp", updatable = false)
    private Instant tsaTimestamp;

    @Column(name = "tsa_serial", updatable = false, length = 64)
    private String tsaSerial;

    @Lob
    @Column(name = "tsa_token", updatable = false)
    private byte[] tsaToken;

    @PrePersist
    void verifyOtpEvidence() {
        if (otpCode == null || otpGeneratedAt == null || otpValidatedAt == null || !otpValidated) {
            throw new ProofIntegrityException("Proof record for signature request " + signatureRequestId
                    + " has no OTP evidence");
        }
    }

    public boolean hasTimestamp() {
        return tsaTimestamp != null;
    }
}
