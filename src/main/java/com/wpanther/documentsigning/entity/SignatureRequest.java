package com.wpanther.documentsigning.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

import com.wpanther.documentsigning.model.Signer;

/**
 * One required signature on a document, addressed externally by its link token.
 */
@Entity
@Table(name = "signature_requests", indexes = {
        @Index(name = "idx_signature_requests_document", columnList = "document_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignatureRequest {

    @Id
    private String id;

    @Column(name = "document_id", nullable = false, updatable = false)
    private String documentId;

    @Column(name = "signing_order", nullable = false, updatable = false)
    private int signingOrder;

    @Embedded
    private Signer signer;

    @Column(name = "link_token", nullable = false, unique = true, updatable = false, length = 64)
    private String linkToken;

    @Column(name = "otp_code", length = 6)
    private String otpCode;

    @Column(name = "otp_generated_at")
    private Instant otpGeneratedAt;

    @Column(name = "signed", nullable = false)
    private boolean signed;

    @Column(name = "signed_at")
    private Instant signedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    public boolean isCancelled() {
        return cancelledAt != null;
    }
}
