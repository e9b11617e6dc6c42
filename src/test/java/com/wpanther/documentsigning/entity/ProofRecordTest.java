package com.wpanther.documentsigning.entity;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.wpanther.documentsigning.exception.ProofIntegrityException;
import com.wpanther.documentsigning.model.SignerRole;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProofRecordTest {

    private ProofRecord.ProofRecordBuilder base() {
        return ProofRecord.builder()
                .id("proof-1")
                .documentId("doc-1")
                .documentType("LEASE")
                .signatureRequestId("req-1")
                .fieldName("signature_tenant_t1")
                .signerRole(SignerRole.TENANT)
                .signerName("Alice Martin")
                .signerEmail("alice.martin@example.com")
                .signatureTimestamp(Instant.parse("2024-05-02T10:00:00Z"));
    }

    @Test
    void testRecordWithOtpEvidenceIsAccepted() {
        ProofRecord proof = base()
                .otpCode("123456")
                .otpGeneratedAt(Instant.parse("2024-05-02T09:55:00Z"))
                .otpValidatedAt(Instant.parse("2024-05-02T10:00:00Z"))
                .otpValidated(true)
                .build();

        assertThatCode(proof::verifyOtpEvidence).doesNotThrowAnyException();
    }

    @Test
    void testRecordWithoutOtpIsRejected() {
        ProofRecord proof = base().build();

        assertThatThrownBy(proof::verifyOtpEvidence)
                .isInstanceOf(ProofIntegrityException.class)
                .hasMessageContaining("req-1");
    }

    @Test
    void testRecordWithUnvalidatedOtpIsRejected() {
        ProofRecord proof = base()
                .otpCode("123456")
                .otpGeneratedAt(Instant.parse("2024-05-02T09:55:00Z"))
                .otpValidatedAt(Instant.parse("2024-05-02T10:00:00Z"))
                .otpValidated(false)
                .build();

        assertThatThrownBy(proof::verifyOtpEvidence).isInstanceOf(ProofIntegrityException.class);
    }
}
