package com.wpanther.documentsigning.service;

import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.documentsigning.dto.ProofEntry;
import com.wpanther.documentsigning.dto.ProofJournal;
import com.wpanther.documentsigning.entity.ProofRecord;
import com.wpanther.documentsigning.entity.SignableDocumentEntity;
import com.wpanther.documentsigning.entity.SignatureRequest;
import com.wpanther.documentsigning.exception.ProofIntegrityException;
import com.wpanther.documentsigning.model.HttpProvenance;
import com.wpanther.documentsigning.repository.ProofRecordRepository;
import com.wpanther.documentsigning.util.CertificateUtil;
import com.wpanther.documentsigning.util.SignatureEvidence;
import com.wpanther.documentsigning.util.SignatureInspector;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the immutable proof record of each signature and assembles the audit journal.
 * Certificate and timestamp details are read back from the signed PDF itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProofJournalService {

    private final ProofRecordRepository proofRecordRepository;
    private final Clock clock;

    /**
     * Persists the proof of one completed signature.
     *
     * @param otpValidatedAt when the signer's code was accepted
     * @throws ProofIntegrityException if the request carries no OTP evidence or the
     *         signed field cannot be read back from {@code pdfAfter}
     */
    @Transactional
    public ProofRecord record(SignableDocumentEntity document, SignatureRequest request, byte[] pdfBefore,
            byte[] pdfAfter, String fieldName, HttpProvenance provenance, Instant otpValidatedAt) {
        if (request.getOtpCode() == null || request.getOtpGeneratedAt() == null || otpValidatedAt == null) {
            throw new ProofIntegrityException("Signature request " + request.getId()
                    + " has no OTP evidence, refusing to record proof");
        }
        if (proofRecordRepository.existsBySignatureRequestId(request.getId())) {
            throw new ProofIntegrityException("Proof already recorded for signature request " + request.getId());
        }

        SignatureEvidence evidence = SignatureInspector.inspect(pdfAfter, fieldName);
        X509Certificate certificate = evidence.getSignerCertificate();
        HttpProvenance origin = provenance != null ? provenance : new HttpProvenance();

        ProofRecord proof = ProofRecord.builder()
                .id(UUID.randomUUID().toString())
                .documentId(document.getId())
                .documentType(document.getDocumentType())
                .signatureRequestId(request.getId())
                .fieldName(fieldName)
                .signerRole(request.getSigner().getRole())
                .signerName(request.getSigner().getName())
                .signerEmail(request.getSigner().getEmail())
                .otpCode(request.getOtpCode())
                .otpGeneratedAt(request.getOtpGeneratedAt())
                .otpValidatedAt(otpValidatedAt)
                .otpValidated(true)
                .ipAddress(origin.getIpAddress() != null ? origin.getIpAddress() : HttpProvenance.UNKNOWN_ADDRESS)
                .userAgent(origin.getUserAgent())
                .referer(origin.getReferer())
                .signatureTimestamp(clock.instant())
                .pdfHashBefore(CertificateUtil.sha256Hex(pdfBefore))
                .pdfHashAfter(CertificateUtil.sha256Hex(pdfAfter))
                .certificatePem(CertificateUtil.toPem(certificate))
                .certificateFingerprint(CertificateUtil.fingerprint(certificate))
                .certificateSubject(certificate.getSubjectX500Principal().getName())
                .certificateIssuer(certificate.getIssuerX500Principal().getName())
                .certificateValidFrom(certificate.getNotBefore().toInstant())
                .certificateValidUntil(certificate.getNotAfter().toInstant())
                .tsaTimestamp(evidence.getTimestampTime())
                .tsaSerial(evidence.getTimestampSerial() != null ? evidence.getTimestampSerial().toString() : null)
                .tsaToken(evidence.getTimestampToken())
                .build();

        ProofRecord saved = proofRecordRepository.saveAndFlush(proof);
        if (!saved.hasTimestamp()) {
            log.warn("Signature without timestamp token documentId={} requestId={}", document.getId(),
                    request.getId());
        }
        log.info("Recorded proof documentId={} requestId={} field={} tsaSerial={}", document.getId(),
                request.getId(), fieldName, saved.getTsaSerial());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ProofRecord> getProofRecords(String documentId) {
        return proofRecordRepository.findByDocumentIdOrderBySignatureTimestampAsc(documentId);
    }

    /**
     * Builds the chronological audit report of a document from persisted proof records.
     */
    @Transactional(readOnly = true)
    public ProofJournal assembleJournal(SignableDocumentEntity document) {
        List<ProofEntry> entries = getProofRecords(document.getId()).stream()
                .map(ProofJournalService::toEntry)
                .collect(Collectors.toList());

        byte[] finalPdf = document.getLatestPdf() != null ? document.getLatestPdf() : document.getOriginalPdf();

        return ProofJournal.builder()
                .document(ProofJournal.DocumentInfo.builder()
                        .type(document.getDocumentType())
                        .id(document.getId())
                        .name(document.getDocumentName())
                        .title(document.getTitle())
                        .status(document.getStatus().name())
                        .pdfHashFinal(finalPdf != null ? CertificateUtil.sha256Hex(finalPdf) : null)
                        .build())
                .certification(certificationOf(document))
                .signatures(entries)
                .audit(ProofJournal.AuditInfo.builder()
                        .generatedAt(clock.instant())
                        .totalSignatures(entries.size())
                        .build())
                .build();
    }

    private ProofJournal.CertificationInfo certificationOf(SignableDocumentEntity document) {
        if (!document.isCertified() || document.getCertificationField() == null) {
            return null;
        }
        SignatureEvidence evidence = SignatureInspector.inspect(document.getLatestPdf(),
                document.getCertificationField());
        return ProofJournal.CertificationInfo.builder()
                .certifier(evidence.getSignerCertificate().getSubjectX500Principal().getName())
                .fieldName(document.getCertificationField())
                .certifiedAt(document.getCertifiedAt())
                .build();
    }

    static ProofEntry toEntry(ProofRecord proof) {
        return ProofEntry.builder()
                .signer(ProofEntry.SignerInfo.builder()
                        .role(proof.getSignerRole() != null ? proof.getSignerRole().getCode() : null)
                        .name(proof.getSignerName())
                        .email(proof.getSignerEmail())
                        .build())
                .otp(ProofEntry.OtpInfo.builder()
                        .code(proof.getOtpCode())
                        .generatedAt(proof.getOtpGeneratedAt())
                        .validatedAt(proof.getOtpValidatedAt())
                        .validated(proof.isOtpValidated())
                        .build())
                .http(ProofEntry.HttpInfo.builder()
                        .ip(proof.getIpAddress())
                        .userAgent(proof.getUserAgent())
                        .referer(proof.getReferer())
                        .build())
                .pdf(ProofEntry.PdfInfo.builder()
                        .hashBefore(proof.getPdfHashBefore())
                        .hashAfter(proof.getPdfHashAfter())
                        .fieldName(proof.getFieldName())
                        .build())
                .certificate(ProofEntry.CertificateInfo.builder()
                        .pem(proof.getCertificatePem())
                        .fingerprint(proof.getCertificateFingerprint())
                        .subject(proof.getCertificateSubject())
                        .issuer(proof.getCertificateIssuer())
                        .validFrom(proof.getCertificateValidFrom())
                        .validUntil(proof.getCertificateValidUntil())
                        .build())
                .tsa(proof.hasTimestamp() ? ProofEntry.TsaInfo.builder()
                        .timestamp(proof.getTsaTimestamp())
                        .serial(proof.getTsaSerial())
                        .build() : null)
                .signatureTimestamp(proof.getSignatureTimestamp())
                .build();
    }
}
