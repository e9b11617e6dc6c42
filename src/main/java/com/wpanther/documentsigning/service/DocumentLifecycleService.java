package com.wpanther.documentsigning.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.documentsigning.entity.DocumentKind;
import com.wpanther.documentsigning.entity.SignableDocumentEntity;
import com.wpanther.documentsigning.entity.SignatureRequest;
import com.wpanther.documentsigning.event.DocumentFullySignedEvent;
import com.wpanther.documentsigning.exception.DocumentStateException;
import com.wpanther.documentsigning.exception.ResourceNotFoundException;
import com.wpanther.documentsigning.model.DocumentStatus;
import com.wpanther.documentsigning.repository.ProofRecordRepository;
import com.wpanther.documentsigning.repository.SignableDocumentRepository;
import com.wpanther.documentsigning.repository.SignatureRequestRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the DRAFT -> SIGNING -> SIGNED / CANCELLED state machine of signable documents.
 * Completion is always derived from the persisted proof records, never from a cached flag.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentLifecycleService {

    private final SignableDocumentRepository documentRepository;
    private final SignatureRequestRepository signatureRequestRepository;
    private final ProofRecordRepository proofRecordRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Registers a new document in DRAFT with its immutable original PDF.
     */
    @Transactional
    public SignableDocumentEntity createDocument(DocumentKind kind, String title, byte[] originalPdf) {
        if (originalPdf == null || originalPdf.length == 0) {
            throw new IllegalArgumentException("Original PDF is required");
        }
        SignableDocumentEntity document = kind.newDocument();
        document.setId(UUID.randomUUID().toString());
        document.setTitle(title);
        document.setStatus(DocumentStatus.DRAFT);
        document.setOriginalPdf(originalPdf.clone());
        document.setCreatedAt(clock.instant());
        document.setUpdatedAt(document.getCreatedAt());

        SignableDocumentEntity saved = documentRepository.save(document);
        log.info("Created document documentId={} type={} size={}", saved.getId(), saved.getDocumentType(),
                originalPdf.length);
        return saved;
    }

    @Transactional(readOnly = true)
    public SignableDocumentEntity getDocument(String documentId) {
        return documentRepository.findById(documentId)
                .orElseThrow(() -> new ResourceNotFoundException("Document not found: " + documentId));
    }

    /**
     * Records the certified artifact. A document is certified at most once.
     */
    @Transactional
    public SignableDocumentEntity recordCertification(SignableDocumentEntity document, byte[] certifiedPdf,
            String fieldName) {
        if (document.isCertified()) {
            throw new DocumentStateException("Document " + document.getId() + " is already certified");
        }
        document.setLatestPdf(certifiedPdf);
        document.setCertificationField(fieldName);
        document.setCertifiedAt(clock.instant());
        document.setUpdatedAt(document.getCertifiedAt());
        return documentRepository.save(document);
    }

    /**
     * DRAFT -> SIGNING. Calling it on a document already in SIGNING does nothing.
     */
    @Transactional
    public SignableDocumentEntity markSigning(SignableDocumentEntity document) {
        if (document.getStatus() == DocumentStatus.SIGNING) {
            return document;
        }
        transition(document, DocumentStatus.SIGNING);
        return documentRepository.save(document);
    }

    /**
     * Moves the document to SIGNED once the number of proof records matches the
     * number of active signature requests. Returns whether the document is SIGNED.
     * Repeated calls on unchanged data neither change state nor publish again.
     */
    @Transactional
    public boolean reevaluateCompletion(SignableDocumentEntity document) {
        if (document.getStatus() == DocumentStatus.SIGNED) {
            return true;
        }
        if (document.getStatus() != DocumentStatus.SIGNING) {
            return false;
        }

        long required = signatureRequestRepository.countByDocumentIdAndCancelledAtIsNull(document.getId());
        long completed = proofRecordRepository.countByDocumentId(document.getId());
        log.debug("Completion check documentId={} proofs={} requests={}", document.getId(), completed, required);
        if (required == 0 || completed != required) {
            return false;
        }

        transition(document, DocumentStatus.SIGNED);
        documentRepository.save(document);

        List<SignatureRequest> requests = signatureRequestRepository
                .findByDocumentIdAndCancelledAtIsNullOrderBySigningOrderAsc(document.getId());
        Instant signedAt = clock.instant();
        eventPublisher.publishEvent(new DocumentFullySignedEvent(document.getId(), document.getDocumentName(),
                document.getLatestFileName(),
                requests.stream().map(SignatureRequest::getSigner).collect(Collectors.toList()), signedAt));
        log.info("Document fully signed documentId={} signatures={}", document.getId(), completed);
        return true;
    }

    /**
     * Any state except SIGNED may be cancelled; cancelling twice is a no-op.
     */
    @Transactional
    public SignableDocumentEntity cancel(SignableDocumentEntity document) {
        if (document.getStatus() == DocumentStatus.CANCELLED) {
            return document;
        }
        transition(document, DocumentStatus.CANCELLED);
        log.info("Cancelled document documentId={}", document.getId());
        return documentRepository.save(document);
    }

    public boolean isLocked(SignableDocumentEntity document) {
        return document.isLocked();
    }

    /**
     * Rejects edits of business fields while the document is locked.
     */
    public void assertEditable(SignableDocumentEntity document) {
        if (document.isLocked()) {
            throw new DocumentStateException("Document " + document.getId() + " is locked in status "
                    + document.getStatus());
        }
    }

    private void transition(SignableDocumentEntity document, DocumentStatus target) {
        DocumentStatus current = document.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new DocumentStateException("Document " + document.getId() + " cannot move from "
                    + current + " to " + target);
        }
        document.setStatus(target);
        document.setUpdatedAt(clock.instant());
        log.debug("Document documentId={} {} -> {}", document.getId(), current, target);
    }
}
