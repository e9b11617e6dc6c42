package com.wpanther.documentsigning.service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.documentsigning.entity.ProofRecord;
import com.wpanther.documentsigning.entity.SignableDocumentEntity;
import com.wpanther.documentsigning.entity.SignatureRequest;
import com.wpanther.documentsigning.event.NextSignerEvent;
import com.wpanther.documentsigning.event.OtpIssuedEvent;
import com.wpanther.documentsigning.event.SignatureInvitationEvent;
import com.wpanther.documentsigning.exception.AlreadySignedException;
import com.wpanther.documentsigning.exception.DocumentAlreadyCertifiedException;
import com.wpanther.documentsigning.exception.DocumentStateException;
import com.wpanther.documentsigning.exception.InvalidOtpException;
import com.wpanther.documentsigning.exception.NotYourTurnException;
import com.wpanther.documentsigning.exception.ResourceNotFoundException;
import com.wpanther.documentsigning.model.ApprovalOptions;
import com.wpanther.documentsigning.model.DocumentStatus;
import com.wpanther.documentsigning.model.HttpProvenance;
import com.wpanther.documentsigning.model.OtpCheckResult;
import com.wpanther.documentsigning.model.Signer;
import com.wpanther.documentsigning.model.SignerCredential;
import com.wpanther.documentsigning.model.SigningOutcome;
import com.wpanther.documentsigning.repository.SignatureRequestRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives sequential multi-party signing of a document: request creation,
 * one-time codes, turn enforcement and completion of each signature.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignatureOrchestrator {

    private static final int LINK_TOKEN_BYTES = 32;

    private final SignatureRequestRepository signatureRequestRepository;
    private final DocumentLifecycleService lifecycleService;
    private final OtpService otpService;
    private final EphemeralCertificateService ephemeralCertificateService;
    private final PdfSigningEngine pdfSigningEngine;
    private final ProofJournalService proofJournalService;
    private final ApplicationEventPublisher eventPublisher;
    private final SecureRandom secureRandom;
    private final Clock clock;

    @Value("${app.signing.require-pre-placed-field:false}")
    private boolean requirePrePlacedField;

    /**
     * Applies the certifying signature. Must happen once, before any approval.
     */
    @Transactional
    public SignableDocumentEntity certifyDocument(String documentId) {
        SignableDocumentEntity document = lifecycleService.getDocument(documentId);
        if (document.isCertified()) {
            throw new DocumentAlreadyCertifiedException("Document " + documentId + " is already certified");
        }
        if (document.getStatus() != DocumentStatus.DRAFT) {
            throw new DocumentStateException("Only a DRAFT document can be certified, status is "
                    + document.getStatus());
        }

        String fieldName = pdfSigningEngine.newCertificationFieldName();
        byte[] certified = pdfSigningEngine.certify(document.getOriginalPdf(), fieldName);
        log.info("Certified documentId={} field={}", documentId, fieldName);
        return lifecycleService.recordCertification(document, certified, fieldName);
    }

    /**
     * Creates one request per signer, ordered 1..N in the given order.
     */
    @Transactional
    public List<SignatureRequest> createRequests(String documentId, List<Signer> signers) {
        SignableDocumentEntity document = lifecycleService.getDocument(documentId);
        if (document.getStatus().isTerminal()) {
            throw new DocumentStateException("Document " + documentId + " is " + document.getStatus());
        }
        if (signers == null || signers.isEmpty()) {
            throw new IllegalArgumentException("At least one signer is required");
        }
        if (signatureRequestRepository.existsByDocumentIdAndCancelledAtIsNull(documentId)) {
            throw new DocumentStateException("Signature requests already exist for document " + documentId);
        }

        Set<String> fieldNames = new HashSet<>();
        List<SignatureRequest> requests = new ArrayList<>();
        Instant now = clock.instant();
        int order = 1;
        for (Signer signer : signers) {
            if (signer.getName() == null || signer.getEmail() == null) {
                throw new IllegalArgumentException("Signer name and email are required");
            }
            if (!fieldNames.add(signer.signatureFieldName())) {
                throw new IllegalArgumentException("Signer listed twice: " + signer.signatureFieldName());
            }
            requests.add(SignatureRequest.builder()
                    .id(UUID.randomUUID().toString())
                    .documentId(documentId)
                    .signingOrder(order++)
                    .signer(signer)
                    .linkToken(newLinkToken())
                    .createdAt(now)
                    .build());
        }

        List<SignatureRequest> saved = signatureRequestRepository.saveAll(requests);
        log.info("Created {} signature requests for documentId={}", saved.size(), documentId);
        return saved;
    }

    /**
     * Invites the first signer and moves the document to SIGNING.
     */
    @Transactional
    public SignableDocumentEntity startSigning(String documentId) {
        SignableDocumentEntity document = lifecycleService.getDocument(documentId);
        if (document.getStatus() != DocumentStatus.DRAFT) {
            throw new DocumentStateException("Signing already started or closed for document " + documentId);
        }
        if (!document.isCertified()) {
            throw new DocumentStateException("Document " + documentId + " must be certified before signing");
        }
        SignatureRequest first = getNextRequest(documentId)
                .orElseThrow(() -> new DocumentStateException("No signature request for document " + documentId));

        publishInvitation(document, first);
        return lifecycleService.markSigning(document);
    }

    @Transactional(readOnly = true)
    public SignatureRequest getRequest(String linkToken) {
        return signatureRequestRepository.findByLinkToken(linkToken)
                .orElseThrow(() -> new ResourceNotFoundException("Signature request not found"));
    }

    @Transactional(readOnly = true)
    public List<SignatureRequest> getRequests(String documentId) {
        return signatureRequestRepository.findByDocumentIdAndCancelledAtIsNullOrderBySigningOrderAsc(documentId);
    }

    /**
     * The lowest-order active request still waiting for its signature.
     */
    @Transactional(readOnly = true)
    public Optional<SignatureRequest> getNextRequest(String documentId) {
        return signatureRequestRepository
                .findFirstByDocumentIdAndCancelledAtIsNullAndSignedFalseOrderBySigningOrderAsc(documentId);
    }

    /**
     * Generates a fresh code for the request, discarding any previous one.
     */
    @Transactional
    public SignatureRequest issueOtp(String linkToken) {
        SignatureRequest request = getRequest(linkToken);
        assertOpen(request);
        SignableDocumentEntity document = lifecycleService.getDocument(request.getDocumentId());
        assertSignable(document);

        String code = otpService.assignNewCode(request);
        SignatureRequest saved = signatureRequestRepository.save(request);
        eventPublisher.publishEvent(new OtpIssuedEvent(document.getId(), request.getId(), request.getSigner(),
                code, request.getOtpGeneratedAt().plus(otpService.getMaxAge())));
        log.info("Issued verification code requestId={} documentId={}", request.getId(), document.getId());
        return saved;
    }

    /**
     * Fails unless the request is the lowest-order unsigned request of its document.
     */
    @Transactional(readOnly = true)
    public void assertTurn(SignatureRequest request) {
        if (request.isSigned()) {
            throw new AlreadySignedException("This signature request has already been signed");
        }
        SignatureRequest next = getNextRequest(request.getDocumentId())
                .orElseThrow(() -> new AlreadySignedException("All signatures have been collected"));
        if (!next.getId().equals(request.getId())) {
            throw new NotYourTurnException(request.getSigningOrder(), next.getSigningOrder());
        }
    }

    @Transactional(readOnly = true)
    public boolean isTurn(SignatureRequest request) {
        if (request.isSigned() || request.isCancelled()) {
            return false;
        }
        return getNextRequest(request.getDocumentId())
                .map(next -> next.getId().equals(request.getId()))
                .orElse(false);
    }

    /**
     * Validates the code, appends the signer's approval signature and records its proof.
     * Any failure rolls the whole step back: the request stays unsigned and no proof exists.
     */
    @Transactional
    public SigningOutcome completeSignature(String linkToken, String otp, HttpProvenance provenance,
            byte[] handwrittenImage) {
        SignatureRequest request = getRequest(linkToken);
        assertOpen(request);
        SignableDocumentEntity document = lifecycleService.getDocument(request.getDocumentId());
        assertSignable(document);
        assertTurn(request);

        OtpCheckResult otpResult = otpService.check(request, otp);
        if (!otpResult.isValid()) {
            log.info("Rejected verification code requestId={} reason={}", request.getId(), otpResult);
            throw new InvalidOtpException(otpResult);
        }
        Instant validatedAt = clock.instant();

        Signer signer = request.getSigner();
        byte[] pdfBefore = document.getLatestPdf();
        SignerCredential credential = ephemeralCertificateService.issue(signer);
        byte[] pdfAfter = pdfSigningEngine.approve(pdfBefore, credential, ApprovalOptions.builder()
                .fieldName(signer.signatureFieldName())
                .anchorMarker(signer.anchorMarker())
                .requirePrePlacedField(requirePrePlacedField)
                .signerName(signer.getName())
                .signerEmail(signer.getEmail())
                .signedAt(validatedAt)
                .reason("Signature of " + document.getDocumentName())
                .handwrittenImage(handwrittenImage)
                .build());

        ProofRecord proof = proofJournalService.record(document, request, pdfBefore, pdfAfter,
                signer.signatureFieldName(), provenance, validatedAt);

        request.setSigned(true);
        request.setSignedAt(validatedAt);
        signatureRequestRepository.saveAndFlush(request);

        document.setLatestPdf(pdfAfter);
        document.setUpdatedAt(validatedAt);
        if (document.getStatus() == DocumentStatus.DRAFT) {
            lifecycleService.markSigning(document);
        }
        boolean complete = lifecycleService.reevaluateCompletion(document);
        if (!complete) {
            getNextRequest(document.getId()).ifPresent(next -> eventPublisher.publishEvent(
                    new NextSignerEvent(document.getId(), document.getDocumentName(), next.getId(),
                            next.getSigningOrder(), next.getSigner(), next.getLinkToken())));
        }

        log.info("Signature completed documentId={} requestId={} order={} status={}", document.getId(),
                request.getId(), request.getSigningOrder(), document.getStatus());
        return SigningOutcome.builder()
                .documentId(document.getId())
                .requestId(request.getId())
                .proofId(proof.getId())
                .fieldName(signer.signatureFieldName())
                .signedAt(validatedAt)
                .documentStatus(document.getStatus())
                .fileName(document.getLatestFileName())
                .build();
    }

    /**
     * Soft-cancels every open request and cancels the document.
     */
    @Transactional
    public SignableDocumentEntity cancelRequests(String documentId) {
        SignableDocumentEntity document = lifecycleService.getDocument(documentId);
        if (document.getStatus() == DocumentStatus.SIGNED) {
            throw new DocumentStateException("A fully signed document cannot be cancelled");
        }
        Instant now = clock.instant();
        List<SignatureRequest> open = new ArrayList<>();
        for (SignatureRequest request : getRequests(documentId)) {
            if (!request.isSigned()) {
                request.setCancelledAt(now);
                open.add(request);
            }
        }
        signatureRequestRepository.saveAll(open);
        log.info("Cancelled {} open signature requests for documentId={}", open.size(), documentId);
        return lifecycleService.cancel(document);
    }

    /**
     * Removes every request so the document can be edited and re-sent. DRAFT only.
     */
    @Transactional
    public void resetForEdit(String documentId) {
        SignableDocumentEntity document = lifecycleService.getDocument(documentId);
        if (document.getStatus() != DocumentStatus.DRAFT) {
            throw new DocumentStateException("Signature requests can only be reset while the document is DRAFT");
        }
        List<SignatureRequest> requests = signatureRequestRepository.findByDocumentId(documentId);
        signatureRequestRepository.deleteAll(requests);
        log.info("Reset {} signature requests for documentId={}", requests.size(), documentId);
    }

    private void publishInvitation(SignableDocumentEntity document, SignatureRequest request) {
        eventPublisher.publishEvent(new SignatureInvitationEvent(document.getId(), document.getDocumentName(),
                request.getId(), request.getSigningOrder(), request.getSigner(), request.getLinkToken()));
    }

    private void assertOpen(SignatureRequest request) {
        if (request.isSigned()) {
            throw new AlreadySignedException("This signature request has already been signed");
        }
        if (request.isCancelled()) {
            throw new DocumentStateException("This signature request has been cancelled");
        }
    }

    private void assertSignable(SignableDocumentEntity document) {
        if (document.getStatus() == DocumentStatus.SIGNED) {
            throw new AlreadySignedException("Document is already fully signed");
        }
        if (document.getStatus() == DocumentStatus.CANCELLED) {
            throw new DocumentStateException("Document " + document.getId() + " has been cancelled");
        }
        if (!document.isCertified() || document.getLatestPdf() == null) {
            throw new DocumentStateException("Document " + document.getId() + " has not been certified");
        }
    }

    private String newLinkToken() {
        byte[] bytes = new byte[LINK_TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
