package com.wpanther.documentsigning.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.documentsigning.dto.ConfirmSignatureRequest;
import com.wpanther.documentsigning.dto.ConfirmSignatureResponse;
import com.wpanther.documentsigning.dto.OtpResponse;
import com.wpanther.documentsigning.dto.SigningSessionResponse;
import com.wpanther.documentsigning.entity.SignableDocumentEntity;
import com.wpanther.documentsigning.entity.SignatureRequest;
import com.wpanther.documentsigning.model.DocumentStatus;
import com.wpanther.documentsigning.model.SigningOutcome;
import com.wpanther.documentsigning.service.DocumentLifecycleService;
import com.wpanther.documentsigning.service.OtpService;
import com.wpanther.documentsigning.service.SignatureOrchestrator;
import com.wpanther.documentsigning.util.HttpProvenanceResolver;
import com.wpanther.documentsigning.util.SignatureImageDecoder;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Signer-facing endpoints. The link token in the path is the signer's credential.
 */
@RestController
@RequestMapping("/api/v1/signing/{token}")
@RequiredArgsConstructor
@Slf4j
public class SigningController {

    private final SignatureOrchestrator signatureOrchestrator;
    private final DocumentLifecycleService lifecycleService;
    private final OtpService otpService;

    @GetMapping
    public ResponseEntity<SigningSessionResponse> getSession(@PathVariable String token) {
        SignatureRequest request = signatureOrchestrator.getRequest(token);
        SignableDocumentEntity document = lifecycleService.getDocument(request.getDocumentId());

        SigningSessionResponse response = SigningSessionResponse.builder()
                .documentId(document.getId())
                .documentName(document.getDocumentName())
                .documentTitle(document.getTitle())
                .documentStatus(document.getStatus())
                .order(request.getSigningOrder())
                .signerName(request.getSigner().getName())
                .signerEmail(request.getSigner().getEmail())
                .signed(request.isSigned())
                .alreadySigned(request.isSigned() || document.getStatus() == DocumentStatus.SIGNED)
                .yourTurn(signatureOrchestrator.isTurn(request))
                .build();
        return ResponseEntity.ok(response);
    }

    /**
     * Issues a new verification code; any previous code stops working.
     */
    @PostMapping("/otp")
    public ResponseEntity<OtpResponse> sendOtp(@PathVariable String token) {
        SignatureRequest request = signatureOrchestrator.issueOtp(token);
        return ResponseEntity.ok(OtpResponse.builder()
                .otpSent(true)
                .expiresAt(request.getOtpGeneratedAt().plus(otpService.getMaxAge()))
                .build());
    }

    @PostMapping("/confirm")
    public ResponseEntity<ConfirmSignatureResponse> confirm(@PathVariable String token,
            @Valid @RequestBody ConfirmSignatureRequest body, HttpServletRequest httpRequest) {
        byte[] image = SignatureImageDecoder.decode(body.getSignatureImage());
        SigningOutcome outcome = signatureOrchestrator.completeSignature(token, body.getOtp().trim(),
                HttpProvenanceResolver.resolve(httpRequest), image);

        return ResponseEntity.ok(ConfirmSignatureResponse.builder()
                .success(true)
                .message(outcome.getDocumentStatus() == DocumentStatus.SIGNED
                        ? "Document signed by all parties"
                        : "Document signed successfully")
                .documentId(outcome.getDocumentId())
                .documentStatus(outcome.getDocumentStatus())
                .fileName(outcome.getFileName())
                .signedAt(outcome.getSignedAt())
                .build());
    }
}
