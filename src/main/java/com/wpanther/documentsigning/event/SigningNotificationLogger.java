package com.wpanther.documentsigning.event;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import lombok.extern.slf4j.Slf4j;

/**
 * Records the notifications handed over to the delivery layer.
 * Listeners run after commit so a rolled back signature never notifies anyone.
 */
@Component
@Slf4j
public class SigningNotificationLogger {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onInvitation(SignatureInvitationEvent event) {
        log.info("Signature invitation documentId={} order={} signer={}", event.getDocumentId(),
                event.getSigningOrder(), event.getSigner().getEmail());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onOtpIssued(OtpIssuedEvent event) {
        log.info("Verification code issued requestId={} signer={} expiresAt={}", event.getRequestId(),
                event.getSigner().getEmail(), event.getExpiresAt());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNextSigner(NextSignerEvent event) {
        log.info("Next signer documentId={} order={} signer={}", event.getDocumentId(), event.getSigningOrder(),
                event.getSigner().getEmail());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onFullySigned(DocumentFullySignedEvent event) {
        log.info("Document fully signed documentId={} file={} signers={}", event.getDocumentId(),
                event.getFileName(), event.getSigners().size());
    }
}
