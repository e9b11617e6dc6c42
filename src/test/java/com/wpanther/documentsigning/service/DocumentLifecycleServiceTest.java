package com.wpanther.documentsigning.service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import com.wpanther.documentsigning.entity.DocumentKind;
import com.wpanther.documentsigning.entity.SignableDocumentEntity;
import com.wpanther.documentsigning.entity.SignatureRequest;
import com.wpanther.documentsigning.event.DocumentFullySignedEvent;
import com.wpanther.documentsigning.exception.DocumentStateException;
import com.wpanther.documentsigning.exception.ResourceNotFoundException;
import com.wpanther.documentsigning.model.DocumentStatus;
import com.wpanther.documentsigning.model.Signer;
import com.wpanther.documentsigning.repository.ProofRecordRepository;
import com.wpanther.documentsigning.repository.SignableDocumentRepository;
import com.wpanther.documentsigning.repository.SignatureRequestRepository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DocumentLifecycleService
 */
@ExtendWith(MockitoExtension.class)
class DocumentLifecycleServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-02T10:00:00Z");

    @Mock
    private SignableDocumentRepository documentRepository;

    @Mock
    private SignatureRequestRepository signatureRequestRepository;

    @Mock
    private ProofRecordRepository proofRecordRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private DocumentLifecycleService lifecycleService;

    @BeforeEach
    void setUp() {
        lifecycleService = new DocumentLifecycleService(documentRepository, signatureRequestRepository,
                proofRecordRepository, eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private SignableDocumentEntity document(DocumentStatus status) {
        SignableDocumentEntity document = DocumentKind.LEASE.newDocument();
        document.setId("doc-1");
        document.setTitle("12 rue des Lilas");
        document.setStatus(status);
        document.setOriginalPdf(new byte[] {1, 2, 3});
        document.setCreatedAt(NOW);
        return document;
    }

    private SignatureRequest request(int order, Signer signer) {
        return SignatureRequest.builder()
                .id("req-" + order)
                .documentId("doc-1")
                .signingOrder(order)
                .signer(signer)
                .build();
    }

    @Test
    void testCreateDocumentStartsInDraft() {
        // Arrange
        byte[] pdf = {37, 80, 68, 70};
        when(documentRepository.save(any(SignableDocumentEntity.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        SignableDocumentEntity result = lifecycleService.createDocument(DocumentKind.INVENTORY, "Check-in", pdf);

        // Assert
        assertThat(result.getId()).isNotBlank();
        assertThat(result.getStatus()).isEqualTo(DocumentStatus.DRAFT);
        assertThat(result.getDocumentType()).isEqualTo("INVENTORY");
        assertThat(result.getOriginalPdf()).isEqualTo(pdf).isNotSameAs(pdf);
        assertThat(result.getCreatedAt()).isEqualTo(NOW);
        assertThat(result.getUpdatedAt()).isEqualTo(NOW);
        assertThat(result.isCertified()).isFalse();
    }

    @Test
    void testCreateDocumentRequiresPdf() {
        assertThatThrownBy(() -> lifecycleService.createDocument(DocumentKind.LEASE, "Empty", new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(documentRepository);
    }

    @Test
    void testGetDocumentNotFound() {
        when(documentRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> lifecycleService.getDocument("missing"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void testMarkSigningFromDraft() {
        // Arrange
        SignableDocumentEntity document = document(DocumentStatus.DRAFT);
        when(documentRepository.save(document)).thenReturn(document);

        // Act
        lifecycleService.markSigning(document);

        // Assert
        assertThat(document.getStatus()).isEqualTo(DocumentStatus.SIGNING);
        assertThat(lifecycleService.isLocked(document)).isTrue();
        assertThatThrownBy(() -> lifecycleService.assertEditable(document))
                .isInstanceOf(DocumentStateException.class);
    }

    @Test
    void testTransitionsStampUpdatedAtFromClock() {
        // Arrange
        SignableDocumentEntity document = document(DocumentStatus.DRAFT);
        document.setUpdatedAt(NOW.minusSeconds(3600));
        when(documentRepository.save(document)).thenReturn(document);

        // Act
        lifecycleService.markSigning(document);

        // Assert
        assertThat(document.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void testMarkSigningTwiceIsNoOp() {
        SignableDocumentEntity document = document(DocumentStatus.SIGNING);

        lifecycleService.markSigning(document);

        assertThat(document.getStatus()).isEqualTo(DocumentStatus.SIGNING);
        verifyNoInteractions(documentRepository);
    }

    @Test
    void testSignedDocumentCannotGoBack() {
        SignableDocumentEntity document = document(DocumentStatus.SIGNED);

        assertThatThrownBy(() -> lifecycleService.markSigning(document))
                .isInstanceOf(DocumentStateException.class)
                .hasMessageContaining("SIGNED");
        assertThatThrownBy(() -> lifecycleService.cancel(document))
                .isInstanceOf(DocumentStateException.class);
        assertThat(document.getStatus()).isEqualTo(DocumentStatus.SIGNED);
    }

    @Test
    void testCancelIsIdempotent() {
        // Arrange
        SignableDocumentEntity document = document(DocumentStatus.SIGNING);
        when(documentRepository.save(document)).thenReturn(document);

        // Act
        lifecycleService.cancel(document);
        lifecycleService.cancel(document);

        // Assert
        assertThat(document.getStatus()).isEqualTo(DocumentStatus.CANCELLED);
        verify(documentRepository, times(1)).save(document);
    }

    @Test
    void testRecordCertificationOnlyOnce() {
        // Arrange
        SignableDocumentEntity document = document(DocumentStatus.DRAFT);
        when(documentRepository.save(document)).thenReturn(document);

        // Act
        lifecycleService.recordCertification(document, new byte[] {9}, "Certification_20240502_100000");

        // Assert
        assertThat(document.isCertified()).isTrue();
        assertThat(document.getCertifiedAt()).isEqualTo(NOW);
        assertThat(document.getLatestPdf()).containsExactly(9);
        assertThatThrownBy(() -> lifecycleService.recordCertification(document, new byte[] {8}, "Certification_x"))
                .isInstanceOf(DocumentStateException.class);
    }

    @Test
    void testCompletionWaitsForEverySignature() {
        // Arrange
        SignableDocumentEntity document = document(DocumentStatus.SIGNING);
        when(signatureRequestRepository.countByDocumentIdAndCancelledAtIsNull("doc-1")).thenReturn(2L);
        when(proofRecordRepository.countByDocumentId("doc-1")).thenReturn(1L);

        // Act
        boolean signed = lifecycleService.reevaluateCompletion(document);

        // Assert
        assertThat(signed).isFalse();
        assertThat(document.getStatus()).isEqualTo(DocumentStatus.SIGNING);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void testCompletionPublishesOnceAndIsIdempotent() {
        // Arrange
        SignableDocumentEntity document = document(DocumentStatus.SIGNING);
        Signer landlord = Signer.landlord("l1", "Jean Dupont", "jean.dupont@example.com");
        Signer tenant = Signer.tenant("t1", "Alice Martin", "alice.martin@example.com");
        when(signatureRequestRepository.countByDocumentIdAndCancelledAtIsNull("doc-1")).thenReturn(2L);
        when(proofRecordRepository.countByDocumentId("doc-1")).thenReturn(2L);
        when(signatureRequestRepository.findByDocumentIdAndCancelledAtIsNullOrderBySigningOrderAsc("doc-1"))
                .thenReturn(List.of(request(1, landlord), request(2, tenant)));
        when(documentRepository.save(document)).thenReturn(document);

        // Act
        boolean first = lifecycleService.reevaluateCompletion(document);
        boolean second = lifecycleService.reevaluateCompletion(document);

        // Assert
        assertThat(first).isTrue();
        assertThat(second).isTrue();
        assertThat(document.getStatus()).isEqualTo(DocumentStatus.SIGNED);

        ArgumentCaptor<DocumentFullySignedEvent> captor = ArgumentCaptor.forClass(DocumentFullySignedEvent.class);
        verify(eventPublisher, times(1)).publishEvent(captor.capture());
        DocumentFullySignedEvent event = captor.getValue();
        assertThat(event.getDocumentId()).isEqualTo("doc-1");
        assertThat(event.getSigners()).containsExactly(landlord, tenant);
        assertThat(event.getSignedAt()).isEqualTo(NOW);
        verify(documentRepository, times(1)).save(document);
    }

    @Test
    void testCompletionWithoutRequestsDoesNothing() {
        SignableDocumentEntity document = document(DocumentStatus.SIGNING);
        when(signatureRequestRepository.countByDocumentIdAndCancelledAtIsNull("doc-1")).thenReturn(0L);
        when(proofRecordRepository.countByDocumentId("doc-1")).thenReturn(0L);

        assertThat(lifecycleService.reevaluateCompletion(document)).isFalse();
        assertThat(document.getStatus()).isEqualTo(DocumentStatus.SIGNING);
    }

    @Test
    void testCompletionIgnoredForDraft() {
        SignableDocumentEntity document = document(DocumentStatus.DRAFT);

        assertThat(lifecycleService.reevaluateCompletion(document)).isFalse();
        verifyNoInteractions(proofRecordRepository, eventPublisher);
    }
}
