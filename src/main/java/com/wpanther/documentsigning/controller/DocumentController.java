package com.wpanther.documentsigning.controller;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.wpanther.documentsigning.dto.CreateSignatureRequestsRequest;
import com.wpanther.documentsigning.dto.DocumentResponse;
import com.wpanther.documentsigning.dto.ProofJournal;
import com.wpanther.documentsigning.dto.SignatureRequestResponse;
import com.wpanther.documentsigning.dto.SignerRequest;
import com.wpanther.documentsigning.entity.DocumentKind;
import com.wpanther.documentsigning.entity.SignableDocumentEntity;
import com.wpanther.documentsigning.service.DocumentLifecycleService;
import com.wpanther.documentsigning.service.ProofJournalService;
import com.wpanther.documentsigning.service.SignatureOrchestrator;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Administration of signable documents: upload, certification, signature
 * requests, cancellation and audit export.
 */
@RestController
@RequestMapping("/api/v1/documents")
@RequiredArgsConstructor
@Slf4j
public class DocumentController {

    private final DocumentLifecycleService lifecycleService;
    private final SignatureOrchestrator signatureOrchestrator;
    private final ProofJournalService proofJournalService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentResponse> createDocument(@RequestParam DocumentKind kind,
            @RequestParam String title, @RequestParam("file") MultipartFile file) throws IOException {
        log.debug("Creating {} document '{}'", kind, title);
        SignableDocumentEntity document = lifecycleService.createDocument(kind, title, file.getBytes());
        return new ResponseEntity<>(toResponse(document), HttpStatus.CREATED);
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentResponse> getDocument(@PathVariable String id) {
        return ResponseEntity.ok(toResponse(lifecycleService.getDocument(id)));
    }

    @PostMapping("/{id}/certify")
    public ResponseEntity<DocumentResponse> certify(@PathVariable String id) {
        return ResponseEntity.ok(toResponse(signatureOrchestrator.certifyDocument(id)));
    }

    @PostMapping("/{id}/signature-requests")
    public ResponseEntity<List<SignatureRequestResponse>> createSignatureRequests(@PathVariable String id,
            @Valid @RequestBody CreateSignatureRequestsRequest request) {
        List<SignatureRequestResponse> created = signatureOrchestrator.createRequests(id,
                request.getSigners().stream().map(SignerRequest::toSigner).collect(Collectors.toList()))
                .stream()
                .map(SignatureRequestResponse::from)
                .collect(Collectors.toList());
        return new ResponseEntity<>(created, HttpStatus.CREATED);
    }

    /**
     * Deletes the signature requests of a DRAFT document so it can be edited.
     */
    @DeleteMapping("/{id}/signature-requests")
    public ResponseEntity<Void> resetSignatureRequests(@PathVariable String id) {
        signatureOrchestrator.resetForEdit(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<DocumentResponse> startSigning(@PathVariable String id) {
        return ResponseEntity.ok(toResponse(signatureOrchestrator.startSigning(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<DocumentResponse> cancel(@PathVariable String id) {
        return ResponseEntity.ok(toResponse(signatureOrchestrator.cancelRequests(id)));
    }

    /**
     * Latest artifact: the signed PDF once signatures exist, else the certified or original one.
     */
    @GetMapping(value = "/{id}/pdf", produces = MediaType.APPLICATION_PDF_VALUE)
    public ResponseEntity<byte[]> downloadPdf(@PathVariable String id) {
        SignableDocumentEntity document = lifecycleService.getDocument(id);
        byte[] pdf = document.getLatestPdf() != null ? document.getLatestPdf() : document.getOriginalPdf();
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_PDF)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(document.getLatestFileName()).build().toString())
                .body(pdf);
    }

    @GetMapping("/{id}/journal")
    public ResponseEntity<ProofJournal> exportJournal(@PathVariable String id) {
        return ResponseEntity.ok(proofJournalService.assembleJournal(lifecycleService.getDocument(id)));
    }

    private DocumentResponse toResponse(SignableDocumentEntity document) {
        List<SignatureRequestResponse> requests = signatureOrchestrator.getRequests(document.getId()).stream()
                .map(SignatureRequestResponse::from)
                .collect(Collectors.toList());
        return DocumentResponse.from(document, requests);
    }
}
