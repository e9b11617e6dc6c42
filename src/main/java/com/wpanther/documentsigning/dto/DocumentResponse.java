package com.wpanther.documentsigning.dto;

import java.time.Instant;
import java.util.List;

import com.wpanther.documentsigning.entity.SignableDocumentEntity;
import com.wpanther.documentsigning.model.DocumentStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {
    private String id;
    private String type;
    private String name;
    private String title;
    private DocumentStatus status;
    private boolean locked;
    private boolean certified;
    private Instant certifiedAt;
    private String fileName;
    private Instant createdAt;
    private List<SignatureRequestResponse> signatureRequests;

    public static DocumentResponse from(SignableDocumentEntity document, List<SignatureRequestResponse> requests) {
        return DocumentResponse.builder()
                .id(document.getId())
                .type(document.getDocumentType())
                .name(document.getDocumentName())
                .title(document.getTitle())
                .status(document.getStatus())
                .locked(document.isLocked())
                .certified(document.isCertified())
                .certifiedAt(document.getCertifiedAt())
                .fileName(document.getLatestFileName())
                .createdAt(document.getCreatedAt())
                .signatureRequests(requests)
                .build();
    }
}
