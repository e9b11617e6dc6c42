package com.wpanther.documentsigning.dto;

import java.time.Instant;

import com.wpanther.documentsigning.model.DocumentStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmSignatureResponse {
    private boolean success;
    private String message;
    private String documentId;
    private DocumentStatus documentStatus;
    private String fileName;
    private Instant signedAt;
}
