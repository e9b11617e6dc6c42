package com.wpanther.documentsigning.dto;

import com.wpanther.documentsigning.model.DocumentStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a signer sees when opening their link.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SigningSessionResponse {
    private String documentId;
    private String documentName;
    private String documentTitle;
    private DocumentStatus documentStatus;
    private int order;
    private String signerName;
    private String signerEmail;
    private boolean signed;
    private boolean alreadySigned;
    private boolean yourTurn;
}
