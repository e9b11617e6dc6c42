package com.wpanther.documentsigning.model;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What to stamp and where, for one approval signature.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalOptions {

    private String fieldName;

    /**
     * Text searched in the page content to position the stamp. Ignored when the field already exists.
     */
    private String anchorMarker;

    /**
     * Fail instead of falling back to marker or default placement when the field is absent.
     */
    private boolean requirePrePlacedField;

    private String signerName;
    private String signerEmail;
    private Instant signedAt;
    private String reason;

    /**
     * Optional PNG or JPEG of the signer's drawn signature.
     */
    private byte[] handwrittenImage;
}
