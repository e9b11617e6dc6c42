package com.wpanther.documentsigning.model;

/**
 * Capability the signing core needs from a business document.
 * Concrete document kinds (lease, inventory, ...) implement it; the core
 * never depends on the kind itself.
 */
public interface SignableDocument {

    String getId();

    /**
     * Human readable name of the document kind, used in notifications and the proof journal.
     */
    String getDocumentName();

    /**
     * Prefix used when naming produced files, e.g. {@code lease_<id>_signed.pdf}.
     */
    String getFilePrefix();

    /**
     * Stable type code of the document kind.
     */
    String getDocumentType();

    DocumentStatus getStatus();

    void setStatus(DocumentStatus status);

    byte[] getOriginalPdf();

    byte[] getLatestPdf();

    void setLatestPdf(byte[] latestPdf);

    default boolean isLocked() {
        return getStatus() != null && getStatus().isLocked();
    }
}
