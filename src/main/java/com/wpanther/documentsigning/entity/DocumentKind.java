package com.wpanther.documentsigning.entity;

import java.util.function.Supplier;

/**
 * Document kinds that can go through the signature workflow.
 */
public enum DocumentKind {
    LEASE(LeaseDocument::new),
    INVENTORY(InventoryDocument::new),
    LEASE_AMENDMENT(LeaseAmendmentDocument::new),
    INSURANCE_QUOTATION(InsuranceQuotationDocument::new);

    private final Supplier<SignableDocumentEntity> factory;

    DocumentKind(Supplier<SignableDocumentEntity> factory) {
        this.factory = factory;
    }

    public SignableDocumentEntity newDocument() {
        return factory.get();
    }
}
