package com.wpanther.documentsigning.entity;

import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.NoArgsConstructor;

@Entity
@DiscriminatorValue("LEASE_AMENDMENT")
@NoArgsConstructor
public class LeaseAmendmentDocument extends SignableDocumentEntity {

    @Override
    public String getDocumentName() {
        return "Lease amendment";
    }

    @Override
    public String getFilePrefix() {
        return "lease_amendment";
    }
}
