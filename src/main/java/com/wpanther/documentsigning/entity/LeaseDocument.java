package com.wpanther.documentsigning.entity;

import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.NoArgsConstructor;

@Entity
@DiscriminatorValue("LEASE")
@NoArgsConstructor
public class LeaseDocument extends SignableDocumentEntity {

    @Override
    public String getDocumentName() {
        return "Lease agreement";
    }

    @Override
    public String getFilePrefix() {
        return "lease";
    }
}
