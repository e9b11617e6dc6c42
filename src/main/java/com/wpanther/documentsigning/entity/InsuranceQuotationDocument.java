package com.wpanther.documentsigning.entity;

import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.NoArgsConstructor;

@Entity
@DiscriminatorValue("INSURANCE_QUOTATION")
@NoArgsConstructor
public class InsuranceQuotationDocument extends SignableDocumentEntity {

    @Override
    public String getDocumentName() {
        return "Insurance quotation";
    }

    @Override
    public String getFilePrefix() {
        return "insurance_quotation";
    }
}
