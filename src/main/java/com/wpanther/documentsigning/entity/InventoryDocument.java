package com.wpanther.documentsigning.entity;

import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.NoArgsConstructor;

@Entity
@DiscriminatorValue("INVENTORY")
@NoArgsConstructor
public class InventoryDocument extends SignableDocumentEntity {

    @Override
    public String getDocumentName() {
        return "Inventory of fixtures";
    }

    @Override
    public String getFilePrefix() {
        return "inventory";
    }
}
