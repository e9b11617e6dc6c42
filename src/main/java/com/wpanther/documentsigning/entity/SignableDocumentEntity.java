package com.wpanther.documentsigning.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

import com.wpanther.documentsigning.model.DocumentStatus;
import com.wpanther.documentsigning.model.SignableDocument;

/**
 * Persistent state the signing core keeps for a business document:
 * its status and the PDF artifacts. Each document kind is a subclass.
 */
@Entity
@Table(name = "signable_documents")
@Inheritance(strategy = InheritanceType.SINGLE_TABLE)
@DiscriminatorColumn(name = "document_type", length = 32)
@Getter
@Setter
@NoArgsConstructor
public abstract class SignableDocumentEntity implements SignableDocument {

    @Id
    private String id;

    @Column(name = "title", nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DocumentStatus status;

    @Lob
    @Column(name = "original_pdf", updatable = false)
    private byte[] originalPdf;

    @Lob
    @Column(name = "latest_pdf")
    private byte[] latestPdf;

    @Column(name = "certification_field")
    private String certificationField;

    @Column(name = "certified_at")
    private Instant certifiedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    @Override
    public String getDocumentType() {
        DiscriminatorValue discriminator = getClass().getAnnotation(DiscriminatorValue.class);
        return discriminator != null ? discriminator.value() : getClass().getSimpleName();
    }

    public boolean isCertified() {
        return certifiedAt != null;
    }

    /**
     * File name for the latest artifact, e.g. {@code lease_<id>_signed.pdf}.
     */
    public String getLatestFileName() {
        String suffix = status == DocumentStatus.SIGNED ? "signed" : (isCertified() ? "certified" : "draft");
        return getFilePrefix() + "_" + id + "_" + suffix + ".pdf";
    }
}
