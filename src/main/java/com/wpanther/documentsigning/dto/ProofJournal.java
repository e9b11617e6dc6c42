package com.wpanther.documentsigning.dto;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exportable audit report of every signature of a document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProofJournal {

    private DocumentInfo document;
    private CertificationInfo certification;
    private List<ProofEntry> signatures;
    private AuditInfo audit;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DocumentInfo {
        private String type;
        private String id;
        private String name;
        private String title;
        private String status;

        @JsonProperty("pdf_hash_final")
        private String pdfHashFinal;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CertificationInfo {
        private String certifier;

        @JsonProperty("field_name")
        private String fieldName;

        @JsonProperty("certified_at")
        private Instant certifiedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuditInfo {
        @JsonProperty("generated_at")
        private Instant generatedAt;

        @JsonProperty("total_signatures")
        private int totalSignatures;
    }
}
