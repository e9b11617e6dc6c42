package com.wpanther.documentsigning.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One proof record as it appears in the journal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProofEntry {

    private SignerInfo signer;
    private OtpInfo otp;
    private HttpInfo http;
    private PdfInfo pdf;
    private CertificateInfo certificate;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private TsaInfo tsa;

    @JsonProperty("signature_timestamp")
    private Instant signatureTimestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SignerInfo {
        private String role;
        private String name;
        private String email;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OtpInfo {
        private String code;

        @JsonProperty("generated_at")
        private Instant generatedAt;

        @JsonProperty("validated_at")
        private Instant validatedAt;

        private boolean validated;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HttpInfo {
        private String ip;

        @JsonProperty("user_agent")
        private String userAgent;

        private String referer;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PdfInfo {
        @JsonProperty("hash_before")
        private String hashBefore;

        @JsonProperty("hash_after")
        private String hashAfter;

        @JsonProperty("field_name")
        private String fieldName;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CertificateInfo {
        private String pem;
        private String fingerprint;
        private String subject;
        private String issuer;

        @JsonProperty("valid_from")
        private Instant validFrom;

        @JsonProperty("valid_until")
        private Instant validUntil;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TsaInfo {
        private Instant timestamp;
        private String serial;
    }
}
