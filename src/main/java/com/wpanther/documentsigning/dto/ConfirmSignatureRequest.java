package com.wpanther.documentsigning.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmSignatureRequest {

    @NotBlank(message = "Verification code is required")
    @Pattern(regexp = "\\s*\\d{6}\\s*", message = "Verification code must have 6 digits")
    private String otp;

    // Optional drawn signature as a data URL
    private String signatureImage;
}
