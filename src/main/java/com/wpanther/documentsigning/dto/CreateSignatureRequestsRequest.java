package com.wpanther.documentsigning.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Signers in the order they must sign.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSignatureRequestsRequest {

    @NotEmpty(message = "At least one signer is required")
    @Valid
    private List<SignerRequest> signers;
}
