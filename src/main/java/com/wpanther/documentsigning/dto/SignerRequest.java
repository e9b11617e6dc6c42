package com.wpanther.documentsigning.dto;

import com.wpanther.documentsigning.model.Signer;
import com.wpanther.documentsigning.model.SignerRole;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignerRequest {

    @NotNull(message = "Signer role is required")
    private SignerRole role;

    @NotBlank(message = "Party ID is required")
    private String partyId;

    @NotBlank(message = "Signer name is required")
    private String name;

    @NotBlank(message = "Signer email is required")
    @Email(message = "Signer email is invalid")
    private String email;

    public Signer toSigner() {
        return new Signer(role, partyId, name, email);
    }
}
