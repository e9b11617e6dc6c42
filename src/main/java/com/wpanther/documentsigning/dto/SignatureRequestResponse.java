package com.wpanther.documentsigning.dto;

import java.time.Instant;

import com.wpanther.documentsigning.entity.SignatureRequest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignatureRequestResponse {
    private String id;
    private int order;
    private String role;
    private String partyId;
    private String name;
    private String email;
    private String linkToken;
    private boolean signed;
    private Instant signedAt;

    public static SignatureRequestResponse from(SignatureRequest request) {
        return SignatureRequestResponse.builder()
                .id(request.getId())
                .order(request.getSigningOrder())
                .role(request.getSigner().getRole().getCode())
                .partyId(request.getSigner().getPartyId())
                .name(request.getSigner().getName())
                .email(request.getSigner().getEmail())
                .linkToken(request.getLinkToken())
                .signed(request.isSigned())
                .signedAt(request.getSignedAt())
                .build();
    }
}
