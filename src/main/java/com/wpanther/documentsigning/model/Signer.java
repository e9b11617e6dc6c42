package com.wpanther.documentsigning.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A party expected to sign a document. The role tags which side the party
 * belongs to; exactly one role is always set.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Signer {

    @Enumerated(EnumType.STRING)
    @Column(name = "signer_role", nullable = false, length = 16)
    private SignerRole role;

    @Column(name = "signer_party_id", nullable = false)
    private String partyId;

    @Column(name = "signer_name", nullable = false)
    private String name;

    @Column(name = "signer_email", nullable = false)
    private String email;

    public static Signer landlord(String partyId, String name, String email) {
        return new Signer(SignerRole.LANDLORD, partyId, name, email);
    }

    public static Signer tenant(String partyId, String name, String email) {
        return new Signer(SignerRole.TENANT, partyId, name, email);
    }

    public static Signer agent(String partyId, String name, String email) {
        return new Signer(SignerRole.AGENT, partyId, name, email);
    }

    /**
     * Name of the PDF signature field reserved for this signer.
     */
    public String signatureFieldName() {
        return "signature_" + role.getCode() + "_" + partyId;
    }

    /**
     * Text marker the document template prints where this signer's stamp goes.
     */
    public String anchorMarker() {
        return "[[" + signatureFieldName() + "]]";
    }
}
