package com.wpanther.documentsigning.model;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A private key with its certificate and the chain up to (and including) its issuer.
 */
public final class SigningIdentity {

    private final String name;
    private final PrivateKey privateKey;
    private final X509Certificate certificate;
    private final List<X509Certificate> chain;

    public SigningIdentity(String name, PrivateKey privateKey, List<X509Certificate> chain) {
        if (privateKey == null || chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException("Signing identity '" + name + "' needs a key and at least one certificate");
        }
        this.name = name;
        this.privateKey = privateKey;
        this.certificate = chain.get(0);
        this.chain = Collections.unmodifiableList(new ArrayList<>(chain));
    }

    public String getName() {
        return name;
    }

    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    public X509Certificate getCertificate() {
        return certificate;
    }

    public List<X509Certificate> getChain() {
        return chain;
    }

    public String getSubjectDn() {
        return certificate.getSubjectX500Principal().getName();
    }
}
