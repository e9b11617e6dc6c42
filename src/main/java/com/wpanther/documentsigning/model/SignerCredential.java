package com.wpanther.documentsigning.model;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Key pair and certificate minted for a single signature event.
 * The private key can be taken exactly once.
 */
public final class SignerCredential {

    private final PrivateKey privateKey;
    private final X509Certificate certificate;
    private final List<X509Certificate> chain;
    private final boolean issuedByCertificateAuthority;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    public SignerCredential(PrivateKey privateKey, List<X509Certificate> chain, boolean issuedByCertificateAuthority) {
        this.privateKey = privateKey;
        this.certificate = chain.get(0);
        this.chain = Collections.unmodifiableList(chain);
        this.issuedByCertificateAuthority = issuedByCertificateAuthority;
    }

    public PrivateKey consumePrivateKey() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Signer credential for "
                    + certificate.getSubjectX500Principal() + " has already been used");
        }
        return privateKey;
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    public X509Certificate getCertificate() {
        return certificate;
    }

    public List<X509Certificate> getChain() {
        return chain;
    }

    public boolean isIssuedByCertificateAuthority() {
        return issuedByCertificateAuthority;
    }
}
