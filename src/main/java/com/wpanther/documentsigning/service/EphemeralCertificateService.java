package com.wpanther.documentsigning.service;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.wpanther.documentsigning.exception.SigningException;
import com.wpanther.documentsigning.model.Signer;
import com.wpanther.documentsigning.model.SignerCredential;
import com.wpanther.documentsigning.model.SigningIdentity;
import com.wpanther.documentsigning.model.TrustMaterial;
import com.wpanther.documentsigning.util.CertificateUtil;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Mints a short-lived certificate for each signature event, issued by the internal CA.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EphemeralCertificateService {

    /** id-kp-documentSigning, RFC 9336. */
    public static final ASN1ObjectIdentifier DOCUMENT_SIGNING = new ASN1ObjectIdentifier("1.3.6.1.5.5.7.3.36");

    private final TrustMaterial trustMaterial;
    private final SecureRandom secureRandom;
    private final Clock clock;

    @Value("${app.signing.organization:Document Signing Service}")
    private String organization;

    @Value("${app.signing.organizational-unit:Electronic Signature}")
    private String organizationalUnit;

    @Value("${app.signing.country:FR}")
    private String country;

    @Value("${app.signing.certificate-validity-days:365}")
    private int validityDays;

    @Value("${app.signing.key-size:2048}")
    private int keySize;

    @Value("${app.signing.allow-self-signed-fallback:true}")
    private boolean allowSelfSignedFallback;

    public SignerCredential issue(Signer signer) {
        if (signer == null || isBlank(signer.getName()) || isBlank(signer.getEmail())) {
            throw new SigningException("Signer name and email are required to issue a certificate");
        }

        KeyPair keyPair = CertificateUtil.generateRsaKeyPair(keySize, secureRandom);
        X500Name subject = subjectFor(signer);
        Instant notBefore = clock.instant().minus(Duration.ofMinutes(1));
        Instant notAfter = notBefore.plus(Duration.ofDays(validityDays));

        Optional<SigningIdentity> ca = usableCertificateAuthority(notBefore);
        if (ca.isPresent()) {
            try {
                X509Certificate certificate = build(subject, keyPair, ca.get(), notBefore, notAfter, signer.getEmail());
                List<X509Certificate> chain = new ArrayList<>();
                chain.add(certificate);
                chain.addAll(ca.get().getChain());
                log.info("Issued signer certificate subject={} serial={}", certificate.getSubjectX500Principal(),
                        certificate.getSerialNumber().toString(16));
                return new SignerCredential(keyPair.getPrivate(), chain, true);
            } catch (GeneralSecurityException | IOException e) {
                if (!allowSelfSignedFallback) {
                    throw new SigningException("Internal CA could not issue signer certificate: " + e.getMessage(), e);
                }
                log.warn("Internal CA failed to issue certificate for {}, falling back to self-signed: {}",
                        signer.getEmail(), e.getMessage());
            }
        } else if (!allowSelfSignedFallback) {
            throw new SigningException("Internal CA is unavailable and self-signed fallback is disabled");
        } else {
            log.warn("Internal CA unavailable, issuing SELF-SIGNED certificate for {}", signer.getEmail());
        }

        try {
            X509Certificate certificate = build(subject, keyPair, null, notBefore, notAfter, signer.getEmail());
            return new SignerCredential(keyPair.getPrivate(), List.of(certificate), false);
        } catch (GeneralSecurityException | IOException e) {
            throw new SigningException("Failed to issue signer certificate: " + e.getMessage(), e);
        }
    }

    private Optional<SigningIdentity> usableCertificateAuthority(Instant at) {
        Optional<SigningIdentity> ca = trustMaterial.getCertificateAuthority();
        if (ca.isPresent()) {
            X509Certificate caCertificate = ca.get().getCertificate();
            if (caCertificate.getNotAfter().toInstant().isBefore(at)
                    || caCertificate.getNotBefore().toInstant().isAfter(at)) {
                log.warn("Internal CA certificate {} is outside its validity period",
                        caCertificate.getSubjectX500Principal());
                return Optional.empty();
            }
        }
        return ca;
    }

    X500Name subjectFor(Signer signer) {
        return new X500NameBuilder(BCStyle.INSTANCE)
                .addRDN(BCStyle.C, country)
                .addRDN(BCStyle.O, organization)
                .addRDN(BCStyle.OU, organizationalUnit)
                .addRDN(BCStyle.CN, signer.getName())
                .addRDN(BCStyle.EmailAddress, signer.getEmail())
                .build();
    }

    private X509Certificate build(X500Name subject, KeyPair keyPair, SigningIdentity issuer,
            Instant notBefore, Instant notAfter, String email) throws GeneralSecurityException, IOException {
        JcaX509ExtensionUtils extensionUtils = new JcaX509ExtensionUtils();
        X509v3CertificateBuilder builder;
        if (issuer != null) {
            builder = new JcaX509v3CertificateBuilder(issuer.getCertificate(),
                    CertificateUtil.randomSerial(secureRandom), Date.from(notBefore), Date.from(notAfter),
                    subject, keyPair.getPublic());
            builder.addExtension(Extension.authorityKeyIdentifier, false,
                    extensionUtils.createAuthorityKeyIdentifier(issuer.getCertificate()));
        } else {
            builder = new JcaX509v3CertificateBuilder(subject, CertificateUtil.randomSerial(secureRandom),
                    Date.from(notBefore), Date.from(notAfter), subject, keyPair.getPublic());
        }

        builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false))
                .addExtension(Extension.keyUsage, true,
                        new KeyUsage(KeyUsage.digitalSignature | KeyUsage.nonRepudiation))
                .addExtension(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(new KeyPurposeId[] {
                        KeyPurposeId.getInstance(DOCUMENT_SIGNING), KeyPurposeId.id_kp_emailProtection }))
                .addExtension(Extension.subjectAlternativeName, false,
                        new GeneralNames(new GeneralName(GeneralName.rfc822Name, email)))
                .addExtension(Extension.subjectKeyIdentifier, false,
                        extensionUtils.createSubjectKeyIdentifier(keyPair.getPublic()));

        return CertificateUtil.sign(builder, issuer != null ? issuer.getPrivateKey() : keyPair.getPrivate());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
