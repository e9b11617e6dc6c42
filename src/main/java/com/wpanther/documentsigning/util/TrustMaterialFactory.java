package com.wpanther.documentsigning.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.Enumeration;
import java.util.List;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.tsp.TSPUtil;
import org.bouncycastle.tsp.TSPValidationException;

import com.wpanther.documentsigning.exception.TrustMaterialException;
import com.wpanther.documentsigning.model.SigningIdentity;
import com.wpanther.documentsigning.model.TrustMaterial;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds {@link TrustMaterial} from PKCS#12 key stores, or generates a
 * self-consistent set in memory for development and tests.
 */
@Slf4j
public final class TrustMaterialFactory {

    private static final Duration GENERATED_VALIDITY = Duration.ofDays(3650);

    private TrustMaterialFactory() {
    }

    /**
     * Location and alias of one PKCS#12 identity. A blank alias selects the first key entry.
     */
    public static class KeyStoreLocation {
        private final Path path;
        private final String alias;

        public KeyStoreLocation(Path path, String alias) {
            this.path = path;
            this.alias = alias;
        }

        public Path getPath() {
            return path;
        }

        public String getAlias() {
            return alias;
        }
    }

    public static TrustMaterial load(KeyStoreLocation certifier, KeyStoreLocation certificateAuthority,
            KeyStoreLocation timeStampAuthority, char[] passphrase) {
        if (passphrase == null || passphrase.length == 0) {
            throw new TrustMaterialException("Key store passphrase is not configured");
        }
        SigningIdentity certifierIdentity = loadIdentity("certifier", certifier, passphrase);
        SigningIdentity caIdentity = certificateAuthority != null
                ? loadIdentity("ca", certificateAuthority, passphrase)
                : null;
        SigningIdentity tsaIdentity = loadIdentity("tsa", timeStampAuthority, passphrase);
        requireTimeStampingUsage(tsaIdentity);
        return new TrustMaterial(certifierIdentity, caIdentity, tsaIdentity);
    }

    /**
     * The TSA certificate needs a critical extended key usage of timeStamping only,
     * otherwise every token generation fails.
     */
    static void requireTimeStampingUsage(SigningIdentity tsa) {
        try {
            TSPUtil.validateCertificate(new JcaX509CertificateHolder(tsa.getCertificate()));
        } catch (TSPValidationException e) {
            throw new TrustMaterialException("Certificate " + tsa.getSubjectDn()
                    + " cannot sign timestamps: " + e.getMessage(), e);
        } catch (CertificateEncodingException e) {
            throw new TrustMaterialException("Could not read TSA certificate " + tsa.getSubjectDn(), e);
        }
    }

    public static SigningIdentity loadIdentity(String name, KeyStoreLocation location, char[] passphrase) {
        Path path = location.getPath();
        if (!Files.isRegularFile(path)) {
            throw new TrustMaterialException("Key store for '" + name + "' not found at " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(in, passphrase);
            String alias = resolveAlias(keyStore, location.getAlias(), path);
            PrivateKey privateKey = (PrivateKey) keyStore.getKey(alias, passphrase);
            Certificate[] chain = keyStore.getCertificateChain(alias);
            if (privateKey == null || chain == null || chain.length == 0) {
                throw new TrustMaterialException("Key store " + path + " has no key and certificate under alias " + alias);
            }
            List<X509Certificate> certificates = new ArrayList<>();
            for (Certificate certificate : chain) {
                certificates.add((X509Certificate) certificate);
            }
            SigningIdentity identity = new SigningIdentity(name, privateKey, certificates);
            log.info("Loaded {} identity subject={} validUntil={}", name, identity.getSubjectDn(),
                    identity.getCertificate().getNotAfter().toInstant());
            return identity;
        } catch (IOException | GeneralSecurityException e) {
            throw new TrustMaterialException("Could not load key store for '" + name + "' from " + path
                    + ": " + e.getMessage(), e);
        }
    }

    private static String resolveAlias(KeyStore keyStore, String alias, Path path) throws GeneralSecurityException {
        if (alias != null && !alias.isBlank()) {
            if (!keyStore.isKeyEntry(alias)) {
                throw new TrustMaterialException("Alias '" + alias + "' not found in " + path);
            }
            return alias;
        }
        Enumeration<String> aliases = keyStore.aliases();
        while (aliases.hasMoreElements()) {
            String candidate = aliases.nextElement();
            if (keyStore.isKeyEntry(candidate)) {
                return candidate;
            }
        }
        throw new TrustMaterialException("No private key entry in " + path);
    }

    /**
     * Generates a root CA with a certifier and a TSA issued under it.
     */
    public static TrustMaterial generate(String organization, String country) {
        SecureRandom random = new SecureRandom();
        Instant notBefore = Instant.now().minus(Duration.ofMinutes(5));
        Instant notAfter = notBefore.plus(GENERATED_VALIDITY);
        try {
            JcaX509ExtensionUtils extensionUtils = new JcaX509ExtensionUtils();

            KeyPair caKeys = CertificateUtil.generateRsaKeyPair(2048, random);
            X500Name caName = name(country, organization, organization + " Internal CA");
            X509v3CertificateBuilder caBuilder = new JcaX509v3CertificateBuilder(caName,
                    CertificateUtil.randomSerial(random), Date.from(notBefore), Date.from(notAfter), caName,
                    caKeys.getPublic())
                    .addExtension(Extension.basicConstraints, true, new BasicConstraints(true))
                    .addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign))
                    .addExtension(Extension.subjectKeyIdentifier, false,
                            extensionUtils.createSubjectKeyIdentifier(caKeys.getPublic()));
            X509Certificate caCertificate = CertificateUtil.sign(caBuilder, caKeys.getPrivate());

            KeyPair certifierKeys = CertificateUtil.generateRsaKeyPair(2048, random);
            X509v3CertificateBuilder certifierBuilder = new JcaX509v3CertificateBuilder(caCertificate,
                    CertificateUtil.randomSerial(random), Date.from(notBefore), Date.from(notAfter),
                    name(country, organization, organization + " Document Certification"),
                    certifierKeys.getPublic())
                    .addExtension(Extension.basicConstraints, true, new BasicConstraints(false))
                    .addExtension(Extension.keyUsage, true,
                            new KeyUsage(KeyUsage.digitalSignature | KeyUsage.nonRepudiation))
                    .addExtension(Extension.authorityKeyIdentifier, false,
                            extensionUtils.createAuthorityKeyIdentifier(caCertificate));
            X509Certificate certifierCertificate = CertificateUtil.sign(certifierBuilder, caKeys.getPrivate());

            KeyPair tsaKeys = CertificateUtil.generateRsaKeyPair(2048, random);
            X509v3CertificateBuilder tsaBuilder = new JcaX509v3CertificateBuilder(caCertificate,
                    CertificateUtil.randomSerial(random), Date.from(notBefore), Date.from(notAfter),
                    name(country, organization, organization + " Time-Stamping Authority"),
                    tsaKeys.getPublic())
                    .addExtension(Extension.basicConstraints, true, new BasicConstraints(false))
                    .addExtension(Extension.keyUsage, true,
                            new KeyUsage(KeyUsage.digitalSignature | KeyUsage.nonRepudiation))
                    .addExtension(Extension.extendedKeyUsage, true,
                            new ExtendedKeyUsage(KeyPurposeId.id_kp_timeStamping))
                    .addExtension(Extension.authorityKeyIdentifier, false,
                            extensionUtils.createAuthorityKeyIdentifier(caCertificate));
            X509Certificate tsaCertificate = CertificateUtil.sign(tsaBuilder, caKeys.getPrivate());

            return new TrustMaterial(
                    new SigningIdentity("certifier", certifierKeys.getPrivate(),
                            List.of(certifierCertificate, caCertificate)),
                    new SigningIdentity("ca", caKeys.getPrivate(), List.of(caCertificate)),
                    new SigningIdentity("tsa", tsaKeys.getPrivate(), List.of(tsaCertificate, caCertificate)));
        } catch (GeneralSecurityException | IOException e) {
            throw new TrustMaterialException("Could not generate trust material", e);
        }
    }

    private static X500Name name(String country, String organization, String commonName) {
        return new X500NameBuilder(BCStyle.INSTANCE)
                .addRDN(BCStyle.C, country)
                .addRDN(BCStyle.O, organization)
                .addRDN(BCStyle.CN, commonName)
                .build();
    }
}
