package com.wpanther.documentsigning.util;

import java.nio.file.Path;
import java.security.cert.X509Certificate;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.wpanther.documentsigning.exception.TrustMaterialException;
import com.wpanther.documentsigning.model.TrustMaterial;
import com.wpanther.documentsigning.support.KeyStores;
import com.wpanther.documentsigning.support.TestTrust;
import com.wpanther.documentsigning.util.TrustMaterialFactory.KeyStoreLocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrustMaterialFactoryTest {

    private static final char[] PASSPHRASE = "s3cret-pass".toCharArray();

    @TempDir
    Path keystoreDir;

    @Test
    void testGeneratedMaterialChainsToInternalCa() throws Exception {
        // Arrange
        TrustMaterial trust = TestTrust.get();
        X509Certificate ca = trust.getCertificateAuthority().orElseThrow().getCertificate();

        // Act & Assert
        trust.getCertifier().getCertificate().verify(ca.getPublicKey());
        trust.getTimeStampAuthority().getCertificate().verify(ca.getPublicKey());
        assertThat(trust.getTimeStampAuthority().getCertificate().getExtendedKeyUsage())
                .containsExactly("1.3.6.1.5.5.7.3.8");
        assertThat(trust.getTimeStampAuthority().getCertificate().getCriticalExtensionOIDs())
                .contains("2.5.29.37");
    }

    @Test
    void testValidationCertificatesAreDeduplicated() {
        TrustMaterial trust = TestTrust.get();

        // certifier, TSA and the CA they share
        assertThat(trust.getValidationCertificates()).hasSize(3);
    }

    @Test
    void testLoadFromPkcs12() {
        // Arrange
        TrustMaterial trust = TestTrust.get();
        KeyStores.writePkcs12(trust.getCertifier(), "certifier", keystoreDir.resolve("certifier.p12"),
                PASSPHRASE);
        KeyStores.writePkcs12(trust.getCertificateAuthority().orElseThrow(), "ca",
                keystoreDir.resolve("ca.p12"), PASSPHRASE);
        KeyStores.writePkcs12(trust.getTimeStampAuthority(), "tsa", keystoreDir.resolve("tsa.p12"),
                PASSPHRASE);

        // Act
        TrustMaterial loaded = TrustMaterialFactory.load(
                new KeyStoreLocation(keystoreDir.resolve("certifier.p12"), "certifier"),
                new KeyStoreLocation(keystoreDir.resolve("ca.p12"), null),
                new KeyStoreLocation(keystoreDir.resolve("tsa.p12"), ""),
                PASSPHRASE);

        // Assert
        assertThat(loaded.getCertifier().getCertificate()).isEqualTo(trust.getCertifier().getCertificate());
        assertThat(loaded.getCertifier().getChain()).hasSize(2);
        assertThat(loaded.getCertificateAuthority()).isPresent();
        assertThat(loaded.getTimeStampAuthority().getSubjectDn())
                .isEqualTo(trust.getTimeStampAuthority().getSubjectDn());
    }

    @Test
    void testTsaCertificateWithoutTimeStampingUsageFailsFast() {
        // Arrange
        TrustMaterial trust = TestTrust.get();
        KeyStoreLocation certifier = new KeyStoreLocation(
                KeyStores.writePkcs12(trust.getCertifier(), "certifier", keystoreDir.resolve("certifier.p12"),
                        PASSPHRASE), null);

        // Act & Assert
        assertThatThrownBy(() -> TrustMaterialFactory.load(certifier, null, certifier, PASSPHRASE))
                .isInstanceOf(TrustMaterialException.class)
                .hasMessageContaining("cannot sign timestamps")
                .hasMessageContaining("Document Certification");
    }

    @Test
    void testMissingPassphraseFailsFast() {
        KeyStoreLocation location = new KeyStoreLocation(keystoreDir.resolve("certifier.p12"), null);

        assertThatThrownBy(() -> TrustMaterialFactory.load(location, null, location, new char[0]))
                .isInstanceOf(TrustMaterialException.class)
                .hasMessageContaining("passphrase");
    }

    @Test
    void testMissingKeyStoreFailsFast() {
        KeyStoreLocation missing = new KeyStoreLocation(keystoreDir.resolve("absent.p12"), null);

        assertThatThrownBy(() -> TrustMaterialFactory.load(missing, null, missing, PASSPHRASE))
                .isInstanceOf(TrustMaterialException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void testWrongPassphraseFails() {
        // Arrange
        KeyStores.writePkcs12(TestTrust.get().getCertifier(), "certifier",
                keystoreDir.resolve("certifier.p12"), PASSPHRASE);
        KeyStoreLocation location = new KeyStoreLocation(keystoreDir.resolve("certifier.p12"), null);

        // Act & Assert
        assertThatThrownBy(() -> TrustMaterialFactory.loadIdentity("certifier", location, "wrong".toCharArray()))
                .isInstanceOf(TrustMaterialException.class);
    }
}
