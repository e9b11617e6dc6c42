package com.wpanther.documentsigning.service;

import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.bouncycastle.cert.jcajce.JcaX509CertificateHolder;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import com.wpanther.documentsigning.exception.SigningException;
import com.wpanther.documentsigning.model.Signer;
import com.wpanther.documentsigning.model.SignerCredential;
import com.wpanther.documentsigning.model.TrustMaterial;
import com.wpanther.documentsigning.support.TestTrust;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for EphemeralCertificateService
 */
class EphemeralCertificateServiceTest {

    private static final Signer TENANT = Signer.tenant("t1", "Alice Martin", "alice.martin@example.com");

    private EphemeralCertificateService serviceWith(TrustMaterial trust, boolean allowFallback) {
        EphemeralCertificateService service = new EphemeralCertificateService(trust, new SecureRandom(),
                Clock.systemUTC());
        ReflectionTestUtils.setField(service, "organization", "Test Org");
        ReflectionTestUtils.setField(service, "organizationalUnit", "Electronic Signature");
        ReflectionTestUtils.setField(service, "country", "FR");
        ReflectionTestUtils.setField(service, "validityDays", 365);
        ReflectionTestUtils.setField(service, "keySize", 2048);
        ReflectionTestUtils.setField(service, "allowSelfSignedFallback", allowFallback);
        return service;
    }

    @Test
    void testIssueCertificateSignedByInternalCa() throws Exception {
        // Arrange
        TrustMaterial trust = TestTrust.get();
        X509Certificate ca = trust.getCertificateAuthority().orElseThrow().getCertificate();

        // Act
        SignerCredential credential = serviceWith(trust, true).issue(TENANT);

        // Assert
        X509Certificate certificate = credential.getCertificate();
        certificate.verify(ca.getPublicKey());
        assertThat(credential.isIssuedByCertificateAuthority()).isTrue();
        assertThat(credential.getChain()).containsExactly(certificate, ca);
        assertThat(certificate.getIssuerX500Principal()).isEqualTo(ca.getSubjectX500Principal());
    }

    @Test
    void testSubjectAndExtensions() throws Exception {
        // Act
        X509Certificate certificate = serviceWith(TestTrust.get(), true).issue(TENANT).getCertificate();

        // Assert
        X500Name subject = new JcaX509CertificateHolder(certificate).getSubject();
        assertThat(rdn(subject, BCStyle.CN)).isEqualTo("Alice Martin");
        assertThat(rdn(subject, BCStyle.O)).isEqualTo("Test Org");
        assertThat(rdn(subject, BCStyle.C)).isEqualTo("FR");
        assertThat(rdn(subject, BCStyle.EmailAddress)).isEqualTo("alice.martin@example.com");

        boolean[] keyUsage = certificate.getKeyUsage();
        assertThat(keyUsage[0]).as("digitalSignature").isTrue();
        assertThat(keyUsage[1]).as("nonRepudiation").isTrue();
        for (int i = 2; i < keyUsage.length; i++) {
            assertThat(keyUsage[i]).isFalse();
        }
        assertThat(certificate.getExtendedKeyUsage()).contains(EphemeralCertificateService.DOCUMENT_SIGNING.getId());
        assertThat(certificate.getBasicConstraints()).isEqualTo(-1);
        assertThat(certificate.getSubjectAlternativeNames())
                .anySatisfy(name -> assertThat(name).isEqualTo(List.of(1, "alice.martin@example.com")));
    }

    @Test
    void testValidityIsAboutOneYear() {
        X509Certificate certificate = serviceWith(TestTrust.get(), true).issue(TENANT).getCertificate();

        Duration validity = Duration.between(certificate.getNotBefore().toInstant(),
                certificate.getNotAfter().toInstant());
        assertThat(validity).isEqualTo(Duration.ofDays(365));
    }

    @Test
    void testEachIssueMintsFreshKey() {
        EphemeralCertificateService service = serviceWith(TestTrust.get(), true);

        SignerCredential first = service.issue(TENANT);
        SignerCredential second = service.issue(TENANT);

        assertThat(first.getCertificate().getPublicKey()).isNotEqualTo(second.getCertificate().getPublicKey());
        assertThat(first.getCertificate().getSerialNumber()).isNotEqualTo(second.getCertificate().getSerialNumber());
    }

    @Test
    void testFallsBackToSelfSignedWithoutCa() throws Exception {
        // Act
        SignerCredential credential = serviceWith(TestTrust.withoutCertificateAuthority(), true).issue(TENANT);

        // Assert
        X509Certificate certificate = credential.getCertificate();
        assertThat(credential.isIssuedByCertificateAuthority()).isFalse();
        assertThat(credential.getChain()).containsExactly(certificate);
        assertThat(certificate.getIssuerX500Principal()).isEqualTo(certificate.getSubjectX500Principal());
        certificate.verify(certificate.getPublicKey());
    }

    @Test
    void testFallbackDisabledFailsWithoutCa() {
        EphemeralCertificateService service = serviceWith(TestTrust.withoutCertificateAuthority(), false);

        assertThatThrownBy(() -> service.issue(TENANT))
                .isInstanceOf(SigningException.class)
                .hasMessageContaining("self-signed fallback is disabled");
    }

    @Test
    void testPrivateKeyUsableOnce() {
        SignerCredential credential = serviceWith(TestTrust.get(), true).issue(TENANT);

        assertThat(credential.consumePrivateKey()).isNotNull();
        assertThat(credential.isConsumed()).isTrue();
        assertThatThrownBy(credential::consumePrivateKey).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testSignerWithoutEmailRejected() {
        Signer noEmail = Signer.tenant("t2", "Bob", null);

        assertThatThrownBy(() -> serviceWith(TestTrust.get(), true).issue(noEmail))
                .isInstanceOf(SigningException.class);
    }

    private static String rdn(X500Name name, ASN1ObjectIdentifier type) {
        return IETFUtils.valueToString(name.getRDNs(type)[0].getFirst().getValue());
    }
}
