package com.wpanther.documentsigning.service;

import java.io.ByteArrayOutputStream;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Calendar;
import java.util.List;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.digitalsignature.PDSignature;
import org.apache.pdfbox.pdmodel.interactive.form.PDSignatureField;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cms.CMSProcessableByteArray;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.SignerInformation;
import org.bouncycastle.cms.jcajce.JcaSimpleSignerInfoVerifierBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import com.wpanther.documentsigning.exception.DocumentAlreadyCertifiedException;
import com.wpanther.documentsigning.exception.SignaturePlacementException;
import com.wpanther.documentsigning.exception.SigningException;
import com.wpanther.documentsigning.model.ApprovalOptions;
import com.wpanther.documentsigning.model.Signer;
import com.wpanther.documentsigning.model.SignerCredential;
import com.wpanther.documentsigning.model.TrustMaterial;
import com.wpanther.documentsigning.support.InMemoryTsa;
import com.wpanther.documentsigning.support.PdfInspection;
import com.wpanther.documentsigning.support.TestPdfs;
import com.wpanther.documentsigning.support.TestTrust;
import com.wpanther.documentsigning.util.CmsSignatureBuilder;
import com.wpanther.documentsigning.util.DocMdpUtil;
import com.wpanther.documentsigning.util.SignatureEvidence;
import com.wpanther.documentsigning.util.SignatureInspector;

import eu.europa.esig.dss.spi.x509.tsp.TSPSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PdfSigningEngine
 */
class PdfSigningEngineTest {

    private static final Signer LANDLORD = Signer.landlord("l1", "Jean Dupont", "jean.dupont@example.com");
    private static final Signer TENANT = Signer.tenant("t1", "Alice Martin", "alice.martin@example.com");

    private final TrustMaterial trust = TestTrust.get();
    private PdfSigningEngine engine;
    private EphemeralCertificateService issuer;

    @BeforeEach
    void setUp() {
        TSPSource tspSource = new InternalTspSource(InMemoryTsa.create(trust, 10));
        engine = new PdfSigningEngine(trust, tspSource, tspSource,
                Clock.fixed(Instant.parse("2024-05-02T09:30:00Z"), ZoneOffset.UTC));
        ReflectionTestUtils.setField(engine, "defaultRect", "425,20,575,150");
        ReflectionTestUtils.setField(engine, "stampWidth", 170f);
        ReflectionTestUtils.setField(engine, "stampHeight", 80f);
        ReflectionTestUtils.setField(engine, "timeZone", "Europe/Paris");
        ReflectionTestUtils.setField(engine, "caption", "Signature conforme eIDAS");
        ReflectionTestUtils.setField(engine, "location", "");

        issuer = new EphemeralCertificateService(trust, new SecureRandom(), Clock.systemUTC());
        ReflectionTestUtils.setField(issuer, "organization", "Test Org");
        ReflectionTestUtils.setField(issuer, "organizationalUnit", "Electronic Signature");
        ReflectionTestUtils.setField(issuer, "country", "FR");
        ReflectionTestUtils.setField(issuer, "validityDays", 365);
        ReflectionTestUtils.setField(issuer, "keySize", 2048);
        ReflectionTestUtils.setField(issuer, "allowSelfSignedFallback", true);
    }

    private byte[] certify(byte[] pdf) {
        return engine.certify(pdf, engine.newCertificationFieldName());
    }

    private ApprovalOptions optionsFor(Signer signer) {
        return ApprovalOptions.builder()
                .fieldName(signer.signatureFieldName())
                .anchorMarker(signer.anchorMarker())
                .signerName(signer.getName())
                .signerEmail(signer.getEmail())
                .reason("Signature of Lease agreement")
                .build();
    }

    @Test
    void testCertifyAddsFormFillPermissionAndTimestamp() throws Exception {
        // Arrange
        byte[] original = TestPdfs.leaseWithMarkers();

        // Act
        byte[] certified = certify(original);

        // Assert
        assertThat(PdfInspection.isCertified(certified)).isTrue();
        assertThat(PdfInspection.docMdpPermission(certified)).isEqualTo(DocMdpUtil.FORM_FILL_AND_SIGN);
        assertThat(PdfInspection.signedFieldNames(certified)).containsExactly("Certification_20240502_093000");

        SignatureEvidence evidence = SignatureInspector.inspect(certified, "Certification_20240502_093000");
        assertThat(evidence.isCertification()).isTrue();
        assertThat(evidence.getSignerCertificate()).isEqualTo(trust.getCertifier().getCertificate());
        assertThat(evidence.hasTimestamp()).isTrue();
        assertThat(evidence.getTimestampSerial()).isNotNull();

        try (PDDocument document = Loader.loadPDF(certified)) {
            assertThat(PdfInspection.dssCertificateCount(document)).isEqualTo(3);
        }
    }

    @Test
    void testCertifyIsIncremental() {
        byte[] original = TestPdfs.leaseWithMarkers();

        byte[] certified = certify(original);

        assertThat(certified.length).isGreaterThan(original.length);
        assertThat(Arrays.copyOf(certified, original.length)).isEqualTo(original);
    }

    @Test
    void testCertifyTwiceRejected() {
        byte[] certified = certify(TestPdfs.leaseWithMarkers());

        assertThatThrownBy(() -> engine.certify(certified, "Certification_again"))
                .isInstanceOf(DocumentAlreadyCertifiedException.class);
    }

    @Test
    void testUncertifiedDocumentReportsNoPermission() {
        byte[] original = TestPdfs.lease("Plain document");

        assertThat(PdfInspection.isCertified(original)).isFalse();
        assertThat(PdfInspection.docMdpPermission(original)).isZero();
    }

    @Test
    void testApprovePlacesStampAtMarker() throws Exception {
        // Arrange
        byte[] certified = certify(TestPdfs.leaseWithMarkers());
        SignerCredential credential = issuer.issue(TENANT);

        // Act
        byte[] signed = engine.approve(certified, credential, optionsFor(TENANT));

        // Assert
        assertThat(Arrays.copyOf(signed, certified.length)).isEqualTo(certified);
        assertThat(credential.isConsumed()).isTrue();
        try (PDDocument document = Loader.loadPDF(signed)) {
            PDSignatureField field = (PDSignatureField) document.getDocumentCatalog().getAcroForm()
                    .getField("signature_tenant_t1");
            assertThat(field).isNotNull();
            PDAnnotationWidget widget = field.getWidgets().get(0);
            PDRectangle rect = widget.getRectangle();
            assertThat(rect.getWidth()).isEqualTo(170f);
            assertThat(rect.getHeight()).isEqualTo(80f);
            assertThat(widget.getAppearance()).isNotNull();
            assertThat(document.getPages().indexOf(widget.getPage())).isEqualTo(1);
        }

        SignatureEvidence evidence = SignatureInspector.inspect(signed, "signature_tenant_t1");
        assertThat(evidence.isCertification()).isFalse();
        assertThat(evidence.getSignerCertificate()).isEqualTo(credential.getCertificate());
        assertThat(evidence.hasTimestamp()).isTrue();
    }

    @Test
    void testApprovalSignatureCoversSignedBytes() throws Exception {
        // Arrange
        byte[] certified = certify(TestPdfs.leaseWithMarkers());
        SignerCredential credential = issuer.issue(LANDLORD);

        // Act
        byte[] signed = engine.approve(certified, credential, optionsFor(LANDLORD));

        // Assert
        try (PDDocument document = Loader.loadPDF(signed)) {
            assertThat(document.getSignatureDictionaries()).hasSize(2);
            for (PDSignature signature : document.getSignatureDictionaries()) {
                byte[] signedContent = signature.getSignedContent(signed);
                CMSSignedData cms = new CMSSignedData(new CMSProcessableByteArray(signedContent),
                        signature.getContents(signed));
                SignerInformation signer = cms.getSignerInfos().getSigners().iterator().next();
                X509CertificateHolder certificate = cms.getCertificates().getMatches(null).stream()
                        .filter(holder -> signer.getSID().match(holder))
                        .findFirst()
                        .orElseThrow();
                assertThat(signer.verify(new JcaSimpleSignerInfoVerifierBuilder().build(certificate))).isTrue();
            }
        }
    }

    @Test
    void testSecondApprovalKeepsFirstSignatureIntact() {
        // Arrange
        byte[] certified = certify(TestPdfs.leaseWithMarkers());
        byte[] afterLandlord = engine.approve(certified, issuer.issue(LANDLORD), optionsFor(LANDLORD));

        // Act
        byte[] afterTenant = engine.approve(afterLandlord, issuer.issue(TENANT), optionsFor(TENANT));

        // Assert
        assertThat(Arrays.copyOf(afterTenant, afterLandlord.length)).isEqualTo(afterLandlord);
        assertThat(PdfInspection.signedFieldNames(afterTenant))
                .containsExactlyInAnyOrder("Certification_20240502_093000", "signature_landlord_l1",
                        "signature_tenant_t1");
    }

    @Test
    void testApproveFallsBackToDefaultRectangle() throws Exception {
        // Arrange
        byte[] certified = certify(TestPdfs.pages(List.of(List.of("Page one"), List.of("Page two"))));

        // Act
        byte[] signed = engine.approve(certified, issuer.issue(TENANT), optionsFor(TENANT));

        // Assert
        try (PDDocument document = Loader.loadPDF(signed)) {
            PDSignatureField field = (PDSignatureField) document.getDocumentCatalog().getAcroForm()
                    .getField("signature_tenant_t1");
            PDRectangle rect = field.getWidgets().get(0).getRectangle();
            assertThat(rect.getLowerLeftX()).isEqualTo(425f);
            assertThat(rect.getLowerLeftY()).isEqualTo(20f);
            assertThat(rect.getUpperRightX()).isEqualTo(575f);
            assertThat(rect.getUpperRightY()).isEqualTo(150f);
            assertThat(document.getPages().indexOf(field.getWidgets().get(0).getPage())).isEqualTo(1);
        }
    }

    @Test
    void testMissingMarkerWithoutDefaultRectangleFails() {
        // Arrange
        ReflectionTestUtils.setField(engine, "defaultRect", "");
        byte[] certified = certify(TestPdfs.lease("No markers here"));
        SignerCredential credential = issuer.issue(TENANT);

        // Act & Assert
        assertThatThrownBy(() -> engine.approve(certified, credential, optionsFor(TENANT)))
                .isInstanceOf(SignaturePlacementException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void testAmbiguousMarkerIsFatal() {
        // Arrange
        byte[] certified = certify(TestPdfs.lease("Tenant [[signature_tenant_t1]]",
                "Tenant again [[signature_tenant_t1]]"));
        SignerCredential credential = issuer.issue(TENANT);

        // Act & Assert
        assertThatThrownBy(() -> engine.approve(certified, credential, optionsFor(TENANT)))
                .isInstanceOf(SignaturePlacementException.class)
                .hasMessageContaining("appears 2 times");
    }

    @Test
    void testRequiredPrePlacedFieldMissingFails() {
        byte[] certified = certify(TestPdfs.leaseWithMarkers());
        ApprovalOptions options = optionsFor(TENANT);
        options.setRequirePrePlacedField(true);
        SignerCredential credential = issuer.issue(TENANT);

        assertThatThrownBy(() -> engine.approve(certified, credential, options))
                .isInstanceOf(SignaturePlacementException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void testPrePlacedFieldIsReused() throws Exception {
        // Arrange
        byte[] certified = certify(TestPdfs.withEmptySignatureField("signature_tenant_t1"));
        ApprovalOptions options = optionsFor(TENANT);
        options.setRequirePrePlacedField(true);

        // Act
        byte[] signed = engine.approve(certified, issuer.issue(TENANT), options);

        // Assert
        try (PDDocument document = Loader.loadPDF(signed)) {
            List<PDSignatureField> fields = document.getSignatureFields();
            assertThat(fields).extracting(PDSignatureField::getPartialName)
                    .containsExactlyInAnyOrder("Certification_20240502_093000", "signature_tenant_t1");
            PDSignatureField field = (PDSignatureField) document.getDocumentCatalog().getAcroForm()
                    .getField("signature_tenant_t1");
            assertThat(field.getSignature()).isNotNull();
            PDRectangle rect = field.getWidgets().get(0).getRectangle();
            assertThat(rect.getLowerLeftX()).isEqualTo(100f);
            assertThat(rect.getLowerLeftY()).isEqualTo(100f);
        }
    }

    @Test
    void testApproveRejectedWhenCertificationForbidsChanges() throws Exception {
        // Arrange
        byte[] locked = certifyWithPermission(TestPdfs.leaseWithMarkers(), DocMdpUtil.NO_CHANGES);
        SignerCredential credential = issuer.issue(TENANT);

        // Act & Assert
        assertThat(PdfInspection.docMdpPermission(locked)).isEqualTo(DocMdpUtil.NO_CHANGES);
        assertThatThrownBy(() -> engine.approve(locked, credential, optionsFor(TENANT)))
                .isInstanceOf(SigningException.class)
                .hasMessageContaining("does not allow");
        assertThat(credential.isConsumed()).isFalse();
    }

    private byte[] certifyWithPermission(byte[] pdf, int permission) throws Exception {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            PDSignature signature = new PDSignature();
            signature.setFilter(PDSignature.FILTER_ADOBE_PPKLITE);
            signature.setSubFilter(PDSignature.SUBFILTER_ETSI_CADES_DETACHED);
            signature.setSignDate(Calendar.getInstance());
            DocMdpUtil.apply(document, signature, permission);
            document.addSignature(signature, new CmsSignatureBuilder(trust.getCertifier().getPrivateKey(),
                    trust.getCertifier().getChain(), null));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.saveIncremental(out);
            return out.toByteArray();
        }
    }
}
