package com.wpanther.documentsigning.service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.GregorianCalendar;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAppearanceDictionary;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAppearanceStream;
import org.apache.pdfbox.pdmodel.interactive.digitalsignature.PDSignature;
import org.apache.pdfbox.pdmodel.interactive.digitalsignature.SignatureInterface;
import org.apache.pdfbox.pdmodel.interactive.digitalsignature.SignatureOptions;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.pdmodel.interactive.form.PDSignatureField;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.wpanther.documentsigning.exception.DocumentAlreadyCertifiedException;
import com.wpanther.documentsigning.exception.SignaturePlacementException;
import com.wpanther.documentsigning.exception.SigningException;
import com.wpanther.documentsigning.model.ApprovalOptions;
import com.wpanther.documentsigning.model.SignerCredential;
import com.wpanther.documentsigning.model.SigningIdentity;
import com.wpanther.documentsigning.model.TrustMaterial;
import com.wpanther.documentsigning.util.AnchorMatch;
import com.wpanther.documentsigning.util.CmsSignatureBuilder;
import com.wpanther.documentsigning.util.DocMdpUtil;
import com.wpanther.documentsigning.util.DssDictionaryUtil;
import com.wpanther.documentsigning.util.PdfAnchorLocator;
import com.wpanther.documentsigning.util.SignatureStamp;
import com.wpanther.documentsigning.util.SignatureStampRenderer;

import eu.europa.esig.dss.spi.x509.tsp.TSPSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Appends certification and approval signatures to PDFs as incremental updates.
 * Bytes of the input document are never rewritten, so earlier signatures stay valid.
 */
@Service
@Slf4j
public class PdfSigningEngine {

    public static final String CERTIFICATION_FIELD_PREFIX = "Certification_";

    private static final DateTimeFormatter FIELD_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneOffset.UTC);

    private final TrustMaterial trustMaterial;
    private final TSPSource approvalTspSource;
    private final TSPSource certificationTspSource;
    private final Clock clock;

    @Value("${app.signing.default-rect:425,20,575,150}")
    private String defaultRect;

    @Value("${app.signing.stamp-width:170}")
    private float stampWidth;

    @Value("${app.signing.stamp-height:80}")
    private float stampHeight;

    @Value("${app.signing.time-zone:Europe/Paris}")
    private String timeZone;

    @Value("${app.signing.caption:Signature conforme eIDAS}")
    private String caption;

    @Value("${app.signing.location:}")
    private String location;

    public PdfSigningEngine(TrustMaterial trustMaterial,
            @Qualifier("internalTspSource") TSPSource approvalTspSource,
            @Qualifier("certificationTspSource") TSPSource certificationTspSource,
            Clock clock) {
        this.trustMaterial = trustMaterial;
        this.approvalTspSource = approvalTspSource;
        this.certificationTspSource = certificationTspSource;
        this.clock = clock;
    }

    public String newCertificationFieldName() {
        return CERTIFICATION_FIELD_PREFIX + FIELD_TIMESTAMP.format(clock.instant());
    }

    /**
     * Adds an invisible certifying signature that only allows form filling and
     * further signatures, embeds the validation certificates and a timestamp.
     *
     * @throws DocumentAlreadyCertifiedException if the PDF already carries a certification
     */
    public byte[] certify(byte[] pdf, String fieldName) {
        SigningIdentity certifier = trustMaterial.getCertifier();
        try (PDDocument document = Loader.loadPDF(pdf)) {
            if (isCertified(document)) {
                throw new DocumentAlreadyCertifiedException("Document is already certified");
            }

            PDSignature signature = newSignature(certifierName(certifier), "Document certification",
                    calendar(clock.instant()));
            DocMdpUtil.apply(document, signature, DocMdpUtil.FORM_FILL_AND_SIGN);
            DssDictionaryUtil.addCertificates(document, trustMaterial.getValidationCertificates());

            byte[] certified;
            try (SignatureOptions options = new SignatureOptions()) {
                options.setPreferredSignatureSize(SignatureOptions.DEFAULT_SIGNATURE_SIZE * 2);
                certified = sign(document, signature, fieldName, options,
                        new CmsSignatureBuilder(certifier.getPrivateKey(), certifier.getChain(),
                                certificationTspSource));
            }
            log.info("Certified document field={} certifier={} size={}", fieldName, certifier.getSubjectDn(),
                    certified.length);
            return certified;
        } catch (IOException e) {
            throw new SigningException("Failed to certify document: " + e.getMessage(), e);
        }
    }

    /**
     * Adds a visible approval signature for one signer, made with the ephemeral credential.
     */
    public byte[] approve(byte[] pdf, SignerCredential credential, ApprovalOptions options) {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            if (DocMdpUtil.getPermission(document) == DocMdpUtil.NO_CHANGES) {
                throw new SigningException("Document certification does not allow further signatures");
            }

            Instant signedAt = options.getSignedAt() != null ? options.getSignedAt() : clock.instant();
            PDSignature signature = newSignature(options.getSignerName(), options.getReason(), calendar(signedAt));
            Placement placement = resolvePlacement(document, options);
            if (placement.existingField != null) {
                placement.existingField.getCOSObject().setItem(COSName.V, signature);
            }

            Set<X509Certificate> validation = new LinkedHashSet<>(credential.getChain());
            validation.addAll(trustMaterial.getValidationCertificates());
            DssDictionaryUtil.addCertificates(document, validation);

            SignatureStamp stamp = SignatureStamp.builder()
                    .signerName(options.getSignerName())
                    .signerEmail(options.getSignerEmail())
                    .signedAt(signedAt.atZone(ZoneId.of(timeZone)))
                    .caption(caption)
                    .handwrittenImage(options.getHandwrittenImage())
                    .build();

            byte[] signed;
            try (SignatureOptions signatureOptions = new SignatureOptions()) {
                signatureOptions.setPreferredSignatureSize(SignatureOptions.DEFAULT_SIGNATURE_SIZE * 2);
                signatureOptions.setPage(placement.pageIndex);
                signatureOptions.setVisualSignature(new ByteArrayInputStream(
                        visualTemplate(document, placement, stamp)));
                signed = sign(document, signature, options.getFieldName(), signatureOptions,
                        new CmsSignatureBuilder(credential.consumePrivateKey(), credential.getChain(),
                                approvalTspSource));
            }
            log.info("Approval signature added field={} page={} signer={}", options.getFieldName(),
                    placement.pageIndex + 1, options.getSignerEmail());
            return signed;
        } catch (IOException e) {
            throw new SigningException("Failed to sign document: " + e.getMessage(), e);
        }
    }

    private boolean isCertified(PDDocument document) {
        if (DocMdpUtil.isCertified(document)) {
            return true;
        }
        for (PDSignatureField field : document.getSignatureFields()) {
            String name = field.getPartialName();
            if (name != null && name.startsWith(CERTIFICATION_FIELD_PREFIX) && field.getSignature() != null) {
                return true;
            }
        }
        return false;
    }

    private byte[] sign(PDDocument document, PDSignature signature, String fieldName, SignatureOptions options,
            SignatureInterface signatureInterface) throws IOException {
        document.addSignature(signature, signatureInterface, options);
        nameField(document, signature, fieldName);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.saveIncremental(out);
        return out.toByteArray();
    }

    private void nameField(PDDocument document, PDSignature signature, String fieldName) throws IOException {
        for (PDSignatureField field : document.getSignatureFields()) {
            COSBase value = field.getCOSObject().getDictionaryObject(COSName.V);
            if (value == signature.getCOSObject()) {
                if (!fieldName.equals(field.getPartialName())) {
                    field.setPartialName(fieldName);
                    field.getCOSObject().setNeedToBeUpdated(true);
                }
                return;
            }
        }
        throw new SigningException("Signature field for " + fieldName + " was not created");
    }

    private Placement resolvePlacement(PDDocument document, ApprovalOptions options) throws IOException {
        PDAcroForm acroForm = document.getDocumentCatalog().getAcroForm(null);
        PDField field = acroForm != null ? acroForm.getField(options.getFieldName()) : null;

        if (field != null) {
            if (!(field instanceof PDSignatureField)) {
                throw new SignaturePlacementException("Field " + options.getFieldName() + " is not a signature field");
            }
            PDSignatureField signatureField = (PDSignatureField) field;
            if (signatureField.getSignature() != null) {
                throw new SigningException("Signature field " + options.getFieldName() + " is already signed");
            }
            PDAnnotationWidget widget = signatureField.getWidgets().get(0);
            return new Placement(pageIndexOf(document, widget), widget.getRectangle(), signatureField);
        }
        if (options.isRequirePrePlacedField()) {
            throw new SignaturePlacementException("Signature field " + options.getFieldName() + " does not exist");
        }

        if (options.getAnchorMarker() != null && !options.getAnchorMarker().isBlank()) {
            Optional<AnchorMatch> anchor = PdfAnchorLocator.findUnique(document, options.getAnchorMarker());
            if (anchor.isPresent()) {
                return new Placement(anchor.get().getPageIndex(),
                        stampRectangle(document.getPage(anchor.get().getPageIndex()), anchor.get()), null);
            }
        }

        PDRectangle fallback = parseRectangle(defaultRect);
        if (fallback == null) {
            throw new SignaturePlacementException("Signature marker " + options.getAnchorMarker()
                    + " not found and no default position is configured");
        }
        log.debug("Signature marker {} not found, using default position {}", options.getAnchorMarker(), defaultRect);
        return new Placement(document.getNumberOfPages() - 1, fallback, null);
    }

    private PDRectangle stampRectangle(PDPage page, AnchorMatch anchor) {
        PDRectangle box = page.getCropBox();
        float x = Math.max(box.getLowerLeftX(), Math.min(anchor.getX(), box.getUpperRightX() - stampWidth));
        float top = Math.min(box.getUpperRightY(), Math.max(anchor.getTop(), box.getLowerLeftY() + stampHeight));
        return new PDRectangle(x, top - stampHeight, stampWidth, stampHeight);
    }

    private static int pageIndexOf(PDDocument document, PDAnnotationWidget widget) throws IOException {
        PDPage page = widget.getPage();
        if (page != null) {
            int index = document.getPages().indexOf(page);
            if (index >= 0) {
                return index;
            }
        }
        for (int i = 0; i < document.getNumberOfPages(); i++) {
            for (PDAnnotation annotation : document.getPage(i).getAnnotations()) {
                if (annotation.getCOSObject() == widget.getCOSObject()) {
                    return i;
                }
            }
        }
        throw new SignaturePlacementException("Signature widget is not attached to any page");
    }

    /**
     * One-page document holding a signature widget with the stamp appearance;
     * PDFBox copies its rectangle and appearance onto the real field.
     */
    private byte[] visualTemplate(PDDocument source, Placement placement, SignatureStamp stamp) throws IOException {
        try (PDDocument template = new PDDocument()) {
            PDPage page = new PDPage(source.getPage(placement.pageIndex).getMediaBox());
            template.addPage(page);

            PDAcroForm acroForm = new PDAcroForm(template);
            template.getDocumentCatalog().setAcroForm(acroForm);
            acroForm.setSignaturesExist(true);
            acroForm.setAppendOnly(true);
            acroForm.getCOSObject().setDirect(true);

            PDSignatureField field = new PDSignatureField(acroForm);
            PDAnnotationWidget widget = field.getWidgets().get(0);
            widget.setRectangle(placement.rectangle);
            List<PDField> fields = new ArrayList<>(acroForm.getFields());
            fields.add(field);
            acroForm.setFields(fields);

            PDAppearanceStream appearanceStream = SignatureStampRenderer.render(template, placement.rectangle, stamp);
            PDAppearanceDictionary appearance = new PDAppearanceDictionary();
            appearance.getCOSObject().setDirect(true);
            appearance.setNormalAppearance(appearanceStream);
            widget.setAppearance(appearance);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            template.save(out);
            return out.toByteArray();
        }
    }

    private PDSignature newSignature(String name, String reason, Calendar signDate) {
        PDSignature signature = new PDSignature();
        signature.setFilter(PDSignature.FILTER_ADOBE_PPKLITE);
        signature.setSubFilter(PDSignature.SUBFILTER_ETSI_CADES_DETACHED);
        signature.setName(name);
        if (reason != null) {
            signature.setReason(reason);
        }
        if (location != null && !location.isBlank()) {
            signature.setLocation(location);
        }
        signature.setSignDate(signDate);
        return signature;
    }

    private String certifierName(SigningIdentity certifier) {
        return certifier.getCertificate().getSubjectX500Principal().getName();
    }

    private Calendar calendar(Instant instant) {
        return GregorianCalendar.from(instant.atZone(ZoneId.of(timeZone)));
    }

    /**
     * Parses {@code llx,lly,urx,ury}; blank disables the default position.
     */
    static PDRectangle parseRectangle(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String[] parts = value.split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Default signature rectangle must be llx,lly,urx,ury: " + value);
        }
        float llx = Float.parseFloat(parts[0].trim());
        float lly = Float.parseFloat(parts[1].trim());
        float urx = Float.parseFloat(parts[2].trim());
        float ury = Float.parseFloat(parts[3].trim());
        return new PDRectangle(llx, lly, urx - llx, ury - lly);
    }

    private static class Placement {
        private final int pageIndex;
        private final PDRectangle rectangle;
        private final PDSignatureField existingField;

        Placement(int pageIndex, PDRectangle rectangle, PDSignatureField existingField) {
            this.pageIndex = pageIndex;
            this.rectangle = rectangle;
            this.existingField = existingField;
        }
    }
}
