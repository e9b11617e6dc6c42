package com.wpanther.documentsigning.util;

import java.io.IOException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.digitalsignature.PDSignature;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.pdmodel.interactive.form.PDSignatureField;
import org.bouncycastle.asn1.cms.Attribute;
import org.bouncycastle.asn1.cms.AttributeTable;
import org.bouncycastle.asn1.cms.ContentInfo;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.SignerInformation;
import org.bouncycastle.tsp.TSPException;
import org.bouncycastle.tsp.TimeStampToken;
import org.bouncycastle.tsp.TimeStampTokenInfo;

import com.wpanther.documentsigning.exception.ProofIntegrityException;

/**
 * Reads back the CMS structure of a signature field: the signer certificate
 * and the signature timestamp token, if any.
 */
public final class SignatureInspector {

    private SignatureInspector() {
    }

    public static SignatureEvidence inspect(byte[] pdf, String fieldName) {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            PDAcroForm acroForm = document.getDocumentCatalog().getAcroForm(null);
            PDField field = acroForm != null ? acroForm.getField(fieldName) : null;
            if (!(field instanceof PDSignatureField)) {
                throw new ProofIntegrityException("Signature field " + fieldName + " not found in signed document");
            }
            PDSignature signature = ((PDSignatureField) field).getSignature();
            if (signature == null) {
                throw new ProofIntegrityException("Signature field " + fieldName + " is not signed");
            }
            boolean certification = signature.getCOSObject().containsKey(COSName.REFERENCE);
            return parse(fieldName, signature.getContents(), certification);
        } catch (IOException e) {
            throw new ProofIntegrityException("Unable to read signed document: " + e.getMessage(), e);
        }
    }

    static SignatureEvidence parse(String fieldName, byte[] contents, boolean certification) {
        try {
            CMSSignedData signedData = new CMSSignedData(contents);
            Collection<SignerInformation> signers = signedData.getSignerInfos().getSigners();
            if (signers.isEmpty()) {
                throw new ProofIntegrityException("Signature " + fieldName + " has no signer");
            }
            SignerInformation signer = signers.iterator().next();

            List<X509CertificateHolder> matches = new ArrayList<>();
            for (X509CertificateHolder holder : signedData.getCertificates().getMatches(null)) {
                if (signer.getSID().match(holder)) {
                    matches.add(holder);
                }
            }
            if (matches.isEmpty()) {
                throw new ProofIntegrityException("Signer certificate not embedded in signature " + fieldName);
            }
            X509Certificate certificate = new JcaX509CertificateConverter()
                    .getCertificate(matches.iterator().next());

            SignatureEvidence.SignatureEvidenceBuilder evidence = SignatureEvidence.builder()
                    .fieldName(fieldName)
                    .signerCertificate(certificate)
                    .certification(certification);

            AttributeTable unsigned = signer.getUnsignedAttributes();
            Attribute timestampAttribute = unsigned != null
                    ? unsigned.get(PKCSObjectIdentifiers.id_aa_signatureTimeStampToken)
                    : null;
            if (timestampAttribute != null && timestampAttribute.getAttrValues().size() > 0) {
                ContentInfo contentInfo = ContentInfo.getInstance(timestampAttribute.getAttrValues().getObjectAt(0));
                TimeStampToken token = new TimeStampToken(contentInfo);
                TimeStampTokenInfo info = token.getTimeStampInfo();
                evidence.timestampTime(info.getGenTime().toInstant())
                        .timestampSerial(info.getSerialNumber())
                        .timestampToken(token.getEncoded());
            }
            return evidence.build();
        } catch (CMSException | TSPException | IOException | CertificateException e) {
            throw new ProofIntegrityException("Unable to parse signature " + fieldName + ": " + e.getMessage(), e);
        }
    }
}
