package com.wpanther.documentsigning.util;

import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.pdfbox.pdmodel.interactive.digitalsignature.SignatureInterface;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.DERSet;
import org.bouncycastle.asn1.cms.Attribute;
import org.bouncycastle.asn1.cms.AttributeTable;
import org.bouncycastle.asn1.ess.ESSCertIDv2;
import org.bouncycastle.asn1.ess.SigningCertificateV2;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.cert.jcajce.JcaCertStore;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSProcessableByteArray;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.CMSSignedDataGenerator;
import org.bouncycastle.cms.DefaultSignedAttributeTableGenerator;
import org.bouncycastle.cms.SignerInformation;
import org.bouncycastle.cms.SignerInformationStore;
import org.bouncycastle.cms.jcajce.JcaSignerInfoGeneratorBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;

import eu.europa.esig.dss.enumerations.DigestAlgorithm;
import eu.europa.esig.dss.model.TimestampBinary;
import eu.europa.esig.dss.spi.x509.tsp.TSPSource;

/**
 * Produces the detached CAdES signature PDFBox embeds in /Contents.
 * When a timestamp source is set, a signature timestamp over the signature
 * value is added as an unsigned attribute.
 */
public class CmsSignatureBuilder implements SignatureInterface {

    private final PrivateKey privateKey;
    private final List<X509Certificate> chain;
    private final TSPSource tspSource;

    public CmsSignatureBuilder(PrivateKey privateKey, List<X509Certificate> chain, TSPSource tspSource) {
        this.privateKey = privateKey;
        this.chain = new ArrayList<>(chain);
        this.tspSource = tspSource;
    }

    @Override
    public byte[] sign(InputStream content) throws IOException {
        try {
            X509Certificate signerCertificate = chain.get(0);
            ContentSigner contentSigner = new JcaContentSignerBuilder(CertificateUtil.SIGNATURE_ALGORITHM)
                    .build(privateKey);

            JcaSignerInfoGeneratorBuilder signerInfoBuilder = new JcaSignerInfoGeneratorBuilder(
                    new JcaDigestCalculatorProviderBuilder().build());
            signerInfoBuilder.setSignedAttributeGenerator(
                    new DefaultSignedAttributeTableGenerator(signingCertificateAttribute(signerCertificate)));

            CMSSignedDataGenerator generator = new CMSSignedDataGenerator();
            generator.addSignerInfoGenerator(signerInfoBuilder.build(contentSigner, signerCertificate));
            generator.addCertificates(new JcaCertStore(chain));

            CMSSignedData signedData = generator.generate(new CMSProcessableByteArray(content.readAllBytes()), false);
            if (tspSource != null) {
                signedData = addSignatureTimestamp(signedData);
            }
            return signedData.getEncoded();
        } catch (GeneralSecurityException | OperatorCreationException | CMSException e) {
            throw new IOException("Failed to build CMS signature: " + e.getMessage(), e);
        }
    }

    private static AttributeTable signingCertificateAttribute(X509Certificate certificate)
            throws GeneralSecurityException {
        ESSCertIDv2 certId = new ESSCertIDv2(CertificateUtil.sha256(certificate.getEncoded()));
        SigningCertificateV2 signingCertificate = new SigningCertificateV2(new ESSCertIDv2[] { certId });
        ASN1EncodableVector attributes = new ASN1EncodableVector();
        attributes.add(new Attribute(PKCSObjectIdentifiers.id_aa_signingCertificateV2, new DERSet(signingCertificate)));
        return new AttributeTable(attributes);
    }

    private CMSSignedData addSignatureTimestamp(CMSSignedData signedData) throws IOException {
        SignerInformationStore signerStore = signedData.getSignerInfos();
        Collection<SignerInformation> timestamped = new ArrayList<>();
        for (SignerInformation signer : signerStore.getSigners()) {
            timestamped.add(addSignatureTimestamp(signer));
        }
        return CMSSignedData.replaceSigners(signedData, new SignerInformationStore(timestamped));
    }

    private SignerInformation addSignatureTimestamp(SignerInformation signer) throws IOException {
        byte[] digest = CertificateUtil.sha256(signer.getSignature());
        TimestampBinary timestamp = tspSource.getTimeStampResponse(DigestAlgorithm.SHA256, digest);

        AttributeTable unsigned = signer.getUnsignedAttributes();
        ASN1EncodableVector vector = unsigned != null ? unsigned.toASN1EncodableVector() : new ASN1EncodableVector();
        vector.add(new Attribute(PKCSObjectIdentifiers.id_aa_signatureTimeStampToken,
                new DERSet(ASN1Primitive.fromByteArray(timestamp.getBytes()))));
        return SignerInformation.replaceUnsignedAttributes(signer, new AttributeTable(vector));
    }
}
