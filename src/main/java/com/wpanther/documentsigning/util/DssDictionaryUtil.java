package com.wpanther.documentsigning.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSStream;
import org.apache.pdfbox.pdmodel.PDDocument;

/**
 * Maintains the document security store (/DSS) that carries validation
 * material inside the PDF.
 */
public final class DssDictionaryUtil {

    private static final COSName DSS = COSName.getPDFName("DSS");
    private static final COSName CERTS = COSName.getPDFName("Certs");

    private DssDictionaryUtil() {
    }

    /**
     * Adds the certificates not already present to /DSS /Certs.
     *
     * @return number of certificates added
     */
    public static int addCertificates(PDDocument document, Iterable<X509Certificate> certificates) throws IOException {
        COSDictionary catalog = document.getDocumentCatalog().getCOSObject();
        COSDictionary dss = catalog.getCOSDictionary(DSS);
        if (dss == null) {
            dss = new COSDictionary();
            catalog.setItem(DSS, dss);
        }
        COSArray certs = dss.getCOSArray(CERTS);
        if (certs == null) {
            certs = new COSArray();
            dss.setItem(CERTS, certs);
        }

        Set<String> present = new HashSet<>();
        for (int i = 0; i < certs.size(); i++) {
            COSBase base = certs.getObject(i);
            if (base instanceof COSStream) {
                try (InputStream in = ((COSStream) base).createInputStream()) {
                    present.add(Arrays.toString(CertificateUtil.sha256(in.readAllBytes())));
                }
            }
        }

        int added = 0;
        for (X509Certificate certificate : certificates) {
            byte[] encoded;
            try {
                encoded = certificate.getEncoded();
            } catch (CertificateEncodingException e) {
                throw new IOException("Unable to encode certificate " + certificate.getSubjectX500Principal(), e);
            }
            if (!present.add(Arrays.toString(CertificateUtil.sha256(encoded)))) {
                continue;
            }
            COSStream stream = document.getDocument().createCOSStream();
            try (OutputStream out = stream.createOutputStream(COSName.FLATE_DECODE)) {
                out.write(encoded);
            }
            stream.setNeedToBeUpdated(true);
            certs.add(stream);
            added++;
        }

        certs.setNeedToBeUpdated(true);
        dss.setNeedToBeUpdated(true);
        catalog.setNeedToBeUpdated(true);
        return added;
    }
}
