package com.wpanther.documentsigning.util;

import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.digitalsignature.PDSignature;

/**
 * Reads and writes the DocMDP transform of a certifying signature.
 * Permission 1 forbids any change, 2 allows form filling and signing,
 * 3 additionally allows annotations.
 */
public final class DocMdpUtil {

    public static final int NO_CHANGES = 1;
    public static final int FORM_FILL_AND_SIGN = 2;

    private DocMdpUtil() {
    }

    /**
     * @return the DocMDP permission of the document, or 0 when it is not certified
     */
    public static int getPermission(PDDocument document) {
        COSDictionary perms = document.getDocumentCatalog().getCOSObject().getCOSDictionary(COSName.PERMS);
        if (perms == null) {
            return 0;
        }
        COSDictionary signature = perms.getCOSDictionary(COSName.DOCMDP);
        if (signature == null) {
            return 0;
        }
        COSArray references = signature.getCOSArray(COSName.REFERENCE);
        if (references == null) {
            return 0;
        }
        for (int i = 0; i < references.size(); i++) {
            COSBase base = references.getObject(i);
            if (base instanceof COSDictionary) {
                COSDictionary reference = (COSDictionary) base;
                if (COSName.DOCMDP.equals(reference.getDictionaryObject(COSName.TRANSFORM_METHOD))) {
                    COSBase params = reference.getDictionaryObject(COSName.TRANSFORM_PARAMS);
                    if (params instanceof COSDictionary) {
                        int permission = ((COSDictionary) params).getInt(COSName.P, FORM_FILL_AND_SIGN);
                        return permission < 1 || permission > 3 ? FORM_FILL_AND_SIGN : permission;
                    }
                }
            }
        }
        return 0;
    }

    public static boolean isCertified(PDDocument document) {
        return getPermission(document) > 0;
    }

    /**
     * Turns {@code signature} into a certifying signature with the given permission.
     */
    public static void apply(PDDocument document, PDSignature signature, int permission) {
        COSDictionary transformParams = new COSDictionary();
        transformParams.setItem(COSName.TYPE, COSName.TRANSFORM_PARAMS);
        transformParams.setInt(COSName.P, permission);
        transformParams.setName(COSName.V, "1.2");
        transformParams.setNeedToBeUpdated(true);

        COSDictionary reference = new COSDictionary();
        reference.setItem(COSName.TYPE, COSName.SIG_REF);
        reference.setItem(COSName.TRANSFORM_METHOD, COSName.DOCMDP);
        reference.setItem(COSName.DIGEST_METHOD, COSName.getPDFName("SHA256"));
        reference.setItem(COSName.TRANSFORM_PARAMS, transformParams);
        reference.setNeedToBeUpdated(true);

        COSArray references = new COSArray();
        references.add(reference);
        references.setNeedToBeUpdated(true);
        signature.getCOSObject().setItem(COSName.REFERENCE, references);

        COSDictionary catalog = document.getDocumentCatalog().getCOSObject();
        COSDictionary perms = new COSDictionary();
        perms.setItem(COSName.DOCMDP, signature);
        perms.setNeedToBeUpdated(true);
        catalog.setItem(COSName.PERMS, perms);
        catalog.setNeedToBeUpdated(true);
    }
}
