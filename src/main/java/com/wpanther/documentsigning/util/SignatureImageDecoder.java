package com.wpanther.documentsigning.util;

import java.util.Base64;

import com.wpanther.documentsigning.exception.SigningException;

/**
 * Decodes the drawn signature sent by the signing page, either a
 * {@code data:image/png;base64,...} URL or bare base64.
 */
public final class SignatureImageDecoder {

    static final int MAX_IMAGE_BYTES = 2 * 1024 * 1024;

    private SignatureImageDecoder() {
    }

    public static byte[] decode(String dataUrl) {
        if (dataUrl == null || dataUrl.isBlank()) {
            return null;
        }
        String payload = dataUrl.trim();
        if (payload.startsWith("data:")) {
            int comma = payload.indexOf(',');
            if (comma < 0 || !payload.substring(0, comma).endsWith(";base64")) {
                throw new SigningException("Signature image must be a base64 data URL");
            }
            payload = payload.substring(comma + 1);
        }
        byte[] image;
        try {
            image = Base64.getMimeDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new SigningException("Signature image is not valid base64", e);
        }
        if (image.length > MAX_IMAGE_BYTES) {
            throw new SigningException("Signature image exceeds " + MAX_IMAGE_BYTES + " bytes");
        }
        return image;
    }
}
