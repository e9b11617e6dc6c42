package com.wpanther.documentsigning.util;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Getter;

/**
 * Content of the visible stamp drawn for an approval signature.
 */
@Getter
@Builder
public class SignatureStamp {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");

    private final String signerName;
    private final String signerEmail;
    private final ZonedDateTime signedAt;
    private final String caption;
    private final byte[] handwrittenImage;

    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        lines.add(signerName + " – " + signerEmail);
        lines.add(DATE_FORMAT.format(signedAt) + " (UTC" + utcOffset() + ")");
        if (caption != null && !caption.isBlank()) {
            lines.add(caption);
        }
        return lines;
    }

    private String utcOffset() {
        String id = signedAt.getOffset().getId();
        return "Z".equals(id) ? "+00:00" : id;
    }

    public boolean hasHandwrittenImage() {
        return handwrittenImage != null && handwrittenImage.length > 0;
    }
}
