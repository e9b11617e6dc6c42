package com.wpanther.documentsigning.util;

import java.io.IOException;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAppearanceStream;

/**
 * Draws a {@link SignatureStamp} into a widget appearance stream: the
 * optional handwritten image on top, the text lines below it.
 */
public final class SignatureStampRenderer {

    private static final float PADDING = 3f;
    private static final float MAX_FONT_SIZE = 8f;
    private static final float MIN_FONT_SIZE = 4f;
    private static final float LINE_SPACING = 1.2f;

    private SignatureStampRenderer() {
    }

    public static PDAppearanceStream render(PDDocument document, PDRectangle rect, SignatureStamp stamp)
            throws IOException {
        float width = rect.getWidth();
        float height = rect.getHeight();

        PDAppearanceStream appearance = new PDAppearanceStream(document);
        appearance.setResources(new PDResources());
        appearance.setBBox(new PDRectangle(width, height));

        PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        List<String> lines = stamp.lines();
        for (int i = 0; i < lines.size(); i++) {
            lines.set(i, encodable(font, lines.get(i)));
        }
        float fontSize = fitFontSize(font, lines, width - 2 * PADDING);
        float textHeight = lines.size() * fontSize * LINE_SPACING;

        try (PDPageContentStream content = new PDPageContentStream(document, appearance)) {
            content.setLineWidth(0.5f);
            content.addRect(0.25f, 0.25f, width - 0.5f, height - 0.5f);
            content.stroke();

            if (stamp.hasHandwrittenImage()) {
                PDImageXObject image = PDImageXObject.createFromByteArray(document, stamp.getHandwrittenImage(),
                        "handwritten-signature");
                float areaWidth = width - 2 * PADDING;
                float areaHeight = height - textHeight - 3 * PADDING;
                if (areaHeight > 0) {
                    float scale = Math.min(areaWidth / image.getWidth(), areaHeight / image.getHeight());
                    float imageWidth = image.getWidth() * scale;
                    float imageHeight = image.getHeight() * scale;
                    content.drawImage(image, PADDING + (areaWidth - imageWidth) / 2,
                            height - PADDING - imageHeight, imageWidth, imageHeight);
                }
            }

            content.beginText();
            content.setFont(font, fontSize);
            content.setLeading(fontSize * LINE_SPACING);
            content.newLineAtOffset(PADDING, PADDING + textHeight - fontSize);
            for (String line : lines) {
                content.showText(line);
                content.newLine();
            }
            content.endText();
        }
        return appearance;
    }

    private static float fitFontSize(PDType1Font font, List<String> lines, float availableWidth) throws IOException {
        float size = MAX_FONT_SIZE;
        for (String line : lines) {
            float lineWidth = font.getStringWidth(line) / 1000f * MAX_FONT_SIZE;
            if (lineWidth > availableWidth) {
                size = Math.min(size, MAX_FONT_SIZE * availableWidth / lineWidth);
            }
        }
        return Math.max(size, MIN_FONT_SIZE);
    }

    /**
     * Replaces characters the standard Helvetica encoding cannot show.
     */
    static String encodable(PDType1Font font, String text) {
        StringBuilder result = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            String character = new String(Character.toChars(codePoint));
            try {
                font.encode(character);
                result.append(character);
            } catch (IOException | IllegalArgumentException e) {
                result.append('?');
            }
        });
        return result.toString();
    }
}
