package com.wpanther.documentsigning.util;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import com.wpanther.documentsigning.exception.SignaturePlacementException;

/**
 * Finds the marker text a document template prints where a signer's stamp goes.
 * Matching runs over whole text lines with whitespace removed, so a marker that
 * the template writes in several runs, or that the stripper splits into words,
 * is still found. A marker broken across two lines is not.
 */
public class PdfAnchorLocator extends PDFTextStripper {

    private final String marker;
    private final List<AnchorMatch> matches = new ArrayList<>();

    // one glyph per character of lineText
    private final StringBuilder lineText = new StringBuilder();
    private final List<TextPosition> lineGlyphs = new ArrayList<>();

    private PdfAnchorLocator(String marker) {
        this.marker = marker.replaceAll("\\s+", "");
        setSortByPosition(true);
    }

    public static List<AnchorMatch> findAll(PDDocument document, String marker) throws IOException {
        PdfAnchorLocator locator = new PdfAnchorLocator(marker);
        locator.getText(document);
        return locator.matches;
    }

    /**
     * @return the single occurrence of {@code marker}, or empty if it does not appear
     * @throws SignaturePlacementException if the marker appears more than once
     */
    public static Optional<AnchorMatch> findUnique(PDDocument document, String marker) throws IOException {
        List<AnchorMatch> found = findAll(document, marker);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Map<Integer, Integer> perPage = new LinkedHashMap<>();
        for (AnchorMatch match : found) {
            perPage.merge(match.getPageIndex(), 1, Integer::sum);
        }
        for (Map.Entry<Integer, Integer> entry : perPage.entrySet()) {
            if (entry.getValue() > 1) {
                throw new SignaturePlacementException("Signature marker " + marker + " appears " + entry.getValue()
                        + " times on page " + (entry.getKey() + 1));
            }
        }
        if (found.size() > 1) {
            throw new SignaturePlacementException("Signature marker " + marker + " appears on " + found.size()
                    + " pages");
        }
        return Optional.of(found.get(0));
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        for (TextPosition glyph : textPositions) {
            String unicode = glyph.getUnicode();
            if (unicode == null) {
                continue;
            }
            for (int i = 0; i < unicode.length(); i++) {
                char c = unicode.charAt(i);
                if (!Character.isWhitespace(c)) {
                    lineText.append(c);
                    lineGlyphs.add(glyph);
                }
            }
        }
        super.writeString(text, textPositions);
    }

    @Override
    protected void writeLineSeparator() throws IOException {
        matchLine();
        super.writeLineSeparator();
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
        matchLine();
        super.endPage(page);
    }

    private void matchLine() {
        if (!marker.isEmpty()) {
            int from = 0;
            int index;
            while ((index = lineText.indexOf(marker, from)) >= 0) {
                matches.add(toMatch(lineGlyphs.subList(index, index + marker.length())));
                from = index + marker.length();
            }
        }
        lineText.setLength(0);
        lineGlyphs.clear();
    }

    private AnchorMatch toMatch(List<TextPosition> glyphs) {
        TextPosition first = glyphs.get(0);
        TextPosition last = glyphs.get(glyphs.size() - 1);
        PDRectangle cropBox = getCurrentPage().getCropBox();

        float height = 0;
        for (TextPosition glyph : glyphs) {
            height = Math.max(height, glyph.getHeightDir());
        }
        float x = cropBox.getLowerLeftX() + first.getXDirAdj();
        float baseline = cropBox.getUpperRightY() - first.getYDirAdj();
        float width = last.getXDirAdj() + last.getWidthDirAdj() - first.getXDirAdj();
        return new AnchorMatch(getCurrentPageNo() - 1, x, baseline + height, width, height);
    }
}
