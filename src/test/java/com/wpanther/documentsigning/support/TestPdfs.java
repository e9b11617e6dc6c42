package com.wpanther.documentsigning.support;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDSignatureField;

/**
 * Small PDFs built with PDFBox for signing tests.
 */
public final class TestPdfs {

    private TestPdfs() {
    }

    /**
     * One A4 page per entry, each page showing its lines of text from the top.
     */
    public static byte[] pages(List<List<String>> pages) {
        try (PDDocument document = new PDDocument()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (List<String> lines : pages) {
                PDPage page = new PDPage(PDRectangle.A4);
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    float y = 780;
                    for (String line : lines) {
                        content.beginText();
                        content.setFont(font, 11);
                        content.newLineAtOffset(60, y);
                        content.showText(line);
                        content.endText();
                        y -= 120;
                    }
                }
            }
            return save(document);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] lease(String... lines) {
        return pages(List.of(List.of(lines)));
    }

    /**
     * A lease with the landlord and tenant markers of the standard test signers.
     */
    public static byte[] leaseWithMarkers() {
        return pages(List.of(
                List.of("Lease agreement", "Rent: 850 EUR per month"),
                List.of("Landlord [[signature_landlord_l1]]", "Tenant [[signature_tenant_t1]]")));
    }

    /**
     * One page with an empty signature field already placed.
     */
    public static byte[] withEmptySignatureField(String fieldName) {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            PDAcroForm acroForm = new PDAcroForm(document);
            document.getDocumentCatalog().setAcroForm(acroForm);

            PDSignatureField field = new PDSignatureField(acroForm);
            field.setPartialName(fieldName);
            field.getWidgets().get(0).setRectangle(new PDRectangle(100, 100, 170, 80));
            field.getWidgets().get(0).setPage(page);
            page.setAnnotations(List.of(field.getWidgets().get(0)));
            acroForm.setFields(List.of(field));
            return save(document);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static byte[] save(PDDocument document) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.save(out);
        return out.toByteArray();
    }
}
