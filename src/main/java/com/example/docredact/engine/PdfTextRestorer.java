package com.example.docredact.engine;

import com.example.docredact.model.PiiItem;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Writes recovered text back over the boxes of a redacted artifact.
 * The artifact's geometry is trusted to be the one produced for the session.
 */
@Component
public class PdfTextRestorer {

    private static final float MIN_FONT_SIZE = 4f;

    public byte[] restore(byte[] redactedPdf, Map<String, List<PiiItem>> pages) throws IOException {
        try (PDDocument document = Loader.loadPDF(redactedPdf)) {
            PDFont font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (Map.Entry<String, List<PiiItem>> entry : pages.entrySet()) {
                int pageIndex = parsePageIndex(entry.getKey());
                if (pageIndex >= document.getNumberOfPages()) {
                    throw new IOException("Artifact has no page " + pageIndex);
                }
                PDPage page = document.getPage(pageIndex);
                float pageHeight = page.getMediaBox().getHeight();
                try (PDPageContentStream cs = new PDPageContentStream(document, page,
                        PDPageContentStream.AppendMode.APPEND, true, true)) {
                    for (PiiItem item : entry.getValue()) {
                        draw(cs, font, item, pageHeight);
                    }
                }
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    private void draw(PDPageContentStream cs, PDFont font, PiiItem item, float pageHeight) throws IOException {
        List<Double> b = item.getBbox();
        float x0 = b.get(0).floatValue();
        float y0 = b.get(1).floatValue();
        float x1 = b.get(2).floatValue();
        float y1 = b.get(3).floatValue();
        float boxWidth = x1 - x0;
        float boxHeight = y1 - y0;

        cs.setNonStrokingColor(Color.WHITE);
        cs.addRect(x0, pageHeight - y1, boxWidth, boxHeight);
        cs.fill();

        String text = encodable(font, item.getText());
        float fontSize = Math.max(MIN_FONT_SIZE, boxHeight * 0.8f);
        float textWidth = font.getStringWidth(text) / 1000f * fontSize;
        if (textWidth > boxWidth && textWidth > 0) {
            fontSize = Math.max(MIN_FONT_SIZE, fontSize * boxWidth / textWidth);
        }

        cs.setNonStrokingColor(Color.BLACK);
        cs.beginText();
        cs.setFont(font, fontSize);
        cs.newLineAtOffset(x0, pageHeight - y1 + boxHeight * 0.2f);
        cs.showText(text);
        cs.endText();
    }

    private static String encodable(PDFont font, String text) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            String ch = new String(Character.toChars(cp));
            try {
                font.encode(ch);
                sb.append(ch);
            } catch (IOException | IllegalArgumentException e) {
                sb.append('?');
            }
        });
        return sb.toString();
    }

    private static int parsePageIndex(String pageId) throws IOException {
        try {
            int index = Integer.parseInt(pageId);
            if (index < 0) throw new IOException("Negative page index " + pageId);
            return index;
        } catch (NumberFormatException e) {
            throw new IOException("Invalid page identifier " + pageId, e);
        }
    }
}
