package com.example.docredact.support;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.PDFTextStripperByArea;

import java.awt.geom.Rectangle2D;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

public final class TestPdfs {

    private TestPdfs() {
    }

    /**
     * A Letter-size PDF with one page per argument; each page argument holds its lines separated by '\n'.
     */
    public static byte[] create(String... pages) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String pageText : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream cs = new PDPageContentStream(document, page)) {
                    float y = 720;
                    for (String line : pageText.split("\n")) {
                        cs.beginText();
                        cs.setFont(font, 12);
                        cs.newLineAtOffset(72, y);
                        cs.showText(line);
                        cs.endText();
                        y -= 24;
                    }
                }
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    public static String text(byte[] pdf) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            return new PDFTextStripper().getText(document);
        }
    }

    /**
     * Text whose glyphs start inside {@code bbox} ([x0, y0, x1, y1], top-left origin) on the given page.
     */
    public static String textInBox(byte[] pdf, int pageIndex, List<Double> bbox) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            PDFTextStripperByArea stripper = new PDFTextStripperByArea();
            stripper.setSortByPosition(true);
            stripper.addRegion("box", new Rectangle2D.Double(
                    bbox.get(0) - 1, bbox.get(1) - 1, bbox.get(2) - bbox.get(0) + 2, bbox.get(3) - bbox.get(1) + 2));
            stripper.extractRegions(document.getPage(pageIndex));
            return stripper.getTextForRegion("box").trim();
        }
    }

    public static int pageCount(byte[] pdf) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            return document.getNumberOfPages();
        }
    }
}
