package com.example.docredact.engine;

import com.example.docredact.model.PiiItem;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the positioned text layer of a PDF, line by line.
 */
@Component
public class PdfTextLocator {

    public List<TextLine> lines(PDDocument document, int pageIndex) throws IOException {
        LineCollector collector = new LineCollector();
        collector.setStartPage(pageIndex + 1);
        collector.setEndPage(pageIndex + 1);
        collector.getText(document);
        return collector.lines;
    }

    /**
     * Every case-insensitive occurrence of {@code needle} on the given lines, carrying the text
     * as it appears on the page rather than as it was asked for.
     */
    public List<PiiItem> find(List<TextLine> lines, String needle) {
        List<PiiItem> matches = new ArrayList<>();
        if (needle == null || needle.isBlank()) return matches;
        String target = needle.trim();
        int length = target.length();
        for (TextLine line : lines) {
            String text = line.getText();
            int from = 0;
            while (from + length <= text.length()) {
                if (!text.regionMatches(true, from, target, 0, length)) {
                    from++;
                    continue;
                }
                List<Double> box = line.bbox(from, from + length);
                if (box != null) {
                    matches.add(PiiItem.builder()
                            .text(text.substring(from, from + length))
                            .bbox(box)
                            .build());
                }
                from += length;
            }
        }
        return matches;
    }

    private static class LineCollector extends PDFTextStripper {

        private final List<TextLine> lines = new ArrayList<>();
        private TextLine current = new TextLine();

        LineCollector() throws IOException {
            setSortByPosition(true);
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) {
            current.addWord(textPositions);
        }

        @Override
        protected void writeWordSeparator() {
            current.addSeparator();
        }

        @Override
        protected void writeLineSeparator() {
            flush();
        }

        @Override
        protected void writeParagraphEnd() throws IOException {
            flush();
            super.writeParagraphEnd();
        }

        @Override
        protected void endPage(PDPage page) throws IOException {
            flush();
            super.endPage(page);
        }

        private void flush() {
            if (!current.isEmpty()) {
                lines.add(current);
            }
            current = new TextLine();
        }
    }
}
