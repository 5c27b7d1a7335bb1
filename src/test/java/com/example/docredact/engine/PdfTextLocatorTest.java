package com.example.docredact.engine;

import com.example.docredact.model.PiiItem;
import com.example.docredact.support.TestPdfs;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.TextPosition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PdfTextLocatorTest {

    private static final float GLYPH_WIDTH = 6f;

    private final PdfTextLocator locator = new PdfTextLocator();

    /** Glyphs for {@code word}, laid out left to right from {@code x} on a baseline at y=100. */
    private static List<TextPosition> glyphs(String word, float x) {
        List<TextPosition> positions = new ArrayList<>();
        for (int i = 0; i < word.length(); i++) {
            TextPosition tp = mock(TextPosition.class);
            when(tp.getUnicode()).thenReturn(String.valueOf(word.charAt(i)));
            when(tp.getXDirAdj()).thenReturn(x + i * GLYPH_WIDTH);
            when(tp.getWidthDirAdj()).thenReturn(GLYPH_WIDTH);
            when(tp.getYDirAdj()).thenReturn(100f);
            when(tp.getHeightDir()).thenReturn(9f);
            when(tp.getFontSizeInPt()).thenReturn(12f);
            positions.add(tp);
        }
        return positions;
    }

    @Test
    void testFind_ReturnsPageTextNotNeedle() throws Exception {
        try (PDDocument document = Loader.loadPDF(TestPdfs.create("Patient: Jane Doe"))) {
            List<PiiItem> matches = locator.find(locator.lines(document, 0), "JANE DOE");

            assertEquals(1, matches.size());
            assertEquals("Jane Doe", matches.get(0).getText());
        }
    }

    @Test
    void testFind_BoxesStayAlignedAfterCaseExpandingCharacters() {
        // Given: "İ Jane Doe"; 'İ' lowercases to two chars under Locale.ROOT
        TextLine line = new TextLine();
        line.addWord(glyphs("İ", 72));
        line.addSeparator();
        line.addWord(glyphs("Jane", 84));
        line.addSeparator();
        line.addWord(glyphs("Doe", 114));

        // When
        List<PiiItem> matches = locator.find(List.of(line), "jane doe");

        // Then
        assertEquals(1, matches.size());
        assertEquals("Jane Doe", matches.get(0).getText());
        List<Double> bbox = matches.get(0).getBbox();
        assertEquals(84.0, bbox.get(0), 0.001);
        assertEquals(114.0 + 3 * GLYPH_WIDTH, bbox.get(2), 0.001);
    }

    @Test
    void testFind_EveryOccurrenceAndBlankNeedle() throws Exception {
        try (PDDocument document = Loader.loadPDF(TestPdfs.create("ref 4411 and 4411\nagain 4411"))) {
            List<TextLine> lines = locator.lines(document, 0);

            assertEquals(3, locator.find(lines, "4411").size());
            assertTrue(locator.find(lines, "  ").isEmpty());
            assertTrue(locator.find(lines, null).isEmpty());
        }
    }
}
