package com.example.docredact.engine;

import org.apache.pdfbox.text.TextPosition;

import java.util.ArrayList;
import java.util.List;

/**
 * One visual line of a page's text layer. Each character of {@link #getText()} maps back to the
 * glyph it came from; word separators map to {@code null}.
 */
public class TextLine {

    private final StringBuilder text = new StringBuilder();
    private final List<TextPosition> glyphs = new ArrayList<>();

    void addWord(List<TextPosition> positions) {
        for (TextPosition position : positions) {
            String unicode = position.getUnicode();
            if (unicode == null) continue;
            for (int i = 0; i < unicode.length(); i++) {
                text.append(unicode.charAt(i));
                glyphs.add(position);
            }
        }
    }

    void addSeparator() {
        text.append(' ');
        glyphs.add(null);
    }

    boolean isEmpty() {
        return text.length() == 0;
    }

    public String getText() {
        return text.toString();
    }

    /**
     * Bounding box of characters [start, end) as [x0, y0, x1, y1], top-left origin, in points.
     * Returns null when the range holds no glyph.
     */
    public List<Double> bbox(int start, int end) {
        double x0 = Double.MAX_VALUE, y0 = Double.MAX_VALUE, x1 = -Double.MAX_VALUE, y1 = -Double.MAX_VALUE;
        boolean any = false;
        for (int i = Math.max(0, start); i < Math.min(end, glyphs.size()); i++) {
            TextPosition tp = glyphs.get(i);
            if (tp == null) continue;
            any = true;
            float size = tp.getFontSizeInPt() > 0 ? tp.getFontSizeInPt() : tp.getHeightDir();
            double ascent = Math.max(tp.getHeightDir(), size * 0.8f);
            x0 = Math.min(x0, tp.getXDirAdj());
            x1 = Math.max(x1, tp.getXDirAdj() + tp.getWidthDirAdj());
            y0 = Math.min(y0, tp.getYDirAdj() - ascent);
            y1 = Math.max(y1, tp.getYDirAdj() + size * 0.2);
        }
        if (!any) return null;
        return List.of(x0, y0, x1, y1);
    }
}
