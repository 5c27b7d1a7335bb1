package com.example.docredact.engine;

import com.example.docredact.model.PiiItem;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Produces the redacted artifact: every page is rasterized, boxes are painted black, and the
 * images become the pages of a new PDF. The source text layer does not survive.
 * Output pages keep the source page size so recorded boxes stay valid for restoration.
 */
@Component
public class PdfRedactionWriter {

    private static final Logger logger = LoggerFactory.getLogger(PdfRedactionWriter.class);

    @Value("${app.redaction.render-dpi:150}")
    private float renderDpi;

    public void write(PDDocument source, Map<String, List<PiiItem>> items, Path artifact) throws IOException {
        float dpi = renderDpi > 0 ? renderDpi : 150f;
        double scale = dpi / 72.0;
        PDFRenderer renderer = new PDFRenderer(source);

        try (PDDocument target = new PDDocument()) {
            for (int i = 0; i < source.getNumberOfPages(); i++) {
                BufferedImage image = renderer.renderImageWithDPI(i, dpi, ImageType.RGB);
                List<PiiItem> pageItems = items.getOrDefault(String.valueOf(i), List.of());

                Graphics2D g = image.createGraphics();
                try {
                    g.setColor(Color.BLACK);
                    for (PiiItem item : pageItems) {
                        List<Double> b = item.getBbox();
                        int x = (int) Math.floor(b.get(0) * scale);
                        int y = (int) Math.floor(b.get(1) * scale);
                        int w = (int) Math.ceil((b.get(2) - b.get(0)) * scale);
                        int h = (int) Math.ceil((b.get(3) - b.get(1)) * scale);
                        g.fillRect(x, y, w, h);
                    }
                } finally {
                    g.dispose();
                }

                float width = (float) (image.getWidth() / scale);
                float height = (float) (image.getHeight() / scale);
                PDPage page = new PDPage(new PDRectangle(width, height));
                target.addPage(page);
                PDImageXObject xObject = LosslessFactory.createFromImage(target, image);
                try (PDPageContentStream cs = new PDPageContentStream(target, page)) {
                    cs.drawImage(xObject, 0, 0, width, height);
                }
                logger.debug("Rasterized page {} with {} redaction boxes", i, pageItems.size());
            }
            target.save(artifact.toFile());
        }
    }
}
