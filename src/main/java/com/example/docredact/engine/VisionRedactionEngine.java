package com.example.docredact.engine;

import com.example.docredact.model.PiiItem;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.*;

/**
 * Accurate engine: each page is rendered and shown to a multimodal model, which names the
 * sensitive strings. Strings are placed using the PDF text layer where possible, otherwise
 * with the box the model reports.
 */
@Component
public class VisionRedactionEngine implements RedactionEngine {

    private static final Logger logger = LoggerFactory.getLogger(VisionRedactionEngine.class);

    static final double MODEL_BOX_SCALE = 1000.0;

    private static final String[] SEVERITY_CATEGORIES = {
            "government identifiers (social security, passport, national ID numbers), payment card numbers, bank account and IBAN numbers",
            "email addresses, phone numbers, IP addresses, driver's licence numbers, street addresses",
            "person names, dates of birth and other dates tied to a person, signatures, any other personal data"
    };

    private final VisionModelClient modelClient;
    private final PdfTextLocator textLocator;
    private final ObjectMapper objectMapper;

    @Value("${app.redaction.render-dpi:150}")
    private float renderDpi;

    public VisionRedactionEngine(VisionModelClient modelClient, PdfTextLocator textLocator, ObjectMapper objectMapper) {
        this.modelClient = modelClient;
        this.textLocator = textLocator;
        this.objectMapper = objectMapper;
    }

    @Override
    public EngineVariant variant() {
        return EngineVariant.VISION;
    }

    @Override
    public Map<String, List<PiiItem>> detect(PDDocument document, int severity) throws EngineFailureException {
        float dpi = renderDpi > 0 ? renderDpi : 150f;
        double scale = dpi / 72.0;
        PDFRenderer renderer = new PDFRenderer(document);
        String instructions = buildInstructions(severity);
        Map<String, List<PiiItem>> pages = new LinkedHashMap<>();

        for (int i = 0; i < document.getNumberOfPages(); i++) {
            BufferedImage image;
            byte[] png;
            List<TextLine> lines;
            try {
                image = renderer.renderImageWithDPI(i, dpi, ImageType.RGB);
                png = toPng(image);
                lines = textLocator.lines(document, i);
            } catch (IOException e) {
                throw new EngineFailureException("Failed to render page " + i + ": " + e.getMessage(), e);
            }

            String answer;
            try {
                answer = modelClient.analyze(png, instructions);
            } catch (RuntimeException e) {
                throw new EngineFailureException("Vision model unavailable: " + e.getMessage(), e);
            }

            double pageWidth = image.getWidth() / scale;
            double pageHeight = image.getHeight() / scale;
            List<PiiItem> items = locate(parseAnswer(answer, i), lines, pageWidth, pageHeight);
            if (!items.isEmpty()) {
                pages.put(String.valueOf(i), items);
            }
            logger.debug("Vision detection on page {}: {} items", i, items.size());
        }
        return pages;
    }

    String buildInstructions(int severity) {
        StringBuilder categories = new StringBuilder();
        for (int level = 0; level < Math.min(severity, SEVERITY_CATEGORIES.length); level++) {
            categories.append("- ").append(SEVERITY_CATEGORIES[level]).append('\n');
        }
        return "You are a document redaction assistant. Find every piece of text on this page image that belongs to one of these categories:\n"
                + categories
                + "Use the exact text as it appears on the page. For each item give its bounding box as [x0, y0, x1, y1] "
                + "with coordinates normalised to 0-1000 relative to the image width and height, origin top-left.\n"
                + "Return ONLY valid JSON of the form {\"items\": [{\"text\": \"...\", \"category\": \"...\", \"box\": [x0, y0, x1, y1]}]}. "
                + "Return {\"items\": []} when nothing qualifies. Do not include explanations.";
    }

    List<JsonNode> parseAnswer(String answer, int pageIndex) throws EngineFailureException {
        if (answer == null || answer.isBlank()) {
            return List.of();
        }
        String json = answer.trim();
        if (json.startsWith("```")) {
            int firstNewline = json.indexOf('\n');
            int lastFence = json.lastIndexOf("```");
            json = firstNewline >= 0 && lastFence > firstNewline ? json.substring(firstNewline + 1, lastFence) : json;
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode items = root.isArray() ? root : root.path("items");
            List<JsonNode> result = new ArrayList<>();
            items.forEach(result::add);
            return result;
        } catch (IOException e) {
            throw new EngineFailureException("Vision model returned unparseable output for page " + pageIndex, e);
        }
    }

    private List<PiiItem> locate(List<JsonNode> found, List<TextLine> lines, double pageWidth, double pageHeight) {
        List<PiiItem> items = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode node : found) {
            String text = node.path("text").asText("").trim();
            if (text.isEmpty()) continue;

            List<PiiItem> placed = textLocator.find(lines, text);
            if (placed.isEmpty()) {
                List<Double> modelBox = modelBox(node.path("box"), pageWidth, pageHeight);
                if (modelBox != null) placed = List.of(PiiItem.builder().text(text).bbox(modelBox).build());
            }
            if (placed.isEmpty()) {
                logger.warn("Vision model reported an item that could not be placed on the page");
                continue;
            }
            for (PiiItem item : placed) {
                if (seen.add(item.getText() + "@" + item.getBbox())) {
                    items.add(item);
                }
            }
        }
        return items;
    }

    private List<Double> modelBox(JsonNode box, double pageWidth, double pageHeight) {
        if (!box.isArray() || box.size() != 4) return null;
        double x0 = clamp(box.get(0).asDouble()), y0 = clamp(box.get(1).asDouble());
        double x1 = clamp(box.get(2).asDouble()), y1 = clamp(box.get(3).asDouble());
        if (x1 <= x0 || y1 <= y0) return null;
        return List.of(
                x0 / MODEL_BOX_SCALE * pageWidth,
                y0 / MODEL_BOX_SCALE * pageHeight,
                x1 / MODEL_BOX_SCALE * pageWidth,
                y1 / MODEL_BOX_SCALE * pageHeight);
    }

    private static double clamp(double v) {
        return Math.max(0, Math.min(MODEL_BOX_SCALE, v));
    }

    private static byte[] toPng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
