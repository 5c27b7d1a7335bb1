package com.example.docredact.engine;

import com.example.docredact.model.PiiItem;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.*;

/**
 * Fast local engine: pattern detection over the PDF text layer. Scanned pages without a text
 * layer yield nothing.
 */
@Component
public class RuleBasedRedactionEngine implements RedactionEngine {

    private static final Logger logger = LoggerFactory.getLogger(RuleBasedRedactionEngine.class);

    private final PdfTextLocator textLocator;

    public RuleBasedRedactionEngine(PdfTextLocator textLocator) {
        this.textLocator = textLocator;
    }

    @Override
    public EngineVariant variant() {
        return EngineVariant.RULE_BASED;
    }

    @Override
    public Map<String, List<PiiItem>> detect(PDDocument document, int severity) throws EngineFailureException {
        Map<String, List<PiiItem>> pages = new LinkedHashMap<>();
        Map<String, Integer> typeCounts = new TreeMap<>();
        try {
            for (int i = 0; i < document.getNumberOfPages(); i++) {
                List<PiiItem> items = new ArrayList<>();
                for (TextLine line : textLocator.lines(document, i)) {
                    String text = line.getText();
                    for (PiiPatterns.Match match : PiiPatterns.scan(text, severity)) {
                        List<Double> box = line.bbox(match.start, match.end);
                        if (box == null) continue;
                        items.add(PiiItem.builder()
                                .text(text.substring(match.start, match.end))
                                .bbox(box)
                                .build());
                        typeCounts.merge(match.type, 1, Integer::sum);
                    }
                }
                if (!items.isEmpty()) {
                    pages.put(String.valueOf(i), items);
                }
            }
        } catch (IOException e) {
            throw new EngineFailureException("Failed to read the PDF text layer: " + e.getMessage(), e);
        }
        logger.debug("Rule-based detection completed: severity={}, types={}", severity, typeCounts);
        return pages;
    }
}
