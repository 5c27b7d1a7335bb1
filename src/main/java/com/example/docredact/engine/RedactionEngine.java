package com.example.docredact.engine;

import com.example.docredact.model.PiiItem;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.util.List;
import java.util.Map;

/**
 * Finds the sensitive strings of a PDF and where they sit.
 * Implementations only detect; painting the artifact is shared by {@link EngineGateway}
 * so both variants produce artifacts with identical geometry.
 */
public interface RedactionEngine {

    EngineVariant variant();

    /**
     * @param document loaded source PDF, read-only for the engine
     * @param severity level already clamped to 1..3, higher redacts more categories
     * @return page index (as string) to ordered items; empty when nothing qualifies
     */
    Map<String, List<PiiItem>> detect(PDDocument document, int severity) throws EngineFailureException;
}
