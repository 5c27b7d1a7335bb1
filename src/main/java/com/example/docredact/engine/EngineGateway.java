package com.example.docredact.engine;

import com.example.docredact.model.PiiItem;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single entry point over the redaction engines. The caller picks the variant; detection is
 * delegated to it and the artifact is always written here, so either variant yields the same
 * kind of artifact and the same item structure.
 */
@Component
public class EngineGateway {

    private static final Logger logger = LoggerFactory.getLogger(EngineGateway.class);

    public static final int MIN_SEVERITY = 1;
    public static final int MAX_SEVERITY = 3;
    static final String PDF_MEDIA_TYPE = "application/pdf";

    private final Map<EngineVariant, RedactionEngine> engines = new EnumMap<>(EngineVariant.class);
    private final PdfRedactionWriter redactionWriter;
    private final Tika tika = new Tika();

    public EngineGateway(List<RedactionEngine> engines, PdfRedactionWriter redactionWriter) {
        for (RedactionEngine engine : engines) {
            this.engines.put(engine.variant(), engine);
        }
        this.redactionWriter = redactionWriter;
    }

    public Set<EngineVariant> variants() {
        return engines.keySet();
    }

    public static int clampSeverity(int severity) {
        return Math.max(MIN_SEVERITY, Math.min(MAX_SEVERITY, severity));
    }

    /**
     * Redacts {@code document} into {@code artifact}. Either the artifact is complete and
     * returned with the extracted items, or it does not exist and an {@link EngineFailureException} is thrown.
     */
    public RedactionResult redact(EngineVariant variant, Path document, int severity, Path artifact) throws EngineFailureException {
        RedactionEngine engine = engines.get(variant);
        if (engine == null) {
            throw new EngineFailureException("No redaction engine registered for " + variant);
        }
        int level = clampSeverity(severity);

        try {
            String mediaType = tika.detect(document);
            if (!PDF_MEDIA_TYPE.equals(mediaType)) {
                throw new EngineFailureException("Unsupported document format: " + mediaType);
            }
            try (PDDocument pdf = Loader.loadPDF(document.toFile())) {
                Map<String, List<PiiItem>> items = engine.detect(pdf, level);
                RedactionResult result = new RedactionResult(artifact, items);
                if (result.hasItems()) {
                    redactionWriter.write(pdf, items, artifact);
                } else {
                    Files.copy(document, artifact);
                }
                logger.info("Engine {} redacted {} items across {} pages (severity {})",
                        variant, result.itemCount(), pdf.getNumberOfPages(), level);
                return result;
            }
        } catch (EngineFailureException e) {
            discard(artifact);
            throw e;
        } catch (IOException e) {
            discard(artifact);
            throw new EngineFailureException("Could not process document: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            discard(artifact);
            throw new EngineFailureException("Redaction engine " + variant + " failed: " + e.getMessage(), e);
        }
    }

    private void discard(Path artifact) {
        try {
            Files.deleteIfExists(artifact);
        } catch (IOException e) {
            logger.warn("Could not remove partial artifact {}", artifact, e);
        }
    }
}
