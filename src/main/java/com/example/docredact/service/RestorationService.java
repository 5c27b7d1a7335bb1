package com.example.docredact.service;

import com.example.docredact.engine.PdfTextRestorer;
import com.example.docredact.model.DecryptionResponse;
import com.example.docredact.model.RestoredDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Rebuilds an original document from its redacted artifact and the session's stored items.
 * The artifact is not checked against the session; a foreign file only spoils the caller's own result.
 */
@Service
public class RestorationService {

    private static final Logger logger = LoggerFactory.getLogger(RestorationService.class);

    private final DecryptionService decryptionService;
    private final PdfTextRestorer textRestorer;

    public RestorationService(DecryptionService decryptionService, PdfTextRestorer textRestorer) {
        this.decryptionService = decryptionService;
        this.textRestorer = textRestorer;
    }

    public ServiceResult<RestoredDocument> restore(String documentId, String encodedKey, String fileName, byte[] redactedArtifact) {
        ServiceResult<DecryptionResponse> decrypted = decryptionService.decrypt(documentId, encodedKey);
        if (!decrypted.isSuccess()) {
            return ServiceResult.failure(decrypted.getErrorKind(), decrypted.getMessage());
        }
        if (redactedArtifact == null || redactedArtifact.length == 0) {
            return ServiceResult.failure(ErrorKind.INVALID_REQUEST, "Redacted file is empty.");
        }

        try {
            byte[] restored = textRestorer.restore(redactedArtifact, decrypted.getValue().getPages());
            logger.info("Session {} restored", documentId);
            return ServiceResult.success(RestoredDocument.builder()
                    .fileName(restoredName(fileName))
                    .contentType(SessionOrchestrator.ARTIFACT_MEDIA_TYPE)
                    .content(restored)
                    .build());
        } catch (IOException | RuntimeException e) {
            logger.warn("Restoration of session {} failed: {}", documentId, e.getMessage());
            return ServiceResult.failure(ErrorKind.RESTORATION_FAILED,
                    "An error occurred during un-redaction: " + e.getMessage());
        }
    }

    static String restoredName(String fileName) {
        String name = TempWorkspace.safeName(fileName);
        return "restored_" + (name.startsWith("redacted_") ? name.substring("redacted_".length()) : name);
    }
}
