package com.example.docredact.service;

import com.example.docredact.crypto.KeyManager;
import com.example.docredact.crypto.PiiCipher;
import com.example.docredact.engine.EngineFailureException;
import com.example.docredact.engine.EngineGateway;
import com.example.docredact.engine.EngineVariant;
import com.example.docredact.engine.RedactionResult;
import com.example.docredact.kv.MetadataStore;
import com.example.docredact.kv.StoreUnavailableException;
import com.example.docredact.model.EncryptedPages;
import com.example.docredact.model.EncryptedPiiItem;
import com.example.docredact.model.PiiItem;
import com.example.docredact.model.RedactedDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;

/**
 * Runs one redaction request end to end and issues its decrypt ticket.
 *
 * <p>Nothing is written to the store until the engine has produced a complete artifact and every
 * item has been encrypted, so a failed request leaves no session behind and returns no id.
 */
@Service
public class SessionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SessionOrchestrator.class);

    static final String ARTIFACT_MEDIA_TYPE = "application/pdf";

    private final EngineGateway engineGateway;
    private final KeyManager keyManager;
    private final PiiCipher piiCipher;
    private final MetadataStore metadataStore;
    private final ObjectMapper objectMapper;
    private final ExecutorService engineExecutor;

    @Value("${app.redaction.ttl-seconds:86400}")
    private long ttlSeconds;

    @Value("${app.redaction.engine-timeout-ms:120000}")
    private long engineTimeoutMs;

    @Value("${app.redaction.temp-dir:${java.io.tmpdir}/doc-redact}")
    private String tempDir;

    public SessionOrchestrator(EngineGateway engineGateway, KeyManager keyManager, PiiCipher piiCipher,
                               MetadataStore metadataStore, ObjectMapper objectMapper,
                               @Value("${app.redaction.engine-threads:4}") int engineThreads) {
        this.engineGateway = engineGateway;
        this.keyManager = keyManager;
        this.piiCipher = piiCipher;
        this.metadataStore = metadataStore;
        this.objectMapper = objectMapper;
        this.engineExecutor = Executors.newFixedThreadPool(Math.max(1, engineThreads), r -> {
            Thread t = new Thread(r, "redaction-engine");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        engineExecutor.shutdownNow();
    }

    public ServiceResult<RedactedDocument> redact(EngineVariant variant, String fileName, byte[] content, int severity) {
        if (content == null || content.length == 0) {
            return ServiceResult.failure(ErrorKind.INVALID_REQUEST, "Uploaded file is empty.");
        }
        long started = System.nanoTime();
        String safeName = TempWorkspace.safeName(fileName);

        try (TempWorkspace workspace = TempWorkspace.create(Path.of(tempDir))) {
            Path input = workspace.write(safeName, content);
            Path artifact = workspace.file("redacted_", safeName);

            RedactionResult result = runEngine(variant, input, severity, artifact);
            byte[] redacted = Files.readAllBytes(result.getArtifact());

            String documentId = UUID.randomUUID().toString();
            String encodedKey = null;
            if (result.hasItems()) {
                SecretKey key = keyManager.generate();
                EncryptedPages pages = encryptPages(key, result.getItems());
                metadataStore.put(documentId, objectMapper.writeValueAsString(pages), Duration.ofSeconds(ttlSeconds));
                encodedKey = keyManager.encode(key);
            }

            logger.info("Redaction session {} issued: engine={}, items={}, stored={}, took {}ms",
                    documentId, variant, result.itemCount(), encodedKey != null,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));

            return ServiceResult.success(RedactedDocument.builder()
                    .documentId(documentId)
                    .encodedKey(encodedKey)
                    .fileName("redacted_" + safeName)
                    .contentType(ARTIFACT_MEDIA_TYPE)
                    .content(redacted)
                    .itemCount(result.itemCount())
                    .build());
        } catch (EngineFailureException e) {
            logger.warn("Redaction with engine {} failed: {}", variant, e.getMessage());
            return ServiceResult.failure(ErrorKind.ENGINE_FAILURE, "An error occurred: " + e.getMessage());
        } catch (StoreUnavailableException e) {
            logger.error("Redaction session could not be stored", e);
            return ServiceResult.failure(ErrorKind.STORE_UNAVAILABLE, "Metadata store is unavailable.");
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize encrypted pages", e);
            return ServiceResult.failure(ErrorKind.ENGINE_FAILURE, "An error occurred while preparing the session.");
        } catch (IOException e) {
            logger.error("Failed to stage document for redaction", e);
            return ServiceResult.failure(ErrorKind.ENGINE_FAILURE, "An error occurred while staging the document.");
        } catch (RuntimeException e) {
            logger.error("Redaction with engine {} failed unexpectedly", variant, e);
            return ServiceResult.failure(ErrorKind.ENGINE_FAILURE, "An error occurred while issuing the session.");
        }
    }

    private RedactionResult runEngine(EngineVariant variant, Path input, int severity, Path artifact) throws EngineFailureException {
        Future<RedactionResult> task;
        try {
            task = engineExecutor.submit(() -> engineGateway.redact(variant, input, severity, artifact));
        } catch (RejectedExecutionException e) {
            throw new EngineFailureException("Redaction engine is not accepting work", e);
        }

        try {
            return task.get(engineTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw new EngineFailureException("Redaction engine timed out after " + engineTimeoutMs + "ms", e);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new EngineFailureException("Redaction was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EngineFailureException) {
                throw (EngineFailureException) cause;
            }
            throw new EngineFailureException("Redaction engine failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Every item is encrypted on its own, so one item's ciphertext never depends on another's.
     */
    private EncryptedPages encryptPages(SecretKey key, Map<String, List<PiiItem>> items) {
        Map<String, List<EncryptedPiiItem>> pages = new LinkedHashMap<>();
        for (Map.Entry<String, List<PiiItem>> page : items.entrySet()) {
            if (page.getValue().isEmpty()) continue;
            List<EncryptedPiiItem> encrypted = new ArrayList<>(page.getValue().size());
            for (PiiItem item : page.getValue()) {
                encrypted.add(EncryptedPiiItem.builder()
                        .encryptedText(piiCipher.encrypt(key, item.getText()))
                        .bbox(item.getBbox())
                        .build());
            }
            pages.put(page.getKey(), encrypted);
        }
        return EncryptedPages.builder().pages(pages).build();
    }
}
