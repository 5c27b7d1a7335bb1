package com.example.docredact.service;

import com.example.docredact.crypto.KeyManager;
import com.example.docredact.crypto.PiiCipher;
import com.example.docredact.engine.*;
import com.example.docredact.model.DecryptionResponse;
import com.example.docredact.model.PiiItem;
import com.example.docredact.model.RedactedDocument;
import com.example.docredact.model.RestoredDocument;
import com.example.docredact.support.InMemoryMetadataStore;
import com.example.docredact.support.TestPdfs;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Redact, then decrypt or restore, through the real rule-based engine and PDF tooling.
 */
class RestorationServiceTest {

    @TempDir
    Path tempRoot;

    private final KeyManager keyManager = new KeyManager();
    private final PiiCipher piiCipher = new PiiCipher();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private InMemoryMetadataStore store;
    private SessionOrchestrator orchestrator;
    private DecryptionService decryptionService;
    private RestorationService restorationService;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetadataStore();
        PdfTextLocator locator = new PdfTextLocator();
        VisionModelClient modelClient = (png, instructions) ->
                "```json\n{\"items\": [{\"text\": \"JANE DOE\", \"category\": \"PERSON_NAME\", \"box\": [100, 80, 200, 100]}]}\n```";
        EngineGateway gateway = new EngineGateway(List.of(
                new RuleBasedRedactionEngine(locator),
                new VisionRedactionEngine(modelClient, locator, objectMapper)), new PdfRedactionWriter());
        orchestrator = new SessionOrchestrator(gateway, keyManager, piiCipher, store, objectMapper, 2);
        ReflectionTestUtils.setField(orchestrator, "ttlSeconds", 86400L);
        ReflectionTestUtils.setField(orchestrator, "engineTimeoutMs", 30000L);
        ReflectionTestUtils.setField(orchestrator, "tempDir", tempRoot.toString());
        decryptionService = new DecryptionService(store, keyManager, piiCipher, objectMapper);
        restorationService = new RestorationService(decryptionService, new PdfTextRestorer());
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private RedactedDocument redactSample() throws Exception {
        byte[] original = TestPdfs.create("Applicant record\nSSN: 123-45-6789\nEmail: jane@example.com");
        ServiceResult<RedactedDocument> result = orchestrator.redact(EngineVariant.RULE_BASED, "applicant.pdf", original, 2);
        assertTrue(result.isSuccess(), result.getMessage());
        return result.getValue();
    }

    @Test
    void testRedactThenRestore_TextReturnsAtItsBoxes() throws Exception {
        // Given
        RedactedDocument redacted = redactSample();
        String redactedText = TestPdfs.text(redacted.getContent());
        assertFalse(redactedText.contains("123-45-6789"));

        // When
        ServiceResult<RestoredDocument> result = restorationService.restore(
                redacted.getDocumentId(), redacted.getEncodedKey(), redacted.getFileName(), redacted.getContent());

        // Then
        assertTrue(result.isSuccess(), result.getMessage());
        RestoredDocument restored = result.getValue();
        assertEquals("restored_applicant.pdf", restored.getFileName());
        String text = TestPdfs.text(restored.getContent());
        assertTrue(text.contains("123-45-6789"));
        assertTrue(text.contains("jane@example.com"));
        assertEachItemSitsInItsBox(redacted, restored.getContent());
    }

    @Test
    void testRedactThenDecrypt_ReturnsExtractedItems() throws Exception {
        RedactedDocument redacted = redactSample();

        ServiceResult<DecryptionResponse> result = decryptionService.decrypt(redacted.getDocumentId(), redacted.getEncodedKey());

        assertTrue(result.isSuccess());
        List<PiiItem> items = result.getValue().getPages().get("0");
        assertEquals(List.of("123-45-6789", "jane@example.com"), items.stream().map(PiiItem::getText).toList());
    }

    @Test
    void testVisionRedactThenRestore_KeepsPageCasing() throws Exception {
        byte[] original = TestPdfs.create("Patient: Jane Doe\nWard 4");
        ServiceResult<RedactedDocument> redacted = orchestrator.redact(EngineVariant.VISION, "chart.pdf", original, 3);
        assertTrue(redacted.isSuccess(), redacted.getMessage());
        assertFalse(TestPdfs.text(redacted.getValue().getContent()).contains("Jane Doe"));

        ServiceResult<DecryptionResponse> decrypted = decryptionService.decrypt(
                redacted.getValue().getDocumentId(), redacted.getValue().getEncodedKey());
        assertEquals("Jane Doe", decrypted.getValue().getPages().get("0").get(0).getText());

        ServiceResult<RestoredDocument> restored = restorationService.restore(redacted.getValue().getDocumentId(),
                redacted.getValue().getEncodedKey(), redacted.getValue().getFileName(), redacted.getValue().getContent());
        assertTrue(restored.isSuccess(), restored.getMessage());
        assertTrue(TestPdfs.text(restored.getValue().getContent()).contains("Jane Doe"));
        assertFalse(TestPdfs.text(restored.getValue().getContent()).contains("JANE DOE"));
        assertEachItemSitsInItsBox(redacted.getValue(), restored.getValue().getContent());
    }

    private void assertEachItemSitsInItsBox(RedactedDocument redacted, byte[] restoredPdf) throws Exception {
        ServiceResult<DecryptionResponse> decrypted = decryptionService.decrypt(redacted.getDocumentId(), redacted.getEncodedKey());
        assertTrue(decrypted.isSuccess());
        assertFalse(decrypted.getValue().getPages().isEmpty());
        for (Map.Entry<String, List<PiiItem>> page : decrypted.getValue().getPages().entrySet()) {
            for (PiiItem item : page.getValue()) {
                assertEquals(item.getText(), TestPdfs.textInBox(restoredPdf, Integer.parseInt(page.getKey()), item.getBbox()),
                        "text drawn at " + item.getBbox());
            }
        }
    }

    @Test
    void testRestore_WrongKey() throws Exception {
        RedactedDocument redacted = redactSample();

        ServiceResult<RestoredDocument> result = restorationService.restore(redacted.getDocumentId(),
                keyManager.encode(keyManager.generate()), redacted.getFileName(), redacted.getContent());

        assertEquals(ErrorKind.DECRYPTION_FAILED, result.getErrorKind());
        assertNull(result.getValue());
    }

    @Test
    void testRestore_MalformedKey() throws Exception {
        RedactedDocument redacted = redactSample();

        ServiceResult<RestoredDocument> result = restorationService.restore(redacted.getDocumentId(),
                "definitely-not-a-key", redacted.getFileName(), redacted.getContent());

        assertEquals(ErrorKind.INVALID_KEY_FORMAT, result.getErrorKind());
    }

    @Test
    void testRestore_AfterExpiry() throws Exception {
        RedactedDocument redacted = redactSample();
        store.advance(Duration.ofSeconds(86400));

        ServiceResult<RestoredDocument> result = restorationService.restore(redacted.getDocumentId(),
                redacted.getEncodedKey(), redacted.getFileName(), redacted.getContent());

        assertEquals(ErrorKind.SESSION_NOT_FOUND, result.getErrorKind());
    }

    @Test
    void testRestore_UnreadableArtifact() throws Exception {
        RedactedDocument redacted = redactSample();

        ServiceResult<RestoredDocument> result = restorationService.restore(redacted.getDocumentId(),
                redacted.getEncodedKey(), "x.pdf", "not a pdf".getBytes(StandardCharsets.US_ASCII));

        assertEquals(ErrorKind.RESTORATION_FAILED, result.getErrorKind());
    }

    @Test
    void testRestore_ArtifactWithTooFewPages() throws Exception {
        store.put("multi", objectMapper.writeValueAsString(Map.of("pages", Map.of("3", List.of(Map.of(
                "encrypted_text", piiCipher.encrypt(keyManager.decode(fixedKey()), "x"),
                "bbox", List.of(1.0, 2.0, 3.0, 4.0)))))), Duration.ofSeconds(60));

        ServiceResult<RestoredDocument> result = restorationService.restore("multi", fixedKey(), "one.pdf",
                TestPdfs.create("single page"));

        assertEquals(ErrorKind.RESTORATION_FAILED, result.getErrorKind());
    }

    @Test
    void testRestoredName() {
        assertEquals("restored_report.pdf", RestorationService.restoredName("redacted_report.pdf"));
        assertEquals("restored_report.pdf", RestorationService.restoredName("report.pdf"));
    }

    private static String fixedKey() {
        return "AAECAwQFBgcICQoLDA0ODxAREhMUFRYXGBkaGxwdHh8=";
    }
}
