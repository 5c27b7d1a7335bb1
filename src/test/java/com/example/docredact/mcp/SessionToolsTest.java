package com.example.docredact.mcp;

import com.example.docredact.engine.EngineGateway;
import com.example.docredact.engine.EngineVariant;
import com.example.docredact.kv.MetadataStore;
import com.example.docredact.kv.StoreUnavailableException;
import com.example.docredact.model.DecryptionResponse;
import com.example.docredact.model.PiiItem;
import com.example.docredact.service.DecryptionService;
import com.example.docredact.service.ErrorKind;
import com.example.docredact.service.ServiceResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionToolsTest {

    @Mock
    private MetadataStore metadataStore;

    @Mock
    private DecryptionService decryptionService;

    private SessionTools sessionTools;

    @BeforeEach
    void setUp() {
        sessionTools = new SessionTools(metadataStore, decryptionService);
    }

    @Test
    void testSessionStatus_Active() {
        when(metadataStore.ttl("doc-1")).thenReturn(Optional.of(Duration.ofSeconds(3600)));

        Map<String, Object> status = sessionTools.redaction_sessionStatus("doc-1");

        assertEquals("doc-1", status.get("documentId"));
        assertEquals(true, status.get("active"));
        assertEquals(3600L, status.get("ttlSec"));
    }

    @Test
    void testSessionStatus_Expired() {
        when(metadataStore.ttl("gone")).thenReturn(Optional.empty());

        Map<String, Object> status = sessionTools.redaction_sessionStatus("gone");

        assertEquals(false, status.get("active"));
        assertNull(status.get("ttlSec"));
    }

    @Test
    void testSessionStatus_StoreDown() {
        when(metadataStore.ttl("doc-1")).thenThrow(new StoreUnavailableException("down", null));

        Map<String, Object> status = sessionTools.redaction_sessionStatus("doc-1");

        assertTrue(status.containsKey("error"));
        assertFalse(status.containsKey("active"));
    }

    @Test
    void testDecrypt_PassesThroughPages() {
        Map<String, List<PiiItem>> pages = Map.of("0", List.of(new PiiItem("jane@example.com", List.of(1.0, 2.0, 3.0, 4.0))));
        when(decryptionService.decrypt("doc-1", "k")).thenReturn(ServiceResult.success(
                DecryptionResponse.builder().documentId("doc-1").pages(pages).build()));

        Map<String, Object> result = sessionTools.redaction_decrypt("doc-1", "k");

        assertEquals("doc-1", result.get("documentId"));
        assertEquals(pages, result.get("pages"));
    }

    @Test
    void testDecrypt_FailureIsErrorBody() {
        when(decryptionService.decrypt("doc-1", "bad"))
                .thenReturn(ServiceResult.failure(ErrorKind.INVALID_KEY_FORMAT, "Invalid decryption key format."));

        Map<String, Object> result = sessionTools.redaction_decrypt("doc-1", "bad");

        assertEquals(true, result.get("isError"));
        @SuppressWarnings("unchecked")
        Map<String, Object> error = (Map<String, Object>) result.get("error");
        assertEquals("INVALID_KEY_FORMAT", error.get("kind"));
    }

    @Test
    void testCapabilities_ListsRegisteredEngines() {
        EngineGateway gateway = mock(EngineGateway.class);
        when(gateway.variants()).thenReturn(EnumSet.allOf(EngineVariant.class));

        Map<String, Object> caps = new CapabilitiesTools(gateway, 86400L).capabilities_list();

        assertEquals(List.of("RULE_BASED", "VISION"), caps.get("engines"));
        assertEquals(86400L, caps.get("sessionTtlSec"));
    }
}
