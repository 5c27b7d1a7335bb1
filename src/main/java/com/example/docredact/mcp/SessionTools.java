package com.example.docredact.mcp;

import com.example.docredact.kv.MetadataStore;
import com.example.docredact.kv.StoreUnavailableException;
import com.example.docredact.model.DecryptionResponse;
import com.example.docredact.service.DecryptionService;
import com.example.docredact.service.ServiceResult;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Service
public class SessionTools {

    private final MetadataStore metadataStore;
    private final DecryptionService decryptionService;

    public SessionTools(MetadataStore metadataStore, DecryptionService decryptionService) {
        this.metadataStore = metadataStore;
        this.decryptionService = decryptionService;
    }

    @Tool(description = "Report whether a redaction session can still be decrypted and for how many seconds")
    public Map<String,Object> redaction_sessionStatus(String documentId) {
        Map<String, Object> result = new HashMap<>();
        result.put("documentId", documentId);
        try {
            Long ttlSec = metadataStore.ttl(documentId).map(Duration::toSeconds).orElse(null);
            result.put("active", ttlSec != null);
            result.put("ttlSec", ttlSec);
        } catch (StoreUnavailableException e) {
            result.put("error", Map.of("kind", "STORE_UNAVAILABLE", "message", "Metadata store is unavailable."));
        }
        return result;
    }

    @Tool(description = "Decrypt the redacted items of a session with its one-time key; returns page to items with bounding boxes")
    public Map<String,Object> redaction_decrypt(String documentId, String decryptionKey) {
        ServiceResult<DecryptionResponse> result = decryptionService.decrypt(documentId, decryptionKey);
        if (!result.isSuccess()) {
            return result.errorBody();
        }
        return Map.of(
                "documentId", result.getValue().getDocumentId(),
                "pages", result.getValue().getPages()
        );
    }
}
