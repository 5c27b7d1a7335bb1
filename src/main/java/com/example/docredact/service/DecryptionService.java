package com.example.docredact.service;

import com.example.docredact.crypto.DecryptionFailedException;
import com.example.docredact.crypto.InvalidKeyFormatException;
import com.example.docredact.crypto.KeyManager;
import com.example.docredact.crypto.PiiCipher;
import com.example.docredact.kv.MetadataStore;
import com.example.docredact.kv.StoreUnavailableException;
import com.example.docredact.model.DecryptionResponse;
import com.example.docredact.model.EncryptedPages;
import com.example.docredact.model.EncryptedPiiItem;
import com.example.docredact.model.PiiItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.util.*;

/**
 * Recovers the plaintext items of a session without touching any document.
 * Either every item decrypts or the whole request fails.
 */
@Service
public class DecryptionService {

    private static final Logger logger = LoggerFactory.getLogger(DecryptionService.class);

    private final MetadataStore metadataStore;
    private final KeyManager keyManager;
    private final PiiCipher piiCipher;
    private final ObjectMapper objectMapper;

    public DecryptionService(MetadataStore metadataStore, KeyManager keyManager, PiiCipher piiCipher, ObjectMapper objectMapper) {
        this.metadataStore = metadataStore;
        this.keyManager = keyManager;
        this.piiCipher = piiCipher;
        this.objectMapper = objectMapper;
    }

    public ServiceResult<DecryptionResponse> decrypt(String documentId, String encodedKey) {
        if (documentId == null || documentId.isBlank()) {
            return ServiceResult.failure(ErrorKind.SESSION_NOT_FOUND, "Document ID not found or has expired.");
        }

        Optional<String> payload;
        try {
            payload = metadataStore.get(documentId);
        } catch (StoreUnavailableException e) {
            logger.error("Metadata store read failed for session {}", documentId, e);
            return ServiceResult.failure(ErrorKind.STORE_UNAVAILABLE, "Metadata store is unavailable.");
        }
        if (payload.isEmpty()) {
            logger.debug("Session {} not found or expired", documentId);
            return ServiceResult.failure(ErrorKind.SESSION_NOT_FOUND, "Document ID not found or has expired.");
        }

        SecretKey key;
        try {
            key = keyManager.decode(encodedKey);
        } catch (InvalidKeyFormatException e) {
            return ServiceResult.failure(ErrorKind.INVALID_KEY_FORMAT, "Invalid decryption key format.");
        }

        EncryptedPages encrypted;
        try {
            encrypted = objectMapper.readValue(payload.get(), EncryptedPages.class);
        } catch (JsonProcessingException e) {
            logger.error("Stored payload of session {} is unreadable", documentId);
            return ServiceResult.failure(ErrorKind.DECRYPTION_FAILED, "Decryption failed. The stored session is unreadable.");
        }

        Map<String, List<PiiItem>> pages = new LinkedHashMap<>();
        try {
            Map<String, List<EncryptedPiiItem>> stored = encrypted.getPages() != null ? encrypted.getPages() : Map.of();
            for (Map.Entry<String, List<EncryptedPiiItem>> page : stored.entrySet()) {
                List<PiiItem> items = new ArrayList<>(page.getValue().size());
                for (EncryptedPiiItem item : page.getValue()) {
                    items.add(PiiItem.builder()
                            .text(piiCipher.decrypt(key, item.getEncryptedText()))
                            .bbox(item.getBbox())
                            .build());
                }
                pages.put(page.getKey(), items);
            }
        } catch (DecryptionFailedException e) {
            logger.info("Decryption rejected for session {}", documentId);
            return ServiceResult.failure(ErrorKind.DECRYPTION_FAILED, "Decryption failed. The provided key is incorrect.");
        }

        return ServiceResult.success(DecryptionResponse.builder()
                .documentId(documentId)
                .pages(pages)
                .build());
    }
}
