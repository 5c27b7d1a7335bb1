package com.example.docredact.kv;

import java.time.Duration;
import java.util.Optional;

/**
 * Expiring key-value custody for encrypted session payloads.
 * An absent value means "never stored or already expired"; the two cases are not distinguished.
 */
public interface MetadataStore {
    Optional<String> get(String documentId);
    void put(String documentId, String payload, Duration ttl);
    Optional<Duration> ttl(String documentId);
}
