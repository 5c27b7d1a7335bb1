package com.example.docredact.model;

import lombok.*;

import java.util.List;
import java.util.Map;

/**
 * The stored form of a redaction session, keyed by page index.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EncryptedPages {
    private Map<String, List<EncryptedPiiItem>> pages;
}
