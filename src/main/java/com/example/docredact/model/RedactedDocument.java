package com.example.docredact.model;

import lombok.*;

/**
 * What a successful redaction hands back to the caller: the artifact plus its decrypt ticket.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RedactedDocument {
    private String documentId;
    private String encodedKey;
    private String fileName;
    private String contentType;
    private byte[] content;
    private int itemCount;
}
