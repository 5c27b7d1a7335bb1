package com.example.docredact.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DecryptionRequest {
    @JsonProperty("document_id")
    private String documentId;
    @JsonProperty("decryption_key")
    private String decryptionKey;
}
