package com.example.docredact.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DecryptionResponse {
    @JsonProperty("document_id")
    private String documentId;
    private Map<String, List<PiiItem>> pages;
}
