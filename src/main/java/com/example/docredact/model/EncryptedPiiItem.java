package com.example.docredact.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EncryptedPiiItem {
    @JsonProperty("encrypted_text")
    private String encryptedText;
    private List<Double> bbox;
}
