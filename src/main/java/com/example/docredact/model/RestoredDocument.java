package com.example.docredact.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RestoredDocument {
    private String fileName;
    private String contentType;
    private byte[] content;
}
