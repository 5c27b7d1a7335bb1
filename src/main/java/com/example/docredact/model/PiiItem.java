package com.example.docredact.model;

import lombok.*;

import java.util.List;

/**
 * One extracted sensitive string and where it sat on its page: [x0, y0, x1, y1] in PDF points, top-left origin.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PiiItem {
    private String text;
    private List<Double> bbox;
}
