package com.example.pdfconvert.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversion packet for an LLM host: one text block plus one image per page.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversionResponse {
    private String documentId;
    private String report;
    private String engine;
    private double confidence;
    private long processingTimeMillis;
    private int pageCount;
    private List<ImageContent> images = new ArrayList<>();
}
