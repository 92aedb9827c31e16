package com.example.pdfconvert.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DocumentSummary {
    private String id;
    private String name;
    private Long size;
    private Instant modifiedTime;
    private String mimeType;
}
