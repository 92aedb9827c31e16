package com.example.pdfconvert.dto.ocr;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecognitionResult {
    private String text;
    private double confidence; // 0.0 - 1.0
    private String language; // comma separated when several
    private String engine;
    private Duration processingTime;
}
