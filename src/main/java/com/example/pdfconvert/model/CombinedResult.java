package com.example.pdfconvert.model;

import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Output of one conversion: the engine's recognized text paired with the page images.
 * The two parts are only related by position; page images are kept in page order.
 */
@Value
public class CombinedResult {
    String documentId;
    String recognizedText;
    String engineUsed;
    double confidence;
    Duration processingTime;
    List<PageImage> pageImages;

    public CombinedResult(String documentId, String recognizedText, String engineUsed,
                          double confidence, Duration processingTime, List<PageImage> pageImages) {
        this.documentId = documentId;
        this.recognizedText = recognizedText;
        this.engineUsed = engineUsed;
        this.confidence = confidence;
        this.processingTime = processingTime;
        this.pageImages = List.copyOf(pageImages);
    }

    public int getPageCount() {
        return pageImages.size();
    }
}
