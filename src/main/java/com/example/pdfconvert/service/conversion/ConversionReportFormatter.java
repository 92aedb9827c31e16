package com.example.pdfconvert.service.conversion;

import com.example.pdfconvert.dto.ConversionResponse;
import com.example.pdfconvert.dto.ImageContent;
import com.example.pdfconvert.model.CombinedResult;
import com.example.pdfconvert.model.PageImage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link CombinedResult} as the text block and page images handed to an LLM host
 * for refinement.
 */
@Component
public class ConversionReportFormatter {

    public ConversionResponse toResponse(CombinedResult result) {
        List<ImageContent> images = new ArrayList<>(result.getPageCount());
        for (PageImage page : result.getPageImages()) {
            images.add(ImageContent.from(page));
        }
        long millis = result.getProcessingTime() != null ? result.getProcessingTime().toMillis() : 0L;
        return new ConversionResponse(result.getDocumentId(), formatReport(result), result.getEngineUsed(),
                result.getConfidence(), millis, result.getPageCount(), images);
    }

    public String formatReport(CombinedResult result) {
        String text = result.getRecognizedText() != null ? result.getRecognizedText() : "";
        long millis = result.getProcessingTime() != null ? result.getProcessingTime().toMillis() : 0L;
        StringBuilder report = new StringBuilder();
        report.append("# PDF Conversion Results\n\n");
        report.append("## OCR Output\n");
        report.append(text).append("\n\n");
        report.append("## Processing Info\n");
        report.append("- Engine: ").append(result.getEngineUsed()).append('\n');
        report.append("- Confidence: ").append(String.format(Locale.ROOT, "%.2f", result.getConfidence())).append('\n');
        report.append("- Processing time: ").append(millis).append(" ms\n");
        report.append("- Pages converted: ").append(result.getPageCount()).append("\n\n");
        report.append("## Instructions for LLM Refinement\n");
        report.append("The above is the OCR output. You also have access to the PNG images of each page below.\n");
        report.append("Please review both the OCR text and the images to create the most accurate Markdown conversion.\n");
        report.append("Correct any OCR errors you can identify by comparing with the visual images.\n");
        return report.toString();
    }
}
