package com.example.pdfconvert.service.ocr;

import com.example.pdfconvert.dto.ocr.EngineInfo;
import com.example.pdfconvert.dto.ocr.RecognitionResult;
import com.example.pdfconvert.dto.ocr.StructuredRecognitionResult;

/**
 * Text recognition capability. Implementations must keep every reported confidence in [0, 1].
 */
public interface RecognitionEngine {

    /**
     * Extract plain text from a single image.
     *
     * @param imageBytes encoded image (PNG, JPEG)
     * @param context cancellation and deadline for the call
     */
    RecognitionResult extractText(byte[] imageBytes, CallContext context);

    /**
     * Extract text with block, table and layout detection.
     *
     * @param documentTypeHint advisory only (e.g. "typed", "handwritten", "math"); may be null
     */
    StructuredRecognitionResult extractStructuredText(byte[] imageBytes, String documentTypeHint, CallContext context);

    /**
     * Recognize a whole PDF in one request.
     */
    RecognitionResult processPdf(byte[] pdfBytes, CallContext context);

    /**
     * Static description of this engine. Performs no I/O.
     */
    EngineInfo info();

    default RecognitionResult extractText(byte[] imageBytes) {
        return extractText(imageBytes, CallContext.background());
    }

    default StructuredRecognitionResult extractStructuredText(byte[] imageBytes, String documentTypeHint) {
        return extractStructuredText(imageBytes, documentTypeHint, CallContext.background());
    }

    default RecognitionResult processPdf(byte[] pdfBytes) {
        return processPdf(pdfBytes, CallContext.background());
    }
}
