package com.example.pdfconvert.service.conversion;

import com.example.pdfconvert.dto.ocr.RecognitionResult;
import com.example.pdfconvert.exception.DecodeException;
import com.example.pdfconvert.exception.EngineNotFoundException;
import com.example.pdfconvert.exception.EngineUnavailableException;
import com.example.pdfconvert.model.CombinedResult;
import com.example.pdfconvert.model.PageImage;
import com.example.pdfconvert.service.document.DocumentSource;
import com.example.pdfconvert.service.ocr.CallContext;
import com.example.pdfconvert.service.ocr.EngineRegistry;
import com.example.pdfconvert.service.ocr.MathpixRecognitionEngine;
import com.example.pdfconvert.service.ocr.RecognitionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Converts a stored PDF into page images plus recognized text.
 * <p>
 * Steps run in order: fetch bytes, rasterize, resolve the OCR engine, recognize the whole PDF,
 * assemble the result. Any failing step fails the conversion; there is no partial result.
 */
@Service
public class ConversionOrchestrationService {

    private static final Logger logger = LoggerFactory.getLogger(ConversionOrchestrationService.class);

    public static final float DEFAULT_DPI = 150f;

    private final DocumentSource documentSource;
    private final PdfRasterizer rasterizer;
    private final EngineRegistry engineRegistry;
    private final float dpi;
    private final String engineName;

    public ConversionOrchestrationService(DocumentSource documentSource,
                                          PdfRasterizer rasterizer,
                                          EngineRegistry engineRegistry,
                                          @Value("${conversion.dpi:150}") float dpi,
                                          @Value("${conversion.engine:" + MathpixRecognitionEngine.ENGINE_NAME + "}") String engineName) {
        this.documentSource = documentSource;
        this.rasterizer = rasterizer;
        this.engineRegistry = engineRegistry;
        this.dpi = dpi > 0 ? dpi : DEFAULT_DPI;
        this.engineName = engineName;
    }

    public CombinedResult convert(String documentId) {
        return convert(documentId, CallContext.background());
    }

    public CombinedResult convert(String documentId, CallContext context) {
        long start = System.currentTimeMillis();
        logger.info("Starting conversion for document {}", documentId);

        // Step 1: PDF content
        byte[] pdfContent = documentSource.fetch(documentId);
        logger.debug("Document {}: fetched {} bytes", documentId, pdfContent.length);

        // Step 2: page images
        List<PageImage> pageImages = rasterizer.render(pdfContent, dpi);
        if (pageImages.isEmpty()) {
            throw new DecodeException("No images generated from PDF " + documentId);
        }
        logger.info("Document {}: rendered {} pages at {} DPI", documentId, pageImages.size(), dpi);

        // Step 3: OCR engine
        RecognitionEngine engine = resolveEngine();

        // Step 4: whole-document recognition on the original bytes
        context.throwIfDone();
        RecognitionResult ocrResult = engine.processPdf(pdfContent, context);
        logger.info("Document {}: {} recognized {} characters (confidence {})", documentId,
                ocrResult.getEngine(), ocrResult.getText() != null ? ocrResult.getText().length() : 0,
                ocrResult.getConfidence());

        // Step 5: pair text and images
        CombinedResult result = new CombinedResult(documentId, ocrResult.getText(), ocrResult.getEngine(),
                ocrResult.getConfidence(), ocrResult.getProcessingTime(), pageImages);
        logger.info("✅ Conversion of document {} finished in {} ms", documentId, System.currentTimeMillis() - start);
        return result;
    }

    private RecognitionEngine resolveEngine() {
        try {
            return engineRegistry.get(engineName);
        } catch (EngineNotFoundException e) {
            logger.error("❌ OCR engine '{}' is not available", engineName);
            throw new EngineUnavailableException(capitalize(engineName) + " OCR engine not available");
        }
    }

    private static String capitalize(String name) {
        return name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
