package com.example.pdfconvert.service.ocr;

import com.example.pdfconvert.dto.ocr.BoundingBox;
import com.example.pdfconvert.dto.ocr.EngineInfo;
import com.example.pdfconvert.dto.ocr.LayoutInfo;
import com.example.pdfconvert.dto.ocr.RecognitionResult;
import com.example.pdfconvert.dto.ocr.StructuredRecognitionResult;
import com.example.pdfconvert.dto.ocr.TextBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * In-process stand-in engine. Returns fixed placeholder output without any I/O, for tests and
 * as an offline fallback when no recognition service is configured.
 */
public class MockRecognitionEngine implements RecognitionEngine {

    private static final Logger logger = LoggerFactory.getLogger(MockRecognitionEngine.class);

    public static final String ENGINE_NAME = "mock";

    static final double IMAGE_CONFIDENCE = 0.85;
    static final double PDF_CONFIDENCE = 0.80;

    static final String IMAGE_TEXT = "This is mock OCR text extracted from the image. "
            + "In a real implementation, this would be the actual text content from the PDF page.";

    static final String PDF_MARKDOWN = String.join("\n",
            "# Mock PDF Conversion",
            "",
            "This is a mock conversion of a PDF document for testing purposes.",
            "",
            "## Content",
            "",
            "The PDF contained text that has been extracted and converted to Markdown format.",
            "",
            "- Item 1",
            "- Item 2",
            "- Item 3",
            "",
            "Mock processing complete.");

    private final List<String> languages;

    public MockRecognitionEngine(List<String> languages) {
        this.languages = languages == null || languages.isEmpty() ? List.of("eng") : List.copyOf(languages);
    }

    @Override
    public RecognitionResult extractText(byte[] imageBytes, CallContext context) {
        context.throwIfDone();
        long start = System.nanoTime();
        logger.debug("Mock OCR on image of {} bytes", imageBytes.length);
        return new RecognitionResult(IMAGE_TEXT, IMAGE_CONFIDENCE, String.join(",", languages),
                ENGINE_NAME, Duration.ofNanos(System.nanoTime() - start));
    }

    @Override
    public StructuredRecognitionResult extractStructuredText(byte[] imageBytes, String documentTypeHint,
                                                             CallContext context) {
        RecognitionResult basic = extractText(imageBytes, context);

        List<TextBlock> blocks = new ArrayList<>();
        blocks.add(new TextBlock("Mock Title", 0.9,
                new BoundingBox(50, 50, 300, 30), TextBlock.BlockType.TITLE));
        blocks.add(new TextBlock("Mock paragraph content with multiple lines of text that would be "
                + "extracted from the document.", 0.85,
                new BoundingBox(50, 100, 400, 60), TextBlock.BlockType.PARAGRAPH));

        LayoutInfo layout = new LayoutInfo(600, 800, LayoutInfo.Orientation.PORTRAIT, 1, false, false);
        return new StructuredRecognitionResult(basic, blocks, new ArrayList<>(), layout);
    }

    @Override
    public RecognitionResult processPdf(byte[] pdfBytes, CallContext context) {
        context.throwIfDone();
        logger.debug("Mock PDF conversion of {} bytes", pdfBytes.length);
        return new RecognitionResult(PDF_MARKDOWN, PDF_CONFIDENCE, "en", ENGINE_NAME, Duration.ofMillis(100));
    }

    @Override
    public EngineInfo info() {
        return new EngineInfo("Mock OCR", "1.0", languages,
                List.of("text_extraction", "basic_layout", "testing"), true, false);
    }
}
