package com.example.pdfconvert.service.ocr;

import com.example.pdfconvert.dto.ocr.RecognitionResult;
import com.example.pdfconvert.dto.ocr.StructuredRecognitionResult;
import com.example.pdfconvert.exception.RecognitionCancelledException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MockRecognitionEngineTest {

    private final MockRecognitionEngine engine = new MockRecognitionEngine(List.of("eng"));

    @Test
    void imageRecognitionIsDeterministic() {
        RecognitionResult first = engine.extractText(new byte[] {1, 2});
        RecognitionResult second = engine.extractText(new byte[] {9, 9, 9});

        assertThat(first.getText()).isEqualTo(second.getText()).isNotBlank();
        assertThat(first.getConfidence()).isEqualTo(0.85);
        assertThat(first.getEngine()).isEqualTo("mock");
    }

    @Test
    void pdfConversionReturnsPlaceholderMarkdown() {
        RecognitionResult result = engine.processPdf(new byte[] {1});

        assertThat(result.getText()).startsWith("# Mock PDF Conversion");
        assertThat(result.getConfidence()).isEqualTo(0.80);
        assertThat(result.getLanguage()).isEqualTo("en");
    }

    @Test
    void structuredBlocksFitTheReportedPage() {
        StructuredRecognitionResult result = engine.extractStructuredText(new byte[] {1}, "typed");

        assertThat(result.getBlocks()).hasSize(2).allSatisfy(block -> {
            assertThat(block.getConfidence()).isBetween(0.0, 1.0);
            assertThat(block.getBoundingBox().fitsWithin(result.getLayout().getPageWidth(),
                    result.getLayout().getPageHeight())).isTrue();
        });
        assertThat(result.getTables()).isEmpty();
    }

    @Test
    void honoursCancellation() {
        CallContext context = CallContext.background();
        context.cancel();

        assertThatThrownBy(() -> engine.processPdf(new byte[] {1}, context))
                .isInstanceOf(RecognitionCancelledException.class);
    }

    @Test
    void isLocalWithoutAuthentication() {
        assertThat(engine.info().isLocal()).isTrue();
        assertThat(engine.info().isRequiresAuth()).isFalse();
        assertThat(new MockRecognitionEngine(null).info().getSupportedLanguages()).containsExactly("eng");
    }
}
