package com.example.pdfconvert;

import com.example.pdfconvert.service.conversion.ConversionOrchestrationService;
import com.example.pdfconvert.service.ocr.EngineRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "document.storage.dir=target/test-documents",
        "mathpix.app-id=",
        "mathpix.app-key="
})
class PdfConvertApplicationTest {

    @Autowired
    private EngineRegistry engineRegistry;

    @Autowired
    private ConversionOrchestrationService orchestrationService;

    @Test
    void startsWithMockEngineOnlyWhenMathpixIsNotConfigured() {
        assertThat(orchestrationService).isNotNull();
        assertThat(engineRegistry.contains("mathpix")).isFalse();
        assertThat(engineRegistry.contains("mock")).isTrue();
        assertThat(engineRegistry.suggest("typed", 1024)).isEqualTo("mock");
    }
}
