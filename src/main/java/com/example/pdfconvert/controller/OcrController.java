package com.example.pdfconvert.controller;

import com.example.pdfconvert.dto.ocr.EngineInfo;
import com.example.pdfconvert.dto.ocr.RecognitionResult;
import com.example.pdfconvert.service.ocr.CallContext;
import com.example.pdfconvert.service.ocr.EngineRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

@RestController
@RequestMapping("/api/ocr")
public class OcrController {

    @Autowired
    private EngineRegistry engineRegistry;

    @Value("${conversion.request-timeout:6m}")
    private Duration requestTimeout;

    @GetMapping("/engines")
    public ResponseEntity<Map<String, EngineInfo>> listEngines() {
        return ResponseEntity.ok(engineRegistry.listEngines());
    }

    @GetMapping("/engines/suggest")
    public ResponseEntity<Map<String, String>> suggestEngine(
            @RequestParam(value = "documentType", defaultValue = "typed") String documentType,
            @RequestParam(value = "sizeHint", defaultValue = "0") long sizeHint) {
        return ResponseEntity.ok(Map.of("engine", engineRegistry.suggest(documentType, sizeHint)));
    }

    /**
     * Recognizes a single image with the suggested engine.
     */
    @PostMapping("/extract")
    public ResponseEntity<RecognitionResult> extract(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "documentType", defaultValue = "typed") String documentType,
            @RequestParam(value = "structured", defaultValue = "false") boolean structured) throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded image is empty");
        }
        CallContext context = CallContext.withTimeout(requestTimeout);
        byte[] image = file.getBytes();
        RecognitionResult result = structured
                ? engineRegistry.extractStructuredTextWithBestEngine(image, documentType, context)
                : engineRegistry.extractTextWithBestEngine(image, documentType, context);
        return ResponseEntity.ok(result);
    }
}
