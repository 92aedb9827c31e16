package com.example.pdfconvert.controller;

import com.example.pdfconvert.dto.ConversionResponse;
import com.example.pdfconvert.model.CombinedResult;
import com.example.pdfconvert.service.conversion.ConversionOrchestrationService;
import com.example.pdfconvert.service.conversion.ConversionReportFormatter;
import com.example.pdfconvert.service.ocr.CallContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@RestController
@RequestMapping("/api/conversions")
public class ConversionController {

    private static final Logger logger = LoggerFactory.getLogger(ConversionController.class);

    @Autowired
    private ConversionOrchestrationService orchestrationService;

    @Autowired
    private ConversionReportFormatter reportFormatter;

    @Value("${conversion.request-timeout:6m}")
    private Duration requestTimeout;

    /**
     * Converts a stored PDF to page images plus OCR text. Blocks until the conversion finishes,
     * fails, or the request timeout passes.
     */
    @PostMapping("/{documentId}")
    public ResponseEntity<ConversionResponse> convert(@PathVariable String documentId) {
        logger.info("=== CONVERSION REQUEST RECEIVED for document: {} ===", documentId);
        CallContext context = CallContext.withTimeout(requestTimeout);
        CombinedResult result = orchestrationService.convert(documentId, context);
        return ResponseEntity.ok(reportFormatter.toResponse(result));
    }
}
