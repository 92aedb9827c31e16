package com.example.pdfconvert.controller;

import com.example.pdfconvert.exception.DecodeException;
import com.example.pdfconvert.exception.DocumentNotFoundException;
import com.example.pdfconvert.exception.EngineUnavailableException;
import com.example.pdfconvert.exception.JobFailedException;
import com.example.pdfconvert.exception.JobTimedOutException;
import com.example.pdfconvert.exception.RecognitionCancelledException;
import com.example.pdfconvert.exception.SubmissionException;
import com.example.pdfconvert.model.CombinedResult;
import com.example.pdfconvert.model.PageImage;
import com.example.pdfconvert.model.RemoteJob;
import com.example.pdfconvert.service.conversion.ConversionOrchestrationService;
import com.example.pdfconvert.service.conversion.ConversionReportFormatter;
import com.example.pdfconvert.service.ocr.CallContext;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConversionController.class)
@Import(ConversionReportFormatter.class)
class ConversionControllerTest {

    private static final String DOCUMENT_ID = "paper.pdf";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversionOrchestrationService orchestrationService;

    private void failWith(RuntimeException exception) {
        doThrow(exception).when(orchestrationService).convert(eq(DOCUMENT_ID), any(CallContext.class));
    }

    @Test
    void returnsReportAndPageImages() throws Exception {
        CombinedResult result = new CombinedResult(DOCUMENT_ID, "# Paper", "mathpix", 0.95,
                Duration.ofMillis(800), List.of(new PageImage(0, 10, 10, new byte[] {1, 2, 3})));
        when(orchestrationService.convert(eq(DOCUMENT_ID), any(CallContext.class))).thenReturn(result);

        mockMvc.perform(post("/api/conversions/{id}", DOCUMENT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentId").value(DOCUMENT_ID))
                .andExpect(jsonPath("$.engine").value("mathpix"))
                .andExpect(jsonPath("$.pageCount").value(1))
                .andExpect(jsonPath("$.report").value(containsString("# PDF Conversion Results")))
                .andExpect(jsonPath("$.images[0].mimeType").value("image/png"))
                .andExpect(jsonPath("$.images[0].data").value("AQID"));
    }

    @Test
    void unknownDocumentIsNotFound() throws Exception {
        failWith(new DocumentNotFoundException(DOCUMENT_ID));

        mockMvc.perform(post("/api/conversions/{id}", DOCUMENT_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("DOCUMENT_NOT_FOUND_ERROR"))
                .andExpect(jsonPath("$.message").value("Document not found: " + DOCUMENT_ID))
                .andExpect(jsonPath("$.path").value("/api/conversions/" + DOCUMENT_ID));
    }

    @Test
    void undecodablePdfIsUnprocessable() throws Exception {
        failWith(new DecodeException("Failed to open PDF: bad header"));

        mockMvc.perform(post("/api/conversions/{id}", DOCUMENT_ID))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("DECODE_ERROR"));
    }

    @Test
    void unavailableEngineIsServiceUnavailable() throws Exception {
        failWith(new EngineUnavailableException("Mathpix OCR engine not available"));

        mockMvc.perform(post("/api/conversions/{id}", DOCUMENT_ID))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Mathpix OCR engine not available"));
    }

    @Test
    void remoteFailuresAreBadGateway() throws Exception {
        failWith(new SubmissionException("Mathpix API request failed with status 401"));
        mockMvc.perform(post("/api/conversions/{id}", DOCUMENT_ID))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("SUBMISSION_ERROR"));

        failWith(new JobFailedException(new RemoteJob("document.pdf"), "Mathpix processing failed"));
        mockMvc.perform(post("/api/conversions/{id}", DOCUMENT_ID))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("JOB_FAILED_ERROR"));
    }

    @Test
    void jobTimeoutIsGatewayTimeout() throws Exception {
        failWith(new JobTimedOutException(new RemoteJob("document.pdf"), "Timeout waiting for Mathpix results"));

        mockMvc.perform(post("/api/conversions/{id}", DOCUMENT_ID))
                .andExpect(status().isGatewayTimeout());
    }

    @Test
    void expiredRequestIsRequestTimeout() throws Exception {
        failWith(new RecognitionCancelledException("Caller deadline exceeded"));

        mockMvc.perform(post("/api/conversions/{id}", DOCUMENT_ID))
                .andExpect(status().isRequestTimeout())
                .andExpect(jsonPath("$.code").value("RECOGNITION_CANCELLED_ERROR"));
    }
}
