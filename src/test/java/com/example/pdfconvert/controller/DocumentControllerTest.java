package com.example.pdfconvert.controller;

import com.example.pdfconvert.dto.DocumentSummary;
import com.example.pdfconvert.service.document.LocalDocumentSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DocumentController.class)
class DocumentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LocalDocumentSource documentSource;

    @Test
    void searchReturnsMatchingDocuments() throws Exception {
        DocumentSummary summary = new DocumentSummary("annual.pdf", "annual.pdf", 2048L,
                Instant.parse("2024-05-01T12:00:00Z"), "application/pdf");
        when(documentSource.search("annual", 5)).thenReturn(List.of(summary));

        mockMvc.perform(get("/api/documents/search").param("query", "annual").param("maxFiles", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("annual.pdf"))
                .andExpect(jsonPath("$[0].size").value(2048))
                .andExpect(jsonPath("$[0].mimeType").value("application/pdf"));
    }

    @Test
    void uploadStoresPdf() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "paper.pdf", "application/pdf", "%PDF-1.7".getBytes());
        when(documentSource.store(eq("paper.pdf"), any(byte[].class))).thenReturn(
                new DocumentSummary("paper.pdf", "paper.pdf", 8L, Instant.now(), "application/pdf"));

        mockMvc.perform(multipart("/api/documents").file(file))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("paper.pdf"));
    }

    @Test
    void nonPdfUploadIsRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain", "hello".getBytes());
        when(documentSource.store(eq("notes.txt"), any(byte[].class)))
                .thenThrow(new IllegalArgumentException("Only PDF files can be stored: notes.txt"));

        mockMvc.perform(multipart("/api/documents").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Only PDF files can be stored: notes.txt"));
    }
}
