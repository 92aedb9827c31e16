package com.example.pdfconvert.controller;

import com.example.pdfconvert.dto.DocumentSummary;
import com.example.pdfconvert.service.document.LocalDocumentSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    @Autowired
    private LocalDocumentSource documentSource;

    @GetMapping("/search")
    public ResponseEntity<List<DocumentSummary>> search(
            @RequestParam(value = "query", defaultValue = "") String query,
            @RequestParam(value = "maxFiles", defaultValue = "10") int maxFiles) {
        return ResponseEntity.ok(documentSource.search(query, maxFiles));
    }

    @PostMapping
    public ResponseEntity<DocumentSummary> upload(@RequestParam("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }
        DocumentSummary stored = documentSource.store(file.getOriginalFilename(), file.getBytes());
        return ResponseEntity.status(HttpStatus.CREATED).body(stored);
    }
}
