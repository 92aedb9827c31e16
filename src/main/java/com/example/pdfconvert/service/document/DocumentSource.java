package com.example.pdfconvert.service.document;

import com.example.pdfconvert.dto.DocumentSummary;
import com.example.pdfconvert.exception.DocumentNotFoundException;

import java.util.List;

/**
 * Supplies the raw PDF bytes for a document identifier.
 */
public interface DocumentSource {

    /**
     * @throws DocumentNotFoundException if the identifier is unknown
     */
    byte[] fetch(String documentId);

    /**
     * Finds PDF documents whose name contains {@code query}.
     *
     * @param maxFiles maximum number of results; non-positive means the source's default
     */
    List<DocumentSummary> search(String query, int maxFiles);
}
