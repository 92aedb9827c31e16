package com.example.pdfconvert.exception;

public class DocumentNotFoundException extends PdfConversionException {

    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + documentId);
        this.documentId = documentId;
    }

    public DocumentNotFoundException(String documentId, Throwable cause) {
        super("Document not found: " + documentId, cause);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
