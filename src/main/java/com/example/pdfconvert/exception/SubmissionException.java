package com.example.pdfconvert.exception;

/**
 * The recognition service rejected an upload (credentials, malformed request, quota).
 */
public class SubmissionException extends PdfConversionException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
