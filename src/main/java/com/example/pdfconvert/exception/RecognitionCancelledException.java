package com.example.pdfconvert.exception;

/**
 * The caller cancelled the call or its deadline expired before recognition finished.
 */
public class RecognitionCancelledException extends PdfConversionException {

    public RecognitionCancelledException(String message) {
        super(message);
    }

    public RecognitionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
