package com.example.pdfconvert.exception;

/**
 * Base type for every failure a conversion attempt can report to its caller.
 * Subclasses name the reason so callers can tell bad input from a slow service
 * from a misconfigured process.
 */
public abstract class PdfConversionException extends RuntimeException {

    protected PdfConversionException(String message) {
        super(message);
    }

    protected PdfConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
