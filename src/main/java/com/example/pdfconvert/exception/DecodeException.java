package com.example.pdfconvert.exception;

/**
 * The input bytes could not be parsed as a PDF.
 */
public class DecodeException extends PdfConversionException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
