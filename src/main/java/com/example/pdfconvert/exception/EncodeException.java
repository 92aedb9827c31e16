package com.example.pdfconvert.exception;

/**
 * A rendered page could not be encoded as an image.
 */
public class EncodeException extends PdfConversionException {

    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
