package com.example.pdfconvert.exception;

/**
 * The recognition engine a conversion needs is not registered.
 */
public class EngineUnavailableException extends PdfConversionException {

    public EngineUnavailableException(String message) {
        super(message);
    }
}
