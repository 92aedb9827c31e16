package com.example.pdfconvert.exception;

/**
 * Registry lookup for an unknown engine name.
 */
public class EngineNotFoundException extends EngineUnavailableException {

    private final String engineName;

    public EngineNotFoundException(String engineName) {
        super("OCR engine not registered: " + engineName);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
