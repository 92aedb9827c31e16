package com.example.pdfconvert.dto.ocr;

import lombok.Value;

import java.util.List;

/**
 * Static self-description of a recognition engine.
 */
@Value
public class EngineInfo {
    String name;
    String version;
    List<String> supportedLanguages;
    List<String> features;
    boolean local;
    boolean requiresAuth;

    public EngineInfo(String name, String version, List<String> supportedLanguages,
                      List<String> features, boolean local, boolean requiresAuth) {
        this.name = name;
        this.version = version;
        this.supportedLanguages = List.copyOf(supportedLanguages);
        this.features = List.copyOf(features);
        this.local = local;
        this.requiresAuth = requiresAuth;
    }
}
