package com.example.pdfconvert.service.ocr;

import com.example.pdfconvert.dto.ocr.EngineInfo;
import com.example.pdfconvert.dto.ocr.RecognitionResult;
import com.example.pdfconvert.dto.ocr.StructuredRecognitionResult;
import com.example.pdfconvert.exception.EngineNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Named recognition engines with a default and a selection heuristic.
 * <p>
 * Instances are assembled once through {@link #builder()} and are immutable afterwards, so
 * concurrent conversions read them without locking.
 */
public final class EngineRegistry {

    private static final Logger logger = LoggerFactory.getLogger(EngineRegistry.class);

    /** Returned by {@link #suggest(String, long)} when nothing is registered. */
    public static final String FALLBACK_ENGINE = "mock";

    private final Map<String, RecognitionEngine> engines;
    private final String defaultEngine;

    private EngineRegistry(Map<String, RecognitionEngine> engines, String defaultEngine) {
        this.engines = Collections.unmodifiableMap(new LinkedHashMap<>(engines));
        this.defaultEngine = defaultEngine;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up an engine. A null or blank name resolves to the default engine.
     *
     * @throws EngineNotFoundException if the registry is empty or the name is unknown
     */
    public RecognitionEngine get(String name) {
        String resolved = name == null || name.isBlank() ? defaultEngine : name;
        RecognitionEngine engine = resolved == null ? null : engines.get(resolved);
        if (engine == null) {
            throw new EngineNotFoundException(resolved == null ? "<default>" : resolved);
        }
        return engine;
    }

    public boolean contains(String name) {
        return engines.containsKey(name);
    }

    public String getDefaultEngine() {
        return defaultEngine;
    }

    public boolean isEmpty() {
        return engines.isEmpty();
    }

    /**
     * Information about all registered engines, keyed by registration name.
     */
    public Map<String, EngineInfo> listEngines() {
        Map<String, EngineInfo> info = new LinkedHashMap<>();
        engines.forEach((name, engine) -> info.put(name, engine.info()));
        return info;
    }

    /**
     * Recommends an engine for a document. Remote engines are preferred for any document type or
     * size; otherwise the default, otherwise any registered engine. Never fails: an empty registry
     * yields {@link #FALLBACK_ENGINE}. Ties are broken by name so registration order does not matter.
     */
    public String suggest(String documentType, long sizeHint) {
        Map<String, RecognitionEngine> byName = new TreeMap<>(engines);
        for (Map.Entry<String, RecognitionEngine> entry : byName.entrySet()) {
            if (!entry.getValue().info().isLocal()) {
                return entry.getKey();
            }
        }
        if (defaultEngine != null) {
            return defaultEngine;
        }
        if (!byName.isEmpty()) {
            return byName.keySet().iterator().next();
        }
        return FALLBACK_ENGINE;
    }

    public RecognitionResult extractTextWithBestEngine(byte[] imageBytes, String documentType, CallContext context) {
        String engineName = suggest(documentType, imageBytes.length);
        RecognitionEngine engine = get(engineName);
        logger.info("Using OCR engine {} (document type: {}, image size: {})",
                engineName, documentType, imageBytes.length);
        return engine.extractText(imageBytes, context);
    }

    public StructuredRecognitionResult extractStructuredTextWithBestEngine(byte[] imageBytes, String documentType,
                                                                           CallContext context) {
        String engineName = suggest(documentType, imageBytes.length);
        RecognitionEngine engine = get(engineName);
        logger.info("Using OCR engine {} for structured extraction (document type: {}, image size: {})",
                engineName, documentType, imageBytes.length);
        return engine.extractStructuredText(imageBytes, documentType, context);
    }

    public static final class Builder {

        private final Map<String, RecognitionEngine> engines = new LinkedHashMap<>();
        private String defaultEngine;

        private Builder() {
        }

        /**
         * Adds an engine. The first engine registered becomes the default unless one is set.
         */
        public Builder register(String name, RecognitionEngine engine) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Engine name must not be blank");
            }
            if (engine == null) {
                throw new IllegalArgumentException("Engine must not be null: " + name);
            }
            engines.put(name, engine);
            if (defaultEngine == null) {
                defaultEngine = name;
            }
            return this;
        }

        /**
         * @throws EngineNotFoundException if {@code name} has not been registered
         */
        public Builder setDefault(String name) {
            if (!engines.containsKey(name)) {
                throw new EngineNotFoundException(name);
            }
            defaultEngine = name;
            return this;
        }

        public EngineRegistry build() {
            EngineRegistry registry = new EngineRegistry(engines, defaultEngine);
            if (registry.isEmpty()) {
                logger.warn("⚠️ No OCR engines registered. Conversions will fail until one is configured.");
            } else {
                logger.info("🤖 OCR engine registry initialized with {} engines (default: {})",
                        engines.size(), defaultEngine);
                registry.listEngines().forEach((name, info) ->
                        logger.info("   {} - {} {} ({})", name, info.getName(), info.getVersion(),
                                info.isLocal() ? "local" : "remote"));
            }
            return registry;
        }
    }
}
