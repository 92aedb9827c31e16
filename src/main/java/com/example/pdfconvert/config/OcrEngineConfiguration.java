package com.example.pdfconvert.config;

import com.example.pdfconvert.service.ocr.EngineRegistry;
import com.example.pdfconvert.service.ocr.MathpixJobClient;
import com.example.pdfconvert.service.ocr.MathpixRecognitionEngine;
import com.example.pdfconvert.service.ocr.MockRecognitionEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the OCR engine registry once at startup. Mathpix is registered only when both
 * credentials are configured; the mock engine is registered unless disabled.
 */
@Configuration
public class OcrEngineConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(OcrEngineConfiguration.class);

    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    @Value("${mathpix.api.url:https://api.mathpix.com/v3/pdf}")
    private String mathpixApiUrl;

    @Value("${mathpix.app-id:}")
    private String mathpixAppId;

    @Value("${mathpix.app-key:}")
    private String mathpixAppKey;

    @Value("${mathpix.languages:en}")
    private String mathpixLanguages;

    @Value("${mathpix.poll-interval:5s}")
    private Duration pollInterval;

    @Value("${mathpix.timeout:5m}")
    private Duration jobTimeout;

    @Value("${mathpix.request-timeout:60s}")
    private Duration requestTimeout;

    @Value("${ocr.mock.enabled:true}")
    private boolean mockEnabled;

    @Value("${ocr.default-engine:}")
    private String defaultEngine;

    @Bean
    public EngineRegistry engineRegistry(ObjectMapper objectMapper) {
        EngineRegistry.Builder builder = EngineRegistry.builder();

        if (hasText(mathpixAppId) && hasText(mathpixAppKey)) {
            logger.info("✅ Mathpix OCR configured");
            logger.info("   - API URL: {}", mathpixApiUrl);
            logger.info("   - App ID: {}", mathpixAppId);
            logger.info("   - App Key: {}...{}",
                       mathpixAppKey.substring(0, Math.min(4, mathpixAppKey.length())),
                       mathpixAppKey.substring(Math.max(0, mathpixAppKey.length() - 4)));
            logger.info("   - Poll interval: {}, timeout: {}", pollInterval, jobTimeout);

            WebClient webClient = WebClient.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
            MathpixJobClient jobClient = new MathpixJobClient(webClient, objectMapper, mathpixApiUrl,
                    mathpixAppId, mathpixAppKey, pollInterval, jobTimeout, requestTimeout, Clock.systemUTC());
            builder.register(MathpixRecognitionEngine.ENGINE_NAME,
                    new MathpixRecognitionEngine(jobClient, parseLanguages(mathpixLanguages)));
        } else {
            logger.warn("⚠️ Mathpix credentials not configured (MATHPIX_APP_ID / MATHPIX_APP_KEY). "
                    + "PDF conversion will report the engine as unavailable.");
        }

        if (mockEnabled) {
            builder.register(MockRecognitionEngine.ENGINE_NAME, new MockRecognitionEngine(List.of("eng")));
        }

        if (hasText(defaultEngine)) {
            builder.setDefault(defaultEngine);
        }
        return builder.build();
    }

    static List<String> parseLanguages(String languages) {
        if (languages == null) {
            return List.of();
        }
        return Arrays.stream(languages.split(","))
            .map(String::trim)
            .filter(language -> !language.isEmpty())
            .collect(Collectors.toList());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
