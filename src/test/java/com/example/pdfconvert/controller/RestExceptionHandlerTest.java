package com.example.pdfconvert.controller;

import com.example.pdfconvert.exception.DecodeException;
import com.example.pdfconvert.exception.EngineNotFoundException;
import com.example.pdfconvert.exception.RecognitionCancelledException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class RestExceptionHandlerTest {

    @Test
    void errorCodesDoNotDependOnDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));

            assertThat(RestExceptionHandler.codeFor(new RecognitionCancelledException("Caller deadline exceeded")))
                    .isEqualTo("RECOGNITION_CANCELLED_ERROR");
            assertThat(RestExceptionHandler.codeFor(new DecodeException("bad input")))
                    .isEqualTo("DECODE_ERROR");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void engineLookupFailureIsServiceUnavailable() {
        assertThat(RestExceptionHandler.statusFor(new EngineNotFoundException("mathpix")))
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }
}
