package com.example.pdfconvert.controller;

import com.example.pdfconvert.dto.ErrorResponse;
import com.example.pdfconvert.exception.DecodeException;
import com.example.pdfconvert.exception.DocumentNotFoundException;
import com.example.pdfconvert.exception.EncodeException;
import com.example.pdfconvert.exception.EngineUnavailableException;
import com.example.pdfconvert.exception.JobFailedException;
import com.example.pdfconvert.exception.JobTimedOutException;
import com.example.pdfconvert.exception.PdfConversionException;
import com.example.pdfconvert.exception.RecognitionCancelledException;
import com.example.pdfconvert.exception.SubmissionException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps conversion failures to HTTP responses that keep the failure reason visible:
 * input problems are 4xx, an unreachable or failing recognition service is 5xx.
 */
@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(RestExceptionHandler.class);

    private static final Map<Class<? extends PdfConversionException>, HttpStatus> STATUS_BY_TYPE = new LinkedHashMap<>();

    static {
        STATUS_BY_TYPE.put(DocumentNotFoundException.class, HttpStatus.NOT_FOUND);
        STATUS_BY_TYPE.put(DecodeException.class, HttpStatus.UNPROCESSABLE_ENTITY);
        STATUS_BY_TYPE.put(EncodeException.class, HttpStatus.INTERNAL_SERVER_ERROR);
        STATUS_BY_TYPE.put(SubmissionException.class, HttpStatus.BAD_GATEWAY);
        STATUS_BY_TYPE.put(JobFailedException.class, HttpStatus.BAD_GATEWAY);
        STATUS_BY_TYPE.put(JobTimedOutException.class, HttpStatus.GATEWAY_TIMEOUT);
        STATUS_BY_TYPE.put(EngineUnavailableException.class, HttpStatus.SERVICE_UNAVAILABLE);
        STATUS_BY_TYPE.put(RecognitionCancelledException.class, HttpStatus.REQUEST_TIMEOUT);
    }

    @ExceptionHandler(PdfConversionException.class)
    public ResponseEntity<ErrorResponse> handleConversionFailure(PdfConversionException exception,
                                                                 HttpServletRequest request) {
        HttpStatus status = statusFor(exception);
        if (status.is5xxServerError()) {
            logger.error("❌ {} on {}: {}", exception.getClass().getSimpleName(), request.getRequestURI(),
                    exception.getMessage());
        } else {
            logger.warn("⚠️ {} on {}: {}", exception.getClass().getSimpleName(), request.getRequestURI(),
                    exception.getMessage());
        }
        return build(status, codeFor(exception), exception.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException exception,
                                                               HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", exception.getMessage(), request);
    }

    static HttpStatus statusFor(PdfConversionException exception) {
        for (Map.Entry<Class<? extends PdfConversionException>, HttpStatus> entry : STATUS_BY_TYPE.entrySet()) {
            if (entry.getKey().isInstance(exception)) {
                return entry.getValue();
            }
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static String codeFor(PdfConversionException exception) {
        // DecodeException -> DECODE_ERROR
        String simpleName = exception.getClass().getSimpleName().replace("Exception", "");
        return simpleName.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT) + "_ERROR";
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(),
                code, message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
