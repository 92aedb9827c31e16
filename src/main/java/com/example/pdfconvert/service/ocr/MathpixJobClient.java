package com.example.pdfconvert.service.ocr;

import com.example.pdfconvert.exception.JobFailedException;
import com.example.pdfconvert.exception.JobTimedOutException;
import com.example.pdfconvert.exception.RecognitionCancelledException;
import com.example.pdfconvert.exception.SubmissionException;
import com.example.pdfconvert.model.RemoteJob;
import com.example.pdfconvert.model.RemoteJob.JobState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Client for the Mathpix asynchronous PDF API: upload a document, poll its status until a
 * terminal state or the job deadline, then download the markdown result.
 * <p>
 * Each call to {@link #execute(byte[], String, CallContext)} drives a fresh {@link RemoteJob}
 * through {@code SUBMITTED -> PROCESSING -> COMPLETED | FAILED | TIMED_OUT}. Every request carries
 * the credentials headers and is bounded by the caller's {@link CallContext} and the request timeout.
 */
public class MathpixJobClient {

    private static final Logger logger = LoggerFactory.getLogger(MathpixJobClient.class);

    static final String OPTIONS_JSON = "{\"conversion_formats\": {\"md\": true}}";

    private static final String STATUS_PROCESSING = "processing";
    private static final String STATUS_COMPLETED = "completed";
    private static final String STATUS_ERROR = "error";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String appId;
    private final String appKey;
    private final Duration pollInterval;
    private final Duration jobTimeout;
    private final Duration requestTimeout;
    private final Clock clock;

    public MathpixJobClient(WebClient webClient, ObjectMapper objectMapper, String apiUrl,
                            String appId, String appKey, Duration pollInterval,
                            Duration jobTimeout, Duration requestTimeout, Clock clock) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
        }
        if (jobTimeout.isNegative() || jobTimeout.isZero()) {
            throw new IllegalArgumentException("Job timeout must be positive: " + jobTimeout);
        }
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl;
        this.appId = appId;
        this.appKey = appKey;
        this.pollInterval = pollInterval;
        this.jobTimeout = jobTimeout;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
    }

    /**
     * Uploads {@code content} and blocks until the job's markdown result is available.
     *
     * @return the job in state {@code COMPLETED} with its result text
     * @throws SubmissionException if the upload is rejected
     * @throws JobFailedException if the service reports an error or a status/result request fails
     * @throws JobTimedOutException if the job is not finished before the job deadline
     * @throws RecognitionCancelledException if the caller cancels or its deadline passes
     */
    public RemoteJob execute(byte[] content, String fileName, CallContext context) {
        RemoteJob job = new RemoteJob(fileName);
        Instant deadline = clock.instant().plus(jobTimeout);

        submit(job, content, context);
        awaitCompletion(job, deadline, context);
        fetchResult(job, context);
        return job;
    }

    void submit(RemoteJob job, byte[] content, CallContext context) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", content)
            .filename(job.getFileName())
            .contentType(mediaTypeFor(job.getFileName()));
        body.part("options_json", OPTIONS_JSON);

        logger.info("Submitting {} ({} bytes) to Mathpix", job.getFileName(), content.length);

        Mono<ResponseEntity<String>> call = webClient.post()
            .uri(apiUrl)
            .headers(this::addCredentials)
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(body.build()))
            .exchangeToMono(response -> response.toEntity(String.class));

        ResponseEntity<String> response;
        try {
            response = await(call, requestTimeout, context);
        } catch (TimeoutException e) {
            throw rejectSubmission(job, "Mathpix upload timed out after " + requestTimeout, e);
        } catch (IOException e) {
            throw rejectSubmission(job, "Mathpix upload failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw rejectSubmission(job, "Mathpix API request failed with status "
                    + response.getStatusCode().value() + ": " + bodyOf(response), null);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(bodyOf(response));
        } catch (JsonProcessingException e) {
            throw rejectSubmission(job, "Unreadable Mathpix upload response", e);
        }

        String error = root.path("error").asText("");
        if (!error.isEmpty()) {
            String detail = root.path("error_info").path("message").asText("");
            throw rejectSubmission(job, "Mathpix error: " + error + (detail.isEmpty() ? "" : " - " + detail), null);
        }

        String externalId = root.path("pdf_id").asText("");
        if (externalId.isEmpty()) {
            externalId = root.path("job_id").asText("");
        }
        if (externalId.isEmpty()) {
            throw rejectSubmission(job, "Mathpix upload response carried no job id", null);
        }

        job.accepted(externalId);
        logger.info("Mathpix accepted {} as job {}", job.getFileName(), externalId);
    }

    void awaitCompletion(RemoteJob job, Instant deadline, CallContext context) {
        while (true) {
            Duration left = Duration.between(clock.instant(), deadline);
            if (left.isNegative() || left.isZero()) {
                throw timeOut(job);
            }

            context.sleep(left.compareTo(pollInterval) < 0 ? left : pollInterval);
            if (!clock.instant().isBefore(deadline)) {
                throw timeOut(job);
            }

            String status = pollStatus(job, deadline, context);
            if (STATUS_COMPLETED.equals(status)) {
                job.transitionTo(JobState.COMPLETED);
                logger.info("Mathpix job {} completed after {} polls", job.getExternalId(), job.getPollCount());
                return;
            } else if (STATUS_ERROR.equals(status)) {
                job.transitionTo(JobState.FAILED);
                logger.warn("Mathpix job {} reported an error", job.getExternalId());
                throw new JobFailedException(job, "Mathpix processing failed for job " + job.getExternalId());
            } else if (!STATUS_PROCESSING.equals(status)) {
                logger.warn("Unrecognized Mathpix status '{}' for job {}, continuing to poll",
                        status, job.getExternalId());
            }
        }
    }

    private String pollStatus(RemoteJob job, Instant deadline, CallContext context) {
        job.polled();
        Duration untilDeadline = Duration.between(clock.instant(), deadline);
        boolean deadlineBound = untilDeadline.compareTo(requestTimeout) < 0;
        Duration limit = deadlineBound ? untilDeadline : requestTimeout;

        Mono<ResponseEntity<String>> call = webClient.get()
            .uri(apiUrl + "/{id}", job.getExternalId())
            .headers(this::addCredentials)
            .exchangeToMono(response -> response.toEntity(String.class));

        ResponseEntity<String> response;
        try {
            response = await(call, limit, context);
        } catch (TimeoutException e) {
            if (deadlineBound || !clock.instant().isBefore(deadline)) {
                throw timeOut(job);
            }
            throw fail(job, "Status request for job " + job.getExternalId() + " timed out", e);
        } catch (IOException e) {
            throw fail(job, "Failed to poll status of job " + job.getExternalId() + ": " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw fail(job, "Poll request failed with status " + response.getStatusCode().value(), null);
        }

        try {
            JsonNode root = objectMapper.readTree(bodyOf(response));
            if (root.has("percent_done")) {
                logger.debug("Mathpix job {}: {}% done", job.getExternalId(), root.get("percent_done").asText());
            }
            String status = root.path("status").asText("");
            logger.debug("Mathpix job {} poll #{} status: {}", job.getExternalId(), job.getPollCount(), status);
            return status;
        } catch (JsonProcessingException e) {
            throw fail(job, "Unreadable poll response for job " + job.getExternalId(), e);
        }
    }

    /**
     * Downloads the markdown for a completed job. A failed download is reported as a
     * {@link JobFailedException}; the job itself stays {@code COMPLETED}.
     */
    void fetchResult(RemoteJob job, CallContext context) {
        Mono<ResponseEntity<String>> call = webClient.get()
            .uri(apiUrl + "/{id}.md", job.getExternalId())
            .headers(this::addCredentials)
            .exchangeToMono(response -> response.toEntity(String.class));

        ResponseEntity<String> response;
        try {
            response = await(call, requestTimeout, context);
        } catch (TimeoutException e) {
            throw new JobFailedException(job, "Results request for job " + job.getExternalId() + " timed out", e);
        } catch (IOException e) {
            throw new JobFailedException(job, "Failed to get results for job " + job.getExternalId()
                    + ": " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new JobFailedException(job, "Results request failed with status " + response.getStatusCode().value());
        }

        String markdown = bodyOf(response);
        job.completed(markdown);
        logger.info("Fetched {} characters of markdown for job {}", markdown.length(), job.getExternalId());
    }

    private ResponseEntity<String> await(Mono<ResponseEntity<String>> call, Duration limit, CallContext context)
            throws IOException, TimeoutException {
        context.throwIfDone();
        Duration bound = context.bound(limit);
        CompletableFuture<ResponseEntity<String>> future = call.toFuture();
        try (CallContext.Registration registration = context.onCancel(() -> future.cancel(true))) {
            return future.get(bound.toNanos(), TimeUnit.NANOSECONDS);
        } catch (CancellationException e) {
            throw new RecognitionCancelledException("Request cancelled by caller", e);
        } catch (TimeoutException e) {
            future.cancel(true);
            context.throwIfDone();
            if (bound.compareTo(limit) < 0) {
                throw new RecognitionCancelledException("Caller deadline exceeded", e);
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RecognitionCancelledException("Interrupted during request", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IOException(cause.getMessage(), cause);
        }
    }

    private void addCredentials(HttpHeaders headers) {
        headers.set("app_id", appId);
        headers.set("app_key", appKey);
    }

    private SubmissionException rejectSubmission(RemoteJob job, String message, Throwable cause) {
        job.transitionTo(JobState.FAILED);
        logger.warn("Mathpix rejected {}: {}", job.getFileName(), message);
        return cause == null ? new SubmissionException(message) : new SubmissionException(message, cause);
    }

    private JobFailedException fail(RemoteJob job, String message, Throwable cause) {
        job.transitionTo(JobState.FAILED);
        logger.warn("Mathpix job {} failed: {}", job.getExternalId(), message);
        return cause == null ? new JobFailedException(job, message) : new JobFailedException(job, message, cause);
    }

    private JobTimedOutException timeOut(RemoteJob job) {
        job.transitionTo(JobState.TIMED_OUT);
        logger.warn("Timeout waiting for Mathpix job {} after {} polls ({})",
                job.getExternalId(), job.getPollCount(), jobTimeout);
        return new JobTimedOutException(job, "Timeout waiting for Mathpix results for job "
                + job.getExternalId() + " after " + jobTimeout);
    }

    private static String bodyOf(ResponseEntity<String> response) {
        return response.getBody() != null ? response.getBody() : "";
    }

    private static MediaType mediaTypeFor(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".pdf")) {
            return MediaType.APPLICATION_PDF;
        }
        if (lower.endsWith(".png")) {
            return MediaType.IMAGE_PNG;
        }
        return MediaType.APPLICATION_OCTET_STREAM;
    }
}
