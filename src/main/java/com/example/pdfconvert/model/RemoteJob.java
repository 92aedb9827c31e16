package com.example.pdfconvert.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * A job tracked by the remote recognition service. Lives only for the duration of one
 * recognition call; nothing is persisted, so a job interrupted mid-poll is orphaned.
 */
public class RemoteJob {

    public enum JobState {
        SUBMITTED,
        PROCESSING,
        COMPLETED,
        FAILED,
        TIMED_OUT;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == TIMED_OUT;
        }
    }

    private static final Set<JobState> FROM_SUBMITTED = EnumSet.of(JobState.PROCESSING, JobState.FAILED);
    private static final Set<JobState> FROM_PROCESSING =
            EnumSet.of(JobState.COMPLETED, JobState.FAILED, JobState.TIMED_OUT);

    private final String fileName;
    private String externalId;
    private JobState state = JobState.SUBMITTED;
    private int pollCount;
    private String resultText;

    public RemoteJob(String fileName) {
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

    public String getExternalId() {
        return externalId;
    }

    public JobState getState() {
        return state;
    }

    public int getPollCount() {
        return pollCount;
    }

    public String getResultText() {
        return resultText;
    }

    public void accepted(String externalId) {
        this.externalId = externalId;
        transitionTo(JobState.PROCESSING);
    }

    public void polled() {
        if (state != JobState.PROCESSING) {
            throw new IllegalStateException("Cannot poll job " + externalId + " in state " + state);
        }
        pollCount++;
    }

    public void completed(String resultText) {
        if (state != JobState.COMPLETED) {
            throw new IllegalStateException("Result received for job " + externalId + " in state " + state);
        }
        this.resultText = resultText;
    }

    /**
     * Moves the job to {@code next}. Terminal states accept no further transitions.
     */
    public void transitionTo(JobState next) {
        boolean allowed = false;
        if (state == JobState.SUBMITTED) {
            allowed = FROM_SUBMITTED.contains(next);
        } else if (state == JobState.PROCESSING) {
            allowed = FROM_PROCESSING.contains(next);
        }
        if (!allowed) {
            throw new IllegalStateException("Illegal job transition " + state + " -> " + next
                    + " for job " + externalId);
        }
        state = next;
    }

    @Override
    public String toString() {
        return "RemoteJob{id=" + externalId + ", file=" + fileName + ", state=" + state
                + ", polls=" + pollCount + "}";
    }
}
