package com.example.pdfconvert.exception;

import com.example.pdfconvert.model.RemoteJob;

/**
 * A submitted job ended in {@link RemoteJob.JobState#FAILED}: the service reported an error
 * while polling, or a status or result request did not succeed.
 */
public class JobFailedException extends PdfConversionException {

    private final transient RemoteJob job;

    public JobFailedException(RemoteJob job, String message) {
        super(message);
        this.job = job;
    }

    public JobFailedException(RemoteJob job, String message, Throwable cause) {
        super(message, cause);
        this.job = job;
    }

    public RemoteJob getJob() {
        return job;
    }
}
