package com.example.pdfconvert.exception;

import com.example.pdfconvert.model.RemoteJob;

/**
 * A submitted job did not reach a terminal status before the polling deadline.
 */
public class JobTimedOutException extends PdfConversionException {

    private final transient RemoteJob job;

    public JobTimedOutException(RemoteJob job, String message) {
        super(message);
        this.job = job;
    }

    public RemoteJob getJob() {
        return job;
    }
}
