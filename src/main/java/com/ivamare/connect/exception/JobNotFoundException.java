package com.ivamare.connect.exception;

/**
 * Raised when a job is enqueued or dispatched under a name with no registered handler.
 */
public class JobNotFoundException extends ConnectException {

    private final String jobName;

    public JobNotFoundException(String jobName) {
        super("No job handler registered for " + jobName);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
