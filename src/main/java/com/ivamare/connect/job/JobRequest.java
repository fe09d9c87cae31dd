package com.ivamare.connect.job;

import com.ivamare.connect.exception.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request to run a named job in the background.
 *
 * @param jobName name of the registered job handler
 * @param queue queue the job runs on
 * @param args job arguments
 * @param deduplicateKey optional key; a request whose key is already queued or running is dropped
 * @param afterCommit whether to defer the submit until the surrounding transaction commits
 */
public record JobRequest(
    String jobName,
    String queue,
    Map<String, Object> args,
    String deduplicateKey,
    boolean afterCommit
) {
    public JobRequest {
        if (jobName == null || jobName.isBlank()) {
            throw new ValidationException("jobName", "must not be blank");
        }
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    /**
     * Create an immediate request on the default queue.
     */
    public static JobRequest of(String jobName, Map<String, Object> args) {
        return new JobRequest(jobName, null, args, null, false);
    }

    public JobRequest withQueue(String queue) {
        return new JobRequest(jobName, queue, args, deduplicateKey, afterCommit);
    }

    public JobRequest withDeduplicateKey(String deduplicateKey) {
        return new JobRequest(jobName, queue, args, deduplicateKey, afterCommit);
    }

    public JobRequest deferredUntilCommit() {
        return new JobRequest(jobName, queue, args, deduplicateKey, true);
    }
}
