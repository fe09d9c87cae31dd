package com.ivamare.connect.job;

/**
 * Deferred job collaborator.
 */
public interface JobScheduler {

    /**
     * Enqueue a job.
     *
     * <p>When {@link JobRequest#afterCommit()} is set and a transaction is active, the job
     * is only handed over once that transaction commits; a rollback discards it.
     *
     * @param request the job to run
     */
    void enqueue(JobRequest request);
}
