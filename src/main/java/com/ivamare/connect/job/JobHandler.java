package com.ivamare.connect.job;

import java.util.Map;

/**
 * Runs one job invocation.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Run the job.
     *
     * @param args the job arguments
     * @throws Exception to trigger the scheduler's retry policy
     */
    void handle(Map<String, Object> args) throws Exception;
}
