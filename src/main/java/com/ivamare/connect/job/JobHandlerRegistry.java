package com.ivamare.connect.job;

import com.ivamare.connect.exception.JobNotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * Registry of named job handlers.
 */
public interface JobHandlerRegistry {

    /**
     * Register a handler.
     *
     * @throws com.ivamare.connect.exception.ValidationException if the name is taken
     */
    void register(String jobName, JobHandler handler);

    Optional<JobHandler> get(String jobName);

    /**
     * @throws JobNotFoundException if no handler is registered
     */
    JobHandler getOrThrow(String jobName);

    boolean hasHandler(String jobName);

    List<String> registeredNames();

    /**
     * Register every {@link ConnectJob} method of a bean.
     *
     * @return the registered job names
     */
    List<String> registerBean(Object bean);
}
