package com.ivamare.connect.job;

import com.ivamare.connect.exception.JobNotFoundException;
import com.ivamare.connect.exception.TransportExceptionClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process JobScheduler backed by a scheduled thread pool.
 *
 * <p>Behaviour:
 * <ul>
 *   <li>after-commit requests are registered as a transaction synchronization when one is active;
 *       a rollback discards them</li>
 *   <li>a request whose deduplicate key is already queued or running is dropped</li>
 *   <li>failed attempts are rescheduled per the {@link RetryPolicy}, then logged as exhausted</li>
 * </ul>
 */
public class ExecutorJobScheduler implements JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorJobScheduler.class);

    private final JobHandlerRegistry registry;
    private final RetryPolicy retryPolicy;
    private final String defaultQueue;
    private final ScheduledExecutorService executor;
    private final Set<String> activeKeys = ConcurrentHashMap.newKeySet();

    public ExecutorJobScheduler(JobHandlerRegistry registry, RetryPolicy retryPolicy,
                                String defaultQueue, int concurrency) {
        this(registry, retryPolicy, defaultQueue,
            Executors.newScheduledThreadPool(concurrency, new JobThreadFactory()));
    }

    public ExecutorJobScheduler(JobHandlerRegistry registry, RetryPolicy retryPolicy,
                                String defaultQueue, ScheduledExecutorService executor) {
        this.registry = registry;
        this.retryPolicy = retryPolicy;
        this.defaultQueue = defaultQueue;
        this.executor = executor;
    }

    @Override
    public void enqueue(JobRequest request) {
        if (request.afterCommit() && TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    try {
                        submit(request);
                    } catch (RuntimeException e) {
                        log.error("Failed to enqueue job {} after commit: {}", request.jobName(), e.getMessage(), e);
                    }
                }
            });
            log.debug("Deferred job {} until transaction commit", request.jobName());
            return;
        }
        submit(request);
    }

    /**
     * Number of deduplicate keys currently queued or running.
     */
    public int activeKeyCount() {
        return activeKeys.size();
    }

    /**
     * Stop accepting jobs and wait for running ones.
     */
    public void shutdown(Duration timeout) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Job executor did not terminate within {}, forcing shutdown", timeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public void shutdown() {
        shutdown(Duration.ofSeconds(10));
    }

    private void submit(JobRequest request) {
        if (!registry.hasHandler(request.jobName())) {
            throw new JobNotFoundException(request.jobName());
        }

        String key = request.deduplicateKey();
        if (key != null && !activeKeys.add(key)) {
            log.debug("Job {} with key {} already queued, skipping", request.jobName(), key);
            return;
        }

        try {
            executor.execute(() -> run(request, 1));
        } catch (RejectedExecutionException e) {
            release(request);
            throw e;
        }
        log.debug("Enqueued job {} on queue {}", request.jobName(), queueOf(request));
    }

    private void run(JobRequest request, int attempt) {
        try {
            registry.getOrThrow(request.jobName()).handle(request.args());
            log.debug("Job {} completed (attempt {})", request.jobName(), attempt);
            release(request);
        } catch (Exception e) {
            onFailure(request, attempt, e);
        }
    }

    private void onFailure(JobRequest request, int attempt, Exception e) {
        if (!retryPolicy.shouldRetry(attempt) || e instanceof JobNotFoundException) {
            log.error("Job {} on queue {} exhausted after {} attempt(s): {}",
                request.jobName(), queueOf(request), attempt, e.getMessage(), e);
            release(request);
            return;
        }

        int backoff = retryPolicy.getBackoff(attempt);
        if (TransportExceptionClassifier.isTransient(e)) {
            log.warn("Job {} failed with transient error (reason={}), retrying in {}s: {}",
                request.jobName(), TransportExceptionClassifier.getTransientReason(e), backoff, e.getMessage());
        } else {
            log.warn("Job {} failed (attempt {}), retrying in {}s: {}",
                request.jobName(), attempt, backoff, e.getMessage());
        }

        try {
            executor.schedule(() -> run(request, attempt + 1), backoff, TimeUnit.SECONDS);
        } catch (RejectedExecutionException rejected) {
            log.error("Job {} could not be rescheduled, executor is shut down", request.jobName());
            release(request);
        }
    }

    private void release(JobRequest request) {
        if (request.deduplicateKey() != null) {
            activeKeys.remove(request.deduplicateKey());
        }
    }

    private String queueOf(JobRequest request) {
        return request.queue() != null ? request.queue() : defaultQueue;
    }

    private static final class JobThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "connect-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
