package com.ivamare.connect.job;

import com.ivamare.connect.exception.JobNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExecutorJobScheduler")
class ExecutorJobSchedulerTest {

    private DefaultJobHandlerRegistry registry;
    private ExecutorJobScheduler scheduler;

    @BeforeEach
    void setUp() {
        registry = new DefaultJobHandlerRegistry();
        scheduler = new ExecutorJobScheduler(registry, new RetryPolicy(3, List.of(0, 0)), "default", 2);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown(Duration.ofSeconds(2));
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Nested
    @DisplayName("immediate jobs")
    class ImmediateJobs {

        @Test
        @DisplayName("should run the handler with the request args")
        void shouldRunHandler() throws Exception {
            CountDownLatch latch = new CountDownLatch(1);
            registry.register("greet", args -> {
                assertEquals("world", args.get("name"));
                latch.countDown();
            });

            scheduler.enqueue(JobRequest.of("greet", Map.of("name", "world")));

            assertTrue(latch.await(2, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("should reject jobs without a handler")
        void shouldRejectUnknownJobs() {
            assertThrows(JobNotFoundException.class, () -> scheduler.enqueue(JobRequest.of("missing", Map.of())));
        }

        @Test
        @DisplayName("should retry failed attempts until success")
        void shouldRetryFailedAttempts() throws Exception {
            AtomicInteger attempts = new AtomicInteger();
            CountDownLatch done = new CountDownLatch(1);
            registry.register("flaky", args -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new IllegalStateException("attempt " + attempts.get());
                }
                done.countDown();
            });

            scheduler.enqueue(JobRequest.of("flaky", Map.of()));

            assertTrue(done.await(2, TimeUnit.SECONDS));
            assertEquals(3, attempts.get());
        }

        @Test
        @DisplayName("should stop after the policy's max attempts")
        void shouldStopAfterMaxAttempts() throws Exception {
            AtomicInteger attempts = new AtomicInteger();
            CountDownLatch exhausted = new CountDownLatch(3);
            registry.register("broken", args -> {
                attempts.incrementAndGet();
                exhausted.countDown();
                throw new IllegalStateException("always");
            });

            scheduler.enqueue(JobRequest.of("broken", Map.of()).withDeduplicateKey("k"));

            assertTrue(exhausted.await(2, TimeUnit.SECONDS));
            Thread.sleep(200);
            assertEquals(3, attempts.get());
            assertEquals(0, scheduler.activeKeyCount());
        }
    }

    @Nested
    @DisplayName("deduplication")
    class Deduplication {

        @Test
        @DisplayName("should drop a request whose key is still active")
        void shouldDropActiveKey() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger runs = new AtomicInteger();
            registry.register("slow", args -> {
                runs.incrementAndGet();
                release.await(2, TimeUnit.SECONDS);
            });

            JobRequest request = JobRequest.of("slow", Map.of()).withDeduplicateKey("same");
            scheduler.enqueue(request);
            scheduler.enqueue(request);

            assertEquals(1, scheduler.activeKeyCount());
            release.countDown();
            scheduler.shutdown(Duration.ofSeconds(2));
            assertEquals(1, runs.get());
            assertEquals(0, scheduler.activeKeyCount());
        }

        @Test
        @DisplayName("should accept the key again once the job completed")
        void shouldReleaseKeyOnCompletion() throws Exception {
            CountDownLatch latch = new CountDownLatch(2);
            registry.register("quick", args -> latch.countDown());
            JobRequest request = JobRequest.of("quick", Map.of()).withDeduplicateKey("again");

            scheduler.enqueue(request);
            waitForKeys();
            scheduler.enqueue(request);

            assertTrue(latch.await(2, TimeUnit.SECONDS));
        }

        private void waitForKeys() throws InterruptedException {
            long deadline = System.currentTimeMillis() + 2000;
            while (scheduler.activeKeyCount() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        }
    }

    @Nested
    @DisplayName("after-commit jobs")
    class AfterCommitJobs {

        @Test
        @DisplayName("should run only once the transaction commits")
        void shouldRunAfterCommit() throws Exception {
            CountDownLatch latch = new CountDownLatch(1);
            registry.register("notify", args -> latch.countDown());
            TransactionSynchronizationManager.initSynchronization();

            scheduler.enqueue(JobRequest.of("notify", Map.of()).deferredUntilCommit());

            assertFalse(latch.await(100, TimeUnit.MILLISECONDS));
            List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
            assertEquals(1, synchronizations.size());
            synchronizations.forEach(TransactionSynchronization::afterCommit);
            assertTrue(latch.await(2, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("should discard the job on rollback")
        void shouldDiscardOnRollback() throws Exception {
            AtomicInteger runs = new AtomicInteger();
            registry.register("notify", args -> runs.incrementAndGet());
            TransactionSynchronizationManager.initSynchronization();

            scheduler.enqueue(JobRequest.of("notify", Map.of()).deferredUntilCommit());
            TransactionSynchronizationManager.getSynchronizations()
                .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));
            scheduler.shutdown(Duration.ofSeconds(2));

            assertEquals(0, runs.get());
        }

        @Test
        @DisplayName("should run immediately without an active transaction")
        void shouldRunImmediatelyWithoutTransaction() throws Exception {
            CountDownLatch latch = new CountDownLatch(1);
            registry.register("notify", args -> latch.countDown());

            scheduler.enqueue(JobRequest.of("notify", Map.of()).deferredUntilCommit());

            assertTrue(latch.await(2, TimeUnit.SECONDS));
        }
    }
}
