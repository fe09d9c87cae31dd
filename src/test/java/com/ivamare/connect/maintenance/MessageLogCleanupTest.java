package com.ivamare.connect.maintenance;

import com.ivamare.connect.ConnectProperties;
import com.ivamare.connect.job.JobRequest;
import com.ivamare.connect.job.JobScheduler;
import com.ivamare.connect.log.MessageLogRepository;
import com.ivamare.connect.model.MessageDirection;
import com.ivamare.connect.model.MessageLogEntry;
import com.ivamare.connect.model.MessageStatus;
import com.ivamare.connect.producer.ProduceMessageJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MessageLogCleanup")
class MessageLogCleanupTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private MessageLogRepository messageLog;

    @Mock
    private JobScheduler jobScheduler;

    private MessageLogCleanup cleanup;

    @BeforeEach
    void setUp() {
        ConnectProperties properties = new ConnectProperties();
        properties.getCleanup().setLogRetention(Duration.ofDays(30));
        properties.getCleanup().setStalePendingThreshold(Duration.ofMinutes(10));
        properties.getCleanup().setMaxProduceRetries(5);
        cleanup = new MessageLogCleanup(messageLog, jobScheduler, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static MessageLogEntry entry(long id, MessageDirection direction, String ruleName, int retryCount) {
        return new MessageLogEntry(id, direction, MessageStatus.PENDING, "key-" + id, "key-" + id, "CreateClient",
            "fineract.commands", null, null, "default",
            direction == MessageDirection.PRODUCED ? "Customer" : null,
            direction == MessageDirection.PRODUCED ? "CUST-0001" : null,
            ruleName, null, null, null, null, retryCount, null, NOW.minusSeconds(3600), null);
    }

    @Test
    @DisplayName("should purge terminal entries older than the retention")
    void shouldPurgeOldEntries() {
        when(messageLog.deleteTerminalOlderThan(NOW.minus(Duration.ofDays(30)))).thenReturn(12);
        when(messageLog.findStalePending(NOW.minus(Duration.ofMinutes(10)))).thenReturn(List.of());

        CleanupResult result = cleanup.run();

        assertEquals(new CleanupResult(12, 0, 0, 0), result);
        verifyNoInteractions(jobScheduler);
    }

    @Test
    @DisplayName("should re-enqueue a stale production with its original key")
    void shouldReenqueueStaleProduction() {
        when(messageLog.findStalePending(any())).thenReturn(List.of(entry(1L, MessageDirection.PRODUCED, "customer-created", 2)));
        when(messageLog.incrementRetryCount(1L)).thenReturn(true);

        CleanupResult result = cleanup.run();

        assertEquals(1, result.reenqueued());
        ArgumentCaptor<JobRequest> request = ArgumentCaptor.forClass(JobRequest.class);
        verify(jobScheduler).enqueue(request.capture());
        assertEquals(ProduceMessageJob.JOB_NAME, request.getValue().jobName());
        assertEquals("default", request.getValue().queue());
        assertEquals("key-1", request.getValue().deduplicateKey());
        assertEquals("key-1", request.getValue().args().get("idempotencyKey"));
        assertEquals("customer-created", request.getValue().args().get("ruleName"));
        assertEquals("CUST-0001", request.getValue().args().get("entityId"));
        assertFalse(request.getValue().afterCommit());
    }

    @Test
    @DisplayName("should fail an entry that exhausted its retries")
    void shouldFailExhaustedEntry() {
        when(messageLog.findStalePending(any())).thenReturn(List.of(entry(2L, MessageDirection.PRODUCED, "customer-created", 5)));
        when(messageLog.markFailed(2L, MessageLogCleanup.EXCEEDED_MESSAGE, null)).thenReturn(true);

        CleanupResult result = cleanup.run();

        assertEquals(1, result.failed());
        verify(messageLog, never()).incrementRetryCount(anyLong());
        verifyNoInteractions(jobScheduler);
    }

    @Test
    @DisplayName("should skip an entry whose key a later attempt completed")
    void shouldSkipCompletedKey() {
        when(messageLog.findStalePending(any())).thenReturn(List.of(entry(3L, MessageDirection.PRODUCED, "customer-created", 0)));
        when(messageLog.isCompleted("key-3")).thenReturn(true);

        CleanupResult result = cleanup.run();

        assertEquals(1, result.skipped());
        verify(messageLog).markSkipped(3L, "Key completed by a later attempt");
        verifyNoInteractions(jobScheduler);
    }

    @Test
    @DisplayName("should fail a stale consumption")
    void shouldFailStaleConsumption() {
        when(messageLog.findStalePending(any())).thenReturn(List.of(entry(4L, MessageDirection.CONSUMED, null, 0)));
        when(messageLog.markFailed(4L, MessageLogCleanup.STALE_MESSAGE, null)).thenReturn(true);

        CleanupResult result = cleanup.run();

        assertEquals(new CleanupResult(0, 0, 0, 1), result);
    }

    @Test
    @DisplayName("should not re-enqueue when another sweep claimed the entry")
    void shouldNotReenqueueLostClaim() {
        when(messageLog.findStalePending(any())).thenReturn(List.of(entry(5L, MessageDirection.PRODUCED, "customer-created", 1)));
        when(messageLog.incrementRetryCount(5L)).thenReturn(false);

        CleanupResult result = cleanup.run();

        assertEquals(new CleanupResult(0, 0, 0, 0), result);
        verifyNoInteractions(jobScheduler);
    }

    @Test
    @DisplayName("should continue past an entry that fails to resolve")
    void shouldContinuePastErrors() {
        when(messageLog.findStalePending(any())).thenReturn(List.of(
            entry(6L, MessageDirection.PRODUCED, "customer-created", 0),
            entry(7L, MessageDirection.CONSUMED, null, 0)));
        when(messageLog.incrementRetryCount(6L)).thenReturn(true);
        doThrow(new IllegalStateException("queue closed")).when(jobScheduler).enqueue(any());
        when(messageLog.markFailed(7L, MessageLogCleanup.STALE_MESSAGE, null)).thenReturn(true);

        CleanupResult result = cleanup.run();

        assertEquals(1, result.failed());
        assertEquals(0, result.reenqueued());
    }
}
