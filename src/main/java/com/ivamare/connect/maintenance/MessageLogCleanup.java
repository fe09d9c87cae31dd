package com.ivamare.connect.maintenance;

import com.ivamare.connect.ConnectProperties;
import com.ivamare.connect.document.DocumentRef;
import com.ivamare.connect.job.JobRequest;
import com.ivamare.connect.job.JobScheduler;
import com.ivamare.connect.log.MessageLogRepository;
import com.ivamare.connect.model.MessageDirection;
import com.ivamare.connect.model.MessageLogEntry;
import com.ivamare.connect.producer.ProduceMessageJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Purges old log entries and resolves entries stuck in Pending.
 *
 * <p>A Pending entry older than the stale threshold is:
 * <ul>
 *   <li>marked Failed ("Exceeded max retries") once its retry count reaches the limit</li>
 *   <li>marked Skipped when a later attempt already completed its key</li>
 *   <li>re-enqueued with the same key if it is a production of a known rule</li>
 *   <li>marked Failed ("Stale Pending entry marked as Failed") otherwise</li>
 * </ul>
 */
public class MessageLogCleanup {

    private static final Logger log = LoggerFactory.getLogger(MessageLogCleanup.class);

    static final String STALE_MESSAGE = "Stale Pending entry marked as Failed";
    static final String EXCEEDED_MESSAGE = "Exceeded max retries";

    private final MessageLogRepository messageLog;
    private final JobScheduler jobScheduler;
    private final ConnectProperties properties;
    private final Clock clock;

    public MessageLogCleanup(MessageLogRepository messageLog, JobScheduler jobScheduler,
                             ConnectProperties properties, Clock clock) {
        this.messageLog = messageLog;
        this.jobScheduler = jobScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    public CleanupResult run() {
        ConnectProperties.CleanupProperties cleanup = properties.getCleanup();
        Instant now = clock.instant();

        int deleted = messageLog.deleteTerminalOlderThan(now.minus(cleanup.getLogRetention()));
        if (deleted > 0) {
            log.info("Message log cleanup deleted {} old entries", deleted);
        }

        int reenqueued = 0;
        int skipped = 0;
        int failed = 0;

        List<MessageLogEntry> stale = messageLog.findStalePending(now.minus(cleanup.getStalePendingThreshold()));
        for (MessageLogEntry entry : stale) {
            try {
                switch (resolveStale(entry, cleanup.getMaxProduceRetries())) {
                    case REENQUEUED -> reenqueued++;
                    case SKIPPED -> skipped++;
                    case FAILED -> failed++;
                    default -> { }
                }
            } catch (RuntimeException e) {
                log.error("Failed to resolve stale entry {}: {}", entry.id(), e.getMessage(), e);
            }
        }

        CleanupResult result = new CleanupResult(deleted, reenqueued, skipped, failed);
        if (!stale.isEmpty()) {
            log.info("Stale pending entries resolved: {}", result);
        }
        return result;
    }

    private StaleResolution resolveStale(MessageLogEntry entry, int maxRetries) {
        if (entry.retryCount() >= maxRetries) {
            return markFailed(entry, EXCEEDED_MESSAGE);
        }

        if (messageLog.isCompleted(entry.idempotencyKey())) {
            messageLog.markSkipped(entry.id(), "Key completed by a later attempt");
            return StaleResolution.SKIPPED;
        }

        if (isRetryableProduction(entry)) {
            if (!messageLog.incrementRetryCount(entry.id())) {
                return StaleResolution.NONE;
            }
            DocumentRef ref = new DocumentRef(entry.sourceEntityType(), entry.sourceEntityId());
            jobScheduler.enqueue(new JobRequest(
                ProduceMessageJob.JOB_NAME,
                properties.getJobs().getDefaultQueue(),
                ProduceMessageJob.args(ref, entry.ruleName(), entry.idempotencyKey()),
                entry.idempotencyKey(),
                false
            ));
            log.info("Stale entry {} re-enqueued (retry {})", entry.id(), entry.retryCount() + 1);
            return StaleResolution.REENQUEUED;
        }

        return markFailed(entry, STALE_MESSAGE);
    }

    private StaleResolution markFailed(MessageLogEntry entry, String reason) {
        if (messageLog.markFailed(entry.id(), reason, null)) {
            log.warn("Entry {} marked Failed: {}", entry.id(), reason);
            return StaleResolution.FAILED;
        }
        return StaleResolution.NONE;
    }

    private static boolean isRetryableProduction(MessageLogEntry entry) {
        return entry.direction() == MessageDirection.PRODUCED
            && entry.ruleName() != null
            && entry.sourceEntityType() != null
            && entry.sourceEntityId() != null;
    }

    private enum StaleResolution {
        REENQUEUED, SKIPPED, FAILED, NONE
    }
}
