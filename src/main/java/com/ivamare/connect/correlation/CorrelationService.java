package com.ivamare.connect.correlation;

import com.ivamare.connect.log.MessageLogRepository;
import com.ivamare.connect.model.MessageDirection;
import com.ivamare.connect.model.MessageLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/**
 * Links a produced command to the business event it caused.
 *
 * <p>Best effort: failures are logged and reported as {@code false}, never thrown, so
 * correlation cannot block the producer or consumer paths.
 */
public class CorrelationService {

    private static final Logger log = LoggerFactory.getLogger(CorrelationService.class);

    private final MessageLogRepository messageLog;
    private final Executor executor;
    private final String businessKeyField;

    public CorrelationService(MessageLogRepository messageLog, Executor executor, String businessKeyField) {
        this.messageLog = messageLog;
        this.executor = executor;
        this.businessKeyField = businessKeyField;
    }

    public String getBusinessKeyField() {
        return businessKeyField;
    }

    /**
     * Write the back-reference on both entries.
     *
     * @return true if both entries were updated
     */
    public boolean correlate(long producedLogId, long consumedLogId) {
        try {
            messageLog.updateCorrelatedLog(producedLogId, consumedLogId);
            messageLog.updateCorrelatedLog(consumedLogId, producedLogId);
            log.info("Correlated produced={} with consumed={}", producedLogId, consumedLogId);
            return true;
        } catch (RuntimeException e) {
            log.warn("Correlation failed produced={} consumed={}: {}", producedLogId, consumedLogId, e.getMessage());
            return false;
        }
    }

    /**
     * Correlate the latest produced and consumed entries whose payload carries the business key.
     *
     * @return true if a pair was found and linked
     */
    public boolean autoCorrelate(String businessKey) {
        if (businessKey == null || businessKey.isBlank()) {
            return false;
        }
        try {
            Optional<MessageLogEntry> produced =
                messageLog.findLatestByPayloadField(MessageDirection.PRODUCED, businessKeyField, businessKey);
            Optional<MessageLogEntry> consumed =
                messageLog.findLatestByPayloadField(MessageDirection.CONSUMED, businessKeyField, businessKey);

            if (produced.isEmpty() || consumed.isEmpty()) {
                log.debug("No correlation pair for {}={}", businessKeyField, businessKey);
                return false;
            }
            return correlate(produced.get().id(), consumed.get().id());
        } catch (RuntimeException e) {
            log.warn("Auto-correlation failed for {}={}: {}", businessKeyField, businessKey, e.getMessage());
            return false;
        }
    }

    /**
     * Run {@link #autoCorrelate(String)} on the executor.
     */
    public CompletableFuture<Boolean> correlateAsync(String businessKey) {
        try {
            return CompletableFuture.supplyAsync(() -> autoCorrelate(businessKey), executor);
        } catch (RuntimeException e) {
            log.warn("Could not schedule correlation for {}: {}", businessKey, e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
    }

    /**
     * Stop accepting correlation tasks. Queued tasks still run.
     */
    public void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
            log.info("Correlation executor shut down");
        }
    }
}
