package com.ivamare.connect.producer;

import com.ivamare.connect.ConnectProperties;
import com.ivamare.connect.document.Document;
import com.ivamare.connect.idempotency.IdempotencyKeys;
import com.ivamare.connect.job.JobRequest;
import com.ivamare.connect.job.JobScheduler;
import com.ivamare.connect.model.DocumentEvent;
import com.ivamare.connect.rule.EmissionRule;
import com.ivamare.connect.rule.RuleMatchingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Host-facing hook for document lifecycle events.
 *
 * <p>Called inside the host's transaction. It never sends anything itself: each passing rule
 * becomes an after-commit {@code produce-message} job, and no error escapes into the caller.
 */
public class DocumentEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(DocumentEventPublisher.class);

    private final RuleMatchingEngine matchingEngine;
    private final JobScheduler jobScheduler;
    private final ConnectProperties properties;

    public DocumentEventPublisher(RuleMatchingEngine matchingEngine, JobScheduler jobScheduler,
                                  ConnectProperties properties) {
        this.matchingEngine = matchingEngine;
        this.jobScheduler = jobScheduler;
        this.properties = properties;
    }

    /**
     * Handle a document lifecycle hook.
     *
     * @param document the changed document
     * @param hookName the host hook name, e.g. {@code after_insert}
     * @return number of production jobs enqueued
     */
    public int onDocumentEvent(Document document, String hookName) {
        try {
            if (!properties.isEnabled() || !matchingEngine.hasRulesFor(document.entityType())) {
                return 0;
            }

            Optional<DocumentEvent> event = DocumentEvent.fromHookName(hookName);
            if (event.isEmpty()) {
                return 0;
            }

            List<EmissionRule> rules = matchingEngine.selectRules(document, event.get());
            int enqueued = 0;
            for (EmissionRule rule : rules) {
                if (enqueue(document, event.get(), rule)) {
                    enqueued++;
                }
            }
            return enqueued;

        } catch (RuntimeException e) {
            log.error("Document event handler error for {} on {}: {}",
                document.entityType(), hookName, e.getMessage(), e);
            return 0;
        }
    }

    private boolean enqueue(Document document, DocumentEvent event, EmissionRule rule) {
        try {
            String key = IdempotencyKeys.producerKey(
                document.entityType(), document.id(), event.getValue(), rule.commandType(), rule.name());

            jobScheduler.enqueue(new JobRequest(
                ProduceMessageJob.JOB_NAME,
                properties.getJobs().getDefaultQueue(),
                ProduceMessageJob.args(document.ref(), rule.name(), key),
                key,
                true
            ));
            log.debug("Enqueued production of {} for rule {} key={}", document.ref(), rule.name(), key);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to enqueue rule {} for {}: {}", rule.name(), document.ref(), e.getMessage(), e);
            return false;
        }
    }
}
