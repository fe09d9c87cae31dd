package com.ivamare.connect.handler;

import com.ivamare.connect.job.JobRequest;
import com.ivamare.connect.job.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dispatches a handler's enabled actions as background jobs.
 *
 * <p>A failing action is logged and does not stop the remaining ones. The binary payload
 * is never passed to a job; only the envelope fields without {@code data}.
 */
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final JobScheduler jobScheduler;

    public ActionDispatcher(JobScheduler jobScheduler) {
        this.jobScheduler = jobScheduler;
    }

    /**
     * Dispatch every enabled action in order.
     *
     * @param handler the matched handler
     * @param payload the decoded inner payload
     * @param envelope envelope fields without the binary payload
     * @return number of actions dispatched successfully
     */
    public int dispatch(EventHandler handler, Map<String, Object> payload, Map<String, Object> envelope) {
        int dispatched = 0;
        for (Action action : handler.actions()) {
            if (!action.enabled()) {
                continue;
            }
            try {
                jobScheduler.enqueue(toJob(action, payload, envelope));
                dispatched++;
                log.info("Dispatched {} for handler {}", action.describe(), handler.name());
            } catch (RuntimeException e) {
                log.warn("Action dispatch failed handler={} action={}: {}",
                    handler.name(), action.describe(), e.getMessage(), e);
            }
        }
        return dispatched;
    }

    private JobRequest toJob(Action action, Map<String, Object> payload, Map<String, Object> envelope) {
        if (action instanceof Action.SyncJobAction sync) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("payload", payload);
            context.put("envelope", envelope);
            return JobRequest.of(sync.jobName(), Map.of("context", context)).withQueue(action.queue());
        }
        if (action instanceof Action.MethodCallAction call) {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("payload", payload);
            args.put("envelope", envelope);
            return JobRequest.of(call.methodName(), args).withQueue(action.queue());
        }
        if (action instanceof Action.CreateDocumentAction create) {
            return JobRequest.of(DocumentActionJob.JOB_NAME,
                DocumentActionJob.createArgs(create.entityType(), create.fieldMappings(), payload))
                .withQueue(action.queue());
        }
        Action.UpdateDocumentAction update = (Action.UpdateDocumentAction) action;
        return JobRequest.of(DocumentActionJob.JOB_NAME,
            DocumentActionJob.updateArgs(update.entityType(), update.fieldMappings(), update.correlationField(), payload))
            .withQueue(action.queue());
    }
}
