package com.ivamare.connect.producer;

import com.ivamare.connect.document.DocumentRef;
import com.ivamare.connect.exception.DocumentNotFoundException;
import com.ivamare.connect.job.ConnectJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Background job entry point for one production.
 */
public class ProduceMessageJob {

    public static final String JOB_NAME = "produce-message";

    private static final Logger log = LoggerFactory.getLogger(ProduceMessageJob.class);

    private final ProducerPipeline pipeline;

    public ProduceMessageJob(ProducerPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Job arguments for a production.
     */
    public static Map<String, Object> args(DocumentRef ref, String ruleName, String idempotencyKey) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("entityType", ref.entityType());
        args.put("entityId", ref.id());
        args.put("ruleName", ruleName);
        args.put("idempotencyKey", idempotencyKey);
        return args;
    }

    /**
     * Run a production. A document deleted before the job ran is dropped, not retried.
     */
    @ConnectJob(JOB_NAME)
    public void run(Map<String, Object> args) {
        DocumentRef ref = new DocumentRef((String) args.get("entityType"), (String) args.get("entityId"));
        String ruleName = (String) args.get("ruleName");
        String key = (String) args.get("idempotencyKey");

        try {
            pipeline.produce(ref, ruleName, key);
        } catch (DocumentNotFoundException e) {
            log.error("Produce job: document {} not found (may have been deleted), rule={}", ref, ruleName);
        }
    }
}
