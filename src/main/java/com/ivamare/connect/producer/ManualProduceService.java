package com.ivamare.connect.producer;

import com.ivamare.connect.document.DocumentRef;
import com.ivamare.connect.idempotency.IdempotencyKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-triggers a production by hand.
 *
 * <p>Every call mints a fresh key, so a manual retry is never suppressed as a duplicate
 * of an earlier attempt.
 */
public class ManualProduceService {

    private static final Logger log = LoggerFactory.getLogger(ManualProduceService.class);

    private final ProducerPipeline pipeline;

    public ManualProduceService(ProducerPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Produce synchronously.
     *
     * @return the key used for the production
     */
    public String produce(String entityType, String entityId, String ruleName) {
        String key = IdempotencyKeys.manualKey();
        log.info("Manual produce {} {} rule={} key={}", entityType, entityId, ruleName, key);
        pipeline.produce(new DocumentRef(entityType, entityId), ruleName, key);
        return key;
    }
}
