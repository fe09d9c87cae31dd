package com.ivamare.connect.producer;

import com.ivamare.connect.ConnectProperties;
import com.ivamare.connect.document.MapDocument;
import com.ivamare.connect.expression.SpelEvaluator;
import com.ivamare.connect.idempotency.IdempotencyKeys;
import com.ivamare.connect.job.JobRequest;
import com.ivamare.connect.job.JobScheduler;
import com.ivamare.connect.mapping.FieldMapping;
import com.ivamare.connect.model.DocumentEvent;
import com.ivamare.connect.model.FieldType;
import com.ivamare.connect.rule.DefaultRuleRegistry;
import com.ivamare.connect.rule.EmissionRule;
import com.ivamare.connect.rule.RuleMatchingEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentEventPublisher")
class DocumentEventPublisherTest {

    @Mock
    private JobScheduler jobScheduler;

    private ConnectProperties properties;
    private DefaultRuleRegistry ruleRegistry;
    private DocumentEventPublisher publisher;
    private MapDocument customer;

    @BeforeEach
    void setUp() {
        SpelEvaluator evaluator = new SpelEvaluator();
        properties = new ConnectProperties();
        ruleRegistry = new DefaultRuleRegistry(evaluator);
        publisher = new DocumentEventPublisher(new RuleMatchingEngine(ruleRegistry, evaluator), jobScheduler, properties);
        customer = new MapDocument("Customer", "CUST-0001", Map.of("name", "CUST-0001", "status", "Active"));
    }

    private void register(String name, int priority, String condition) {
        ruleRegistry.register(EmissionRule.builder(name)
            .on("Customer", DocumentEvent.AFTER_INSERT)
            .condition(condition)
            .mapping(FieldMapping.field("clientId", FieldType.STRING, "name"))
            .command("CreateClientCommand", "CreateClientCommand")
            .priority(priority)
            .build());
    }

    @Test
    @DisplayName("should enqueue one after-commit job per passing rule, in priority order")
    void shouldEnqueuePerRule() {
        register("second", 20, null);
        register("first", 1, "doc.status == 'Active'");
        register("never", 5, "doc.status == 'Closed'");

        int enqueued = publisher.onDocumentEvent(customer, "after_insert");

        assertEquals(2, enqueued);
        ArgumentCaptor<JobRequest> requests = ArgumentCaptor.forClass(JobRequest.class);
        verify(jobScheduler, times(2)).enqueue(requests.capture());

        List<JobRequest> captured = requests.getAllValues();
        JobRequest first = captured.get(0);
        String expectedKey = IdempotencyKeys.producerKey("Customer", "CUST-0001", "after_insert", "CreateClientCommand", "first");
        assertEquals(ProduceMessageJob.JOB_NAME, first.jobName());
        assertEquals("default", first.queue());
        assertEquals(expectedKey, first.deduplicateKey());
        assertEquals(expectedKey, first.args().get("idempotencyKey"));
        assertEquals("first", first.args().get("ruleName"));
        assertTrue(first.afterCommit());
        assertEquals("second", captured.get(1).args().get("ruleName"));
    }

    @Test
    @DisplayName("should do nothing for hooks the bridge ignores")
    void shouldIgnoreUnknownHooks() {
        register("first", 1, null);

        assertEquals(0, publisher.onDocumentEvent(customer, "before_validate"));
        verifyNoInteractions(jobScheduler);
    }

    @Test
    @DisplayName("should do nothing when disabled or no rules exist for the type")
    void shouldShortCircuit() {
        assertEquals(0, publisher.onDocumentEvent(customer, "after_insert"));

        register("first", 1, null);
        properties.setEnabled(false);

        assertEquals(0, publisher.onDocumentEvent(customer, "after_insert"));
        verifyNoInteractions(jobScheduler);
    }

    @Test
    @DisplayName("should never let a scheduler failure escape into the host")
    void shouldSwallowSchedulerFailures() {
        register("first", 1, null);
        register("second", 2, null);
        doThrow(new IllegalStateException("queue down")).doNothing().when(jobScheduler).enqueue(any());

        int enqueued = assertDoesNotThrow(() -> publisher.onDocumentEvent(customer, "after_insert"));

        assertEquals(1, enqueued);
    }
}
