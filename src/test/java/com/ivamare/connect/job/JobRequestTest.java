package com.ivamare.connect.job;

import com.ivamare.connect.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobRequest")
class JobRequestTest {

    @Test
    @DisplayName("should create an immediate request on the default queue")
    void shouldCreateImmediateRequest() {
        JobRequest request = JobRequest.of("produce-message", Map.of("ruleName", "r1"));

        assertEquals("produce-message", request.jobName());
        assertNull(request.queue());
        assertNull(request.deduplicateKey());
        assertFalse(request.afterCommit());
        assertEquals("r1", request.args().get("ruleName"));
    }

    @Test
    @DisplayName("should copy and freeze args")
    void shouldCopyArgs() {
        Map<String, Object> args = new HashMap<>();
        args.put("entityId", "CUST-0001");
        JobRequest request = JobRequest.of("job", args);
        args.put("entityId", "changed");

        assertEquals("CUST-0001", request.args().get("entityId"));
        assertThrows(UnsupportedOperationException.class, () -> request.args().put("x", 1));
    }

    @Test
    @DisplayName("should derive copies with queue, key and commit deferral")
    void shouldDeriveCopies() {
        JobRequest request = JobRequest.of("job", null)
            .withQueue("long")
            .withDeduplicateKey("k1")
            .deferredUntilCommit();

        assertEquals("long", request.queue());
        assertEquals("k1", request.deduplicateKey());
        assertTrue(request.afterCommit());
        assertTrue(request.args().isEmpty());
    }

    @Test
    @DisplayName("should reject a blank job name")
    void shouldRejectBlankJobName() {
        assertThrows(ValidationException.class, () -> JobRequest.of(" ", Map.of()));
    }
}
