package com.ivamare.connect.handler;

import com.ivamare.connect.document.DocumentStore;
import com.ivamare.connect.document.MapDocument;
import com.ivamare.connect.exception.CorrelationFieldMissingException;
import com.ivamare.connect.exception.TargetDocumentNotFoundException;
import com.ivamare.connect.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentActionJob")
class DocumentActionJobTest {

    @Mock
    private DocumentStore documentStore;

    private DocumentActionJob job;

    private final Map<String, Object> payload = Map.of(
        "clientId", "CUST-0001",
        "client", Map.of("status", "Active", "officeName", "Head Office")
    );

    @BeforeEach
    void setUp() {
        job = new DocumentActionJob(documentStore);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("should create a document from dotted payload paths")
        void shouldCreateDocument() {
            when(documentStore.create(eq("Note"), anyMap())).thenReturn(new MapDocument("Note", "N-1", Map.of()));

            job.run(DocumentActionJob.createArgs("Note",
                Map.of("subject", "clientId", "office", "client.officeName", "missing", "client.nope.deep"), payload));

            verify(documentStore).create(eq("Note"), argThat(values ->
                "CUST-0001".equals(values.get("subject"))
                    && "Head Office".equals(values.get("office"))
                    && values.containsKey("missing") && values.get("missing") == null));
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("should update the document matched by the correlation field")
        void shouldUpdateMatchedDocument() {
            when(documentStore.findOne("Customer", Map.of("clientId", "CUST-0001")))
                .thenReturn(Optional.of(new MapDocument("Customer", "C-42", Map.of())));

            job.run(DocumentActionJob.updateArgs("Customer", Map.of("status", "client.status"), "clientId", payload));

            verify(documentStore).update("Customer", "C-42", Map.of("status", "Active"));
        }

        @Test
        @DisplayName("should fail when no correlation field is configured")
        void shouldFailWithoutCorrelationField() {
            assertThrows(CorrelationFieldMissingException.class, () ->
                job.run(DocumentActionJob.updateArgs("Customer", Map.of("status", "client.status"), null, payload)));
            verifyNoInteractions(documentStore);
        }

        @Test
        @DisplayName("should fail when the payload lacks the correlation value")
        void shouldFailWithoutCorrelationValue() {
            assertThrows(CorrelationFieldMissingException.class, () ->
                job.run(DocumentActionJob.updateArgs("Customer", Map.of(), "externalId", payload)));
        }

        @Test
        @DisplayName("should fail when no document matches")
        void shouldFailWhenTargetMissing() {
            when(documentStore.findOne(eq("Customer"), anyMap())).thenReturn(Optional.empty());

            TargetDocumentNotFoundException ex = assertThrows(TargetDocumentNotFoundException.class, () ->
                job.run(DocumentActionJob.updateArgs("Customer", Map.of(), "clientId", payload)));

            assertEquals(Map.of("clientId", "CUST-0001"), ex.getFilter());
            verify(documentStore, never()).update(anyString(), anyString(), anyMap());
        }
    }

    @Test
    @DisplayName("should reject unknown action types")
    void shouldRejectUnknownActionType() {
        assertThrows(ValidationException.class, () -> job.run(Map.of("actionType", "delete", "entityType", "Customer")));
    }
}
