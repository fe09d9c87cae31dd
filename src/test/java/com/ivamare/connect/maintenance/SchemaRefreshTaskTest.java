package com.ivamare.connect.maintenance;

import com.ivamare.connect.exception.TransportException;
import com.ivamare.connect.schema.SchemaResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchemaRefreshTask")
class SchemaRefreshTaskTest {

    @Mock
    private SchemaResolver schemaResolver;

    @Test
    @DisplayName("should report the number of refreshed schemas")
    void shouldRefresh() {
        when(schemaResolver.refreshAll()).thenReturn(4);

        assertEquals(4, new SchemaRefreshTask(schemaResolver).run());
    }

    @Test
    @DisplayName("should report zero when the registry is unreachable")
    void shouldSurviveFailure() {
        when(schemaResolver.refreshAll()).thenThrow(new TransportException("registry unreachable"));

        assertEquals(0, new SchemaRefreshTask(schemaResolver).run());
    }
}
