package com.ivamare.connect.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DocumentEvent")
class DocumentEventTest {

    @Test
    @DisplayName("should map host hook names")
    void shouldMapHookNames() {
        assertEquals(Optional.of(DocumentEvent.AFTER_INSERT), DocumentEvent.fromHookName("after_insert"));
        assertEquals(Optional.of(DocumentEvent.ON_SUBMIT), DocumentEvent.fromHookName("on_submit"));
    }

    @Test
    @DisplayName("should ignore hooks the bridge does not react to")
    void shouldIgnoreUnknownHooks() {
        assertTrue(DocumentEvent.fromHookName("before_save").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> DocumentEvent.fromValue("before_save"));
    }
}
