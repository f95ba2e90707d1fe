package com.ryuqq.turnstile.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Event 테스트.
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
class EventTest {

    @Test
    void human_CreatesHumanEventWithoutAttributes() {
        Event event = Event.human("hello");

        assertEquals(EventKind.HUMAN, event.kind());
        assertEquals("hello", event.content());
        assertTrue(event.attributes().isEmpty());
        assertFalse(event.isSystem());
    }

    @Test
    void system_CreatesSystemEvent() {
        assertTrue(Event.system("reminder fired").isSystem());
    }

    @Test
    void constructor_CopiesAttributes() {
        // Given
        Map<String, String> attributes = new HashMap<>();
        attributes.put("channel", "C1");

        // When
        Event event = new Event(EventKind.HUMAN, "hi", attributes);
        attributes.put("channel", "changed");

        // Then
        assertEquals("C1", event.attributes().get("channel"));
        assertThrows(UnsupportedOperationException.class, () -> event.attributes().put("x", "y"));
    }

    @Test
    void constructor_NullKindOrContent_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Event(null, "hi", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new Event(EventKind.HUMAN, null, Map.of()));
    }
}
