package com.ryuqq.turnstile.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ThreadId Value Object 테스트.
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
class ThreadIdTest {

    @Test
    void of_ValidValue_CreatesThreadId() {
        // When
        ThreadId threadId = ThreadId.of("slack-C024BE91L");

        // Then
        assertEquals("slack-C024BE91L", threadId.getValue());
        assertEquals("slack-C024BE91L", threadId.toString());
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> ThreadId.of(null));
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ThreadId.of("  "));
    }

    @Test
    void of_ValueWithColon_ThrowsException() {
        // TokenId uses ':' as separator
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> ThreadId.of("a:b"));
        assertTrue(exception.getMessage().contains("':'"));
    }

    @Test
    void of_ValueWithWhitespace_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ThreadId.of("a b"));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ThreadId.of("t".repeat(256)));
        assertDoesNotThrow(() -> ThreadId.of("t".repeat(255)));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        assertEquals(ThreadId.of("t1"), ThreadId.of("t1"));
        assertEquals(ThreadId.of("t1").hashCode(), ThreadId.of("t1").hashCode());
        assertNotEquals(ThreadId.of("t1"), ThreadId.of("t2"));
    }
}
