package com.ryuqq.turnstile.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TokenId Value Object 테스트.
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
class TokenIdTest {

    private final ThreadId threadId = ThreadId.of("thread-1");

    @Test
    void of_ValidSequence_FormatsValue() {
        // When
        TokenId tokenId = TokenId.of(threadId, 7);

        // Then
        assertEquals("thread-1:7", tokenId.getValue());
        assertEquals(threadId, tokenId.getThreadId());
        assertEquals(7, tokenId.getSequence());
    }

    @Test
    void of_NonPositiveSequence_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> TokenId.of(threadId, 0));
        assertThrows(IllegalArgumentException.class, () -> TokenId.of(threadId, -1));
    }

    @Test
    void of_NullThreadId_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> TokenId.of(null, 1));
    }

    @Test
    void parse_FormattedValue_ReturnsEqualTokenId() {
        // Given
        TokenId original = TokenId.of(threadId, 42);

        // When
        TokenId parsed = TokenId.parse(original.getValue());

        // Then
        assertEquals(original, parsed);
        assertEquals(original.hashCode(), parsed.hashCode());
    }

    @Test
    void parse_MalformedValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> TokenId.parse(null));
        assertThrows(IllegalArgumentException.class, () -> TokenId.parse("no-separator"));
        assertThrows(IllegalArgumentException.class, () -> TokenId.parse(":5"));
        assertThrows(IllegalArgumentException.class, () -> TokenId.parse("thread-1:"));
        assertThrows(IllegalArgumentException.class, () -> TokenId.parse("thread-1:abc"));
    }
}
