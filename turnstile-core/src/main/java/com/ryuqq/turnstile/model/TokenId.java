package com.ryuqq.turnstile.model;

/**
 * Invocation Token 식별자.
 *
 * <p>형식: {@code <threadId>:<sequence>}. sequence는 스레드별 단조 증가 카운터입니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public final class TokenId {

    private final ThreadId threadId;
    private final long sequence;

    private TokenId(ThreadId threadId, long sequence) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        this.threadId = threadId;
        this.sequence = sequence;
    }

    /**
     * TokenId 생성.
     *
     * @param threadId 토큰이 속한 스레드
     * @param sequence 스레드 내 순번 (1부터 시작)
     * @return TokenId 인스턴스
     * @throws IllegalArgumentException threadId가 null이거나 sequence가 양수가 아닌 경우
     */
    public static TokenId of(ThreadId threadId, long sequence) {
        return new TokenId(threadId, sequence);
    }

    /**
     * 문자열 표현({@code <threadId>:<sequence>})에서 TokenId 복원.
     *
     * @param value 문자열 표현
     * @return TokenId 인스턴스
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public static TokenId parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        int separator = value.lastIndexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("TokenId must look like '<threadId>:<sequence>' (value: " + value + ")");
        }
        try {
            long sequence = Long.parseLong(value.substring(separator + 1));
            return new TokenId(ThreadId.of(value.substring(0, separator)), sequence);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("TokenId sequence is not a number (value: " + value + ")", e);
        }
    }

    public ThreadId getThreadId() {
        return threadId;
    }

    public long getSequence() {
        return sequence;
    }

    /**
     * 문자열 표현 조회.
     *
     * @return {@code <threadId>:<sequence>}
     */
    public String getValue() {
        return threadId.getValue() + ":" + sequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TokenId tokenId = (TokenId) o;
        return sequence == tokenId.sequence && threadId.equals(tokenId.threadId);
    }

    @Override
    public int hashCode() {
        return 31 * threadId.hashCode() + Long.hashCode(sequence);
    }

    @Override
    public String toString() {
        return getValue();
    }
}
