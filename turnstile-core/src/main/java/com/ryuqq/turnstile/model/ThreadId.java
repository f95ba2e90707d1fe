package com.ryuqq.turnstile.model;

/**
 * 대화 스레드 식별자.
 *
 * <p>ThreadId는 스케줄러가 턴을 직렬화하는 단위입니다.
 * 동일 ThreadId에 대해서는 한 번에 하나의 턴만 실행됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>콜론(:)과 공백 문자 불가 (TokenId 구분자로 사용)</li>
 * </ul>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public final class ThreadId {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private ThreadId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ThreadId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("ThreadId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[^:\\s]+$")) {
            throw new IllegalArgumentException("ThreadId cannot contain ':' or whitespace (value: " + value + ")");
        }
        this.value = value;
    }

    /**
     * ThreadId 생성.
     *
     * @param value ThreadId 값
     * @return ThreadId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ThreadId of(String value) {
        return new ThreadId(value);
    }

    /**
     * ThreadId 값 조회.
     *
     * @return ThreadId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ThreadId threadId = (ThreadId) o;
        return value.equals(threadId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
