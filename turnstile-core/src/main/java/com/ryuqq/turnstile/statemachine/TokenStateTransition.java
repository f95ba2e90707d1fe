package com.ryuqq.turnstile.statemachine;

/**
 * Invocation Token 상태 전이 검증.
 *
 * <p>토큰은 정확히 한 번만 settle되어야 합니다.
 * 종료 상태에서의 전이 시도는 이중 전달 버그이므로 {@link IllegalStateException}으로 거부합니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public final class TokenStateTransition {

    private TokenStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(TokenState from, TokenState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Token already settled: %s → %s", from, to)
            );
        }
        if (!to.isTerminal()) {
            throw new IllegalStateException(
                String.format("Invalid token transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static TokenState transition(TokenState current, TokenState next) {
        validate(current, next);
        return next;
    }
}
