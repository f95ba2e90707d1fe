package com.ryuqq.turnstile.outcome;

import com.ryuqq.turnstile.statemachine.RunStatus;

/**
 * 취소 결과.
 *
 * <p>취소 신호를 받은 TurnProcessor가 오류로 종료된 경우입니다.
 * 토큰 입장에서는 {@link Failed}와 동일하게 reject 경로를 탑니다.</p>
 *
 * @param cause TurnProcessor가 취소 시 던진 예외
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public record Cancelled(Throwable cause) implements RunOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public Cancelled {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    @Override
    public RunStatus status() {
        return RunStatus.CANCELLED;
    }
}
