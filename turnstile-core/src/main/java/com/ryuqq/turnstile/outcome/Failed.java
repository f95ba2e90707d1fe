package com.ryuqq.turnstile.outcome;

import com.ryuqq.turnstile.statemachine.RunStatus;

/**
 * 실패 결과.
 *
 * <p>TurnProcessor가 던진 예외를 그대로 보관합니다.
 * 이 실행에 포함된 모든 토큰은 같은 예외 인스턴스로 reject됩니다.</p>
 *
 * @param cause TurnProcessor 오류
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public record Failed(Throwable cause) implements RunOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public Failed {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    @Override
    public RunStatus status() {
        return RunStatus.FAILED;
    }
}
