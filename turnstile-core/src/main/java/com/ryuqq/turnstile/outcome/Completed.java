package com.ryuqq.turnstile.outcome;

import com.ryuqq.turnstile.model.TurnResponse;
import com.ryuqq.turnstile.statemachine.RunStatus;

/**
 * 성공 결과.
 *
 * @param response 턴의 최종 응답
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public record Completed(TurnResponse response) implements RunOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException response가 null인 경우
     */
    public Completed {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
    }

    @Override
    public RunStatus status() {
        return RunStatus.COMPLETED;
    }
}
