package com.ryuqq.turnstile.outcome;

import com.ryuqq.turnstile.statemachine.RunStatus;

/**
 * 턴 실행(Run) 결과.
 *
 * <ul>
 *   <li>{@link Completed}: TurnProcessor가 응답을 반환함</li>
 *   <li>{@link Failed}: TurnProcessor가 오류를 던짐</li>
 *   <li>{@link Cancelled}: 취소 신호 이후 TurnProcessor가 종료됨</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 고정됩니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public sealed interface RunOutcome permits Completed, Failed, Cancelled {

    /**
     * 결과에 대응하는 종료 상태.
     *
     * @return COMPLETED, FAILED 또는 CANCELLED
     */
    RunStatus status();

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    default boolean isCancelled() {
        return this instanceof Cancelled;
    }
}
