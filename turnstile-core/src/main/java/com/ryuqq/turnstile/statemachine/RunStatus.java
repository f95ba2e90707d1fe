package com.ryuqq.turnstile.statemachine;

/**
 * 턴 실행(Run)의 생명주기 상태.
 *
 * <pre>
 * RUNNING
 *    │
 *    ├─► COMPLETED (TurnProcessor 성공)
 *    ├─► FAILED    (TurnProcessor 오류)
 *    └─► CANCELLED (stop/shutdown 후 TurnProcessor 종료)
 * </pre>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public enum RunStatus {

    /**
     * 실행 중.
     */
    RUNNING,

    /**
     * 성공.
     */
    COMPLETED,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return RUNNING이 아니면 true
     */
    public boolean isTerminal() {
        return this != RUNNING;
    }
}
