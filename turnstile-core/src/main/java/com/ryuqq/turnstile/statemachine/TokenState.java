package com.ryuqq.turnstile.statemachine;

/**
 * Invocation Token의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → RESOLVED (포함된 이벤트 수가 total에 도달)</li>
 *   <li>PENDING → REJECTED (토큰 일부를 포함한 실행이 실패, 또는 shutdown)</li>
 *   <li><strong>종료 상태에서는 전이 불가 (정확히 한 번 settle)</strong></li>
 * </ul>
 *
 * <pre>
 * PENDING
 *    │
 *    ├─► RESOLVED
 *    │
 *    └─► REJECTED
 * </pre>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public enum TokenState {

    /**
     * 결과 대기 중.
     */
    PENDING,

    /**
     * 모든 이벤트가 턴에 포함되어 응답으로 완료됨.
     */
    RESOLVED,

    /**
     * 실패 또는 shutdown으로 거부됨.
     */
    REJECTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return RESOLVED 또는 REJECTED인 경우 true
     */
    public boolean isTerminal() {
        return this == RESOLVED || this == REJECTED;
    }
}
