package com.ryuqq.turnstile.model;

/**
 * 턴의 최종 응답 메시지.
 *
 * <p>하나의 턴은 정확히 하나의 TurnResponse를 생성하며,
 * 해당 턴에서 완료된 모든 토큰이 같은 TurnResponse로 resolve됩니다.</p>
 *
 * @param runId 응답을 생성한 실행 ID
 * @param content 응답 본문 (null 가능: 텍스트 응답 없이 끝난 턴)
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public record TurnResponse(
    RunId runId,
    String content
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException runId가 null인 경우
     */
    public TurnResponse {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        // content는 null 허용
    }

    /**
     * 본문 없는 응답 생성.
     *
     * @param runId 실행 ID
     * @return TurnResponse 인스턴스
     */
    public static TurnResponse empty(RunId runId) {
        return new TurnResponse(runId, null);
    }
}
