package com.ryuqq.turnstile.spi;

import com.ryuqq.turnstile.contract.TurnRequest;
import com.ryuqq.turnstile.model.TurnResponse;

/**
 * 턴 처리기 (외부 협력자).
 *
 * <p>drain된 이벤트 배치를 받아 하나의 최종 응답을 생성합니다.
 * 모델 호출, 도구 실행, 컨텍스트 압축 등의 내부 로직은 Turnstile의 관심사가 아닙니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>스케줄러의 워커 스레드에서 동기적으로 호출됩니다.</li>
 *   <li>같은 스레드에 대해 순차적으로 반복 호출되어도 안전해야 합니다 (동시 호출은 없음).</li>
 *   <li>{@link TurnRequest#cancellation()} 신호를 받으면 즉시 예외로 종료해야 합니다.</li>
 *   <li>busy 모드가 inject일 때, 원하는 시점에 {@link TurnRequest#pullInjectable()}을 호출할 수 있습니다.</li>
 *   <li>재시도 정책이 필요하다면 TurnProcessor가 직접 구현합니다. 스케줄러는 재시도하지 않습니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TurnProcessor processor = request -&gt; {
 *     String reply = model.call(request.events());
 *     request.cancellation().throwIfCancelled();
 *     List&lt;Event&gt; late = request.pullInjectable();
 *     if (!late.isEmpty()) {
 *         reply = model.call(late);
 *     }
 *     return new TurnResponse(request.runId(), reply);
 * };
 * </pre>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TurnProcessor {

    /**
     * 턴 실행.
     *
     * @param request 실행 요청 (이벤트, 취소 핸들, 주입 채널)
     * @return 최종 응답 (null 불가)
     * @throws Exception 턴 실패 시. 예외는 이 실행에 포함된 모든 토큰에 그대로 전달됩니다.
     */
    TurnResponse process(TurnRequest request) throws Exception;
}
