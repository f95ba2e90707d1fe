package com.ryuqq.turnstile.contract;

import com.ryuqq.turnstile.cancel.CancellationToken;
import com.ryuqq.turnstile.model.Event;
import com.ryuqq.turnstile.model.RunId;
import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.spi.InjectionChannel;

import java.time.Instant;
import java.util.List;

/**
 * TurnProcessor에 전달되는 턴 실행 요청.
 *
 * <p>스케줄러가 drain한 이벤트와 함께, 실행을 제어하는 두 개의 핸들을 담고 있습니다:</p>
 * <ul>
 *   <li>cancellation: stop/shutdown 시 신호를 받는 취소 핸들</li>
 *   <li>injection: 실행 도중 새로 도착한 이벤트를 가져오는 좁은 capability</li>
 * </ul>
 *
 * @param threadId 스레드 ID
 * @param runId 실행 ID
 * @param events drain된 이벤트 (도착 순서, 1개 이상)
 * @param cancellation 취소 핸들
 * @param injection busy-injection 채널
 * @param startedAt 실행 시작 시각
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public record TurnRequest(
    ThreadId threadId,
    RunId runId,
    List<Event> events,
    CancellationToken cancellation,
    InjectionChannel injection,
    Instant startedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 인자가 null이거나 events가 비어 있는 경우
     */
    public TurnRequest {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }
        if (injection == null) {
            throw new IllegalArgumentException("injection cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
        events = List.copyOf(events);
    }

    /**
     * 현재 실행에 주입 가능한 이벤트를 가져옵니다.
     *
     * @return 주입된 이벤트 (없으면 빈 목록)
     * @see InjectionChannel#pullInjectable(ThreadId)
     */
    public List<Event> pullInjectable() {
        return injection.pullInjectable(threadId);
    }
}
