package com.ryuqq.turnstile.application.scheduler;

import com.ryuqq.turnstile.model.Event;
import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.model.TurnResponse;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 스레드 단위 턴 스케줄러.
 *
 * <p>호출자가 제출한 이벤트 배치를 스레드별로 버퍼링하고, 스레드당 최대 하나의 턴만 실행하며,
 * 각 호출자에게 자신이 제출한 이벤트를 포함한 턴의 결과를 정확히 한 번 전달합니다.</p>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>동일 스레드의 턴은 절대 겹치지 않습니다.</li>
 *   <li>반환된 future는 정확히 한 번 완료됩니다 (응답 또는 예외).</li>
 *   <li>한 스레드의 실패는 다른 스레드에 영향을 주지 않습니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ThreadId thread = ThreadId.of("slack-C123");
 * CompletableFuture&lt;TurnResponse&gt; reply = scheduler.submit(thread, List.of(Event.human("hello")));
 *
 * reply.whenComplete((response, error) -&gt; {
 *     if (error instanceof SchedulerShutdownException) {
 *         // 서비스 종료 중
 *     } else if (error != null) {
 *         // 턴 실패 (TurnProcessor 오류 그대로)
 *     } else {
 *         send(response.content());
 *     }
 * });
 * </pre>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public interface TurnScheduler {

    /**
     * 이벤트 배치를 하나의 토큰으로 제출.
     *
     * <p>배치는 스레드 버퍼에 들어가고, 스케줄러는 즉시 턴을 시작하거나 debounce 타이머를 겁니다.
     * 같은 스레드에 대한 동시 submit은 각각 독립적으로 추적됩니다.</p>
     *
     * @param threadId 대상 스레드
     * @param events 이벤트 목록 (1개 이상, 순서 보존)
     * @return 토큰이 resolve/reject될 때 완료되는 future
     * @throws IllegalArgumentException threadId가 null이거나 events가 null/빈 목록인 경우
     */
    CompletableFuture<TurnResponse> submit(ThreadId threadId, List<Event> events);

    /**
     * 단일 이벤트 제출.
     *
     * @param threadId 대상 스레드
     * @param event 이벤트
     * @return 토큰이 resolve/reject될 때 완료되는 future
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    default CompletableFuture<TurnResponse> submit(ThreadId threadId, Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return submit(threadId, List.of(event));
    }

    /**
     * 스레드의 현재 실행을 취소하고 대기 중인 debounce 타이머를 해제.
     *
     * <p>토큰을 직접 settle하지 않습니다. 취소된 실행이 실패 경로로 종료되면서
     * 해당 실행의 토큰을 reject합니다. 버퍼에 남은 배치는 이후 새 실행에서 처리됩니다.</p>
     *
     * @param threadId 대상 스레드 (알 수 없는 스레드면 아무 일도 하지 않음)
     */
    void stop(ThreadId threadId);

    /**
     * 전체 종료.
     *
     * <p>모든 스레드에 stop을 호출한 뒤, 아직 대기 중인 모든 토큰을
     * {@link com.ryuqq.turnstile.cancel.SchedulerShutdownException}으로 reject합니다.
     * 여러 번 호출해도 안전합니다.</p>
     */
    void shutdown();

    /**
     * 스레드 상태 조회.
     *
     * @param threadId 대상 스레드
     * @return 현재 상태 스냅샷 (알 수 없는 스레드면 idle 스냅샷)
     */
    ThreadSnapshot snapshot(ThreadId threadId);
}
