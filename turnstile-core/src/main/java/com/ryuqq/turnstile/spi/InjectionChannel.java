package com.ryuqq.turnstile.spi;

import com.ryuqq.turnstile.model.Event;
import com.ryuqq.turnstile.model.ThreadId;

import java.util.List;

/**
 * Busy-injection capability.
 *
 * <p>실행 중인 TurnProcessor가 스케줄러 전체가 아닌 이 좁은 인터페이스만 참조하도록 하여,
 * 의존 방향을 processor → scheduler 한 방향으로 유지합니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface InjectionChannel {

    /**
     * 현재 실행에 주입할 이벤트를 버퍼에서 꺼냅니다.
     *
     * <p>스케줄러 drain과 같은 정책으로 drain하며, 꺼낸 토큰 수는 현재 실행에 합산됩니다.
     * busy 모드가 wait이거나 호출 시점에 해당 실행이 활성 상태가 아니면 빈 목록을 반환합니다.
     * 예외를 던지지 않습니다.</p>
     *
     * @param threadId 현재 실행의 스레드
     * @return 주입된 이벤트 (없으면 빈 목록)
     */
    List<Event> pullInjectable(ThreadId threadId);
}
