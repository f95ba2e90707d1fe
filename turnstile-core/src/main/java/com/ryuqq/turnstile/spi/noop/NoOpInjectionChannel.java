package com.ryuqq.turnstile.spi.noop;

import com.ryuqq.turnstile.model.Event;
import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.spi.InjectionChannel;

import java.util.List;

/**
 * 항상 빈 목록을 반환하는 InjectionChannel.
 *
 * <p>스케줄러 없이 TurnProcessor를 단독 실행할 때 사용합니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public final class NoOpInjectionChannel implements InjectionChannel {

    public static final NoOpInjectionChannel INSTANCE = new NoOpInjectionChannel();

    private NoOpInjectionChannel() {
    }

    @Override
    public List<Event> pullInjectable(ThreadId threadId) {
        return List.of();
    }
}
