package com.ryuqq.turnstile.adapter.runner;

import com.ryuqq.turnstile.model.Event;
import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.spi.InjectionChannel;

import java.util.List;

/**
 * 실행 하나에 묶인 busy-injection 채널.
 *
 * <p>실행이 끝난 뒤에 호출되면 스케줄러가 경고를 남기고 빈 목록을 반환합니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
final class RunInjectionChannel implements InjectionChannel {

    private final ThreadRunScheduler scheduler;
    private final ThreadState state;
    private final InFlightRun run;

    RunInjectionChannel(ThreadRunScheduler scheduler, ThreadState state, InFlightRun run) {
        this.scheduler = scheduler;
        this.state = state;
        this.run = run;
    }

    @Override
    public List<Event> pullInjectable(ThreadId threadId) {
        return scheduler.pullInjectable(state, run, threadId);
    }
}
