package com.ryuqq.turnstile.adapter.runner;

import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.model.TokenId;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * 스레드별 스케줄링 상태.
 *
 * <p>모든 필드는 이 객체의 모니터({@code synchronized (state)}) 안에서만 읽고 씁니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
final class ThreadState {

    private final ThreadId threadId;
    private final Map<TokenId, InvocationToken> tokens = new LinkedHashMap<>();

    private long sequence;
    private InFlightRun currentRun;
    private ScheduledFuture<?> timer;
    private long timerGeneration;

    ThreadState(ThreadId threadId) {
        this.threadId = threadId;
    }

    ThreadId threadId() {
        return threadId;
    }

    Map<TokenId, InvocationToken> tokens() {
        return tokens;
    }

    TokenId nextTokenId() {
        sequence++;
        return TokenId.of(threadId, sequence);
    }

    boolean isRunning() {
        return currentRun != null;
    }

    InFlightRun currentRun() {
        return currentRun;
    }

    void startRun(InFlightRun run) {
        if (currentRun != null) {
            throw new IllegalStateException("Thread " + threadId + " already runs " + currentRun.runId());
        }
        this.currentRun = run;
    }

    void finishRun() {
        this.currentRun = null;
    }

    boolean isTimerArmed() {
        return timer != null;
    }

    /**
     * 새 타이머를 등록하기 위한 세대 번호를 발급하고 기존 타이머를 취소합니다.
     */
    long nextTimerGeneration() {
        cancelTimer();
        return ++timerGeneration;
    }

    void armTimer(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    /**
     * 발화한 타이머가 현재 타이머라면 해제합니다.
     */
    void timerFired(long generation) {
        if (generation == timerGeneration) {
            timer = null;
        }
    }

    void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }
}
