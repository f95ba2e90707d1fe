package com.ryuqq.turnstile.application.scheduler;

import com.ryuqq.turnstile.model.RunId;
import com.ryuqq.turnstile.model.ThreadId;

import java.util.Optional;

/**
 * 스레드 스케줄링 상태의 읽기 전용 스냅샷.
 *
 * <p>조회 시점의 값이며, 반환 직후 실제 상태는 바뀔 수 있습니다.</p>
 *
 * @param threadId 스레드 ID
 * @param running 실행 중 여부
 * @param currentRunId 현재 실행 ID (실행 중이 아니면 null)
 * @param pendingTokenCount 아직 settle되지 않은 토큰 수
 * @param bufferedBatchCount 버퍼에서 drain을 기다리는 배치 수
 * @param timerArmed debounce 타이머가 걸려 있는지 여부
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public record ThreadSnapshot(
    ThreadId threadId,
    boolean running,
    RunId currentRunId,
    int pendingTokenCount,
    int bufferedBatchCount,
    boolean timerArmed
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException threadId가 null이거나, running과 currentRunId가 일치하지 않는 경우
     */
    public ThreadSnapshot {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (running != (currentRunId != null)) {
            throw new IllegalArgumentException(
                "currentRunId must be present only while running (running: " + running + ", currentRunId: " + currentRunId + ")"
            );
        }
        if (pendingTokenCount < 0 || bufferedBatchCount < 0) {
            throw new IllegalArgumentException("counts cannot be negative");
        }
    }

    /**
     * 상태가 없는 스레드의 스냅샷.
     *
     * @param threadId 스레드 ID
     * @return idle 스냅샷
     */
    public static ThreadSnapshot idle(ThreadId threadId) {
        return new ThreadSnapshot(threadId, false, null, 0, 0, false);
    }

    public Optional<RunId> getCurrentRunId() {
        return Optional.ofNullable(currentRunId);
    }

    /**
     * 아무 작업도 남아 있지 않은지 확인.
     *
     * @return 실행 중이 아니고, 대기 토큰/배치/타이머가 모두 없으면 true
     */
    public boolean isQuiescent() {
        return !running && pendingTokenCount == 0 && bufferedBatchCount == 0 && !timerArmed;
    }
}
