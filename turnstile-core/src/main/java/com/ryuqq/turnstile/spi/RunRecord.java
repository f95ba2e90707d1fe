package com.ryuqq.turnstile.spi;

import com.ryuqq.turnstile.model.RunId;
import com.ryuqq.turnstile.model.ThreadId;

import java.time.Instant;

/**
 * 실행 시작 기록.
 *
 * @param runId 실행 ID
 * @param threadId 스레드 ID
 * @param eventCount 시작 시점에 drain된 이벤트 수
 * @param startedAt 시작 시각
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public record RunRecord(
    RunId runId,
    ThreadId threadId,
    int eventCount,
    Instant startedAt
) {

    public RunRecord {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (eventCount <= 0) {
            throw new IllegalArgumentException("eventCount must be positive (current: " + eventCount + ")");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
    }
}
