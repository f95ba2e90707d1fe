package com.ryuqq.turnstile.model;

import java.util.UUID;

/**
 * 턴 실행(Run) 식별자.
 *
 * <p>형식: {@code <threadId>/run-<uuid>}. 로그와 RunLedger에서 실행 단위를 추적하는 데 사용됩니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public final class RunId {

    private final ThreadId threadId;
    private final String value;

    private RunId(ThreadId threadId, String value) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RunId cannot be null or blank");
        }
        this.threadId = threadId;
        this.value = value;
    }

    /**
     * 새 RunId 생성 (UUID 기반).
     *
     * @param threadId 실행이 속한 스레드
     * @return 새 RunId
     * @throws IllegalArgumentException threadId가 null인 경우
     */
    public static RunId next(ThreadId threadId) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        return new RunId(threadId, threadId.getValue() + "/run-" + UUID.randomUUID());
    }

    /**
     * 기존 값으로 RunId 생성.
     *
     * @param threadId 실행이 속한 스레드
     * @param value RunId 값
     * @return RunId 인스턴스
     */
    public static RunId of(ThreadId threadId, String value) {
        return new RunId(threadId, value);
    }

    public ThreadId getThreadId() {
        return threadId;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunId runId = (RunId) o;
        return value.equals(runId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
