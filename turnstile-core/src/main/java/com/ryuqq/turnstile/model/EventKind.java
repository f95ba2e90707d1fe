package com.ryuqq.turnstile.model;

/**
 * 인바운드 이벤트 종류.
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public enum EventKind {

    /**
     * 사람이 보낸 메시지.
     */
    HUMAN,

    /**
     * 시스템 트리거 (웹훅, 스케줄 등).
     */
    SYSTEM
}
