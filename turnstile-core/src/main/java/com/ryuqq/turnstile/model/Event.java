package com.ryuqq.turnstile.model;

import java.util.Map;

/**
 * 스레드에 제출되는 대화 이벤트.
 *
 * <p>Turnstile은 이벤트 내용을 해석하지 않습니다.
 * 내용은 그대로 TurnProcessor에게 전달됩니다.</p>
 *
 * @param kind 이벤트 종류 (HUMAN, SYSTEM)
 * @param content 이벤트 본문
 * @param attributes 부가 정보 (채널, 발신자 등, 빈 맵 가능)
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public record Event(
    EventKind kind,
    String content,
    Map<String, String> attributes
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 content가 null인 경우
     */
    public Event {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * 사람 메시지 이벤트 생성.
     *
     * @param content 본문
     * @return HUMAN Event
     */
    public static Event human(String content) {
        return new Event(EventKind.HUMAN, content, Map.of());
    }

    /**
     * 시스템 트리거 이벤트 생성.
     *
     * @param content 본문
     * @return SYSTEM Event
     */
    public static Event system(String content) {
        return new Event(EventKind.SYSTEM, content, Map.of());
    }

    public boolean isSystem() {
        return kind == EventKind.SYSTEM;
    }
}
