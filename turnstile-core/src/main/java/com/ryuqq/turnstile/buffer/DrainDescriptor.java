package com.ryuqq.turnstile.buffer;

import com.ryuqq.turnstile.model.Event;

import java.util.List;

/**
 * drain 결과.
 *
 * <p>events는 꺼낸 배치들을 도착 순서대로 평탄화한 목록이고,
 * tokenParts는 각 토큰이 그중 몇 개의 이벤트를 기여했는지를 나타냅니다.</p>
 *
 * @param events 평탄화된 이벤트 목록
 * @param tokenParts 토큰별 포함 이벤트 수 (도착 순서)
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public record DrainDescriptor(
    List<Event> events,
    List<TokenPart> tokenParts
) {

    private static final DrainDescriptor EMPTY = new DrainDescriptor(List.of(), List.of());

    public DrainDescriptor {
        if (events == null || tokenParts == null) {
            throw new IllegalArgumentException("events and tokenParts cannot be null");
        }
        events = List.copyOf(events);
        tokenParts = List.copyOf(tokenParts);
    }

    /**
     * 빈 descriptor (대기 배치 없음 또는 debounce 미경과).
     *
     * @return 빈 DrainDescriptor
     */
    public static DrainDescriptor empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
