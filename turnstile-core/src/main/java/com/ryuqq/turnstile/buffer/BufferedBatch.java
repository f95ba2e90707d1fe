package com.ryuqq.turnstile.buffer;

import com.ryuqq.turnstile.model.Event;
import com.ryuqq.turnstile.model.TokenId;

import java.time.Instant;
import java.util.List;

/**
 * 토큰 태그가 붙은 이벤트 배치.
 *
 * <p>배치 안의 이벤트는 절대 서로 다른 토큰으로 나뉘지 않습니다.</p>
 *
 * @param tokenId 배치를 제출한 토큰
 * @param events 순서가 보존된 이벤트 목록 (1개 이상)
 * @param enqueuedAt 버퍼 도착 시각 (debounce 계산용)
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public record BufferedBatch(
    TokenId tokenId,
    List<Event> events,
    Instant enqueuedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 인자가 null이거나 events가 비어 있는 경우
     */
    public BufferedBatch {
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        if (enqueuedAt == null) {
            throw new IllegalArgumentException("enqueuedAt cannot be null");
        }
        events = List.copyOf(events);
    }

    public int size() {
        return events.size();
    }
}
