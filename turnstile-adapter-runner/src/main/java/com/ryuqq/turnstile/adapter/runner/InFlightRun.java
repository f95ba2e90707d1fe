package com.ryuqq.turnstile.adapter.runner;

import com.ryuqq.turnstile.buffer.TokenPart;
import com.ryuqq.turnstile.cancel.CancellationToken;
import com.ryuqq.turnstile.model.RunId;
import com.ryuqq.turnstile.model.TokenId;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 실행 중인 턴 하나의 기록.
 *
 * <p>어떤 토큰의 이벤트가 몇 개 포함되었는지(includedCounts)를 추적합니다.
 * 시작 시 drain된 배치와 busy injection으로 추가된 배치가 모두 여기에 누적됩니다.</p>
 *
 * <p>소유 {@link ThreadState}의 모니터 안에서만 변경됩니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
final class InFlightRun {

    private final RunId runId;
    private final CancellationToken cancellation;
    private final Instant startedAt;
    private final Map<TokenId, Integer> includedCounts = new LinkedHashMap<>();
    private int eventCount;

    InFlightRun(RunId runId, CancellationToken cancellation, Instant startedAt) {
        this.runId = runId;
        this.cancellation = cancellation;
        this.startedAt = startedAt;
    }

    RunId runId() {
        return runId;
    }

    CancellationToken cancellation() {
        return cancellation;
    }

    Instant startedAt() {
        return startedAt;
    }

    int eventCount() {
        return eventCount;
    }

    void include(List<TokenPart> parts) {
        for (TokenPart part : parts) {
            includedCounts.merge(part.tokenId(), part.count(), Integer::sum);
            eventCount += part.count();
        }
    }

    Map<TokenId, Integer> includedCounts() {
        return Collections.unmodifiableMap(includedCounts);
    }
}
