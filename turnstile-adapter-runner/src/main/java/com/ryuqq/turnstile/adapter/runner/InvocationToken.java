package com.ryuqq.turnstile.adapter.runner;

import com.ryuqq.turnstile.model.TokenId;
import com.ryuqq.turnstile.model.TurnResponse;
import com.ryuqq.turnstile.statemachine.TokenState;
import com.ryuqq.turnstile.statemachine.TokenStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * submit 호출 하나에 대응하는 완료 핸들.
 *
 * <p>상태 변경은 소유 스레드의 {@link ThreadState} 모니터 안에서만 일어납니다.
 * Future 완료는 {@link Settlement#apply()}로 모니터 밖에서 수행합니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
final class InvocationToken {

    private static final Logger log = LoggerFactory.getLogger(InvocationToken.class);

    private final TokenId tokenId;
    private final int totalEventCount;
    private final CompletableFuture<TurnResponse> future = new CompletableFuture<>();

    private int includedCount;
    private TokenState state = TokenState.PENDING;

    InvocationToken(TokenId tokenId, int totalEventCount) {
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
        }
        if (totalEventCount <= 0) {
            throw new IllegalArgumentException("totalEventCount must be positive (current: " + totalEventCount + ")");
        }
        this.tokenId = tokenId;
        this.totalEventCount = totalEventCount;
    }

    TokenId tokenId() {
        return tokenId;
    }

    int totalEventCount() {
        return totalEventCount;
    }

    int includedCount() {
        return includedCount;
    }

    TokenState state() {
        return state;
    }

    CompletableFuture<TurnResponse> future() {
        return future;
    }

    /**
     * 성공한 실행이 처리한 이벤트 수를 누적합니다.
     *
     * @param count 이번 실행에 포함된 이벤트 수
     * @return 누적 수가 전체 수에 도달했으면 true
     */
    boolean credit(int count) {
        int next = includedCount + count;
        if (next > totalEventCount) {
            log.warn("Included count clamped for token {} (total={}, included={}, credited={})",
                tokenId, totalEventCount, includedCount, count);
            next = totalEventCount;
        }
        includedCount = next;
        return includedCount == totalEventCount;
    }

    /**
     * RESOLVED로 전이하고, 모니터 밖에서 적용할 Settlement를 반환합니다.
     *
     * @throws IllegalStateException 이미 종료 상태인 경우
     */
    Settlement resolve(TurnResponse response) {
        state = TokenStateTransition.transition(state, TokenState.RESOLVED);
        return new Settlement(future, response, null);
    }

    /**
     * REJECTED로 전이하고, 모니터 밖에서 적용할 Settlement를 반환합니다.
     *
     * @throws IllegalStateException 이미 종료 상태인 경우
     */
    Settlement reject(Throwable cause) {
        state = TokenStateTransition.transition(state, TokenState.REJECTED);
        return new Settlement(future, null, cause);
    }

    /**
     * 보류된 Future 완료.
     *
     * @param future 대상 Future
     * @param response 성공 응답 (실패 시 null)
     * @param error 실패 원인 (성공 시 null)
     */
    record Settlement(CompletableFuture<TurnResponse> future, TurnResponse response, Throwable error) {

        void apply() {
            if (error != null) {
                future.completeExceptionally(error);
            } else {
                future.complete(response);
            }
        }
    }
}
