package com.ryuqq.turnstile.buffer;

import com.ryuqq.turnstile.model.TokenId;

/**
 * drain 결과에 포함된 토큰별 이벤트 수.
 *
 * @param tokenId 토큰 ID
 * @param count 이번 drain에 포함된 이벤트 수 (양수)
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public record TokenPart(TokenId tokenId, int count) {

    public TokenPart {
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
        }
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive (current: " + count + ")");
        }
    }
}
