package com.ryuqq.turnstile.buffer;

/**
 * 버퍼 drain 시 어떤 배치를 꺼낼지 결정하는 정책.
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public enum DrainPolicy {

    /**
     * 대기 중인 모든 배치를 하나의 턴으로 합칩니다 (도착 순서 유지).
     */
    ALL_TOGETHER("all-together"),

    /**
     * 가장 오래된 배치 하나만 꺼냅니다. 나머지는 다음 drain까지 대기합니다.
     */
    ONE_BY_ONE("one-by-one");

    private final String key;

    DrainPolicy(String key) {
        this.key = key;
    }

    /**
     * 설정 키 조회.
     *
     * @return 설정 파일에서 사용하는 값 (예: all-together)
     */
    public String key() {
        return key;
    }

    /**
     * 설정 키로 정책 조회.
     *
     * @param key all-together 또는 one-by-one (대소문자 무시)
     * @return DrainPolicy
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static DrainPolicy fromKey(String key) {
        for (DrainPolicy policy : values()) {
            if (policy.key.equalsIgnoreCase(key) || policy.name().equalsIgnoreCase(key)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown drain policy: " + key);
    }
}
