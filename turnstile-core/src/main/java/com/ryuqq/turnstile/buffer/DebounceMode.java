package com.ryuqq.turnstile.buffer;

/**
 * 연속 도착 시 debounce window 계산 방식.
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public enum DebounceMode {

    /**
     * 새 배치가 도착할 때마다 window를 처음부터 다시 셉니다 (기본값).
     *
     * <p>버스트가 끝날 때까지 drain이 미뤄지므로 가장 많이 합쳐집니다.</p>
     */
    RESET_ON_ARRIVAL("reset-on-arrival"),

    /**
     * 가장 오래된 대기 배치의 도착 시각부터 window를 셉니다.
     *
     * <p>버스트가 계속되어도 첫 도착 후 window가 지나면 drain됩니다.</p>
     */
    FIXED_FROM_FIRST_ARRIVAL("fixed-from-first-arrival");

    private final String key;

    DebounceMode(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * 설정 키로 모드 조회.
     *
     * @param key reset-on-arrival 또는 fixed-from-first-arrival (대소문자 무시)
     * @return DebounceMode
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static DebounceMode fromKey(String key) {
        for (DebounceMode mode : values()) {
            if (mode.key.equalsIgnoreCase(key) || mode.name().equalsIgnoreCase(key)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown debounce mode: " + key);
    }
}
