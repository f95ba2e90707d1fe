package com.ryuqq.turnstile.adapter.runner;

/**
 * 실행 중인 스레드에 새 이벤트가 도착했을 때의 동작.
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public enum BusyMode {

    /**
     * 새 이벤트는 버퍼에서 대기하고 다음 실행에서 처리됩니다.
     */
    WAIT("wait"),

    /**
     * 실행 중인 TurnProcessor가 pullInjectable로 새 이벤트를 현재 턴에 합칠 수 있습니다.
     */
    INJECT("inject");

    private final String key;

    BusyMode(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * 설정 키로 모드 조회.
     *
     * @param key wait 또는 inject (대소문자 무시)
     * @return BusyMode
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static BusyMode fromKey(String key) {
        for (BusyMode mode : values()) {
            if (mode.key.equalsIgnoreCase(key) || mode.name().equalsIgnoreCase(key)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown busy mode: " + key);
    }
}
