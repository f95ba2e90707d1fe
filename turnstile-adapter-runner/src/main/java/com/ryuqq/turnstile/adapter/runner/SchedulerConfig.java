package com.ryuqq.turnstile.adapter.runner;

import com.ryuqq.turnstile.buffer.DebounceMode;
import com.ryuqq.turnstile.buffer.DrainPolicy;

import java.util.Properties;

/**
 * ThreadRunScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>debounceWindowMs: 마지막 도착 후 drain까지 기다리는 시간 (기본 0ms)</li>
 *   <li>drainPolicy: 한 턴에 담을 배치 범위 (기본 ALL_TOGETHER)</li>
 *   <li>busyMode: 실행 중 도착한 이벤트 처리 방식 (기본 WAIT)</li>
 *   <li>debounceMode: 연속 도착 시 window 계산 방식 (기본 RESET_ON_ARRIVAL)</li>
 * </ul>
 *
 * <p>실행 중에 {@link ThreadRunScheduler#updateConfig(SchedulerConfig)}로 교체할 수 있으며,
 * 다음 스케줄링 결정부터 적용됩니다. 이미 실행 중인 턴에는 소급 적용되지 않습니다.</p>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>채팅처럼 연속 입력이 잦은 채널: debounceWindowMs 500~2000, ALL_TOGETHER</li>
 *   <li>이벤트마다 별도 응답이 필요한 채널: ONE_BY_ONE</li>
 *   <li>긴 턴 도중 사용자의 정정 입력을 반영해야 하는 경우: INJECT</li>
 * </ul>
 *
 * @author Turnstile Team
 * @since 1.0.0
 * @param debounceWindowMs debounce window (밀리초, 0 이상)
 * @param drainPolicy drain 정책
 * @param busyMode busy 모드
 * @param debounceMode debounce 모드
 */
public record SchedulerConfig(
    long debounceWindowMs,
    DrainPolicy drainPolicy,
    BusyMode busyMode,
    DebounceMode debounceMode
) {

    public static final String DEBOUNCE_WINDOW_MS_KEY = "turnstile.debounce-window-ms";
    public static final String DRAIN_POLICY_KEY = "turnstile.drain-policy";
    public static final String BUSY_MODE_KEY = "turnstile.busy-mode";
    public static final String DEBOUNCE_MODE_KEY = "turnstile.debounce-mode";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: debounceWindowMs=0, drainPolicy=ALL_TOGETHER, busyMode=WAIT, debounceMode=RESET_ON_ARRIVAL</p>
     */
    public SchedulerConfig() {
        this(0, DrainPolicy.ALL_TOGETHER, BusyMode.WAIT, DebounceMode.RESET_ON_ARRIVAL);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SchedulerConfig {
        if (debounceWindowMs < 0) {
            throw new IllegalArgumentException(
                "debounceWindowMs cannot be negative (current: " + debounceWindowMs + ")"
            );
        }
        if (drainPolicy == null) {
            throw new IllegalArgumentException("drainPolicy cannot be null");
        }
        if (busyMode == null) {
            throw new IllegalArgumentException("busyMode cannot be null");
        }
        if (debounceMode == null) {
            throw new IllegalArgumentException("debounceMode cannot be null");
        }
    }

    /**
     * Properties에서 설정 로드.
     *
     * <p>없는 키는 기본값을 사용합니다.</p>
     *
     * <pre>
     * turnstile.debounce-window-ms=500
     * turnstile.drain-policy=one-by-one
     * turnstile.busy-mode=inject
     * turnstile.debounce-mode=reset-on-arrival
     * </pre>
     *
     * @param properties 설정 값
     * @return SchedulerConfig
     * @throws IllegalArgumentException properties가 null이거나 값이 잘못된 경우
     */
    public static SchedulerConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        SchedulerConfig defaults = new SchedulerConfig();

        String debounce = properties.getProperty(DEBOUNCE_WINDOW_MS_KEY);
        long debounceWindowMs = defaults.debounceWindowMs();
        if (debounce != null) {
            try {
                debounceWindowMs = Long.parseLong(debounce.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(DEBOUNCE_WINDOW_MS_KEY + " must be a number (current: " + debounce + ")", e);
            }
        }

        String drain = properties.getProperty(DRAIN_POLICY_KEY);
        String busy = properties.getProperty(BUSY_MODE_KEY);
        String mode = properties.getProperty(DEBOUNCE_MODE_KEY);

        return new SchedulerConfig(
            debounceWindowMs,
            drain == null ? defaults.drainPolicy() : DrainPolicy.fromKey(drain.trim()),
            busy == null ? defaults.busyMode() : BusyMode.fromKey(busy.trim()),
            mode == null ? defaults.debounceMode() : DebounceMode.fromKey(mode.trim())
        );
    }

    /**
     * debounceWindowMs만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withDebounceWindowMs(long debounceWindowMs) {
        return new SchedulerConfig(debounceWindowMs, drainPolicy, busyMode, debounceMode);
    }

    /**
     * drainPolicy만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withDrainPolicy(DrainPolicy drainPolicy) {
        return new SchedulerConfig(debounceWindowMs, drainPolicy, busyMode, debounceMode);
    }

    /**
     * busyMode만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withBusyMode(BusyMode busyMode) {
        return new SchedulerConfig(debounceWindowMs, drainPolicy, busyMode, debounceMode);
    }

    /**
     * debounceMode만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withDebounceMode(DebounceMode debounceMode) {
        return new SchedulerConfig(debounceWindowMs, drainPolicy, busyMode, debounceMode);
    }
}
