package com.ryuqq.turnstile.spi;

import com.ryuqq.turnstile.model.RunId;
import com.ryuqq.turnstile.outcome.RunOutcome;

/**
 * 실행 생명주기 기록 SPI.
 *
 * <p>스케줄러는 실행 시작과 종료를 best-effort로 보고합니다.
 * 구현체의 예외는 WARN 로그로 남고 스케줄링에 영향을 주지 않습니다.</p>
 *
 * <p><strong>구현 가이드:</strong></p>
 * <ul>
 *   <li>thread-safe해야 합니다 (서로 다른 스레드의 실행이 동시에 보고됨).</li>
 *   <li>스케줄러 워커 스레드에서 호출되므로 오래 블로킹하지 않아야 합니다.</li>
 *   <li>스케줄러 상태는 휘발성이므로, 이 기록을 근거로 토큰을 복구하지 않습니다.</li>
 * </ul>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public interface RunLedger {

    /**
     * 실행 시작 기록.
     *
     * @param record 시작 정보
     */
    void runStarted(RunRecord record);

    /**
     * 실행 종료 기록.
     *
     * @param runId 실행 ID
     * @param outcome 종료 결과 (Completed, Failed, Cancelled)
     */
    void runTerminated(RunId runId, RunOutcome outcome);
}
