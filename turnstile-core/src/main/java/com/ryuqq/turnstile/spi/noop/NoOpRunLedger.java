package com.ryuqq.turnstile.spi.noop;

import com.ryuqq.turnstile.model.RunId;
import com.ryuqq.turnstile.outcome.RunOutcome;
import com.ryuqq.turnstile.spi.RunLedger;
import com.ryuqq.turnstile.spi.RunRecord;

/**
 * 아무것도 기록하지 않는 RunLedger.
 *
 * <p>스케줄러의 기본값입니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public final class NoOpRunLedger implements RunLedger {

    public static final NoOpRunLedger INSTANCE = new NoOpRunLedger();

    private NoOpRunLedger() {
    }

    @Override
    public void runStarted(RunRecord record) {
        // no-op
    }

    @Override
    public void runTerminated(RunId runId, RunOutcome outcome) {
        // no-op
    }
}
