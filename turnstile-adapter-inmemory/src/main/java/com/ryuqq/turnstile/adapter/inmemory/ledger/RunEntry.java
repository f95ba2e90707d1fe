package com.ryuqq.turnstile.adapter.inmemory.ledger;

import com.ryuqq.turnstile.model.RunId;
import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.outcome.RunOutcome;
import com.ryuqq.turnstile.spi.RunRecord;
import com.ryuqq.turnstile.statemachine.RunStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * Immutable view of one recorded run.
 *
 * @param record start information reported by the scheduler
 * @param status current status (RUNNING until terminated)
 * @param outcome terminal outcome, null while RUNNING
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public record RunEntry(
    RunRecord record,
    RunStatus status,
    RunOutcome outcome
) {

    public RunEntry {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status.isTerminal() != (outcome != null)) {
            throw new IllegalArgumentException(
                "outcome must be present only for terminal status (status: " + status + ", outcome: " + outcome + ")"
            );
        }
    }

    static RunEntry started(RunRecord record) {
        return new RunEntry(record, RunStatus.RUNNING, null);
    }

    RunEntry terminated(RunStatus next, RunOutcome outcome) {
        return new RunEntry(record, next, outcome);
    }

    public RunId runId() {
        return record.runId();
    }

    public ThreadId threadId() {
        return record.threadId();
    }

    public Instant startedAt() {
        return record.startedAt();
    }

    public Optional<RunOutcome> getOutcome() {
        return Optional.ofNullable(outcome);
    }
}
