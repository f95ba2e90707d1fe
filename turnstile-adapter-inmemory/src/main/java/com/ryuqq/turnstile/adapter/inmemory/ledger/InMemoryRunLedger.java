package com.ryuqq.turnstile.adapter.inmemory.ledger;

import com.ryuqq.turnstile.model.RunId;
import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.outcome.RunOutcome;
import com.ryuqq.turnstile.spi.RunLedger;
import com.ryuqq.turnstile.spi.RunRecord;
import com.ryuqq.turnstile.statemachine.RunStatusTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link RunLedger} SPI for testing and reference purposes.
 *
 * <p>Every run the scheduler starts is stored as a {@link RunEntry} and moved to its terminal
 * status when the scheduler reports the outcome. Status changes are validated with
 * {@link RunStatusTransition}, so a run can terminate only once.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>runs:</strong> ConcurrentHashMap&lt;RunId, RunEntry&gt; - O(1) lookup by run</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Grows without bound until {@link #clear()} is called</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryRunLedger ledger = new InMemoryRunLedger();
 * TurnScheduler scheduler = new ThreadRunScheduler(processor, new SchedulerConfig(), ledger);
 *
 * scheduler.submit(threadId, Event.human("hello")).get();
 *
 * List&lt;RunEntry&gt; runs = ledger.findByThread(threadId);
 * </pre>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public class InMemoryRunLedger implements RunLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRunLedger.class);

    private final ConcurrentHashMap<RunId, RunEntry> runs = new ConcurrentHashMap<>();

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if record is null
     * @throws IllegalStateException if the run was already recorded
     */
    @Override
    public void runStarted(RunRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        RunEntry existing = runs.putIfAbsent(record.runId(), RunEntry.started(record));
        if (existing != null) {
            throw new IllegalStateException("Run already recorded: " + record.runId());
        }
        log.debug("Recorded start of run {} ({} event(s))", record.runId(), record.eventCount());
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if runId or outcome is null
     * @throws IllegalStateException if the run is unknown or already terminated
     */
    @Override
    public void runTerminated(RunId runId, RunOutcome outcome) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }

        RunEntry updated = runs.computeIfPresent(runId, (id, entry) ->
            entry.terminated(RunStatusTransition.transition(entry.status(), outcome.status()), outcome)
        );
        if (updated == null) {
            throw new IllegalStateException("Run not found: " + runId);
        }
        log.debug("Recorded termination of run {} ({})", runId, updated.status());
    }

    /**
     * Finds a run by id.
     *
     * @param runId run id
     * @return the entry, or empty if the run was never recorded
     */
    public Optional<RunEntry> find(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        return Optional.ofNullable(runs.get(runId));
    }

    /**
     * Lists every run of a thread, oldest first.
     *
     * @param threadId thread id
     * @return entries ordered by start time (empty if none)
     */
    public List<RunEntry> findByThread(ThreadId threadId) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        return runs.values().stream()
            .filter(entry -> entry.threadId().equals(threadId))
            .sorted(Comparator.comparing(RunEntry::startedAt))
            .collect(Collectors.toList());
    }

    /**
     * Number of recorded runs.
     */
    public int size() {
        return runs.size();
    }

    /**
     * Clears all stored data.
     *
     * <p>Useful for test isolation and cleanup between test cases.</p>
     */
    public void clear() {
        runs.clear();
    }
}
