package com.ryuqq.turnstile.buffer;

import com.ryuqq.turnstile.model.Event;
import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.model.TokenId;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-thread, debounced queue of token-tagged event batches.
 *
 * <p>The buffer is pure bookkeeping: it never invokes the turn processor and never blocks.
 * It answers two questions for the scheduler: "what would a drain look like right now?"
 * and "when will the next drain become ready?".</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>queues:</strong> ConcurrentHashMap&lt;ThreadId, ThreadQueue&gt; - one FIFO of
 *       {@link BufferedBatch} per thread, created lazily on first enqueue</li>
 *   <li><strong>ThreadQueue:</strong> ArrayDeque guarded by its own monitor, so different threads
 *       never contend on a shared lock</li>
 * </ul>
 *
 * <p><strong>Debounce:</strong></p>
 * <ul>
 *   <li>A thread is ready when it has pending batches and the debounce window has elapsed</li>
 *   <li>{@link DebounceMode#RESET_ON_ARRIVAL}: window counted from the newest pending arrival</li>
 *   <li>{@link DebounceMode#FIXED_FROM_FIRST_ARRIVAL}: window counted from the oldest pending arrival</li>
 *   <li>debounceWindowMs = 0: every pending batch is immediately ready</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * MessageBuffer buffer = new MessageBuffer(Clock.systemUTC(), 50);
 * buffer.enqueue(threadId, tokenId, List.of(Event.human("hi")));
 *
 * DrainDescriptor drained = buffer.tryDrain(threadId, DrainPolicy.ALL_TOGETHER);
 * if (drained.isEmpty()) {
 *     buffer.nextReadyAt(threadId).ifPresent(at -&gt; armTimer(at));
 * }
 * </pre>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public final class MessageBuffer {

    private final Clock clock;
    private final ConcurrentHashMap<ThreadId, ThreadQueue> queues = new ConcurrentHashMap<>();

    private volatile long debounceWindowMs;
    private volatile DebounceMode debounceMode;

    /**
     * Creates a buffer without debounce, reading time from the UTC system clock.
     */
    public MessageBuffer() {
        this(Clock.systemUTC(), 0);
    }

    /**
     * Creates a buffer with the default {@link DebounceMode#RESET_ON_ARRIVAL} mode.
     *
     * @param clock time source for arrival stamps and readiness checks
     * @param debounceWindowMs debounce window in milliseconds (&gt;= 0)
     * @throws IllegalArgumentException if clock is null or the window is negative
     */
    public MessageBuffer(Clock clock, long debounceWindowMs) {
        this(clock, debounceWindowMs, DebounceMode.RESET_ON_ARRIVAL);
    }

    /**
     * Creates a buffer.
     *
     * @param clock time source for arrival stamps and readiness checks
     * @param debounceWindowMs debounce window in milliseconds (&gt;= 0)
     * @param debounceMode how repeated arrivals move the window
     * @throws IllegalArgumentException if clock or mode is null or the window is negative
     */
    public MessageBuffer(Clock clock, long debounceWindowMs, DebounceMode debounceMode) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        setDebounceWindowMs(debounceWindowMs);
        setDebounceMode(debounceMode);
    }

    /**
     * Changes the debounce window. Takes effect on the next readiness check.
     *
     * @param debounceWindowMs debounce window in milliseconds (&gt;= 0)
     * @throws IllegalArgumentException if the window is negative
     */
    public void setDebounceWindowMs(long debounceWindowMs) {
        if (debounceWindowMs < 0) {
            throw new IllegalArgumentException("debounceWindowMs cannot be negative, but was: " + debounceWindowMs);
        }
        this.debounceWindowMs = debounceWindowMs;
    }

    /**
     * Changes the debounce mode. Takes effect on the next readiness check.
     *
     * @param debounceMode new mode
     * @throws IllegalArgumentException if mode is null
     */
    public void setDebounceMode(DebounceMode debounceMode) {
        if (debounceMode == null) {
            throw new IllegalArgumentException("debounceMode cannot be null");
        }
        this.debounceMode = debounceMode;
    }

    public long getDebounceWindowMs() {
        return debounceWindowMs;
    }

    public DebounceMode getDebounceMode() {
        return debounceMode;
    }

    /**
     * Appends a batch to the thread's pending list and restarts its debounce window.
     *
     * @param threadId target thread
     * @param tokenId token that owns the batch
     * @param events events of the batch, in submission order (at least one)
     * @throws IllegalArgumentException if any argument is null or events is empty
     */
    public void enqueue(ThreadId threadId, TokenId tokenId, List<Event> events) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        BufferedBatch batch = new BufferedBatch(tokenId, events, clock.instant());
        queues.computeIfAbsent(threadId, id -> new ThreadQueue()).add(batch);
    }

    /**
     * Removes and returns the next drain for the thread, if one is ready.
     *
     * <p>Returns {@link DrainDescriptor#empty()} when nothing is pending or the debounce
     * window has not elapsed yet.</p>
     *
     * @param threadId target thread
     * @param policy which batches make up the drain
     * @return the drained events with their per-token counts
     * @throws IllegalArgumentException if threadId or policy is null
     */
    public DrainDescriptor tryDrain(ThreadId threadId, DrainPolicy policy) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        ThreadQueue queue = queues.get(threadId);
        if (queue == null) {
            return DrainDescriptor.empty();
        }
        return queue.drain(policy, clock.instant(), debounceWindowMs, debounceMode);
    }

    /**
     * Returns the instant at which the thread's debounce window elapses.
     *
     * @param threadId target thread
     * @return ready instant, or empty if nothing is pending
     * @throws IllegalArgumentException if threadId is null
     */
    public Optional<Instant> nextReadyAt(ThreadId threadId) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        ThreadQueue queue = queues.get(threadId);
        if (queue == null) {
            return Optional.empty();
        }
        return queue.readyAt(debounceWindowMs, debounceMode);
    }

    /**
     * Removes every queued batch that belongs to one of the given tokens.
     *
     * <p>Used after a run fails so that a later drain cannot try to finish a doomed token.</p>
     *
     * @param threadId target thread
     * @param tokenIds tokens to forget
     * @return number of batches removed
     * @throws IllegalArgumentException if threadId or tokenIds is null
     */
    public int dropTokens(ThreadId threadId, Collection<TokenId> tokenIds) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (tokenIds == null) {
            throw new IllegalArgumentException("tokenIds cannot be null");
        }
        ThreadQueue queue = queues.get(threadId);
        if (queue == null || tokenIds.isEmpty()) {
            return 0;
        }
        return queue.removeTokens(new HashSet<>(tokenIds));
    }

    /**
     * Number of batches still waiting for a drain.
     *
     * @param threadId target thread
     * @return pending batch count (0 for unknown threads)
     */
    public int pendingBatchCount(ThreadId threadId) {
        ThreadQueue queue = threadId == null ? null : queues.get(threadId);
        return queue == null ? 0 : queue.size();
    }

    /**
     * Discards every pending batch of the thread.
     *
     * @param threadId target thread
     */
    public void clear(ThreadId threadId) {
        if (threadId != null) {
            queues.remove(threadId);
        }
    }

    /**
     * Discards every pending batch of every thread.
     */
    public void clearAll() {
        queues.clear();
    }

    private static final class ThreadQueue {

        private final Deque<BufferedBatch> batches = new ArrayDeque<>();

        synchronized void add(BufferedBatch batch) {
            batches.addLast(batch);
        }

        synchronized int size() {
            return batches.size();
        }

        synchronized Optional<Instant> readyAt(long windowMs, DebounceMode mode) {
            if (batches.isEmpty()) {
                return Optional.empty();
            }
            BufferedBatch anchor = mode == DebounceMode.RESET_ON_ARRIVAL ? batches.peekLast() : batches.peekFirst();
            return Optional.of(anchor.enqueuedAt().plusMillis(windowMs));
        }

        synchronized DrainDescriptor drain(DrainPolicy policy, Instant now, long windowMs, DebounceMode mode) {
            Optional<Instant> readyAt = readyAt(windowMs, mode);
            if (readyAt.isEmpty() || now.isBefore(readyAt.get())) {
                return DrainDescriptor.empty();
            }

            List<Event> events = new ArrayList<>();
            List<TokenPart> parts = new ArrayList<>();
            int take = policy == DrainPolicy.ONE_BY_ONE ? 1 : batches.size();
            for (int i = 0; i < take; i++) {
                BufferedBatch batch = batches.pollFirst();
                events.addAll(batch.events());
                parts.add(new TokenPart(batch.tokenId(), batch.size()));
            }
            return new DrainDescriptor(events, parts);
        }

        synchronized int removeTokens(Set<TokenId> tokenIds) {
            int before = batches.size();
            batches.removeIf(batch -> tokenIds.contains(batch.tokenId()));
            return before - batches.size();
        }
    }
}
