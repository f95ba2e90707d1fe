package com.ryuqq.turnstile.testkit.contract;

import com.ryuqq.turnstile.contract.TurnRequest;
import com.ryuqq.turnstile.model.Event;
import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.model.TurnResponse;
import com.ryuqq.turnstile.spi.TurnProcessor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Scriptable {@link TurnProcessor} for contract tests.
 *
 * <p>Records every {@link TurnRequest} it receives and detects overlapping runs of the same thread.
 * Its behaviour can be scripted before or during a test:</p>
 * <ul>
 *   <li>{@link #blockUntilReleased()}: every run waits until {@link #release()} or cancellation</li>
 *   <li>{@link #failNextWith(Exception)}: the next run throws the given exception</li>
 *   <li>{@link #injectBeforeReturning()}: every run calls pullInjectable once before returning</li>
 *   <li>{@link #delayEachRun(Duration)}: every run sleeps for the given duration</li>
 * </ul>
 *
 * <p>The response content is the content of all processed events (drained and injected),
 * joined with {@value #SEPARATOR}.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public class ScriptedTurnProcessor implements TurnProcessor {

    public static final String SEPARATOR = "|";

    private static final long CANCEL_POLL_MS = 5;

    private final List<TurnRequest> invocations = new CopyOnWriteArrayList<>();
    private final List<Event> injectedEvents = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<ThreadId, AtomicInteger> activeByThread = new ConcurrentHashMap<>();
    private final AtomicBoolean overlapDetected = new AtomicBoolean(false);
    private final Queue<Exception> failures = new ConcurrentLinkedQueue<>();
    private final Object invocationMonitor = new Object();

    private volatile CountDownLatch gate;
    private volatile boolean injectBeforeReturning;
    private volatile long delayMs;

    @Override
    public TurnResponse process(TurnRequest request) throws Exception {
        AtomicInteger active = activeByThread.computeIfAbsent(request.threadId(), id -> new AtomicInteger());
        if (active.incrementAndGet() > 1) {
            overlapDetected.set(true);
        }
        synchronized (invocationMonitor) {
            invocations.add(request);
            invocationMonitor.notifyAll();
        }

        try {
            CountDownLatch current = gate;
            if (current != null) {
                while (!current.await(CANCEL_POLL_MS, TimeUnit.MILLISECONDS)) {
                    request.cancellation().throwIfCancelled();
                }
            }
            if (delayMs > 0) {
                Thread.sleep(delayMs);
            }
            request.cancellation().throwIfCancelled();

            List<Event> processed = new ArrayList<>(request.events());
            if (injectBeforeReturning) {
                List<Event> injected = request.pullInjectable();
                injectedEvents.addAll(injected);
                processed.addAll(injected);
            }

            Exception failure = failures.poll();
            if (failure != null) {
                throw failure;
            }

            String content = processed.stream().map(Event::content).collect(Collectors.joining(SEPARATOR));
            return new TurnResponse(request.runId(), content);
        } finally {
            active.decrementAndGet();
        }
    }

    /**
     * Makes subsequent runs wait until {@link #release()} is called.
     */
    public ScriptedTurnProcessor blockUntilReleased() {
        this.gate = new CountDownLatch(1);
        return this;
    }

    /**
     * Lets every blocked run continue, and stops blocking later runs.
     */
    public void release() {
        CountDownLatch current = gate;
        gate = null;
        if (current != null) {
            current.countDown();
        }
    }

    public ScriptedTurnProcessor failNextWith(Exception failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        failures.add(failure);
        return this;
    }

    public ScriptedTurnProcessor injectBeforeReturning() {
        this.injectBeforeReturning = true;
        return this;
    }

    public ScriptedTurnProcessor delayEachRun(Duration delay) {
        this.delayMs = delay.toMillis();
        return this;
    }

    /**
     * Waits until at least {@code count} runs have started.
     *
     * @param count expected number of started runs
     * @param timeout maximum wait
     * @return the request of the {@code count}-th run
     * @throws AssertionError if the runs did not start in time
     * @throws InterruptedException if interrupted while waiting
     */
    public TurnRequest awaitInvocation(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (invocationMonitor) {
            while (invocations.size() < count) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new AssertionError("Expected " + count + " run(s) but saw " + invocations.size());
                }
                TimeUnit.NANOSECONDS.timedWait(invocationMonitor, remaining);
            }
            return invocations.get(count - 1);
        }
    }

    public List<TurnRequest> invocations() {
        return List.copyOf(invocations);
    }

    public int invocationCount() {
        return invocations.size();
    }

    /**
     * Event contents of each run, in run order.
     */
    public List<List<String>> invokedContents() {
        return invocations.stream()
            .map(request -> request.events().stream().map(Event::content).collect(Collectors.toList()))
            .collect(Collectors.toList());
    }

    public List<Event> injectedEvents() {
        return List.copyOf(injectedEvents);
    }

    public boolean overlapDetected() {
        return overlapDetected.get();
    }
}
