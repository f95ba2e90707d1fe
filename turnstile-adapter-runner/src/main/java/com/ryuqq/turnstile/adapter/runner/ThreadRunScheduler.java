package com.ryuqq.turnstile.adapter.runner;

import com.ryuqq.turnstile.application.scheduler.ThreadSnapshot;
import com.ryuqq.turnstile.application.scheduler.TurnScheduler;
import com.ryuqq.turnstile.buffer.DrainDescriptor;
import com.ryuqq.turnstile.buffer.DrainPolicy;
import com.ryuqq.turnstile.buffer.MessageBuffer;
import com.ryuqq.turnstile.cancel.CancellationToken;
import com.ryuqq.turnstile.cancel.SchedulerShutdownException;
import com.ryuqq.turnstile.contract.TurnRequest;
import com.ryuqq.turnstile.model.Event;
import com.ryuqq.turnstile.model.RunId;
import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.model.TokenId;
import com.ryuqq.turnstile.model.TurnResponse;
import com.ryuqq.turnstile.outcome.Cancelled;
import com.ryuqq.turnstile.outcome.Completed;
import com.ryuqq.turnstile.outcome.Failed;
import com.ryuqq.turnstile.outcome.RunOutcome;
import com.ryuqq.turnstile.spi.RunLedger;
import com.ryuqq.turnstile.spi.RunRecord;
import com.ryuqq.turnstile.spi.TurnProcessor;
import com.ryuqq.turnstile.spi.noop.NoOpRunLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스레드별 턴 스케줄러 구현체.
 *
 * <p>스레드마다 동시에 최대 하나의 실행만 허용하고, 실행 중에 도착한 이벤트는
 * 버퍼에 쌓아 두었다가 다음 실행(또는 busy injection)으로 처리합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>submit마다 InvocationToken 발급 및 MessageBuffer enqueue</li>
 *   <li>debounce window가 지나면 drain하여 TurnProcessor 실행</li>
 *   <li>실행 결과에 따른 토큰 resolve/reject</li>
 *   <li>RunLedger에 실행 시작/종료 기록 (best-effort)</li>
 *   <li>stop/shutdown 시 취소 신호 전파 및 대기 토큰 정리</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(threadId, events)
 *   ↓
 * token 발급 + buffer.enqueue
 *   ↓
 * scheduleOrRun(threadId)
 *   1. running이면 종료 (실행 종료 후 다시 호출됨)
 *   2. tryDrain → 비어 있으면 nextReadyAt에 타이머 등록
 *   3. Run 생성 → worker 스레드에서 processor.process(request)
 *   4. 결과 처리:
 *      - 성공 → includedCounts 누적, 전체 수에 도달한 토큰 resolve
 *      - 실패 → 포함된 모든 토큰 reject + buffer.dropTokens
 *   5. running 해제 → scheduleOrRun 재호출
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>스레드 상태 변경은 모두 해당 {@link ThreadState}의 모니터 안에서 수행</li>
 *   <li>서로 다른 스레드는 락을 공유하지 않음 (전역 락 없음)</li>
 *   <li>토큰 Future는 모니터 밖에서 완료되므로, 콜백에서 submit을 다시 호출해도 안전</li>
 * </ul>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public final class ThreadRunScheduler implements TurnScheduler {

    private static final Logger log = LoggerFactory.getLogger(ThreadRunScheduler.class);

    private final TurnProcessor processor;
    private final RunLedger runLedger;
    private final Clock clock;
    private final MessageBuffer buffer;
    private final ExecutorService workerExecutor;
    private final ScheduledExecutorService timerExecutor;
    private final boolean ownsExecutors;

    private final ConcurrentHashMap<ThreadId, ThreadState> threads = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final Object activityMonitor = new Object();
    private int activeRuns;

    private volatile SchedulerConfig config;

    /**
     * 생성자 (기본 설정).
     *
     * @param processor 턴 실행자
     * @throws IllegalArgumentException processor가 null인 경우
     */
    public ThreadRunScheduler(TurnProcessor processor) {
        this(processor, new SchedulerConfig());
    }

    /**
     * 생성자 (기본 RunLedger, 자체 executor 사용).
     *
     * @param processor 턴 실행자
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ThreadRunScheduler(TurnProcessor processor, SchedulerConfig config) {
        this(processor, config, NoOpRunLedger.INSTANCE);
    }

    /**
     * 생성자 (RunLedger 주입, 자체 executor 사용).
     *
     * @param processor 턴 실행자
     * @param config 설정
     * @param runLedger 실행 기록 저장소
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ThreadRunScheduler(TurnProcessor processor, SchedulerConfig config, RunLedger runLedger) {
        this(
            processor,
            config,
            runLedger,
            Clock.systemUTC(),
            Executors.newCachedThreadPool(namedDaemonThreads("turnstile-run-")),
            Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("turnstile-debounce-")),
            true
        );
    }

    /**
     * 생성자 (모든 의존성 주입).
     *
     * <p>주입된 executor는 호출자가 소유하며 {@link #shutdown()}에서 종료하지 않습니다.</p>
     *
     * @param processor 턴 실행자
     * @param config 설정
     * @param runLedger 실행 기록 저장소
     * @param clock 시간 소스 (debounce 계산, 실행 시작 시각)
     * @param workerExecutor TurnProcessor를 실행할 executor
     * @param timerExecutor debounce 타이머 executor
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ThreadRunScheduler(
        TurnProcessor processor,
        SchedulerConfig config,
        RunLedger runLedger,
        Clock clock,
        ExecutorService workerExecutor,
        ScheduledExecutorService timerExecutor
    ) {
        this(processor, config, runLedger, clock, workerExecutor, timerExecutor, false);
    }

    private ThreadRunScheduler(
        TurnProcessor processor,
        SchedulerConfig config,
        RunLedger runLedger,
        Clock clock,
        ExecutorService workerExecutor,
        ScheduledExecutorService timerExecutor,
        boolean ownsExecutors
    ) {
        if (processor == null) {
            throw new IllegalArgumentException("processor cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (runLedger == null) {
            throw new IllegalArgumentException("runLedger cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (workerExecutor == null) {
            throw new IllegalArgumentException("workerExecutor cannot be null");
        }
        if (timerExecutor == null) {
            throw new IllegalArgumentException("timerExecutor cannot be null");
        }

        this.processor = processor;
        this.config = config;
        this.runLedger = runLedger;
        this.clock = clock;
        this.buffer = new MessageBuffer(clock, config.debounceWindowMs(), config.debounceMode());
        this.workerExecutor = workerExecutor;
        this.timerExecutor = timerExecutor;
        this.ownsExecutors = ownsExecutors;
    }

    @Override
    public CompletableFuture<TurnResponse> submit(ThreadId threadId, List<Event> events) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        for (Event event : events) {
            if (event == null) {
                throw new IllegalArgumentException("events cannot contain null");
            }
        }
        if (shutdown.get()) {
            return CompletableFuture.failedFuture(new SchedulerShutdownException("Scheduler is shut down"));
        }

        long systemCount = events.stream().filter(Event::isSystem).count();
        log.info("New events in thread {} (events={}, human={}, system={})",
            threadId, events.size(), events.size() - systemCount, systemCount);

        SchedulerConfig current = config;
        ThreadState state = threads.computeIfAbsent(threadId, ThreadState::new);
        List<CompletableFuture<TurnResponse>> parts = new ArrayList<>();

        synchronized (state) {
            // shutdown()은 플래그를 먼저 세우고 스레드별 모니터를 잡으므로, 여기서 확인하면 누락되는 토큰이 없음
            if (shutdown.get()) {
                return CompletableFuture.failedFuture(new SchedulerShutdownException("Scheduler is shut down"));
            }
            if (current.drainPolicy() == DrainPolicy.ONE_BY_ONE && events.size() > 1) {
                for (Event event : events) {
                    parts.add(register(state, List.of(event)));
                }
            } else {
                parts.add(register(state, events));
            }
        }

        scheduleOrRun(threadId);
        return parts.size() == 1 ? parts.get(0) : lastOf(parts);
    }

    @Override
    public void stop(ThreadId threadId) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        ThreadState state = threads.get(threadId);
        if (state == null) {
            return;
        }

        InFlightRun run;
        synchronized (state) {
            state.cancelTimer();
            run = state.currentRun();
        }

        if (run != null && run.cancellation().cancel()) {
            log.info("Cancellation requested for run {} in thread {}", run.runId(), threadId);
        }
    }

    /**
     * 스케줄러 종료.
     *
     * <p>모든 스레드의 실행에 취소 신호를 보내고, 대기 중인 토큰을
     * {@link SchedulerShutdownException}으로 reject합니다. 여러 번 호출해도 안전합니다.</p>
     *
     * <p>진행 중인 TurnProcessor의 종료는 기다리지 않습니다.
     * 필요하면 {@link #awaitIdle(Duration)}을 사용하세요.</p>
     */
    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            log.debug("Scheduler already shut down");
            return;
        }
        log.info("Shutting down scheduler ({} thread(s))", threads.size());

        for (ThreadId threadId : threads.keySet()) {
            stop(threadId);
        }

        SchedulerShutdownException cause = new SchedulerShutdownException("Scheduler is shutting down");
        List<InvocationToken.Settlement> settlements = new ArrayList<>();
        for (ThreadState state : threads.values()) {
            synchronized (state) {
                state.cancelTimer();
                for (InvocationToken token : state.tokens().values()) {
                    settlements.add(token.reject(cause));
                }
                state.tokens().clear();
            }
        }
        buffer.clearAll();

        settlements.forEach(InvocationToken.Settlement::apply);
        log.info("Rejected {} pending token(s) on shutdown", settlements.size());

        if (ownsExecutors) {
            workerExecutor.shutdown();
            timerExecutor.shutdownNow();
        }
    }

    @Override
    public ThreadSnapshot snapshot(ThreadId threadId) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        ThreadState state = threads.get(threadId);
        if (state == null) {
            return ThreadSnapshot.idle(threadId);
        }
        synchronized (state) {
            InFlightRun run = state.currentRun();
            return new ThreadSnapshot(
                threadId,
                run != null,
                run == null ? null : run.runId(),
                state.tokens().size(),
                buffer.pendingBatchCount(threadId),
                state.isTimerArmed()
            );
        }
    }

    /**
     * 설정 교체.
     *
     * <p>다음 스케줄링 결정부터 적용됩니다. 이미 등록된 debounce 타이머와
     * 실행 중인 턴에는 소급 적용되지 않습니다.</p>
     *
     * @param newConfig 새 설정
     * @throws IllegalArgumentException newConfig가 null인 경우
     */
    public void updateConfig(SchedulerConfig newConfig) {
        if (newConfig == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        buffer.setDebounceWindowMs(newConfig.debounceWindowMs());
        buffer.setDebounceMode(newConfig.debounceMode());
        this.config = newConfig;
        log.info("Scheduler config updated: {}", newConfig);
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * 진행 중인 실행이 모두 끝날 때까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 시간 안에 모든 실행이 끝났으면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (activityMonitor) {
            while (activeRuns > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(activityMonitor, remaining);
            }
            return true;
        }
    }

    /**
     * 실행 중인 턴에 새 이벤트를 주입합니다 ({@link RunInjectionChannel}에서 호출).
     *
     * @param state 채널이 묶인 스레드 상태
     * @param run 채널이 묶인 실행
     * @param requested 호출자가 지정한 스레드 ID
     * @return 주입된 이벤트 (없거나 호출 시점이 잘못된 경우 빈 목록)
     */
    List<Event> pullInjectable(ThreadState state, InFlightRun run, ThreadId requested) {
        if (!state.threadId().equals(requested)) {
            log.warn("pullInjectable for thread {} called from a run of thread {}; ignoring", requested, state.threadId());
            return List.of();
        }

        SchedulerConfig current = config;
        synchronized (state) {
            if (state.currentRun() != run) {
                log.warn("pullInjectable called outside run {} of thread {}; ignoring", run.runId(), state.threadId());
                return List.of();
            }
            if (current.busyMode() != BusyMode.INJECT || shutdown.get()) {
                return List.of();
            }

            DrainDescriptor drained = buffer.tryDrain(state.threadId(), current.drainPolicy());
            if (drained.isEmpty()) {
                return List.of();
            }
            run.include(drained.tokenParts());
            log.debug("Injected {} event(s) into run {}", drained.events().size(), run.runId());
            return drained.events();
        }
    }

    private CompletableFuture<TurnResponse> register(ThreadState state, List<Event> events) {
        TokenId tokenId = state.nextTokenId();
        InvocationToken token = new InvocationToken(tokenId, events.size());
        state.tokens().put(tokenId, token);
        buffer.enqueue(state.threadId(), tokenId, events);
        return token.future();
    }

    private void scheduleOrRun(ThreadId threadId) {
        ThreadState state = threads.get(threadId);
        if (state == null) {
            return;
        }

        TurnRequest request;
        InFlightRun run;
        synchronized (state) {
            if (shutdown.get() || state.isRunning()) {
                return;
            }

            DrainDescriptor drained = buffer.tryDrain(threadId, config.drainPolicy());
            if (drained.isEmpty()) {
                armTimer(state);
                return;
            }

            state.cancelTimer();
            run = new InFlightRun(RunId.next(threadId), new CancellationToken(), clock.instant());
            run.include(drained.tokenParts());
            state.startRun(run);
            request = new TurnRequest(
                threadId,
                run.runId(),
                drained.events(),
                run.cancellation(),
                new RunInjectionChannel(this, state, run),
                run.startedAt()
            );
        }

        log.info("Starting run {} with {} event(s)", run.runId(), request.events().size());
        recordStarted(new RunRecord(run.runId(), threadId, request.events().size(), run.startedAt()));

        synchronized (activityMonitor) {
            activeRuns++;
        }
        try {
            workerExecutor.execute(() -> executeRun(state, run, request));
        } catch (RejectedExecutionException e) {
            log.error("Worker executor rejected run {}", run.runId(), e);
            finishRun(state, run, new Failed(e));
        }
    }

    private void executeRun(ThreadState state, InFlightRun run, TurnRequest request) {
        RunOutcome outcome;
        try {
            TurnResponse response = processor.process(request);
            outcome = response == null
                ? new Failed(new IllegalStateException("turn processor returned null response"))
                : new Completed(response);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = failureOf(run, e);
        } catch (Exception e) {
            outcome = failureOf(run, e);
        } catch (Error e) {
            finishRun(state, run, new Failed(e));
            throw e;
        }
        finishRun(state, run, outcome);
    }

    private static RunOutcome failureOf(InFlightRun run, Exception e) {
        return run.cancellation().isCancelled() ? new Cancelled(e) : new Failed(e);
    }

    private void finishRun(ThreadState state, InFlightRun run, RunOutcome outcome) {
        ThreadId threadId = state.threadId();
        List<InvocationToken.Settlement> settlements = new ArrayList<>();
        List<TokenId> settledIds = new ArrayList<>();

        try {
            synchronized (state) {
                if (outcome instanceof Completed completed) {
                    for (Map.Entry<TokenId, Integer> entry : run.includedCounts().entrySet()) {
                        InvocationToken token = state.tokens().get(entry.getKey());
                        if (token != null && token.credit(entry.getValue())) {
                            state.tokens().remove(entry.getKey());
                            settlements.add(token.resolve(completed.response()));
                            settledIds.add(entry.getKey());
                        }
                    }
                } else {
                    Throwable cause = causeOf(outcome);
                    for (TokenId tokenId : run.includedCounts().keySet()) {
                        InvocationToken token = state.tokens().remove(tokenId);
                        if (token != null) {
                            settlements.add(token.reject(cause));
                            settledIds.add(tokenId);
                        }
                    }
                    buffer.dropTokens(threadId, run.includedCounts().keySet());
                }
                state.finishRun();
            }

            if (outcome instanceof Completed) {
                log.info("Run {} completed (resolved tokens: {})", run.runId(), settledIds);
            } else if (outcome instanceof Cancelled) {
                log.info("Run {} cancelled (rejected tokens: {})", run.runId(), settledIds);
            } else {
                log.error("Run {} failed (rejected tokens: {})", run.runId(), settledIds, causeOf(outcome));
            }

            settlements.forEach(InvocationToken.Settlement::apply);
            recordTerminated(run.runId(), outcome);
        } finally {
            synchronized (activityMonitor) {
                activeRuns--;
                activityMonitor.notifyAll();
            }
        }

        scheduleOrRun(threadId);
    }

    private static Throwable causeOf(RunOutcome outcome) {
        if (outcome instanceof Failed failed) {
            return failed.cause();
        }
        if (outcome instanceof Cancelled cancelled) {
            return cancelled.cause();
        }
        throw new IllegalArgumentException("Outcome has no cause: " + outcome);
    }

    // state 모니터 안에서 호출
    private void armTimer(ThreadState state) {
        Optional<Instant> readyAt = buffer.nextReadyAt(state.threadId());
        if (readyAt.isEmpty()) {
            state.cancelTimer();
            return;
        }

        long delayMs = Math.max(0, Duration.between(clock.instant(), readyAt.get()).toMillis());
        long generation = state.nextTimerGeneration();
        ThreadId threadId = state.threadId();
        try {
            ScheduledFuture<?> timer = timerExecutor.schedule(
                () -> onTimer(state, generation),
                delayMs,
                TimeUnit.MILLISECONDS
            );
            state.armTimer(timer);
            log.debug("Debounce timer armed for thread {} ({}ms)", threadId, delayMs);
        } catch (RejectedExecutionException e) {
            log.warn("Timer executor rejected debounce timer for thread {}", threadId, e);
        }
    }

    private void onTimer(ThreadState state, long generation) {
        synchronized (state) {
            state.timerFired(generation);
        }
        scheduleOrRun(state.threadId());
    }

    private void recordStarted(RunRecord record) {
        try {
            runLedger.runStarted(record);
        } catch (RuntimeException e) {
            log.warn("Failed to record start of run {}", record.runId(), e);
        }
    }

    private void recordTerminated(RunId runId, RunOutcome outcome) {
        try {
            runLedger.runTerminated(runId, outcome);
        } catch (RuntimeException e) {
            log.warn("Failed to record termination of run {} ({})", runId, outcome.status(), e);
        }
    }

    /**
     * 분할 제출된 토큰들을 하나의 Future로 합칩니다.
     *
     * <p>모든 부분이 resolve되면 마지막 부분의 응답으로, 하나라도 reject되면 즉시 그 예외로 완료됩니다.</p>
     */
    private static CompletableFuture<TurnResponse> lastOf(List<CompletableFuture<TurnResponse>> parts) {
        CompletableFuture<TurnResponse> combined = new CompletableFuture<>();
        CompletableFuture<TurnResponse> last = parts.get(parts.size() - 1);
        AtomicInteger remaining = new AtomicInteger(parts.size());
        for (CompletableFuture<TurnResponse> part : parts) {
            part.whenComplete((response, error) -> {
                if (error != null) {
                    combined.completeExceptionally(error);
                } else if (remaining.decrementAndGet() == 0) {
                    combined.complete(last.join());
                }
            });
        }
        return combined;
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
