package com.ryuqq.turnstile.adapter.runner;

import com.ryuqq.turnstile.application.scheduler.ThreadSnapshot;
import com.ryuqq.turnstile.cancel.SchedulerShutdownException;
import com.ryuqq.turnstile.contract.TurnRequest;
import com.ryuqq.turnstile.model.Event;
import com.ryuqq.turnstile.model.RunId;
import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.model.TurnResponse;
import com.ryuqq.turnstile.outcome.Cancelled;
import com.ryuqq.turnstile.outcome.Completed;
import com.ryuqq.turnstile.outcome.Failed;
import com.ryuqq.turnstile.spi.RunLedger;
import com.ryuqq.turnstile.spi.TurnProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * ThreadRunScheduler 유닛 테스트.
 *
 * <p>RunLedger와 TurnProcessor를 mock으로 두고 스케줄러 자체의 동작을 검증합니다:</p>
 * <ul>
 *   <li>실행 시작/종료의 ledger 기록 (best-effort)</li>
 *   <li>TurnProcessor 오류/null 응답/취소 처리</li>
 *   <li>입력 검증과 주입된 executor 소유권</li>
 * </ul>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ThreadRunSchedulerTest {

    private static final long TIMEOUT_MS = 5_000;

    @Mock
    private TurnProcessor processor;

    @Mock
    private RunLedger runLedger;

    private ExecutorService workerExecutor;
    private ScheduledExecutorService timerExecutor;
    private ThreadRunScheduler scheduler;

    private final ThreadId threadId = ThreadId.of("thread-1");

    @BeforeEach
    void setUp() {
        workerExecutor = Executors.newSingleThreadExecutor();
        timerExecutor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ThreadRunScheduler(
            processor, new SchedulerConfig(), runLedger, Clock.systemUTC(), workerExecutor, timerExecutor
        );
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
        workerExecutor.shutdownNow();
        timerExecutor.shutdownNow();
    }

    // ============================================================
    // 1. Ledger 기록
    // ============================================================

    @Test
    void 성공한_실행은_ledger에_시작과_완료가_기록됨() throws Exception {
        // given
        when(processor.process(any())).thenAnswer(invocation -> respond(invocation.getArgument(0), "ok"));

        // when
        TurnResponse response = get(scheduler.submit(threadId, List.of(Event.human("a"), Event.system("tick"))));

        // then
        assertThat(response.content()).isEqualTo("ok");
        verify(runLedger, timeout(TIMEOUT_MS)).runStarted(argThat(record ->
            record.threadId().equals(threadId) && record.eventCount() == 2
        ));
        verify(runLedger, timeout(TIMEOUT_MS)).runTerminated(eq(response.runId()), any(Completed.class));
    }

    @Test
    void ledger_예외는_스케줄링에_영향을_주지_않음() throws Exception {
        // given
        doThrow(new IllegalStateException("ledger down")).when(runLedger).runStarted(any());
        doThrow(new IllegalStateException("ledger down")).when(runLedger).runTerminated(any(), any());
        when(processor.process(any())).thenAnswer(invocation -> respond(invocation.getArgument(0), "still fine"));

        // when
        TurnResponse first = get(scheduler.submit(threadId, Event.human("a")));
        TurnResponse second = get(scheduler.submit(threadId, Event.human("b")));

        // then
        assertThat(first.content()).isEqualTo("still fine");
        assertThat(second.content()).isEqualTo("still fine");
        assertThat(scheduler.awaitIdle(Duration.ofMillis(TIMEOUT_MS))).isTrue();
    }

    // ============================================================
    // 2. TurnProcessor 오류 처리
    // ============================================================

    @Test
    void processor_예외는_그대로_토큰에_전달되고_FAILED로_기록됨() throws Exception {
        // given
        IOException failure = new IOException("upstream closed");
        when(processor.process(any())).thenThrow(failure);

        // when
        CompletableFuture<TurnResponse> future = scheduler.submit(threadId, Event.human("a"));

        // then
        assertThat(causeOf(future)).isSameAs(failure);
        verify(runLedger, timeout(TIMEOUT_MS)).runTerminated(any(RunId.class), argThat(outcome ->
            outcome instanceof Failed failed && failed.cause() == failure
        ));
    }

    @Test
    void processor가_null을_반환하면_실패로_처리됨() throws Exception {
        // given
        when(processor.process(any())).thenReturn(null);

        // when
        CompletableFuture<TurnResponse> future = scheduler.submit(threadId, Event.human("a"));

        // then
        assertThat(causeOf(future))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("turn processor returned null response");
    }

    @Test
    void stop_이후_processor가_던진_예외는_CANCELLED로_기록됨() throws Exception {
        // given
        CountDownLatch started = new CountDownLatch(1);
        IOException aborted = new IOException("stream aborted");
        when(processor.process(any())).thenAnswer(invocation -> {
            TurnRequest request = invocation.getArgument(0);
            CountDownLatch cancelled = new CountDownLatch(1);
            request.cancellation().onCancel(cancelled::countDown);
            started.countDown();
            cancelled.await(TIMEOUT_MS, TimeUnit.MILLISECONDS);
            throw aborted;
        });
        CompletableFuture<TurnResponse> future = scheduler.submit(threadId, Event.human("a"));
        assertThat(started.await(TIMEOUT_MS, TimeUnit.MILLISECONDS)).isTrue();

        // when
        scheduler.stop(threadId);

        // then
        assertThat(causeOf(future)).isSameAs(aborted);
        verify(runLedger, timeout(TIMEOUT_MS)).runTerminated(any(RunId.class), any(Cancelled.class));
    }

    @Test
    void worker_executor가_거부하면_토큰은_그_예외로_reject됨() throws Exception {
        // given
        workerExecutor.shutdown();

        // when
        CompletableFuture<TurnResponse> future = scheduler.submit(threadId, Event.human("a"));

        // then
        assertThat(causeOf(future)).isInstanceOf(RejectedExecutionException.class);
        assertThat(scheduler.snapshot(threadId).running()).isFalse();
        verifyNoInteractions(processor);
    }

    // ============================================================
    // 3. 재진입, 입력 검증, 소유권
    // ============================================================

    @Test
    void 완료_콜백에서_다시_submit해도_교착되지_않음() throws Exception {
        // given
        when(processor.process(any())).thenAnswer(invocation -> {
            TurnRequest request = invocation.getArgument(0);
            return respond(request, request.events().get(0).content());
        });

        // when
        CompletableFuture<TurnResponse> chained = scheduler.submit(threadId, Event.human("first"))
            .thenCompose(response -> scheduler.submit(threadId, Event.human("after " + response.content())));

        // then
        assertThat(get(chained).content()).isEqualTo("after first");
    }

    @Test
    void 잘못된_입력은_IllegalArgumentException() {
        assertThatThrownBy(() -> scheduler.submit(null, List.of(Event.human("a"))))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scheduler.submit(threadId, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scheduler.submit(threadId, (Event) null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scheduler.updateConfig(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ThreadRunScheduler(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 알_수_없는_스레드의_snapshot은_idle() {
        // when
        scheduler.stop(threadId);
        ThreadSnapshot snapshot = scheduler.snapshot(threadId);

        // then
        assertThat(snapshot).isEqualTo(ThreadSnapshot.idle(threadId));
        verifyNoInteractions(processor, runLedger);
    }

    @Test
    void 주입된_executor는_shutdown에서_종료하지_않음() {
        // when
        scheduler.shutdown();

        // then
        assertThat(scheduler.isShutdown()).isTrue();
        assertThat(workerExecutor.isShutdown()).isFalse();
        assertThat(timerExecutor.isShutdown()).isFalse();
        assertThat(scheduler.submit(threadId, Event.human("late")))
            .failsWithin(Duration.ofSeconds(1))
            .withThrowableOfType(ExecutionException.class)
            .withCauseInstanceOf(SchedulerShutdownException.class);
    }

    @Test
    void updateConfig는_다음_결정부터_적용됨() {
        // when
        scheduler.updateConfig(new SchedulerConfig().withBusyMode(BusyMode.INJECT).withDebounceWindowMs(30));

        // then
        assertThat(scheduler.getConfig().busyMode()).isEqualTo(BusyMode.INJECT);
        assertThat(scheduler.getConfig().debounceWindowMs()).isEqualTo(30);
    }

    private static TurnResponse respond(TurnRequest request, String content) {
        return new TurnResponse(request.runId(), content);
    }

    private static TurnResponse get(CompletableFuture<TurnResponse> future) throws Exception {
        return future.get(TIMEOUT_MS, TimeUnit.MILLISECONDS);
    }

    private static Throwable causeOf(CompletableFuture<TurnResponse> future) throws Exception {
        try {
            future.get(TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        }
        throw new AssertionError("Expected the token to be rejected");
    }
}
