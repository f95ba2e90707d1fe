package com.ryuqq.turnstile.testkit.contract;

import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.model.TurnResponse;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 스레드당 단일 실행 계약 테스트.
 *
 * <p>여러 호출자가 동시에 submit해도 같은 스레드의 TurnProcessor 실행이 겹치지 않아야 합니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
class AtMostOneRunContractTest extends AbstractSchedulerContractTest {

    private static final int CALLERS = 8;
    private static final int SUBMITS_PER_CALLER = 25;

    @Test
    void 동시_submit_폭주에도_같은_스레드의_실행은_겹치지_않음() throws Exception {
        // given
        processor.delayEachRun(Duration.ofMillis(1));
        List<ThreadId> threadIds = List.of(thread("fuzz-a"), thread("fuzz-b"), thread("fuzz-c"));
        List<CompletableFuture<TurnResponse>> futures = new CopyOnWriteArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService callers = Executors.newFixedThreadPool(CALLERS);

        // when
        for (int c = 0; c < CALLERS; c++) {
            int caller = c;
            callers.submit(() -> {
                start.await();
                for (int i = 0; i < SUBMITS_PER_CALLER; i++) {
                    ThreadId target = threadIds.get(ThreadLocalRandom.current().nextInt(threadIds.size()));
                    futures.add(scheduler.submit(target, human("c" + caller + "-" + i)));
                    if (i % 5 == 0) {
                        Thread.sleep(1);
                    }
                }
                return null;
            });
        }
        start.countDown();
        callers.shutdown();
        assertThat(callers.awaitTermination(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();

        for (CompletableFuture<TurnResponse> future : futures) {
            await(future);
        }

        // then
        assertThat(futures).hasSize(CALLERS * SUBMITS_PER_CALLER);
        assertThat(processor.overlapDetected()).isFalse();
        for (ThreadId threadId : threadIds) {
            awaitQuiescent(threadId);
        }
    }

    @Test
    void 실행_중_도착한_이벤트는_현재_실행이_끝난_뒤_다음_실행에서_처리됨() throws Exception {
        // given
        ThreadId threadId = thread("sequential");
        processor.blockUntilReleased();
        CompletableFuture<TurnResponse> first = scheduler.submit(threadId, human("a"));
        processor.awaitInvocation(1, TIMEOUT);

        // when
        CompletableFuture<TurnResponse> second = scheduler.submit(threadId, human("b"));
        CompletableFuture<TurnResponse> third = scheduler.submit(threadId, human("c"));

        // then: 실행 중에는 새 실행이 시작되지 않음
        assertThat(scheduler.snapshot(threadId).running()).isTrue();
        assertThat(scheduler.snapshot(threadId).bufferedBatchCount()).isEqualTo(2);
        assertThat(processor.invocationCount()).isEqualTo(1);

        processor.release();

        assertThat(await(first).content()).isEqualTo("a");
        assertThat(await(second).content()).isEqualTo("b|c");
        assertThat(await(third).content()).isEqualTo("b|c");
        assertThat(processor.invokedContents()).containsExactly(List.of("a"), List.of("b", "c"));
        assertThat(processor.overlapDetected()).isFalse();
    }

    @Test
    void 서로_다른_스레드는_동시에_실행될_수_있음() throws Exception {
        // given
        processor.blockUntilReleased();

        // when
        CompletableFuture<TurnResponse> a = scheduler.submit(thread("left"), human("l"));
        CompletableFuture<TurnResponse> b = scheduler.submit(thread("right"), human("r"));

        // then
        processor.awaitInvocation(2, TIMEOUT);
        assertThat(scheduler.snapshot(thread("left")).running()).isTrue();
        assertThat(scheduler.snapshot(thread("right")).running()).isTrue();

        processor.release();
        assertThat(await(a).content()).isEqualTo("l");
        assertThat(await(b).content()).isEqualTo("r");
    }
}
