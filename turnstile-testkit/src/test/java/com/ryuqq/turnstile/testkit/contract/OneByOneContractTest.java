package com.ryuqq.turnstile.testkit.contract;

import com.ryuqq.turnstile.adapter.runner.SchedulerConfig;
import com.ryuqq.turnstile.buffer.DrainPolicy;
import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.model.TurnResponse;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ONE_BY_ONE 격리 계약 테스트.
 *
 * <p>배치마다 별도의 실행이 일어나고, 각 토큰은 자기 실행의 응답으로 resolve됩니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
class OneByOneContractTest extends AbstractSchedulerContractTest {

    @Override
    protected SchedulerConfig config() {
        return new SchedulerConfig().withDrainPolicy(DrainPolicy.ONE_BY_ONE);
    }

    @Test
    void 대기_중인_두_배치는_각각의_실행으로_처리됨() throws Exception {
        // given
        ThreadId threadId = thread("isolated");
        processor.blockUntilReleased();
        CompletableFuture<TurnResponse> first = scheduler.submit(threadId, human("a"));
        processor.awaitInvocation(1, TIMEOUT);

        CompletableFuture<TurnResponse> second = scheduler.submit(threadId, human("b"));
        CompletableFuture<TurnResponse> third = scheduler.submit(threadId, human("c"));

        // when
        processor.release();

        // then
        assertThat(await(first).content()).isEqualTo("a");
        assertThat(await(second).content()).isEqualTo("b");
        assertThat(await(third).content()).isEqualTo("c");
        assertThat(processor.invokedContents()).containsExactly(List.of("a"), List.of("b"), List.of("c"));
        assertThat(await(second).runId()).isNotEqualTo(await(third).runId());
    }

    @Test
    void 여러_이벤트를_한번에_제출하면_이벤트마다_실행되고_마지막_응답으로_완료됨() throws Exception {
        // given
        ThreadId threadId = thread("split");

        // when
        CompletableFuture<TurnResponse> future = scheduler.submit(threadId, List.of(human("x"), human("y"), human("z")));

        // then
        assertThat(await(future).content()).isEqualTo("z");
        assertThat(processor.invokedContents()).containsExactly(List.of("x"), List.of("y"), List.of("z"));
        awaitQuiescent(threadId);
    }

    @Test
    void 분할된_이벤트_중_하나가_실패하면_제출_전체가_그_예외로_실패함() throws Exception {
        // given
        ThreadId threadId = thread("split-failure");
        IllegalArgumentException failure = new IllegalArgumentException("bad x");
        processor.failNextWith(failure);

        // when
        CompletableFuture<TurnResponse> future = scheduler.submit(threadId, List.of(human("x"), human("y")));

        // then
        assertThat(awaitRejection(future)).isSameAs(failure);
        awaitQuiescent(threadId);
        assertThat(processor.invokedContents()).containsExactly(List.of("x"), List.of("y"));
    }
}
