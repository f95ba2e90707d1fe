package com.ryuqq.turnstile.testkit.contract;

import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.model.TurnResponse;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * WAIT 모드 계약 테스트.
 *
 * <p>WAIT 모드에서는 pullInjectable이 항상 빈 목록을 반환하고,
 * 실행 중 도착한 이벤트는 다음 실행에서 처리됩니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
class WaitModeContractTest extends AbstractSchedulerContractTest {

    @Test
    void WAIT_모드의_pullInjectable은_빈_목록이고_이벤트는_다음_실행으로_넘어감() throws Exception {
        // given
        ThreadId threadId = thread("wait");
        processor.blockUntilReleased().injectBeforeReturning();
        CompletableFuture<TurnResponse> first = scheduler.submit(threadId, human("a"));
        processor.awaitInvocation(1, TIMEOUT);
        CompletableFuture<TurnResponse> second = scheduler.submit(threadId, human("b"));

        // when
        processor.release();

        // then
        assertThat(await(first).content()).isEqualTo("a");
        assertThat(await(second).content()).isEqualTo("b");
        assertThat(processor.injectedEvents()).isEmpty();
        assertThat(processor.invokedContents()).containsExactly(List.of("a"), List.of("b"));
    }
}
