package com.ryuqq.turnstile.testkit.contract;

import com.ryuqq.turnstile.adapter.inmemory.ledger.RunEntry;
import com.ryuqq.turnstile.contract.TurnRequest;
import com.ryuqq.turnstile.model.Event;
import com.ryuqq.turnstile.model.ThreadId;
import com.ryuqq.turnstile.model.TurnResponse;
import com.ryuqq.turnstile.statemachine.RunStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 토큰 완결성 계약 테스트.
 *
 * <p>모든 토큰은 정확히 한 번 resolve 또는 reject되며,
 * resolve된 토큰의 이벤트는 모두 어떤 실행에 포함되어 있어야 합니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
class TokenCompletenessContractTest extends AbstractSchedulerContractTest {

    @Test
    void 모든_토큰은_settle되고_제출된_이벤트는_빠짐없이_순서대로_처리됨() throws Exception {
        // given
        ThreadId threadId = thread("complete");
        List<CompletableFuture<TurnResponse>> futures = new ArrayList<>();
        List<String> submitted = new ArrayList<>();

        // when
        for (int i = 0; i < 20; i++) {
            List<Event> batch = new ArrayList<>();
            for (int j = 0; j <= i % 3; j++) {
                String content = "m" + i + "." + j;
                batch.add(human(content));
                submitted.add(content);
            }
            futures.add(scheduler.submit(threadId, batch));
        }

        // then
        for (CompletableFuture<TurnResponse> future : futures) {
            await(future);
        }
        List<String> processed = new ArrayList<>();
        for (TurnRequest request : processor.invocations()) {
            request.events().forEach(event -> processed.add(event.content()));
        }
        assertThat(processed).containsExactlyElementsOf(submitted);
        awaitQuiescent(threadId);
    }

    @Test
    void 실패가_섞여도_모든_토큰은_한번씩_settle됨() throws Exception {
        // given
        ThreadId threadId = thread("mixed");
        processor.blockUntilReleased();
        CompletableFuture<TurnResponse> first = scheduler.submit(threadId, human("first"));
        processor.awaitInvocation(1, TIMEOUT);
        processor.failNextWith(new IllegalStateException("boom"));

        List<CompletableFuture<TurnResponse>> later = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            later.add(scheduler.submit(threadId, human("later-" + i)));
        }

        // when
        processor.release();

        // then: 첫 실행이 실패하므로 first만 reject, 이후 배치는 새 실행에서 resolve
        assertThat(awaitRejection(first)).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        for (CompletableFuture<TurnResponse> future : later) {
            assertThat(await(future).content()).isEqualTo("later-0|later-1|later-2|later-3|later-4");
        }
        awaitQuiescent(threadId);
    }

    @Test
    void 모든_실행이_ledger에_종료_상태로_기록됨() throws Exception {
        // given
        ThreadId threadId = thread("ledger");
        processor.failNextWith(new RuntimeException("first fails"));

        // when
        awaitRejection(scheduler.submit(threadId, human("a")));
        await(scheduler.submit(threadId, human("b")));
        awaitQuiescent(threadId);

        // then
        List<RunEntry> runs = ledger.findByThread(threadId);
        assertThat(runs).hasSize(2);
        assertThat(runs).extracting(RunEntry::status)
            .containsExactlyInAnyOrder(RunStatus.FAILED, RunStatus.COMPLETED);
        assertThat(runs).allMatch(entry -> entry.record().eventCount() == 1);
    }
}
