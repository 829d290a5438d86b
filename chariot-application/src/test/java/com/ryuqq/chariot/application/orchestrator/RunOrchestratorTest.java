package com.ryuqq.chariot.application.orchestrator;

import com.ryuqq.chariot.application.container.RunErrorHandler;
import com.ryuqq.chariot.core.cancel.CancellationToken;
import com.ryuqq.chariot.core.capability.Runner;
import com.ryuqq.chariot.core.exception.RunFailureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.*;

/**
 * RunOrchestrator 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>모든 Runner가 같은 run 토큰으로 병렬 실행</li>
 *   <li>첫 실패가 run 토큰을 취소</li>
 *   <li>후속 실패는 취소되지 않은 범위 토큰과 함께 errorHandler로 전달</li>
 *   <li>parentToken 취소가 Runner에게 전파</li>
 * </ul>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@Timeout(10)
class RunOrchestratorTest {

    @Mock
    private RunErrorHandler errorHandler;

    @Test
    void run_Runner가_없으면_즉시_반환() {
        // given
        RunOrchestrator orchestrator = new RunOrchestrator(CancellationToken.root(), List.of());

        // when
        orchestrator.run(null, errorHandler);

        // then
        verifyNoInteractions(errorHandler);
    }

    @Test
    void run_모든_Runner가_성공하면_정상_반환하고_run_토큰은_취소됨() throws Exception {
        // given
        CancellationToken root = CancellationToken.root();
        Runner first = mock(Runner.class);
        Runner second = mock(Runner.class);
        RunOrchestrator orchestrator = new RunOrchestrator(root, List.of(first, second));

        // when
        orchestrator.run(null, errorHandler);

        // then
        ArgumentCaptor<CancellationToken> firstToken = ArgumentCaptor.forClass(CancellationToken.class);
        verify(first).run(firstToken.capture());
        verify(second).run(same(firstToken.getValue()));
        assertThat(firstToken.getValue().isCancelled()).isTrue();
        assertThat(root.isCancelled()).isFalse();
        verifyNoInteractions(errorHandler);
    }

    @Test
    void run_Runner들이_병렬로_실행됨() {
        // given
        CountDownLatch bothStarted = new CountDownLatch(2);
        Runner waiter = token -> {
            bothStarted.countDown();
            bothStarted.await();
        };
        RunOrchestrator orchestrator = new RunOrchestrator(CancellationToken.root(), List.of(waiter, waiter));

        // when
        orchestrator.run(null, null);

        // then
        assertThat(bothStarted.getCount()).isZero();
    }

    @Test
    void run_첫_실패가_다른_Runner를_취소하고_RunFailureException으로_전파됨() {
        // given
        IllegalStateException failure = new IllegalStateException("listener crashed");
        Runner failing = token -> {
            throw failure;
        };
        Runner blocking = CancellationToken::await;
        RunOrchestrator orchestrator = new RunOrchestrator(CancellationToken.root(), List.of(blocking, failing));

        // when & then
        assertThatThrownBy(() -> orchestrator.run(null, errorHandler))
            .isInstanceOf(RunFailureException.class)
            .hasCauseReference(failure)
            .satisfies(e -> assertThat(((RunFailureException) e).secondaries()).isEmpty());
        verifyNoInteractions(errorHandler);
    }

    @Test
    void run_후속_실패는_완료_순서대로_errorHandler에_전달됨() {
        // given
        IllegalStateException first = new IllegalStateException("first");
        IllegalStateException second = new IllegalStateException("second");
        IllegalStateException third = new IllegalStateException("third");
        List<Throwable> handled = new CopyOnWriteArrayList<>();
        CountDownLatch secondGate = new CountDownLatch(1);

        Runner firstRunner = token -> {
            throw first;
        };
        Runner secondRunner = token -> {
            token.await();
            secondGate.countDown();
            throw second;
        };
        Runner thirdRunner = token -> {
            secondGate.await();
            throw third;
        };
        RunOrchestrator orchestrator = new RunOrchestrator(CancellationToken.root(),
            List.of(thirdRunner, secondRunner, firstRunner));

        // when & then
        assertThatThrownBy(() -> orchestrator.run(null, (token, error) -> handled.add(error)))
            .isInstanceOf(RunFailureException.class)
            .hasCauseReference(first)
            .satisfies(e -> assertThat(((RunFailureException) e).secondaries()).hasSize(2));
        assertThat(handled).containsExactlyInAnyOrder(second, third);
        assertThat(handled).hasSize(2);
    }

    @Test
    void run_errorHandler는_첫_실패로_취소되지_않은_범위_토큰을_받음() {
        // given
        CancellationToken parent = CancellationToken.root().withTimeout(Duration.ofMinutes(5));
        List<Boolean> handlerTokenCancelled = new CopyOnWriteArrayList<>();
        AtomicReference<CancellationToken> handlerToken = new AtomicReference<>();
        AtomicReference<CancellationToken> runnerToken = new AtomicReference<>();

        Runner failing = token -> {
            throw new IllegalStateException("first");
        };
        Runner laterFailing = token -> {
            runnerToken.set(token);
            token.await();
            throw new IllegalStateException("later");
        };
        RunOrchestrator orchestrator = new RunOrchestrator(CancellationToken.root(), List.of(laterFailing, failing));

        // when
        assertThatThrownBy(() -> orchestrator.run(parent, (token, error) -> {
            handlerTokenCancelled.add(token.isCancelled());
            handlerToken.set(token);
        }))
            .isInstanceOf(RunFailureException.class)
            .hasRootCauseMessage("first");

        // then
        assertThat(handlerTokenCancelled).containsExactly(false);
        assertThat(handlerToken.get()).isNotSameAs(runnerToken.get());
        assertThat(handlerToken.get().deadline()).isEqualTo(parent.deadline());
        assertThat(handlerToken.get().isCancelled()).isTrue();
        assertThat(parent.isCancelled()).isFalse();
    }

    @Test
    void run_errorHandler_예외는_전파되지_않음() {
        // given
        Runner failing = token -> {
            throw new IllegalStateException("boom");
        };
        Runner laterFailing = token -> {
            token.await();
            throw new IllegalStateException("later");
        };
        doThrow(new RuntimeException("handler crashed")).when(errorHandler).handle(any(), any());
        RunOrchestrator orchestrator = new RunOrchestrator(CancellationToken.root(), List.of(failing, laterFailing));

        // when & then
        assertThatThrownBy(() -> orchestrator.run(null, errorHandler))
            .isInstanceOf(RunFailureException.class)
            .hasRootCauseMessage("boom");
        verify(errorHandler).handle(any(), any());
    }

    @Test
    void run_parentToken_취소가_Runner에게_전파됨() throws InterruptedException {
        // given
        CancellationToken parent = CancellationToken.root();
        AtomicReference<CancellationToken> seen = new AtomicReference<>();
        CountDownLatch started = new CountDownLatch(1);
        Runner runner = token -> {
            seen.set(token);
            started.countDown();
            token.await();
        };
        RunOrchestrator orchestrator = new RunOrchestrator(CancellationToken.root(), List.of(runner));

        // when
        Thread canceller = new Thread(() -> {
            try {
                started.await();
                parent.cancel();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        canceller.start();
        orchestrator.run(parent, null);
        canceller.join();

        // then
        assertThat(seen.get().isCancelled()).isTrue();
    }

    @Test
    void run_root_취소가_Runner에게_전파됨() {
        // given
        CancellationToken root = CancellationToken.root();
        Runner runner = token -> {
            root.cancel();
            token.await();
        };

        // when
        new RunOrchestrator(root, List.of(runner)).run(null, null);

        // then
        assertThat(root.isCancelled()).isTrue();
    }

    @Test
    void constructor_null_의존성은_예외() {
        assertThatThrownBy(() -> new RunOrchestrator(null, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RunOrchestrator(CancellationToken.root(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
