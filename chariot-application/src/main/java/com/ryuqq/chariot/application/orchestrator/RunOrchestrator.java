package com.ryuqq.chariot.application.orchestrator;

import com.ryuqq.chariot.application.container.RunErrorHandler;
import com.ryuqq.chariot.core.cancel.CancellationToken;
import com.ryuqq.chariot.core.cancel.Cancelled;
import com.ryuqq.chariot.core.capability.Runner;
import com.ryuqq.chariot.core.exception.RunFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * RunnerSet 병렬 실행기.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(parentToken, errorHandler)
 *   ↓
 * scopeToken = parentToken 있으면 linked(root, parentToken), 없으면 root.derive()
 * runToken = scopeToken.derive()
 *   ↓
 * Runner마다 전용 스레드에서 runner.run(runToken) 실행 (실패는 캡처, 전파 안 함)
 *   ↓
 * 완료 순서대로 결과 수집:
 *   - 첫 실패 → runToken 취소 (다른 Runner들에게 종료 요청)
 *   - 이후 실패 → errorHandler(scopeToken, error)   (scopeToken은 첫 실패로 취소되지 않음)
 *   ↓
 * 모든 Runner 종료 대기 → runToken, scopeToken 취소 → 실패가 있으면 RunFailureException(primary, secondaries)
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>취소는 권고이며 스레드를 인터럽트하지 않음 (토큰을 무시하는 Runner는 대기를 무한히 지연시킴)</li>
 *   <li>대기 중 호출 스레드가 인터럽트되면 runToken을 취소하고 계속 대기한 뒤 인터럽트 플래그를 복원</li>
 *   <li>RunnerSet은 초기화 이후 불변이므로 잠금 없이 읽음</li>
 * </ul>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class RunOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);

    private final CancellationToken root;
    private final List<Runner> runners;
    private final AtomicInteger threadCounter = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param root 컨테이너 root 토큰
     * @param runners RunnerSet
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RunOrchestrator(CancellationToken root, List<Runner> runners) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (runners == null) {
            throw new IllegalArgumentException("runners cannot be null");
        }
        this.root = root;
        this.runners = List.copyOf(runners);
    }

    /**
     * 모든 Runner를 병렬 실행하고 종료를 기다림.
     *
     * @param parentToken run 토큰의 추가 부모 (null 가능)
     * @param errorHandler 후속 실패 observer (null 가능)
     * @throws RunFailureException 하나 이상의 Runner가 실패한 경우
     */
    public void run(CancellationToken parentToken, RunErrorHandler errorHandler) {
        CancellationToken scopeToken = parentToken != null
            ? CancellationToken.linked(root, parentToken)
            : root.derive();
        CancellationToken runToken = scopeToken.derive();

        if (runners.isEmpty()) {
            scopeToken.cancel(Cancelled.of("run completed"));
            return;
        }

        ExecutorService workers = Executors.newFixedThreadPool(runners.size(), threadFactory());
        try {
            CompletionService<Throwable> completion = new ExecutorCompletionService<>(workers);
            for (Runner runner : runners) {
                completion.submit(() -> invoke(runner, runToken));
            }
            log.info("Started {} runners", runners.size());

            awaitAll(completion, runToken, scopeToken, errorHandler);
        } finally {
            runToken.cancel(Cancelled.of("run completed"));
            scopeToken.cancel(Cancelled.of("run completed"));
            workers.shutdown();
        }
    }

    private void awaitAll(CompletionService<Throwable> completion, CancellationToken runToken,
                          CancellationToken scopeToken, RunErrorHandler errorHandler) {
        Throwable primary = null;
        List<Throwable> secondaries = new ArrayList<>();
        boolean interrupted = false;

        for (int finished = 0; finished < runners.size(); finished++) {
            Throwable failure = null;
            while (true) {
                try {
                    failure = completion.take().get();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                    runToken.cancel(Cancelled.of("run interrupted"));
                } catch (ExecutionException e) {
                    failure = e.getCause();
                    break;
                }
            }

            if (failure == null) {
                continue;
            }
            if (primary == null) {
                primary = failure;
                log.warn("Runner failed, cancelling remaining runners", failure);
                runToken.cancel(Cancelled.of("runner failed: " + failure));
            } else {
                secondaries.add(failure);
                notifyHandler(errorHandler, scopeToken, failure);
            }
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (primary != null) {
            throw new RunFailureException(primary, secondaries);
        }
        log.info("All runners finished");
    }

    private static Throwable invoke(Runner runner, CancellationToken token) {
        try {
            runner.run(token);
            return null;
        } catch (Exception e) {
            return e;
        }
    }

    private static void notifyHandler(RunErrorHandler errorHandler, CancellationToken token, Throwable failure) {
        if (errorHandler == null) {
            log.warn("Subsequent runner failure", failure);
            return;
        }
        try {
            errorHandler.handle(token, failure);
        } catch (RuntimeException e) {
            log.error("Run error handler failed while handling {}", failure, e);
        }
    }

    private ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "chariot-runner-" + threadCounter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }
}
