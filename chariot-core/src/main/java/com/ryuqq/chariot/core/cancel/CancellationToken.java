package com.ryuqq.chariot.core.cancel;

import com.ryuqq.chariot.core.model.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 조합 가능한 협조적 취소 신호.
 *
 * <p>컨테이너는 생애 동안 하나의 root 토큰을 소유하며, 각 단계(assembly, run, shutdown)는
 * root로부터 파생된 토큰을 사용합니다.</p>
 *
 * <p><strong>전파 규칙:</strong></p>
 * <ul>
 *   <li>부모 토큰이 취소되면 모든 파생 토큰이 같은 사유로 취소됨</li>
 *   <li>파생 토큰의 취소는 부모에게 전파되지 않음</li>
 *   <li>{@link #linked(CancellationToken...)}로 만든 토큰은 부모 중 하나라도 취소되면 취소됨</li>
 *   <li>마감 시각이 있는 토큰은 마감 시각에 {@link DeadlineExceeded}로 취소됨</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 한 번 취소된 토큰은 다시 활성화되지 않으며, 최초 사유가 유지됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * public void run(CancellationToken token) throws Exception {
 *     while (!token.isCancelled()) {
 *         pollOnce();
 *     }
 * }
 * </pre>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class CancellationToken {

    /**
     * 주입 가능한 ambient 토큰의 Kind.
     */
    public static final Kind<CancellationToken> KIND = Kind.of(CancellationToken.class);

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private static final ScheduledThreadPoolExecutor DEADLINES = deadlineScheduler();

    private final Object lock = new Object();
    private final CountDownLatch done = new CountDownLatch(1);
    private final List<Runnable> listeners = new ArrayList<>();
    private final List<Registration> upstream = new ArrayList<>();
    private final Instant deadline;

    private volatile CancellationReason reason;

    private CancellationToken(Instant deadline) {
        this.deadline = deadline;
    }

    /**
     * 부모 없는 root 토큰 생성.
     *
     * @return 새 root 토큰
     */
    public static CancellationToken root() {
        return new CancellationToken(null);
    }

    /**
     * 여러 부모에 연결된 토큰 생성.
     *
     * <p>부모 중 하나라도 취소되면 새 토큰도 취소됩니다. 마감 시각은 부모들 중 가장 이른 값을 상속합니다.</p>
     *
     * @param parents 부모 토큰 (1개 이상)
     * @return 연결된 새 토큰
     * @throws IllegalArgumentException parents가 비었거나 null 원소를 포함한 경우
     */
    public static CancellationToken linked(CancellationToken... parents) {
        if (parents == null || parents.length == 0) {
            throw new IllegalArgumentException("parents cannot be null or empty");
        }
        Instant earliest = null;
        for (CancellationToken parent : parents) {
            if (parent == null) {
                throw new IllegalArgumentException("parent cannot be null");
            }
            earliest = earlier(earliest, parent.deadline);
        }
        return attach(new CancellationToken(earliest), parents);
    }

    /**
     * 이 토큰에 연결된 파생 토큰 생성.
     *
     * @return 파생 토큰
     */
    public CancellationToken derive() {
        return linked(this);
    }

    /**
     * 마감 시각이 있는 파생 토큰 생성.
     *
     * <p>부모의 마감 시각이 더 이르면 부모의 마감 시각이 유지됩니다.</p>
     *
     * @param deadline 마감 시각
     * @return 파생 토큰
     * @throws IllegalArgumentException deadline이 null인 경우
     */
    public CancellationToken withDeadline(Instant deadline) {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
        return attach(new CancellationToken(earlier(this.deadline, deadline)), this);
    }

    /**
     * 현재 시각 기준 timeout 이후를 마감 시각으로 하는 파생 토큰 생성.
     *
     * @param timeout 제한 시간 (0 이상)
     * @return 파생 토큰
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    public CancellationToken withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative (current: " + timeout + ")");
        }
        return withDeadline(Instant.now().plus(timeout));
    }

    /**
     * 토큰 취소.
     *
     * @param reason 취소 사유
     * @return 이번 호출로 취소되었으면 true, 이미 취소된 상태였으면 false
     * @throws IllegalArgumentException reason이 null인 경우
     */
    public boolean cancel(CancellationReason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        List<Runnable> toNotify;
        List<Registration> toRelease;
        synchronized (lock) {
            if (this.reason != null) {
                return false;
            }
            this.reason = reason;
            toNotify = new ArrayList<>(listeners);
            toRelease = new ArrayList<>(upstream);
            listeners.clear();
            upstream.clear();
        }
        done.countDown();

        for (Registration registration : toRelease) {
            registration.close();
        }
        for (Runnable listener : toNotify) {
            notifyListener(listener);
        }
        return true;
    }

    /**
     * 기본 사유로 토큰 취소.
     *
     * @return 이번 호출로 취소되었으면 true
     */
    public boolean cancel() {
        return cancel(Cancelled.of("cancelled"));
    }

    public boolean isCancelled() {
        return reason != null;
    }

    /**
     * 취소 사유 조회.
     *
     * @return 취소 사유, 아직 취소되지 않았으면 empty
     */
    public Optional<CancellationReason> reason() {
        return Optional.ofNullable(reason);
    }

    /**
     * 마감 시각 조회.
     *
     * @return 마감 시각, 없으면 empty
     */
    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * 취소 시 호출될 listener 등록.
     *
     * <p>이미 취소된 경우 listener는 호출 스레드에서 즉시 실행됩니다.</p>
     *
     * @param listener 취소 시 실행할 작업
     * @return 등록 해제 핸들
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public Registration onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        synchronized (lock) {
            if (reason == null) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        notifyListener(listener);
        return () -> { };
    }

    /**
     * 취소될 때까지 대기.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void await() throws InterruptedException {
        done.await();
    }

    /**
     * 취소될 때까지 최대 timeout 동안 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 취소되었으면 true, 시간 초과면 false
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        return done.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * 취소된 경우 {@link CancelledException} 발생.
     *
     * @throws CancelledException 토큰이 취소된 경우
     */
    public void throwIfCancelled() {
        CancellationReason current = reason;
        if (current != null) {
            throw new CancelledException(current);
        }
    }

    @Override
    public String toString() {
        CancellationReason current = reason;
        return "CancellationToken{cancelled=" + (current != null)
            + (current != null ? ", reason=" + current.describe() : "")
            + (deadline != null ? ", deadline=" + deadline : "") + "}";
    }

    private static CancellationToken attach(CancellationToken child, CancellationToken... parents) {
        for (CancellationToken parent : parents) {
            Registration registration = parent.onCancel(
                () -> child.cancel(parent.reason().orElseGet(() -> Cancelled.of("parent cancelled"))));
            child.keepUpstream(registration);
        }
        if (child.deadline != null && !child.isCancelled()) {
            long delayNanos = Math.max(0, Duration.between(Instant.now(), child.deadline).toNanos());
            ScheduledFuture<?> timer = DEADLINES.schedule(
                () -> child.cancel(new DeadlineExceeded(child.deadline)), delayNanos, TimeUnit.NANOSECONDS);
            child.keepUpstream(() -> timer.cancel(false));
        }
        return child;
    }

    private void keepUpstream(Registration registration) {
        synchronized (lock) {
            if (reason == null) {
                upstream.add(registration);
                return;
            }
        }
        registration.close();
    }

    private static ScheduledThreadPoolExecutor deadlineScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "chariot-deadline");
            thread.setDaemon(true);
            return thread;
        });
        // 취소된 마감 타이머는 마감 시각까지 큐에 남지 않음
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /**
     * 대기 중인 마감 타이머 수.
     */
    static int pendingDeadlines() {
        return DEADLINES.getQueue().size();
    }

    private static Instant earlier(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isBefore(b) ? a : b;
    }

    private static void notifyListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed", e);
        }
    }

    /**
     * listener 등록 해제 핸들.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        /**
         * 등록 해제. 여러 번 호출해도 안전합니다.
         */
        @Override
        void close();
    }
}
