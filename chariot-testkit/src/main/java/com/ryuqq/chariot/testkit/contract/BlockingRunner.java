package com.ryuqq.chariot.testkit.contract;

import com.ryuqq.chariot.core.cancel.CancellationReason;
import com.ryuqq.chariot.core.cancel.CancellationToken;
import com.ryuqq.chariot.core.capability.Runner;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runner that blocks until its run token is cancelled, then returns normally.
 *
 * <p>Records {@code "run:name"} when started and {@code "stopped:name"} when it
 * observes cancellation.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public class BlockingRunner implements Runner {

    private final String name;
    private final EventLog log;
    private final CountDownLatch started = new CountDownLatch(1);
    private final AtomicReference<CancellationReason> observedReason = new AtomicReference<>();

    public BlockingRunner(String name, EventLog log) {
        this.name = name;
        this.log = log;
    }

    @Override
    public void run(CancellationToken token) throws Exception {
        log.record("run:" + name);
        started.countDown();
        token.await();
        observedReason.set(token.reason().orElseThrow());
        log.record("stopped:" + name);
    }

    /**
     * Waits until this runner has started.
     *
     * @param timeout maximum wait
     * @return true if the runner started within the timeout
     */
    public boolean awaitStarted(Duration timeout) throws InterruptedException {
        return started.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Returns the cancellation reason seen when the runner stopped, or null if still running.
     */
    public CancellationReason observedReason() {
        return observedReason.get();
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "BlockingRunner{" + name + "}";
    }
}
