package com.ryuqq.chariot.testkit.contract;

import com.ryuqq.chariot.core.cancel.CancellationToken;
import com.ryuqq.chariot.core.capability.Runner;

import java.util.concurrent.CountDownLatch;

/**
 * Runner that throws a fixed exception.
 *
 * <p>When a gate is given the runner waits for it before failing, which lets tests
 * control the completion order of several failing runners.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public class FailingRunner implements Runner {

    private final Exception failure;
    private final CountDownLatch gate;

    public FailingRunner(Exception failure) {
        this(failure, null);
    }

    public FailingRunner(Exception failure, CountDownLatch gate) {
        this.failure = failure;
        this.gate = gate;
    }

    @Override
    public void run(CancellationToken token) throws Exception {
        if (gate != null) {
            gate.await();
        }
        throw failure;
    }

    @Override
    public String toString() {
        return "FailingRunner{" + failure + "}";
    }
}
