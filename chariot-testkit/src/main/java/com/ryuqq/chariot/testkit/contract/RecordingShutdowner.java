package com.ryuqq.chariot.testkit.contract;

import com.ryuqq.chariot.core.cancel.CancellationToken;
import com.ryuqq.chariot.core.capability.Shutdowner;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shutdowner that records each invocation into an {@link EventLog}.
 *
 * <p>Construction is recorded as {@code "construct:name"} and shutdown as
 * {@code "shutdown:name"}. Optionally throws after recording to exercise
 * best-effort shutdown.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public class RecordingShutdowner implements Shutdowner {

    private final String name;
    private final EventLog log;
    private final RuntimeException failure;
    private final AtomicInteger shutdownCount = new AtomicInteger();
    private final AtomicReference<CancellationToken> observedToken = new AtomicReference<>();

    public RecordingShutdowner(String name, EventLog log) {
        this(name, log, null);
    }

    /**
     * Creates a shutdowner that throws {@code failure} after recording its shutdown.
     *
     * @param name component name used in events
     * @param log shared event log
     * @param failure exception to throw on shutdown, or null
     */
    public RecordingShutdowner(String name, EventLog log, RuntimeException failure) {
        this.name = name;
        this.log = log;
        this.failure = failure;
        log.record("construct:" + name);
    }

    @Override
    public void shutdown(CancellationToken token) {
        shutdownCount.incrementAndGet();
        observedToken.set(token);
        log.record("shutdown:" + name);
        if (failure != null) {
            throw failure;
        }
    }

    public String name() {
        return name;
    }

    public int shutdownCount() {
        return shutdownCount.get();
    }

    /**
     * Returns the token passed to the last shutdown call, or null if never shut down.
     */
    public CancellationToken observedToken() {
        return observedToken.get();
    }

    @Override
    public String toString() {
        return "RecordingShutdowner{" + name + "}";
    }
}
