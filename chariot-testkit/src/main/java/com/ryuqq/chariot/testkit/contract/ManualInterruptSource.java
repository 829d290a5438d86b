package com.ryuqq.chariot.testkit.contract;

import com.ryuqq.chariot.core.spi.InterruptSource;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Manually triggered implementation of InterruptSource for testing purposes.
 *
 * <p>Tests call {@link #fire(String)} to simulate an operating-system signal without
 * touching the JVM's real signal handlers.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public class ManualInterruptSource implements InterruptSource {

    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    @Override
    public Subscription subscribe(Set<String> signals, Consumer<String> listener) {
        Subscriber subscriber = new Subscriber(Set.copyOf(signals), listener);
        subscribers.add(subscriber);
        return subscriber;
    }

    /**
     * Delivers a signal to every active subscriber listening for it.
     *
     * @param signal the signal name (e.g., "INT")
     * @return number of subscribers notified
     */
    public int fire(String signal) {
        int delivered = 0;
        for (Subscriber subscriber : subscribers) {
            if (subscriber.isActive() && subscriber.signals.contains(signal)) {
                subscriber.listener.accept(signal);
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Returns the number of subscriptions that have not been closed.
     */
    public int activeSubscriptions() {
        return (int) subscribers.stream().filter(Subscriber::isActive).count();
    }

    /**
     * Returns the signal names requested by the most recent subscription.
     *
     * @throws IllegalStateException if nothing subscribed yet
     */
    public Set<String> lastSubscribedSignals() {
        if (subscribers.isEmpty()) {
            throw new IllegalStateException("No subscription yet");
        }
        return subscribers.get(subscribers.size() - 1).signals;
    }

    private static final class Subscriber implements Subscription {

        private final Set<String> signals;
        private final Consumer<String> listener;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Subscriber(Set<String> signals, Consumer<String> listener) {
            this.signals = signals;
            this.listener = listener;
        }

        boolean isActive() {
            return !closed.get();
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }
}
