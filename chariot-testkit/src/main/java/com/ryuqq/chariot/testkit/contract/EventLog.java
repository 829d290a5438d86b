package com.ryuqq.chariot.testkit.contract;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe, append-only record of lifecycle events observed by test components.
 *
 * <p>Events are plain strings such as {@code "construct:db"} or {@code "shutdown:db"},
 * so ordering assertions read naturally.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public class EventLog {

    private final List<String> events = new CopyOnWriteArrayList<>();

    public void record(String event) {
        events.add(event);
    }

    /**
     * Returns a snapshot of all events in recording order.
     */
    public List<String> events() {
        return List.copyOf(events);
    }

    /**
     * Returns events starting with the given prefix, in recording order.
     *
     * @param prefix event prefix (e.g., "shutdown:")
     * @return matching events
     */
    public List<String> eventsStartingWith(String prefix) {
        return events.stream().filter(event -> event.startsWith(prefix)).toList();
    }

    public void clear() {
        events.clear();
    }
}
