package com.ryuqq.chariot.application.signal;

import com.ryuqq.chariot.core.spi.InterruptSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;
import sun.misc.SignalHandler;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 운영체제 신호 기반 {@link InterruptSource} 구현체.
 *
 * <p>신호 이름은 "INT", "TERM"처럼 SIG 접두사 없이 쓰며, 접두사가 있으면 제거하고
 * 대문자로 정규화합니다. 구독 해제 시 이전 핸들러를 복원합니다.</p>
 *
 * <p><strong>주의:</strong> JVM이 내부적으로 사용하는 신호(예: QUIT, USR2)는 등록할 수 없으며,
 * 이 경우 이미 설치한 핸들러를 되돌린 뒤 {@link IllegalArgumentException}을 던집니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class SignalInterruptSource implements InterruptSource {

    private static final Logger log = LoggerFactory.getLogger(SignalInterruptSource.class);

    private static final String PREFIX = "SIG";

    @Override
    public Subscription subscribe(Set<String> signals, Consumer<String> listener) {
        if (signals == null) {
            throw new IllegalArgumentException("signals cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }

        Map<Signal, SignalHandler> previous = new LinkedHashMap<>();
        try {
            for (String name : normalize(signals)) {
                Signal signal = new Signal(name);
                SignalHandler old = Signal.handle(signal, received -> deliver(listener, name));
                previous.put(signal, old);
            }
        } catch (IllegalArgumentException e) {
            restore(previous);
            throw e;
        }
        log.debug("Subscribed to signals {}", previous.keySet());

        AtomicBoolean closed = new AtomicBoolean(false);
        return () -> {
            if (closed.compareAndSet(false, true)) {
                restore(previous);
                log.debug("Restored handlers for signals {}", previous.keySet());
            }
        };
    }

    static Set<String> normalize(Set<String> signals) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String signal : signals) {
            if (signal == null || signal.isBlank()) {
                throw new IllegalArgumentException("signal name cannot be null or blank");
            }
            String upper = signal.trim().toUpperCase(Locale.ROOT);
            normalized.add(upper.startsWith(PREFIX) ? upper.substring(PREFIX.length()) : upper);
        }
        return normalized;
    }

    private static void deliver(Consumer<String> listener, String name) {
        log.info("Received signal {}", name);
        try {
            listener.accept(name);
        } catch (RuntimeException e) {
            log.warn("Signal listener failed for {}", name, e);
        }
    }

    private static void restore(Map<Signal, SignalHandler> previous) {
        previous.forEach(Signal::handle);
    }
}
