package com.ryuqq.chariot.core.cancel;

/**
 * 인터럽트 신호로 인한 취소.
 *
 * @param signal 수신한 신호 이름 (예: INT, TERM)
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public record Interrupted(String signal) implements CancellationReason {

    public Interrupted {
        if (signal == null || signal.isBlank()) {
            throw new IllegalArgumentException("signal cannot be null or blank");
        }
    }

    @Override
    public String describe() {
        return "interrupted by signal " + signal;
    }
}
