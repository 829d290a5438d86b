package com.ryuqq.chariot.core.cancel;

import java.time.Instant;

/**
 * 마감 시각 경과로 인한 취소.
 *
 * @param deadline 경과한 마감 시각
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public record DeadlineExceeded(Instant deadline) implements CancellationReason {

    public DeadlineExceeded {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
    }

    @Override
    public String describe() {
        return "deadline exceeded: " + deadline;
    }
}
