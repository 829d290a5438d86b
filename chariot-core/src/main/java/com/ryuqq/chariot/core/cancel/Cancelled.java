package com.ryuqq.chariot.core.cancel;

/**
 * 명시적 취소.
 *
 * @param message 취소 메시지
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public record Cancelled(String message) implements CancellationReason {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null이거나 빈 문자열인 경우
     */
    public Cancelled {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 메시지로 Cancelled 생성.
     *
     * @param message 취소 메시지
     * @return Cancelled 인스턴스
     */
    public static Cancelled of(String message) {
        return new Cancelled(message);
    }

    @Override
    public String describe() {
        return "cancelled: " + message;
    }
}
