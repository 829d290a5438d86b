package com.ryuqq.chariot.core.cancel;

/**
 * 취소된 토큰을 확인했을 때 발생하는 예외.
 *
 * <p>{@link CancellationToken#throwIfCancelled()}에서 발생하며, Runner가 협조적 종료를
 * 표현할 때 그대로 던질 수 있습니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public class CancelledException extends RuntimeException {

    private final transient CancellationReason reason;

    public CancelledException(CancellationReason reason) {
        super(reason == null ? "cancelled" : reason.describe());
        this.reason = reason;
    }

    public CancellationReason getReason() {
        return reason;
    }
}
