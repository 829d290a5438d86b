package com.ryuqq.chariot.core.cancel;

/**
 * 취소 사유.
 *
 * <p>CancellationReason은 세 가지 가능한 사유를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Cancelled}: 명시적으로 취소됨</li>
 *   <li>{@link DeadlineExceeded}: 마감 시각 경과</li>
 *   <li>{@link Interrupted}: 인터럽트 신호 수신</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public sealed interface CancellationReason permits Cancelled, DeadlineExceeded, Interrupted {

    /**
     * 사람이 읽을 수 있는 사유 설명.
     *
     * @return 사유 설명
     */
    String describe();

    /**
     * 마감 시각 경과로 인한 취소인지 확인.
     *
     * @return 마감 경과 여부
     */
    default boolean isDeadlineExceeded() {
        return this instanceof DeadlineExceeded;
    }

    /**
     * 인터럽트 신호로 인한 취소인지 확인.
     *
     * @return 인터럽트 여부
     */
    default boolean isInterrupted() {
        return this instanceof Interrupted;
    }
}
