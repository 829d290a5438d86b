package com.ryuqq.chariot.core.spi;

import java.util.Set;
import java.util.function.Consumer;

/**
 * 프로세스 인터럽트 신호 공급원 SPI.
 *
 * <p>컨테이너는 생성 시점에 이 공급원을 구독하고, 신호가 전달되면 root 토큰을 취소합니다.
 * 구독은 컨테이너 종료 시 해제됩니다. 전역 싱글톤이 아닌, 컨테이너에 명시적으로 주입되는 객체입니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>subscribe: 주어진 신호 이름들에 대해 listener 등록</li>
 *   <li>Subscription.close: 등록 해제 및 이전 상태 복원 (멱등)</li>
 *   <li>listener는 임의의 스레드에서 호출될 수 있음</li>
 * </ul>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public interface InterruptSource {

    /**
     * 신호 구독.
     *
     * @param signals 신호 이름 (예: INT, TERM)
     * @param listener 신호 수신 시 호출 (신호 이름 전달)
     * @return 구독 해제 핸들
     * @throws IllegalArgumentException 지원하지 않는 신호 이름인 경우
     */
    Subscription subscribe(Set<String> signals, Consumer<String> listener);

    /**
     * 신호를 전혀 전달하지 않는 공급원.
     *
     * @return no-op 공급원
     */
    static InterruptSource none() {
        return (signals, listener) -> () -> { };
    }

    /**
     * 구독 해제 핸들.
     */
    @FunctionalInterface
    interface Subscription extends AutoCloseable {

        /**
         * 구독 해제. 여러 번 호출해도 안전해야 합니다.
         */
        @Override
        void close();
    }
}
