package com.ryuqq.chariot.core.capability;

import com.ryuqq.chariot.core.cancel.CancellationToken;

/**
 * 컨테이너 실행 시 동시에 실행되는 컴포넌트 capability.
 *
 * <p>생성된 컴포넌트가 이 인터페이스를 구현하면 RunnerSet에 수집되고,
 * {@code Container.run()} 호출 시 전용 스레드에서 다른 Runner들과 병렬 실행됩니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>token이 취소되면 가능한 빨리 반환해야 함 (취소는 권고이며 강제 종료되지 않음)</li>
 *   <li>예외를 던지면 실패로 수집되고, 첫 실패는 다른 Runner들의 토큰을 취소시킴</li>
 *   <li>정상 반환은 실패 없음으로 간주</li>
 * </ul>
 *
 * <p>함수형 인터페이스이므로 람다로 Runner 전용 컴포넌트를 바로 정의할 수 있습니다:</p>
 * <pre>
 * Initializer.of(Kind.of(Runner.class, "ticker"), () -&gt; token -&gt; {
 *     while (!token.await(Duration.ofSeconds(1))) {
 *         tick();
 *     }
 * });
 * </pre>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Runner {

    /**
     * 컴포넌트 실행.
     *
     * @param token run 단계 취소 토큰
     * @throws Exception 실행 실패 시
     */
    void run(CancellationToken token) throws Exception;
}
