package com.ryuqq.chariot.core.capability;

import com.ryuqq.chariot.core.cancel.CancellationToken;

/**
 * 컨테이너 종료 시 정리되는 컴포넌트 capability.
 *
 * <p>생성된 컴포넌트가 이 인터페이스를 구현하면 ShutdownerSet에 생성 순서대로 수집되고,
 * {@code Container.shutdown()} 또는 초기화 실패 시 생성의 역순으로 순차 호출됩니다.</p>
 *
 * <p>종료는 best-effort이며 실패를 외부로 전달하지 않습니다. 내부 오류 처리는 컴포넌트의 몫입니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Shutdowner {

    /**
     * 컴포넌트 정리.
     *
     * @param token shutdown 단계 취소 토큰 (caller가 마감 시각을 줄 수 있음)
     */
    void shutdown(CancellationToken token);
}
