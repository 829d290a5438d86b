package com.ryuqq.chariot.application.container;

import com.ryuqq.chariot.core.cancel.CancellationToken;

/**
 * 첫 번째 이후의 Runner 실패를 전달받는 observer.
 *
 * <p>완료 순서대로, run이 반환되기 전에 실패마다 한 번씩 호출됩니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RunErrorHandler {

    /**
     * 후속 실패 처리.
     *
     * @param token run 범위 토큰. 첫 실패로 취소되지 않으며 root나 run 부모 토큰이
     *              취소될 때만 취소되므로 후속 보고 작업에 사용할 수 있음
     * @param error Runner가 던진 오류
     */
    void handle(CancellationToken token, Throwable error);
}
