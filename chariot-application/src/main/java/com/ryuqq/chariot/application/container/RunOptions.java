package com.ryuqq.chariot.application.container;

import com.ryuqq.chariot.core.cancel.CancellationToken;

/**
 * {@link Container#run(RunOptions)} 설정.
 *
 * @param parentToken run 토큰의 추가 부모 (null이면 root만 사용)
 * @param errorHandler 후속 실패 observer (null 가능)
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public record RunOptions(
    CancellationToken parentToken,
    RunErrorHandler errorHandler
) {

    /**
     * 기본 설정 생성자.
     */
    public RunOptions() {
        this(null, null);
    }

    public RunOptions withParentToken(CancellationToken parentToken) {
        return new RunOptions(parentToken, errorHandler);
    }

    public RunOptions withErrorHandler(RunErrorHandler errorHandler) {
        return new RunOptions(parentToken, errorHandler);
    }
}
