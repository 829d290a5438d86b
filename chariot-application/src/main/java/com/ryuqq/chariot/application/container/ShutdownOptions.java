package com.ryuqq.chariot.application.container;

import com.ryuqq.chariot.core.cancel.CancellationToken;

/**
 * {@link Container#shutdown(ShutdownOptions)} 설정.
 *
 * <p>parentToken에 마감 시각을 주면 Shutdowner들이 그 마감을 관찰할 수 있습니다.</p>
 *
 * @param parentToken shutdown 토큰의 추가 부모 (null이면 root만 사용)
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public record ShutdownOptions(CancellationToken parentToken) {

    public ShutdownOptions() {
        this(null);
    }
}
