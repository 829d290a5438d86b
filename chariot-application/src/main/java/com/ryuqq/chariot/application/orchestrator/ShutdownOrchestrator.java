package com.ryuqq.chariot.application.orchestrator;

import com.ryuqq.chariot.core.cancel.CancellationToken;
import com.ryuqq.chariot.core.cancel.Cancelled;
import com.ryuqq.chariot.core.capability.Shutdowner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * ShutdownerSet 순차 종료기.
 *
 * <p>Shutdowner들을 생성의 역순으로 하나씩 호출합니다. 나중에 생성된 컴포넌트는 먼저 생성된
 * 컴포넌트에 의존할 수 있으므로 먼저 정리됩니다.</p>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>외부로 예외를 전달하지 않음 (Shutdowner의 RuntimeException은 로그 후 계속 진행)</li>
 *   <li>마지막으로 항상 root 토큰을 취소 (이후 컨테이너 재사용 불가)</li>
 * </ul>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class ShutdownOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ShutdownOrchestrator.class);

    private final CancellationToken root;
    private final List<Shutdowner> shutdowners;

    /**
     * 생성자.
     *
     * @param root 컨테이너 root 토큰
     * @param shutdowners 생성 순서의 ShutdownerSet
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ShutdownOrchestrator(CancellationToken root, List<Shutdowner> shutdowners) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (shutdowners == null) {
            throw new IllegalArgumentException("shutdowners cannot be null");
        }
        this.root = root;
        this.shutdowners = List.copyOf(shutdowners);
    }

    /**
     * 모든 Shutdowner를 역순으로 호출한 뒤 root 토큰 취소.
     *
     * @param parentToken shutdown 토큰의 추가 부모 (null 가능)
     */
    public void shutdown(CancellationToken parentToken) {
        CancellationToken shutdownToken = parentToken != null
            ? CancellationToken.linked(root, parentToken)
            : root.derive();

        try {
            for (int i = shutdowners.size() - 1; i >= 0; i--) {
                Shutdowner shutdowner = shutdowners.get(i);
                try {
                    shutdowner.shutdown(shutdownToken);
                } catch (RuntimeException e) {
                    log.warn("Shutdowner {} failed, continuing with the rest", shutdowner, e);
                }
            }
            log.info("Shut down {} components", shutdowners.size());
        } finally {
            shutdownToken.cancel(Cancelled.of("shutdown completed"));
            root.cancel(Cancelled.of("container shut down"));
        }
    }
}
