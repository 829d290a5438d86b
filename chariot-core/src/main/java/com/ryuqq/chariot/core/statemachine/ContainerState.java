package com.ryuqq.chariot.core.statemachine;

/**
 * 컨테이너의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>초기 상태는 READY (초기화가 성공한 컨테이너만 생성됨)</li>
 *   <li>READY → RUNNING (run 시작)</li>
 *   <li>RUNNING → READY (run 종료)</li>
 *   <li>READY → SHUT_DOWN, RUNNING → SHUT_DOWN (shutdown)</li>
 *   <li><strong>SHUT_DOWN은 종료 상태 (재사용 불가)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * READY ◄──► RUNNING
 *   │           │
 *   ▼           ▼
 * SHUT_DOWN ◄───┘
 *
 * 금지된 전이:
 * - RUNNING → RUNNING ❌
 * - SHUT_DOWN → * ❌
 * </pre>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public enum ContainerState {

    /**
     * 모든 컴포넌트 생성 완료 (초기 상태).
     */
    READY,

    /**
     * Runner들이 실행 중.
     */
    RUNNING,

    /**
     * 종료됨 (종료 상태).
     */
    SHUT_DOWN;

    /**
     * 종료 상태인지 확인.
     *
     * @return SHUT_DOWN이면 true
     */
    public boolean isTerminal() {
        return this == SHUT_DOWN;
    }
}
