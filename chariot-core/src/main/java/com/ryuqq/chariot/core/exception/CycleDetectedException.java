package com.ryuqq.chariot.core.exception;

import com.ryuqq.chariot.core.model.Kind;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 의존성 체인이 현재 해석 경로에 있는 Kind를 다시 방문한 경우.
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public class CycleDetectedException extends ChariotException {

    private final transient List<Kind<?>> cycle;

    /**
     * 생성자.
     *
     * @param cycle 순환 경로 (처음과 마지막 원소가 같은 Kind)
     */
    public CycleDetectedException(List<Kind<?>> cycle) {
        super(ErrorCode.CYCLE_DETECTED, "dependency cycle detected: " + render(cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<Kind<?>> getCycle() {
        return cycle;
    }

    private static String render(List<Kind<?>> cycle) {
        return cycle.stream().map(Kind::toString).collect(Collectors.joining(" -> "));
    }
}
