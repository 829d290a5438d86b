package com.ryuqq.chariot.core.graph;

import com.ryuqq.chariot.core.capability.Runner;
import com.ryuqq.chariot.core.capability.Shutdowner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 생성된 컴포넌트 중 {@link Runner}와 {@link Shutdowner}를 구현한 것을 수집합니다.
 *
 * <p>수집 순서는 생성 완료 순서이며, ShutdownerSet의 순서는 종료 시 역순으로 사용됩니다.
 * 같은 인스턴스가 여러 Kind로 생성되어도 한 번만 수집됩니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class Capabilities {

    private final List<Runner> runners = new ArrayList<>();
    private final List<Shutdowner> shutdowners = new ArrayList<>();
    private final Map<Object, Boolean> seen = new IdentityHashMap<>();

    /**
     * 컴포넌트의 capability를 확인하고 해당 집합에 추가.
     *
     * @param component 생성된 컴포넌트
     */
    public void inspect(Object component) {
        if (component == null || seen.put(component, Boolean.TRUE) != null) {
            return;
        }
        if (component instanceof Runner) {
            runners.add((Runner) component);
        }
        if (component instanceof Shutdowner) {
            shutdowners.add((Shutdowner) component);
        }
    }

    /**
     * RunnerSet 스냅샷.
     *
     * @return 생성 순서의 Runner 목록
     */
    public List<Runner> runners() {
        return Collections.unmodifiableList(new ArrayList<>(runners));
    }

    /**
     * ShutdownerSet 스냅샷.
     *
     * @return 생성 순서의 Shutdowner 목록
     */
    public List<Shutdowner> shutdowners() {
        return Collections.unmodifiableList(new ArrayList<>(shutdowners));
    }
}
