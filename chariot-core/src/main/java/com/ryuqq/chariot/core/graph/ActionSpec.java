package com.ryuqq.chariot.core.graph;

import com.ryuqq.chariot.core.model.Initializer;
import com.ryuqq.chariot.core.model.Kind;

import java.util.List;

/**
 * 산출물이 없는 initializer (action).
 *
 * <p>Kind를 소유하지 않으며 의존성 대상이 될 수 없습니다. 모든 constructor가 해석된 뒤
 * 선언 순서대로 실행됩니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class ActionSpec extends Declaration {

    ActionSpec(Initializer initializer) {
        super(initializer);
    }

    public String getName() {
        return name();
    }

    /**
     * 선언된 의존성 Kind.
     *
     * @return 선언 순서의 의존성
     */
    public List<Kind<?>> getDependencies() {
        return dependencies();
    }

    @Override
    public String toString() {
        return "ActionSpec{" + name() + ", dependencies=" + dependencies() + "}";
    }
}
