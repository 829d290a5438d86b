package com.ryuqq.chariot.core.graph;

import com.ryuqq.chariot.core.model.Kind;

import java.util.List;

/**
 * Kind 하나에 대한 생성 정보와 해석된 값.
 *
 * <p><strong>불변식:</strong> Kind당 최대 하나의 ComponentRecord만 존재합니다.
 * 값이 한 번 해석되면 다시 생성되지 않습니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class ComponentRecord {

    private final Kind<?> kind;
    private final ConstructorSpec constructor;
    private boolean resolved;
    private Object value;

    private ComponentRecord(Kind<?> kind, ConstructorSpec constructor, boolean resolved, Object value) {
        this.kind = kind;
        this.constructor = constructor;
        this.resolved = resolved;
        this.value = value;
    }

    static ComponentRecord produced(Kind<?> kind, ConstructorSpec constructor) {
        return new ComponentRecord(kind, constructor, false, null);
    }

    /**
     * 생성자 없이 이미 해석된 레코드 (ambient 토큰 등).
     */
    static ComponentRecord resolved(Kind<?> kind, Object value) {
        return new ComponentRecord(kind, null, true, value);
    }

    public Kind<?> getKind() {
        return kind;
    }

    /**
     * 선언된 의존성 Kind 조회.
     *
     * @return 의존성 목록 (생성자가 없으면 빈 목록)
     */
    public List<Kind<?>> getDependencies() {
        return constructor == null ? List.of() : constructor.dependencies();
    }

    /**
     * 이 Kind를 생성하는 initializer 이름.
     *
     * @return initializer 이름, 생성자가 없으면 "built-in"
     */
    public String getProducerName() {
        return constructor == null ? "built-in" : constructor.name();
    }

    public boolean isResolved() {
        return resolved;
    }

    /**
     * 해석된 값 조회.
     *
     * @return 해석된 값
     * @throws IllegalStateException 아직 해석되지 않은 경우
     */
    public Object getValue() {
        if (!resolved) {
            throw new IllegalStateException(kind + " is not resolved yet");
        }
        return value;
    }

    ConstructorSpec constructor() {
        return constructor;
    }

    void resolve(Object value) {
        this.value = value;
        this.resolved = true;
    }

    @Override
    public String toString() {
        return "ComponentRecord{" + kind + ", producer=" + getProducerName() + ", resolved=" + resolved + "}";
    }
}
