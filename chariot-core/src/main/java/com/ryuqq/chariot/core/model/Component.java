package com.ryuqq.chariot.core.model;

/**
 * 미리 생성된 컴포넌트 값.
 *
 * <p>그래프 구성 시 의존성 없는 단일 산출물 constructor로 변환되어
 * 다른 initializer와 동일하게 처리됩니다.</p>
 *
 * @param kind 컴포넌트 Kind
 * @param value 컴포넌트 값
 * @param <T> 컴포넌트 타입
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public record Component<T>(Kind<T> kind, T value) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 value가 kind를 만족하지 않는 경우
     */
    public Component {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (!kind.accepts(value)) {
            throw new IllegalArgumentException("value must be a non-null instance of " + kind);
        }
    }

    public static <T> Component<T> of(Kind<T> kind, T value) {
        return new Component<>(kind, value);
    }

    /**
     * 값의 구체 클래스를 Kind로 사용하는 컴포넌트 생성.
     *
     * @param value 컴포넌트 값
     * @return Component 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static Component<?> ofValue(Object value) {
        return bind(Kind.ofValue(value), value);
    }

    private static <T> Component<T> bind(Kind<T> kind, Object value) {
        return new Component<>(kind, kind.cast(value));
    }

    /**
     * constructor 선언으로 변환.
     *
     * @return 의존성 없이 value를 반환하는 Initializer
     */
    public Initializer toInitializer() {
        return Initializer.component(kind, value);
    }
}
