package com.ryuqq.chariot.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * initializer 본문에 전달되는 해석된 의존성 값.
 *
 * <p>값은 선언된 의존성 순서대로 전달되며, 선언된 collector가 있으면
 * 수집된 컴포넌트 목록이 별도로 전달됩니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class Arguments {

    private final List<Kind<?>> kinds;
    private final List<Object> values;
    private final List<Object> collected;

    /**
     * 생성자.
     *
     * @param kinds 선언된 의존성 Kind 목록
     * @param values kinds와 같은 순서의 값 목록
     * @param collected collector로 수집된 값 목록 (collector가 없으면 빈 목록)
     * @throws IllegalArgumentException 인자가 null이거나 kinds와 values의 크기가 다른 경우
     */
    public Arguments(List<Kind<?>> kinds, List<Object> values, List<Object> collected) {
        if (kinds == null || values == null || collected == null) {
            throw new IllegalArgumentException("kinds, values and collected cannot be null");
        }
        if (kinds.size() != values.size()) {
            throw new IllegalArgumentException(
                "values must match kinds (kinds: " + kinds.size() + ", values: " + values.size() + ")");
        }
        this.kinds = List.copyOf(kinds);
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.collected = Collections.unmodifiableList(new ArrayList<>(collected));
    }

    /**
     * 위치로 의존성 값 조회.
     *
     * @param index 선언 순서상 위치
     * @return 의존성 값
     * @throws IndexOutOfBoundsException index가 범위를 벗어난 경우
     */
    public Object get(int index) {
        return values.get(index);
    }

    /**
     * Kind로 의존성 값 조회.
     *
     * @param kind 선언된 의존성 Kind
     * @param <T> 컴포넌트 타입
     * @return 의존성 값
     * @throws IllegalArgumentException kind가 선언된 의존성이 아닌 경우
     */
    public <T> T get(Kind<T> kind) {
        int index = kinds.indexOf(kind);
        if (index < 0) {
            throw new IllegalArgumentException(kind + " is not a declared dependency");
        }
        return kind.cast(values.get(index));
    }

    /**
     * collector로 수집된 컴포넌트 조회.
     *
     * @param capability 수집 대상 capability 타입
     * @param <T> capability 타입
     * @return 수집된 컴포넌트 목록 (레지스트리 순서)
     * @throws ClassCastException 수집된 값이 capability를 만족하지 않는 경우
     */
    public <T> List<T> collected(Class<T> capability) {
        List<T> result = new ArrayList<>(collected.size());
        for (Object value : collected) {
            result.add(capability.cast(value));
        }
        return Collections.unmodifiableList(result);
    }

    public int size() {
        return values.size();
    }
}
