package com.ryuqq.chariot.core.model;

/**
 * 컴포넌트의 명목적(nominal) 식별자.
 *
 * <p>Kind는 의존성 그래프의 정점(vertex)이며, 선언된 타입과 선택적 qualifier 이름으로
 * 구성됩니다. 구조가 같더라도 선언된 타입이나 qualifier가 다르면 서로 다른 Kind입니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>type: null 불가, primitive 타입 불가</li>
 *   <li>qualifier: null 불가 (빈 문자열은 "qualifier 없음"을 의미)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Kind&lt;DataSource&gt; primary = Kind.of(DataSource.class);
 * Kind&lt;DataSource&gt; replica = Kind.of(DataSource.class, "replica");
 * </pre>
 *
 * @param <T> 컴포넌트 타입
 * @author Chariot Team
 * @since 1.0.0
 */
public final class Kind<T> {

    private final Class<T> type;
    private final String qualifier;

    private Kind(Class<T> type, String qualifier) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type.isPrimitive()) {
            throw new IllegalArgumentException("type cannot be primitive (current: " + type.getName() + ")");
        }
        if (qualifier == null) {
            throw new IllegalArgumentException("qualifier cannot be null");
        }
        this.type = type;
        this.qualifier = qualifier;
    }

    /**
     * qualifier 없는 Kind 생성.
     *
     * @param type 컴포넌트 타입
     * @param <T> 컴포넌트 타입
     * @return Kind 인스턴스
     * @throws IllegalArgumentException type이 null이거나 primitive인 경우
     */
    public static <T> Kind<T> of(Class<T> type) {
        return new Kind<>(type, "");
    }

    /**
     * qualifier가 있는 Kind 생성.
     *
     * @param type 컴포넌트 타입
     * @param qualifier 구분 이름
     * @param <T> 컴포넌트 타입
     * @return Kind 인스턴스
     * @throws IllegalArgumentException type이 null/primitive이거나 qualifier가 null인 경우
     */
    public static <T> Kind<T> of(Class<T> type, String qualifier) {
        return new Kind<>(type, qualifier);
    }

    /**
     * 값의 런타임 클래스로 Kind 생성.
     *
     * <p>미리 생성된 컴포넌트를 등록할 때 사용합니다.</p>
     *
     * @param value 컴포넌트 값
     * @return 값의 구체 클래스를 타입으로 하는 Kind
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static Kind<?> ofValue(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return of(value.getClass());
    }

    public Class<T> type() {
        return type;
    }

    public String qualifier() {
        return qualifier;
    }

    /**
     * 값이 이 Kind의 타입을 만족하는지 확인.
     *
     * @param value 검사할 값
     * @return value가 null이 아니고 type의 인스턴스이면 true
     */
    public boolean accepts(Object value) {
        return type.isInstance(value);
    }

    /**
     * 이 Kind의 타입이 주어진 capability를 만족하는지 확인.
     *
     * @param capability capability 타입
     * @return type이 capability에 할당 가능하면 true
     */
    public boolean satisfies(Class<?> capability) {
        return capability.isAssignableFrom(type);
    }

    /**
     * 값을 이 Kind의 타입으로 캐스팅.
     *
     * @param value 캐스팅할 값
     * @return 캐스팅된 값
     * @throws ClassCastException 타입이 맞지 않는 경우
     */
    public T cast(Object value) {
        return type.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Kind<?> kind = (Kind<?>) o;
        return type.equals(kind.type) && qualifier.equals(kind.qualifier);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + qualifier.hashCode();
    }

    @Override
    public String toString() {
        if (qualifier.isEmpty()) {
            return "Kind{" + type.getName() + '}';
        }
        return "Kind{" + type.getName() + "@" + qualifier + '}';
    }
}
