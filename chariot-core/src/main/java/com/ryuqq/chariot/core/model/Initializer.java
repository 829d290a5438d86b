package com.ryuqq.chariot.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * initializer 선언.
 *
 * <p>initializer는 0..N개의 의존성을 받아 0..N개의 컴포넌트를 생성하는 함수입니다.
 * 의존성과 산출물의 Kind는 등록 시점에 명시적으로 선언되며, 컨테이너는 호출 가능한
 * 객체의 시그니처를 검사하지 않습니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>constructor: 1개 이상의 Kind를 생성</li>
 *   <li>action: 생성하는 Kind가 없음 (모든 constructor 이후 선언 순서대로 실행)</li>
 * </ul>
 *
 * <p><strong>Failure slot:</strong> 마지막으로 선언된 산출물의 타입이 {@link Throwable}이면
 * 컴포넌트가 아닌 실패 결과로 취급됩니다. 본문이 그 위치에 null이 아닌 값을 반환하면
 * 초기화가 중단됩니다. 본문이 던진 예외도 같은 방식으로 처리됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Initializer config = Initializer.of(Kind.of(Config.class), Config::load);
 * Initializer server = Initializer.of(Kind.of(Config.class), Kind.of(Server.class), Server::new);
 * Initializer warmup = Initializer.action(Kind.of(Server.class), Server::warmUp);
 *
 * Initializer pair = Initializer.builder("pair")
 *     .dependsOn(Kind.of(Config.class))
 *     .produces(Kind.of(Reader.class), Kind.of(Writer.class))
 *     .body(args -&gt; List.of(new Reader(), new Writer()))
 *     .build();
 * </pre>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class Initializer {

    private final String name;
    private final List<Kind<?>> dependencies;
    private final List<Kind<?>> products;
    private final Class<?> collects;
    private final Body body;

    private Initializer(String name, List<Kind<?>> dependencies, List<Kind<?>> products,
                        Class<?> collects, Body body) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (dependencies == null || dependencies.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("dependencies cannot be null or contain null");
        }
        if (products == null || products.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("products cannot be null or contain null");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        this.name = name;
        this.dependencies = List.copyOf(dependencies);
        this.products = List.copyOf(products);
        this.collects = collects;
        this.body = body;
    }

    // ============================================================
    // constructor factories
    // ============================================================

    public static <R> Initializer of(Kind<R> product, Fn0<R> fn) {
        requireFn(fn);
        return new Initializer(defaultName(Arrays.asList(product)), List.of(), Arrays.asList(product), null,
            args -> Collections.singletonList(fn.apply()));
    }

    public static <A, R> Initializer of(Kind<A> a, Kind<R> product, Fn1<A, R> fn) {
        requireFn(fn);
        return new Initializer(defaultName(Arrays.asList(product)), Arrays.asList(a), Arrays.asList(product), null,
            args -> Collections.singletonList(fn.apply(args.get(a))));
    }

    public static <A, B, R> Initializer of(Kind<A> a, Kind<B> b, Kind<R> product, Fn2<A, B, R> fn) {
        requireFn(fn);
        return new Initializer(defaultName(Arrays.asList(product)), Arrays.asList(a, b), Arrays.asList(product), null,
            args -> Collections.singletonList(fn.apply(args.get(a), args.get(b))));
    }

    public static <A, B, C, R> Initializer of(Kind<A> a, Kind<B> b, Kind<C> c, Kind<R> product,
                                              Fn3<A, B, C, R> fn) {
        requireFn(fn);
        return new Initializer(defaultName(Arrays.asList(product)), Arrays.asList(a, b, c), Arrays.asList(product), null,
            args -> Collections.singletonList(fn.apply(args.get(a), args.get(b), args.get(c))));
    }

    /**
     * 미리 생성된 값을 의존성 없는 단일 산출물 constructor로 변환.
     *
     * @param kind 값의 Kind
     * @param value 컴포넌트 값
     * @param <T> 컴포넌트 타입
     * @return constructor 선언
     * @throws IllegalArgumentException value가 null이거나 kind를 만족하지 않는 경우
     */
    public static <T> Initializer component(Kind<T> kind, T value) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (!kind.accepts(value)) {
            throw new IllegalArgumentException("value must be a non-null instance of " + kind);
        }
        return new Initializer("component " + kind, List.of(), Arrays.asList(kind), null, args -> Collections.singletonList(value));
    }

    // ============================================================
    // action factories
    // ============================================================

    public static Initializer action(Act0 act) {
        requireFn(act);
        return new Initializer("action", List.of(), List.of(), null, args -> {
            act.run();
            return List.of();
        });
    }

    public static <A> Initializer action(Kind<A> a, Act1<A> act) {
        requireFn(act);
        return new Initializer(actionName(Arrays.asList(a)), Arrays.asList(a), List.of(), null, args -> {
            act.accept(args.get(a));
            return List.of();
        });
    }

    public static <A, B> Initializer action(Kind<A> a, Kind<B> b, Act2<A, B> act) {
        requireFn(act);
        return new Initializer(actionName(Arrays.asList(a, b)), Arrays.asList(a, b), List.of(), null, args -> {
            act.accept(args.get(a), args.get(b));
            return List.of();
        });
    }

    public static <A, B, C> Initializer action(Kind<A> a, Kind<B> b, Kind<C> c, Act3<A, B, C> act) {
        requireFn(act);
        return new Initializer(actionName(Arrays.asList(a, b, c)), Arrays.asList(a, b, c), List.of(), null, args -> {
            act.accept(args.get(a), args.get(b), args.get(c));
            return List.of();
        });
    }

    /**
     * 일반형 선언 builder.
     *
     * @param name initializer 이름 (오류 메시지와 로그에 사용)
     * @return Builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * 이름만 바꾼 새 인스턴스 생성.
     */
    public Initializer named(String name) {
        return new Initializer(name, dependencies, products, collects, body);
    }

    public String getName() {
        return name;
    }

    public List<Kind<?>> getDependencies() {
        return dependencies;
    }

    /**
     * 선언된 산출물 Kind (failure slot 포함).
     *
     * @return 선언 순서의 산출물 Kind 목록
     */
    public List<Kind<?>> getProducts() {
        return products;
    }

    /**
     * collector capability 조회.
     *
     * @return 수집 대상 타입, 없으면 null
     */
    public Class<?> getCollectsOrNull() {
        return collects;
    }

    public Body getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "Initializer{" + name + ", dependencies=" + dependencies + ", products=" + products + "}";
    }

    private static String defaultName(List<Kind<?>> products) {
        return "constructor of " + products.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    private static String actionName(List<Kind<?>> dependencies) {
        return "action on " + dependencies.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    private static void requireFn(Object fn) {
        if (fn == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
    }

    /**
     * 일반형 initializer 본문.
     *
     * <p>반환 목록은 선언된 산출물과 같은 길이, 같은 순서여야 합니다.</p>
     */
    @FunctionalInterface
    public interface Body {
        List<?> invoke(Arguments arguments) throws Exception;
    }

    @FunctionalInterface
    public interface Fn0<R> {
        R apply() throws Exception;
    }

    @FunctionalInterface
    public interface Fn1<A, R> {
        R apply(A a) throws Exception;
    }

    @FunctionalInterface
    public interface Fn2<A, B, R> {
        R apply(A a, B b) throws Exception;
    }

    @FunctionalInterface
    public interface Fn3<A, B, C, R> {
        R apply(A a, B b, C c) throws Exception;
    }

    @FunctionalInterface
    public interface Act0 {
        void run() throws Exception;
    }

    @FunctionalInterface
    public interface Act1<A> {
        void accept(A a) throws Exception;
    }

    @FunctionalInterface
    public interface Act2<A, B> {
        void accept(A a, B b) throws Exception;
    }

    @FunctionalInterface
    public interface Act3<A, B, C> {
        void accept(A a, B b, C c) throws Exception;
    }

    /**
     * 일반형 initializer builder.
     */
    public static final class Builder {

        private final String name;
        private final List<Kind<?>> dependencies = new ArrayList<>();
        private final List<Kind<?>> products = new ArrayList<>();
        private Class<?> collects;
        private Body body;

        private Builder(String name) {
            this.name = name;
        }

        public Builder dependsOn(Kind<?>... kinds) {
            dependencies.addAll(Arrays.asList(kinds));
            return this;
        }

        public Builder produces(Kind<?>... kinds) {
            products.addAll(Arrays.asList(kinds));
            return this;
        }

        /**
         * 마지막 파라미터로 capability를 만족하는 모든 컴포넌트를 수집하도록 선언.
         *
         * @param capability 수집 대상 타입
         * @return this
         */
        public Builder collects(Class<?> capability) {
            if (capability == null) {
                throw new IllegalArgumentException("capability cannot be null");
            }
            this.collects = capability;
            return this;
        }

        public Builder body(Body body) {
            this.body = body;
            return this;
        }

        /**
         * Initializer 생성.
         *
         * @return Initializer
         * @throws IllegalArgumentException name, body가 비었거나 Kind에 null이 포함된 경우
         */
        public Initializer build() {
            return new Initializer(name, dependencies, products, collects, body);
        }
    }
}
