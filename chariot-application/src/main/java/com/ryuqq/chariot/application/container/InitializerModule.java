package com.ryuqq.chariot.application.container;

import com.ryuqq.chariot.core.model.Component;
import com.ryuqq.chariot.core.model.Initializer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 재사용 가능한 initializer 묶음.
 *
 * <p>관련된 initializer와 미리 생성된 값을 이름 있는 단위로 묶어 여러 애플리케이션에서
 * 재사용하거나 다른 모듈에 포함할 수 있습니다.</p>
 *
 * <pre>
 * InitializerModule server = InitializerModule.of("server",
 *     Initializer.of(CONFIG, API, Api::new),
 *     Initializer.of(CONFIG, HEALTHZ, Healthz::new));
 *
 * InitializerModule app = InitializerModule.of("app").include(configModule, server);
 * </pre>
 *
 * @param name 모듈 이름
 * @param initializers 선언 순서의 initializer
 * @param components 선언 순서의 미리 생성된 값
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public record InitializerModule(
    String name,
    List<Initializer> initializers,
    List<Component<?>> components
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 비었거나 목록이 null인 경우
     */
    public InitializerModule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (initializers == null || components == null) {
            throw new IllegalArgumentException("initializers and components cannot be null");
        }
        initializers = List.copyOf(initializers);
        components = List.copyOf(components);
    }

    public static InitializerModule of(String name, Initializer... initializers) {
        return new InitializerModule(name, Arrays.asList(initializers), List.of());
    }

    /**
     * 미리 생성된 값을 추가한 새 인스턴스 생성.
     */
    public InitializerModule withComponents(Component<?>... more) {
        List<Component<?>> merged = new ArrayList<>(components);
        merged.addAll(Arrays.asList(more));
        return new InitializerModule(name, initializers, merged);
    }

    /**
     * 다른 모듈의 선언을 순서대로 포함한 새 인스턴스 생성.
     */
    public InitializerModule include(InitializerModule... modules) {
        List<Initializer> mergedInitializers = new ArrayList<>(initializers);
        List<Component<?>> mergedComponents = new ArrayList<>(components);
        for (InitializerModule module : modules) {
            mergedInitializers.addAll(module.initializers());
            mergedComponents.addAll(module.components());
        }
        return new InitializerModule(name, mergedInitializers, mergedComponents);
    }
}
