package com.ryuqq.chariot.application.container;

import com.ryuqq.chariot.application.signal.SignalInterruptSource;
import com.ryuqq.chariot.core.cancel.CancellationToken;
import com.ryuqq.chariot.core.model.Component;
import com.ryuqq.chariot.core.model.Initializer;
import com.ryuqq.chariot.core.model.Kind;
import com.ryuqq.chariot.core.spi.InterruptSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Container 생성 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>initializers: 선언 순서의 initializer (기본 없음)</li>
 *   <li>components: 미리 생성된 값, initializer 뒤에 병합됨 (기본 없음)</li>
 *   <li>signals: 기본 신호(INT)에 추가로 root 토큰을 취소할 신호 (기본 없음)</li>
 *   <li>initToken: 초기화 중 주입할 ambient 토큰의 추가 부모 (기본 null)</li>
 *   <li>interruptSource: 신호 공급원 (기본 {@link SignalInterruptSource})</li>
 * </ul>
 *
 * @author Chariot Team
 * @since 1.0.0
 * @param initializers 선언 순서의 initializer
 * @param components 선언 순서의 미리 생성된 값
 * @param signals 추가 신호 이름
 * @param initToken 초기화 단계 토큰의 추가 부모 (null 가능)
 * @param interruptSource 신호 공급원
 */
public record ContainerOptions(
    List<Initializer> initializers,
    List<Component<?>> components,
    Set<String> signals,
    CancellationToken initToken,
    InterruptSource interruptSource
) {

    /**
     * 기본 설정 생성자.
     */
    public ContainerOptions() {
        this(List.of(), List.of(), Set.of(), null, new SignalInterruptSource());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ContainerOptions {
        if (initializers == null || components == null || signals == null) {
            throw new IllegalArgumentException("initializers, components and signals cannot be null");
        }
        if (interruptSource == null) {
            throw new IllegalArgumentException("interruptSource cannot be null");
        }
        initializers = List.copyOf(initializers);
        components = List.copyOf(components);
        signals = Set.copyOf(signals);
    }

    /**
     * initializer를 추가한 새 인스턴스 생성.
     */
    public ContainerOptions withInitializers(Initializer... more) {
        List<Initializer> merged = new ArrayList<>(initializers);
        merged.addAll(Arrays.asList(more));
        return new ContainerOptions(merged, components, signals, initToken, interruptSource);
    }

    /**
     * 구체 클래스를 Kind로 하는 미리 생성된 값을 추가한 새 인스턴스 생성.
     */
    public ContainerOptions withComponents(Object... values) {
        List<Component<?>> merged = new ArrayList<>(components);
        for (Object value : values) {
            merged.add(Component.ofValue(value));
        }
        return new ContainerOptions(initializers, merged, signals, initToken, interruptSource);
    }

    /**
     * 명시한 Kind로 미리 생성된 값을 추가한 새 인스턴스 생성.
     */
    public <T> ContainerOptions withComponent(Kind<T> kind, T value) {
        List<Component<?>> merged = new ArrayList<>(components);
        merged.add(Component.of(kind, value));
        return new ContainerOptions(initializers, merged, signals, initToken, interruptSource);
    }

    /**
     * 모듈의 선언을 순서대로 추가한 새 인스턴스 생성.
     */
    public ContainerOptions withModules(InitializerModule... modules) {
        List<Initializer> mergedInitializers = new ArrayList<>(initializers);
        List<Component<?>> mergedComponents = new ArrayList<>(components);
        for (InitializerModule module : modules) {
            mergedInitializers.addAll(module.initializers());
            mergedComponents.addAll(module.components());
        }
        return new ContainerOptions(mergedInitializers, mergedComponents, signals, initToken, interruptSource);
    }

    /**
     * 추가 신호를 병합한 새 인스턴스 생성.
     */
    public ContainerOptions withSignals(String... more) {
        Set<String> merged = new LinkedHashSet<>(signals);
        merged.addAll(Arrays.asList(more));
        return new ContainerOptions(initializers, components, merged, initToken, interruptSource);
    }

    /**
     * initToken만 변경한 새 인스턴스 생성.
     */
    public ContainerOptions withInitToken(CancellationToken initToken) {
        return new ContainerOptions(initializers, components, signals, initToken, interruptSource);
    }

    /**
     * interruptSource만 변경한 새 인스턴스 생성.
     */
    public ContainerOptions withInterruptSource(InterruptSource interruptSource) {
        return new ContainerOptions(initializers, components, signals, initToken, interruptSource);
    }
}
