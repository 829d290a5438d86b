package com.ryuqq.chariot.core.graph;

import com.ryuqq.chariot.core.exception.ConstructorFailureException;
import com.ryuqq.chariot.core.exception.CycleDetectedException;
import com.ryuqq.chariot.core.exception.MissingDependencyException;
import com.ryuqq.chariot.core.model.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 레지스트리의 모든 컴포넌트를 깊이 우선으로 한 번씩 생성합니다.
 *
 * <p><strong>해석 알고리즘:</strong></p>
 * <pre>
 * resolveAll():
 *   For each record (등록 순서):
 *     미해석이면 path = {record.kind} 로 resolve(record)
 *
 * resolve(record):
 *   For each requirement (선언된 의존성, 그다음 수집 대상):
 *     a. 레코드 없음 → MissingDependencyException
 *     b. path에 이미 있음 → CycleDetectedException
 *     c. path에 추가 → resolve(dependency) → path에서 제거 (성공/실패 무관)
 *   constructor 호출 → 산출물 저장 → Runner/Shutdowner 수집
 * </pre>
 *
 * <p>path는 현재 호출 스택을 나타내므로 재귀가 풀릴 때 정확히 줄어듭니다.
 * 따라서 순환은 현재 체인에서만 감지되며, 다이아몬드형 공유 의존성은 순환이 아닙니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 초기화 단계 전용이며 단일 스레드에서만 호출됩니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final Registry registry;
    private final Capabilities capabilities;

    /**
     * 생성자.
     *
     * @param registry 그래프가 구성된 레지스트리
     * @param capabilities 생성된 컴포넌트의 capability 수집기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DependencyResolver(Registry registry, Capabilities capabilities) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities cannot be null");
        }
        this.registry = registry;
        this.capabilities = capabilities;
    }

    /**
     * 아직 해석되지 않은 모든 레코드를 해석.
     *
     * @throws MissingDependencyException 의존성의 생성자가 없는 경우
     * @throws CycleDetectedException 순환 의존성이 있는 경우
     * @throws ConstructorFailureException 생성자가 실패한 경우
     */
    public void resolveAll() {
        Set<Kind<?>> path = new LinkedHashSet<>();
        for (ComponentRecord record : registry.records()) {
            if (record.isResolved()) {
                continue;
            }
            path.add(record.getKind());
            try {
                resolve(record, path);
            } finally {
                path.remove(record.getKind());
            }
        }
    }

    private void resolve(ComponentRecord record, Set<Kind<?>> path) {
        if (record.isResolved()) {
            return;
        }
        ConstructorSpec constructor = record.constructor();

        List<Object> values = new ArrayList<>();
        for (Kind<?> requirement : constructor.requirements()) {
            ComponentRecord dependency = registry.find(requirement)
                .orElseThrow(() -> new MissingDependencyException(requirement, constructor.name()));

            if (path.contains(requirement)) {
                throw new CycleDetectedException(cycleOf(path, requirement));
            }

            path.add(requirement);
            try {
                resolve(dependency, path);
            } finally {
                path.remove(requirement);
            }
            values.add(dependency.getValue());
        }

        construct(constructor, values);
    }

    private void construct(ConstructorSpec constructor, List<Object> values) {
        List<Object> products;
        try {
            products = constructor.invoke(values);
        } catch (Declaration.InvocationFailedException e) {
            throw new ConstructorFailureException(constructor.name(), e.getCause());
        }

        for (int i = 0; i < products.size(); i++) {
            Kind<?> kind = constructor.products().get(i);
            Object product = products.get(i);
            registry.find(kind)
                .orElseThrow(() -> new IllegalStateException(kind + " vanished from registry"))
                .resolve(product);
            capabilities.inspect(product);
        }
        log.debug("Constructed {} via {}", constructor.products(), constructor.name());
    }

    private static List<Kind<?>> cycleOf(Set<Kind<?>> path, Kind<?> repeated) {
        List<Kind<?>> chain = new ArrayList<>(path);
        List<Kind<?>> cycle = new ArrayList<>(chain.subList(chain.indexOf(repeated), chain.size()));
        cycle.add(repeated);
        return cycle;
    }
}
