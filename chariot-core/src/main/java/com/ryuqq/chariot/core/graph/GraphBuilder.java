package com.ryuqq.chariot.core.graph;

import com.ryuqq.chariot.core.cancel.CancellationToken;
import com.ryuqq.chariot.core.exception.DuplicateKindException;
import com.ryuqq.chariot.core.model.Component;
import com.ryuqq.chariot.core.model.Initializer;
import com.ryuqq.chariot.core.model.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * initializer 선언을 분류하여 {@link Registry}를 채웁니다.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * build(initializers, components)
 *   ↓
 * 1. 미리 생성된 값 → 의존성 없는 단일 산출물 constructor로 변환, 선언 목록 뒤에 병합
 *   ↓
 * 2. 각 initializer 분류:
 *    - failure slot 제외 산출물 ≥ 1 → constructor (산출물마다 ComponentRecord 등록)
 *    - 산출물 0 → action (선언 순서 보존)
 *   ↓
 * 3. collector 확장: capability를 만족하는 Kind를 레지스트리 순서로 의존성에 추가
 * </pre>
 *
 * <p>중복 Kind 검사는 어떤 생성자도 호출되기 전에 이 단계에서 수행됩니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final Registry registry;

    /**
     * 생성자.
     *
     * @param registry 채울 레지스트리 (ambient 토큰 등 미리 해석된 레코드를 포함할 수 있음)
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public GraphBuilder(Registry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    /**
     * 그래프 구성.
     *
     * @param initializers 선언 순서의 initializer
     * @param components 선언 순서의 미리 생성된 값
     * @return 선언 순서의 action 목록
     * @throws DuplicateKindException 같은 Kind를 두 번 이상 선언한 경우
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public List<ActionSpec> build(List<Initializer> initializers, List<Component<?>> components) {
        if (initializers == null || components == null) {
            throw new IllegalArgumentException("initializers and components cannot be null");
        }

        List<Initializer> merged = new ArrayList<>(initializers);
        for (Component<?> component : components) {
            merged.add(component.toInitializer());
        }

        List<ActionSpec> actions = new ArrayList<>();
        List<Declaration> declarations = new ArrayList<>();

        for (Initializer initializer : merged) {
            if (initializer == null) {
                throw new IllegalArgumentException("initializer cannot be null");
            }
            ConstructorSpec constructor = new ConstructorSpec(initializer);
            if (constructor.products().isEmpty()) {
                ActionSpec action = new ActionSpec(initializer);
                actions.add(action);
                declarations.add(action);
                continue;
            }

            for (Kind<?> product : constructor.products()) {
                registry.register(ComponentRecord.produced(product, constructor));
            }
            declarations.add(constructor);
        }

        for (Declaration declaration : declarations) {
            expandCollector(declaration);
        }

        log.debug("Graph built: {} components, {} actions", registry.size(), actions.size());
        return List.copyOf(actions);
    }

    private void expandCollector(Declaration declaration) {
        Class<?> capability = declaration.initializer().getCollectsOrNull();
        if (capability == null) {
            return;
        }
        List<Kind<?>> matching = new ArrayList<>();
        for (Kind<?> kind : registry.kinds()) {
            if (kind.equals(CancellationToken.KIND) || declaration.products().contains(kind)) {
                continue;
            }
            if (kind.satisfies(capability)) {
                matching.add(kind);
            }
        }
        declaration.collect(matching);
        log.debug("{} collects {} components of {}", declaration.name(), matching.size(), capability.getName());
    }
}
