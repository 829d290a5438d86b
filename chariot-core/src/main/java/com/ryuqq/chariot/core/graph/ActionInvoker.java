package com.ryuqq.chariot.core.graph;

import com.ryuqq.chariot.core.exception.ActionFailureException;
import com.ryuqq.chariot.core.exception.MissingDependencyException;
import com.ryuqq.chariot.core.model.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 모든 constructor가 해석된 뒤 action을 선언 순서대로 실행합니다.
 *
 * <p>의존성은 이미 해석된 레지스트리에서 조회하며, 해석을 다시 유발하지 않습니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class ActionInvoker {

    private static final Logger log = LoggerFactory.getLogger(ActionInvoker.class);

    private final Registry registry;

    public ActionInvoker(Registry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    /**
     * action 실행.
     *
     * @param actions 선언 순서의 action
     * @throws MissingDependencyException 의존성이 레지스트리에 없거나 해석되지 않은 경우
     * @throws ActionFailureException action이 실패한 경우 (이후 action은 실행되지 않음)
     */
    public void invokeAll(List<ActionSpec> actions) {
        for (ActionSpec action : actions) {
            List<Object> values = new ArrayList<>();
            for (Kind<?> requirement : action.requirements()) {
                ComponentRecord record = registry.find(requirement)
                    .filter(ComponentRecord::isResolved)
                    .orElseThrow(() -> new MissingDependencyException(requirement, action.name()));
                values.add(record.getValue());
            }

            try {
                action.invoke(values);
            } catch (Declaration.InvocationFailedException e) {
                throw new ActionFailureException(action.name(), e.getCause());
            }
            log.debug("Invoked {}", action.name());
        }
    }
}
