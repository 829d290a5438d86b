package com.ryuqq.chariot.core.graph;

import com.ryuqq.chariot.core.model.Arguments;
import com.ryuqq.chariot.core.model.Initializer;
import com.ryuqq.chariot.core.model.Kind;

import java.util.ArrayList;
import java.util.List;

/**
 * 분류된 initializer의 공통 부분.
 *
 * <p>선언된 의존성, collector로 확장된 의존성, failure slot 여부를 보관하고
 * 본문 호출 결과를 검증합니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
abstract class Declaration {

    private final Initializer initializer;
    private final List<Kind<?>> products;
    private final boolean failureSlot;
    private List<Kind<?>> collected = List.of();

    Declaration(Initializer initializer) {
        this.initializer = initializer;
        List<Kind<?>> declared = initializer.getProducts();
        this.failureSlot = hasFailureSlot(declared);
        this.products = failureSlot ? declared.subList(0, declared.size() - 1) : declared;
    }

    /**
     * 마지막 산출물이 Throwable 타입이면 failure slot.
     */
    static boolean hasFailureSlot(List<Kind<?>> declaredProducts) {
        if (declaredProducts.isEmpty()) {
            return false;
        }
        return declaredProducts.get(declaredProducts.size() - 1).satisfies(Throwable.class);
    }

    String name() {
        return initializer.getName();
    }

    Initializer initializer() {
        return initializer;
    }

    /**
     * failure slot을 제외한 산출물 Kind.
     */
    List<Kind<?>> products() {
        return products;
    }

    boolean hasFailureSlot() {
        return failureSlot;
    }

    List<Kind<?>> dependencies() {
        return initializer.getDependencies();
    }

    List<Kind<?>> collected() {
        return collected;
    }

    void collect(List<Kind<?>> kinds) {
        this.collected = List.copyOf(kinds);
    }

    /**
     * 해석해야 하는 모든 Kind (선언된 의존성, 그다음 수집 대상).
     */
    List<Kind<?>> requirements() {
        List<Kind<?>> all = new ArrayList<>(dependencies());
        all.addAll(collected);
        return all;
    }

    /**
     * 본문 호출 및 결과 검증.
     *
     * @param values requirements() 순서의 값
     * @return failure slot을 제외한 산출물 값
     * @throws InvocationFailedException 본문이 예외를 던졌거나, failure slot에 오류를 반환했거나, 반환 형태가 선언과 다른 경우
     */
    List<Object> invoke(List<Object> values) throws InvocationFailedException {
        int declaredCount = dependencies().size();
        Arguments arguments = new Arguments(
            dependencies(),
            values.subList(0, declaredCount),
            values.subList(declaredCount, values.size())
        );

        List<?> outputs;
        try {
            outputs = initializer.getBody().invoke(arguments);
        } catch (Exception e) {
            throw new InvocationFailedException(e);
        }
        if (outputs == null) {
            outputs = List.of();
        }

        int expected = products.size() + (failureSlot ? 1 : 0);
        if (outputs.size() != expected) {
            throw new InvocationFailedException(new IllegalStateException(
                "returned " + outputs.size() + " values, expected " + expected));
        }

        if (failureSlot) {
            Object failure = outputs.get(expected - 1);
            if (failure instanceof Throwable) {
                throw new InvocationFailedException((Throwable) failure);
            }
            if (failure != null) {
                throw new InvocationFailedException(new IllegalStateException(
                    "failure slot holds a non-throwable value: " + failure));
            }
        }

        List<Object> result = new ArrayList<>(products.size());
        for (int i = 0; i < products.size(); i++) {
            Kind<?> kind = products.get(i);
            Object value = outputs.get(i);
            if (!kind.accepts(value)) {
                throw new InvocationFailedException(new IllegalStateException(
                    "returned " + (value == null ? "null" : value.getClass().getName()) + " for " + kind));
            }
            result.add(value);
        }
        return result;
    }

    /**
     * 본문 호출 실패. 원인 오류를 그대로 보존합니다.
     */
    static final class InvocationFailedException extends Exception {

        InvocationFailedException(Throwable cause) {
            super(cause);
        }
    }
}
