package com.ryuqq.chariot.core.exception;

import com.ryuqq.chariot.core.model.Kind;

/**
 * 하나의 Kind를 두 생성자가 선언한 경우.
 *
 * <p>그래프 구성 단계에서 어떤 생성자도 호출되기 전에 발생합니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public class DuplicateKindException extends ChariotException {

    private final transient Kind<?> kind;

    public DuplicateKindException(Kind<?> kind, String firstProducer, String secondProducer) {
        super(ErrorCode.DUPLICATE_KIND,
            "duplicating component " + kind + " (declared by " + firstProducer + " and " + secondProducer + ")");
        this.kind = kind;
    }

    public Kind<?> getKind() {
        return kind;
    }
}
