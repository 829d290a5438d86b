package com.ryuqq.chariot.core.exception;

import com.ryuqq.chariot.core.model.Kind;

/**
 * 선언된 의존성을 생성하는 initializer가 없는 경우.
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public class MissingDependencyException extends ChariotException {

    private final transient Kind<?> kind;

    public MissingDependencyException(Kind<?> kind, String requiredBy) {
        super(ErrorCode.MISSING_DEPENDENCY, "missing dependency " + kind + " required by " + requiredBy);
        this.kind = kind;
    }

    public Kind<?> getKind() {
        return kind;
    }
}
