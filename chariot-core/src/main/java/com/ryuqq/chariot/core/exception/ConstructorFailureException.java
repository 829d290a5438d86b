package com.ryuqq.chariot.core.exception;

/**
 * 생성자가 실패한 경우.
 *
 * <p>생성자가 던진 예외, 또는 failure slot에 반환한 오류가 cause로 보존됩니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public class ConstructorFailureException extends ChariotException {

    private final String initializer;

    public ConstructorFailureException(String initializer, Throwable cause) {
        super(ErrorCode.CONSTRUCTOR_FAILURE, "initializer " + initializer + " failed: " + cause, cause);
        this.initializer = initializer;
    }

    public ConstructorFailureException(String initializer, String message) {
        super(ErrorCode.CONSTRUCTOR_FAILURE, "initializer " + initializer + " failed: " + message);
        this.initializer = initializer;
    }

    public String getInitializer() {
        return initializer;
    }
}
