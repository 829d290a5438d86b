package com.ryuqq.chariot.core.exception;

/**
 * 컨테이너 오류의 최상위 예외.
 *
 * <p>모든 하위 예외는 {@link ErrorCode}를 가지며, 원인 오류가 있으면 cause로 보존합니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public abstract class ChariotException extends RuntimeException {

    private final ErrorCode errorCode;

    protected ChariotException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    protected ChariotException(ErrorCode errorCode, String message, Throwable cause) {
        super("[" + errorCode.getCode() + "] " + message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
