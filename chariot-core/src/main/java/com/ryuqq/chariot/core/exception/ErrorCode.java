package com.ryuqq.chariot.core.exception;

/**
 * 컨테이너 오류 코드.
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /**
     * 두 initializer가 같은 Kind를 생성함.
     */
    DUPLICATE_KIND("CHR-001"),

    /**
     * 선언된 의존성의 생성자가 없음.
     */
    MISSING_DEPENDENCY("CHR-002"),

    /**
     * 의존성 체인이 해석 중인 Kind를 다시 방문함.
     */
    CYCLE_DETECTED("CHR-003"),

    /**
     * 생성자가 실패를 반환하거나 예외를 던짐.
     */
    CONSTRUCTOR_FAILURE("CHR-004"),

    /**
     * action이 실패를 반환하거나 예외를 던짐.
     */
    ACTION_FAILURE("CHR-005"),

    /**
     * 하나 이상의 Runner가 실패함.
     */
    RUN_FAILURE("CHR-006");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
