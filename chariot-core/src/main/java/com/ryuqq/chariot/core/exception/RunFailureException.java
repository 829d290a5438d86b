package com.ryuqq.chariot.core.exception;

import java.util.List;

/**
 * 병렬 실행 중 하나 이상의 Runner가 실패한 경우.
 *
 * <p>완료 순서상 첫 번째 오류가 primary cause이고, 나머지는 secondary로 보존되며
 * suppressed 예외로도 추가됩니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public class RunFailureException extends ChariotException {

    private final transient List<Throwable> secondaries;

    public RunFailureException(Throwable primary, List<Throwable> secondaries) {
        super(ErrorCode.RUN_FAILURE, describe(primary, secondaries), primary);
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        this.secondaries = secondaries == null ? List.of() : List.copyOf(secondaries);
        this.secondaries.forEach(this::addSuppressed);
    }

    public Throwable primary() {
        return getCause();
    }

    public List<Throwable> secondaries() {
        return secondaries;
    }

    private static String describe(Throwable primary, List<Throwable> secondaries) {
        int others = secondaries == null ? 0 : secondaries.size();
        return "runner failed: " + primary + (others > 0 ? " (and " + others + " more)" : "");
    }
}
