package com.ryuqq.chariot.core.exception;

/**
 * action (산출물 없는 initializer)이 실패한 경우.
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public class ActionFailureException extends ChariotException {

    private final String action;

    public ActionFailureException(String action, Throwable cause) {
        super(ErrorCode.ACTION_FAILURE, "action " + action + " failed: " + cause, cause);
        this.action = action;
    }

    public String getAction() {
        return action;
    }
}
