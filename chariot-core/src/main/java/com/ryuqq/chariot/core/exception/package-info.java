/**
 * Container error types.
 *
 * <p>Every error extends {@link com.ryuqq.chariot.core.exception.ChariotException} and carries an
 * {@link com.ryuqq.chariot.core.exception.ErrorCode}. Original errors raised by components are kept
 * as the cause.</p>
 *
 * @since 1.0.0
 * @author Chariot Team
 */
package com.ryuqq.chariot.core.exception;
