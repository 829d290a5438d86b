/**
 * Cooperative cancellation package.
 *
 * <p>{@link com.ryuqq.chariot.core.cancel.CancellationToken} is a composable stop signal. A container
 * owns one root token and derives a token per phase; parents propagate cancellation to children,
 * never the other way around.</p>
 *
 * <h2>Reasons</h2>
 * <ul>
 *   <li>{@link com.ryuqq.chariot.core.cancel.Cancelled} - explicit cancellation</li>
 *   <li>{@link com.ryuqq.chariot.core.cancel.DeadlineExceeded} - deadline reached</li>
 *   <li>{@link com.ryuqq.chariot.core.cancel.Interrupted} - OS signal received</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Chariot Team
 */
package com.ryuqq.chariot.core.cancel;
