/**
 * Operating-system signal wiring for the container's root token.
 *
 * @since 1.0.0
 * @author Chariot Team
 */
package com.ryuqq.chariot.application.signal;
