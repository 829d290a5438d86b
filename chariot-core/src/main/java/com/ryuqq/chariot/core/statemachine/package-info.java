/**
 * Container lifecycle state machine.
 *
 * <pre>
 * READY ⇄ RUNNING
 *   └───────┴──→ SHUT_DOWN (terminal)
 * </pre>
 *
 * @since 1.0.0
 * @author Chariot Team
 */
package com.ryuqq.chariot.core.statemachine;
