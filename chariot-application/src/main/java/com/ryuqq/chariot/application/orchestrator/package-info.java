/**
 * Run and shutdown phases of a READY container.
 *
 * <ul>
 *   <li>{@link com.ryuqq.chariot.application.orchestrator.RunOrchestrator}: runners in parallel, first failure cancels the rest</li>
 *   <li>{@link com.ryuqq.chariot.application.orchestrator.ShutdownOrchestrator}: shutdowners in reverse construction order</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Chariot Team
 */
package com.ryuqq.chariot.application.orchestrator;
