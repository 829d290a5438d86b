/**
 * Reusable fixtures for container contract tests.
 *
 * @since 1.0.0
 * @author Chariot Team
 */
package com.ryuqq.chariot.testkit.contract;
