/**
 * Container facade and its option records.
 *
 * @since 1.0.0
 * @author Chariot Team
 */
package com.ryuqq.chariot.application.container;
