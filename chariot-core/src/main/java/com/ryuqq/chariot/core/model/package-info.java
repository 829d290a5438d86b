/**
 * Declaration model package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.chariot.core.model.Kind} - nominal component identity</li>
 *   <li>{@link com.ryuqq.chariot.core.model.Initializer} - explicitly typed constructor or action</li>
 *   <li>{@link com.ryuqq.chariot.core.model.Component} - pre-built component value</li>
 *   <li>{@link com.ryuqq.chariot.core.model.Arguments} - resolved values handed to an initializer</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Chariot Team
 */
package com.ryuqq.chariot.core.model;
