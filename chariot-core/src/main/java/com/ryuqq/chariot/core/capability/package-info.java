/**
 * Component capabilities.
 *
 * <p>A constructed component may implement {@link com.ryuqq.chariot.core.capability.Runner},
 * {@link com.ryuqq.chariot.core.capability.Shutdowner}, both or neither. Capabilities are checked
 * with {@code instanceof} at the moment a component is produced.</p>
 *
 * @since 1.0.0
 * @author Chariot Team
 */
package com.ryuqq.chariot.core.capability;
