/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that infrastructure adapters implement so the
 * container can stay independent of process-level mechanics.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.chariot.core.spi.InterruptSource} - delivery of OS interrupt signals</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>{@code chariot-application} ships a {@code sun.misc.Signal} backed implementation used by default;
 * {@code chariot-testkit} ships a manually fired implementation for tests.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Explicit ownership:</strong> a source is passed to the container, never looked up globally</li>
 *   <li><strong>Scoped lifetime:</strong> subscribe on container creation, close on shutdown</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Chariot Team
 */
package com.ryuqq.chariot.core.spi;
