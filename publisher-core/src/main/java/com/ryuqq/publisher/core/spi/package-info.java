/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Collaborators of the delivery pipeline are injected through these interfaces;
 * nothing is looked up from a global service locator.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.publisher.core.spi.Cache} - durable keyed cache with TTL</li>
 *   <li>{@link com.ryuqq.publisher.core.spi.EntityStore} - authoritative content pieces</li>
 *   <li>{@link com.ryuqq.publisher.core.spi.PlatformAdapter} / {@link com.ryuqq.publisher.core.spi.AdapterRegistry} - per-platform publishing</li>
 *   <li>{@link com.ryuqq.publisher.core.spi.ApprovalProvider} / {@link com.ryuqq.publisher.core.spi.ApprovalProviderRegistry} - approval channels</li>
 *   <li>{@link com.ryuqq.publisher.core.spi.ContinuationHandler} - interpretation of persisted follow-up actions</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>publisher-adapter-inmemory provides reference implementations for tests and
 * single-process hosts. Production hosts supply durable ones.</p>
 *
 * @since 1.0.0
 * @author Publisher Team
 */
package com.ryuqq.publisher.core.spi;
