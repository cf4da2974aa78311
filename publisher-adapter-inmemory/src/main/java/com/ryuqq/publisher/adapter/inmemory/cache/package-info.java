/**
 * In-memory Cache adapter implementation package.
 *
 * <p>{@link com.ryuqq.publisher.adapter.inmemory.cache.InMemoryCache} is a thread-safe,
 * clock-driven TTL cache that stores values as JSON.</p>
 *
 * @see com.ryuqq.publisher.core.spi.Cache
 * @author Publisher Team
 * @since 1.0.0
 */
package com.ryuqq.publisher.adapter.inmemory.cache;
