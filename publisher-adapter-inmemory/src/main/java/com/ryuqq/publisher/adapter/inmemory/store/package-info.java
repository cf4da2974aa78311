/**
 * In-memory EntityStore adapter.
 *
 * @see com.ryuqq.publisher.core.spi.EntityStore
 * @author Publisher Team
 * @since 1.0.0
 */
package com.ryuqq.publisher.adapter.inmemory.store;
