/**
 * In-memory adapter and approval provider registries.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
package com.ryuqq.publisher.adapter.inmemory.registry;
