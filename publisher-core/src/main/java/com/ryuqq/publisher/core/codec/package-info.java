/**
 * Jackson-based JSON codec for cached values.
 *
 * @since 1.0.0
 * @author Publisher Team
 */
package com.ryuqq.publisher.core.codec;
