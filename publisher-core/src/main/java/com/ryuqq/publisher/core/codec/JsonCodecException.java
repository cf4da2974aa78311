package com.ryuqq.publisher.core.codec;

/**
 * Raised when a cached value cannot be encoded or decoded.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public class JsonCodecException extends RuntimeException {

    public JsonCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
