package com.ryuqq.publisher.core.spi;

import java.util.Optional;

/**
 * Durable keyed cache SPI with per-key expiry.
 *
 * <p>This is the only persistence used for in-flight scheduling and approval state.
 * Implementations must survive a process restart; there are no transactions, so
 * callers write full values (never deltas) and tolerate benign read-modify-write races.</p>
 *
 * <p><strong>Key namespaces used by the pipeline:</strong></p>
 * <ul>
 *   <li>{@code approval/<provider>/<contentId>-approval} - ApprovalRequest</li>
 *   <li>{@code pendingApprovals} - array of active ApprovalRequests</li>
 *   <li>{@code contentDelivery/scheduled/<contentId>-<epochMs>} - ScheduledDeliveryEntry</li>
 *   <li>{@code contentDelivery/scheduledKeys} - array of scheduled entry keys</li>
 *   <li>{@code lock/<name>} - mutual exclusion marker</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Values are stored as self-describing JSON</li>
 *   <li>Expired keys behave exactly like absent keys</li>
 *   <li>Thread-safe</li>
 * </ul>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public interface Cache {

    /**
     * Reads and decodes a value.
     *
     * @param key cache key
     * @param type target type (use array types such as {@code String[].class} for lists)
     * @param <T> value type
     * @return the value, or empty if absent or expired
     * @throws IllegalArgumentException if key or type is null
     */
    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Writes a value, replacing any previous one.
     *
     * @param key cache key
     * @param value value to encode (not null)
     * @param expiresAtEpochMs absolute expiry instant in epoch milliseconds
     * @throws IllegalArgumentException if key or value is null
     */
    void set(String key, Object value, long expiresAtEpochMs);

    /**
     * Deletes a key. Deleting an absent key is a no-op.
     *
     * @param key cache key
     */
    void delete(String key);
}
