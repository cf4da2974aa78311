package com.ryuqq.publisher.core.spi;

import com.ryuqq.publisher.core.model.Approvable;
import com.ryuqq.publisher.core.model.ApprovalRequest;

/**
 * Approval channel SPI (e.g. a chat message whose reactions decide the outcome).
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@code submitForApproval} returns the request carrying the provider-side
 *       correlation id in {@code platformId}</li>
 *   <li>{@code checkApprovalStatus} returns the request with its current status;
 *       it may throw on transient outages (treated as "no change")</li>
 *   <li>{@code cleanupRequest} is best-effort</li>
 * </ul>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public interface ApprovalProvider {

    /**
     * @return unique provider name used as registry key and cache namespace
     */
    String providerName();

    /**
     * Called once when the provider is registered with a coordinator.
     */
    default void initialize() {
    }

    <T extends Approvable> ApprovalRequest<T> submitForApproval(ApprovalRequest<T> request);

    <T extends Approvable> ApprovalRequest<T> checkApprovalStatus(ApprovalRequest<T> request);

    /**
     * Deletes the provider-side artifact of a finished request.
     *
     * @param correlationId the request's {@code platformId}
     */
    void cleanupRequest(String correlationId);
}
