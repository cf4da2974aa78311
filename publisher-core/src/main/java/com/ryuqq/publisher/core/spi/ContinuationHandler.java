package com.ryuqq.publisher.core.spi;

import com.ryuqq.publisher.core.model.ApprovalRequest;
import com.ryuqq.publisher.core.model.Continuation;

/**
 * Interprets one {@link Continuation} kind when an approval request changes status.
 *
 * <p>Exceptions are retried by the coordinator with bounded backoff and then logged;
 * they never propagate into approval bookkeeping.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ContinuationHandler {

    void handle(ApprovalRequest<?> request, Continuation continuation) throws Exception;
}
