package com.ryuqq.publisher.testkit.contract;

import com.ryuqq.publisher.core.model.Approvable;
import com.ryuqq.publisher.core.model.ApprovalRequest;
import com.ryuqq.publisher.core.model.ApprovalStatus;
import com.ryuqq.publisher.core.spi.ApprovalProvider;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ApprovalProvider test double whose decisions are set by the test.
 *
 * <p>Submissions get the platform id {@code <providerName>:<requestId>}. Status checks return
 * the decision set through {@link #decide(String, ApprovalStatus)}, PENDING otherwise.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class ScriptedApprovalProvider implements ApprovalProvider {

    private final String name;
    private final AtomicInteger submitCount = new AtomicInteger();
    private final AtomicInteger checkCount = new AtomicInteger();
    private final AtomicInteger initializeCount = new AtomicInteger();
    private final Map<String, ApprovalStatus> decisions = new ConcurrentHashMap<>();
    private final List<String> cleanedUp = new CopyOnWriteArrayList<>();
    private volatile RuntimeException submitFailure;
    private volatile RuntimeException checkFailure;

    public ScriptedApprovalProvider(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    /**
     * Sets the status that the next checks report for a request.
     *
     * @param requestId approval request id ({@code <contentId>-approval})
     * @param status decided status
     */
    public void decide(String requestId, ApprovalStatus status) {
        decisions.put(requestId, status);
    }

    public void failSubmissions(RuntimeException failure) {
        this.submitFailure = failure;
    }

    public void failChecks(RuntimeException failure) {
        this.checkFailure = failure;
    }

    public int submitCount() {
        return submitCount.get();
    }

    public int checkCount() {
        return checkCount.get();
    }

    public int initializeCount() {
        return initializeCount.get();
    }

    public List<String> cleanedUp() {
        return List.copyOf(cleanedUp);
    }

    public static String platformIdFor(String providerName, String requestId) {
        return providerName + ":" + requestId;
    }

    @Override
    public String providerName() {
        return name;
    }

    @Override
    public void initialize() {
        initializeCount.incrementAndGet();
    }

    @Override
    public <T extends Approvable> ApprovalRequest<T> submitForApproval(ApprovalRequest<T> request) {
        submitCount.incrementAndGet();
        RuntimeException failure = submitFailure;
        if (failure != null) {
            throw failure;
        }
        return request.withPlatformId(platformIdFor(name, request.id()));
    }

    @Override
    public <T extends Approvable> ApprovalRequest<T> checkApprovalStatus(ApprovalRequest<T> request) {
        checkCount.incrementAndGet();
        RuntimeException failure = checkFailure;
        if (failure != null) {
            throw failure;
        }
        ApprovalStatus decided = decisions.get(request.id());
        if (decided == null || decided == request.status()) {
            return request;
        }
        return request.withStatus(decided).withApproverId("reviewer").withComments("Decided by " + name);
    }

    @Override
    public void cleanupRequest(String correlationId) {
        cleanedUp.add(correlationId);
    }
}
