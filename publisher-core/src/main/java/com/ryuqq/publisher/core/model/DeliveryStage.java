package com.ryuqq.publisher.core.model;

/**
 * 전달 결과가 도달한 파이프라인 단계.
 *
 * <pre>
 * submitted ─► VALIDATION_FAILED
 *     └─► validated ─► SCHEDULED
 *              ├─► APPROVAL_PENDING ─► PUBLISHED | DROPPED
 *              └─► (auto-approved)  ─► PUBLISHED | PUBLISH_FAILED
 * </pre>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public enum DeliveryStage {

    VALIDATION_FAILED,

    SCHEDULED,

    APPROVAL_PENDING,

    PUBLISHED,

    PUBLISH_FAILED,

    /**
     * 거절/실패로 게시하지 않고 종료.
     */
    DROPPED,

    /**
     * 어댑터 없음, 이미 게시됨 등 사전 조건 불충족.
     */
    REJECTED
}
