/**
 * 승인 조정 유스케이스 포트.
 *
 * <p>구현체는 adapter-runner 모듈의 {@code PollingApprovalCoordinator}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.publisher.application.approval;
