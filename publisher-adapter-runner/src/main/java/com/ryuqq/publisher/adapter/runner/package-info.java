/**
 * Runner Adapter Layer - 전달 파이프라인 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.publisher.adapter.runner.ContentDeliveryRunner} - DeliveryOrchestrator 구현</li>
 *   <li>{@link com.ryuqq.publisher.adapter.runner.PollingApprovalCoordinator} - 폴링 기반 ApprovalCoordinator</li>
 *   <li>{@link com.ryuqq.publisher.adapter.runner.DeliveryScheduler} - 시계 기반 타이머 (Runtime)</li>
 *   <li>{@link com.ryuqq.publisher.adapter.runner.MaintenanceReaper} / {@link com.ryuqq.publisher.adapter.runner.ApprovalSweeper} - 주기 스캔</li>
 *   <li>{@link com.ryuqq.publisher.adapter.runner.DeliveryPipeline} - 전체 조립</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ContentDeliveryRunner, PollingApprovalCoordinator)
 *   ↓ implements
 * application (DeliveryOrchestrator, ApprovalCoordinator, Runtime)
 *   ↓ depends on
 * core (ContentPiece, ApprovalRequest, Outcome, spi)
 * </pre>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
package com.ryuqq.publisher.adapter.runner;
