/**
 * 콘텐츠 전달 유스케이스 포트.
 *
 * <p>구현체는 adapter-runner 모듈의 {@code ContentDeliveryRunner}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.publisher.application.orchestrator;
