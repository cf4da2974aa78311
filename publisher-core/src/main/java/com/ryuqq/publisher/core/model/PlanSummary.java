package com.ryuqq.publisher.core.model;

import java.time.Instant;
import java.util.List;

/**
 * 승인 대상이 되는 기획 요약 (Master Plan / Micro Plan).
 *
 * <p>콘텐츠 조각과 달리 특정 플랫폼에 속하지 않으므로
 * 기본 승인 제공자로 라우팅됩니다.</p>
 *
 * @param id 기획 ID
 * @param kind 기획 종류
 * @param title 제목
 * @param masterPlanId 상위 Master Plan ID (MICRO인 경우)
 * @param contentPieceIds 포함된 콘텐츠 ID 목록
 * @param created 생성 일시
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public record PlanSummary(
    String id,
    Kind kind,
    String title,
    String masterPlanId,
    List<String> contentPieceIds,
    Instant created
) implements Approvable {

    /**
     * 기획 종류.
     */
    public enum Kind {
        MASTER,
        MICRO
    }

    public PlanSummary {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        contentPieceIds = contentPieceIds == null ? List.of() : List.copyOf(contentPieceIds);
    }
}
