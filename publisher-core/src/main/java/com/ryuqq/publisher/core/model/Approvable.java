package com.ryuqq.publisher.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 승인 요청에 담길 수 있는 페이로드.
 *
 * <p>캐시에 저장된 승인 요청을 재시작 후 문맥 없이 복원할 수 있도록
 * {@code type} 판별자와 함께 직렬화됩니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ContentPiece.class, name = "contentPiece"),
    @JsonSubTypes.Type(value = PlanSummary.class, name = "plan")
})
public interface Approvable {

    /**
     * 페이로드 식별자. 승인 요청 ID는 이 값에서 결정적으로 파생됩니다.
     *
     * @return 식별자
     */
    String id();
}
