package com.ryuqq.publisher.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 승인 상태 변경 시 실행할 후속 작업.
 *
 * <p>함수 값은 직렬화할 수 없으므로, 후속 작업은 {@code kind} 판별자를 가진
 * 작은 태그 값으로 표현되어 승인 요청과 함께 캐시에 저장됩니다.
 * 실행 시점에 Approval Coordinator가 {@code kind}에 등록된
 * {@link com.ryuqq.publisher.core.spi.ContinuationHandler}로 디스패치합니다.</p>
 *
 * <p><strong>종류:</strong></p>
 * <ul>
 *   <li>{@link Publish}: 승인된 콘텐츠를 게시</li>
 *   <li>{@link RecordApprovalOnly}: 예약 항목에 승인 결과만 기록</li>
 *   <li>{@link Notify}: 외부 리스너에게 통지</li>
 * </ul>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Continuation.Publish.class, name = Continuation.PUBLISH),
    @JsonSubTypes.Type(value = Continuation.RecordApprovalOnly.class, name = Continuation.RECORD_APPROVAL_ONLY),
    @JsonSubTypes.Type(value = Continuation.Notify.class, name = Continuation.NOTIFY)
})
public sealed interface Continuation
    permits Continuation.Publish, Continuation.RecordApprovalOnly, Continuation.Notify {

    String PUBLISH = "publish";
    String RECORD_APPROVAL_ONLY = "recordApprovalOnly";
    String NOTIFY = "notify";

    /**
     * 디스패치 키.
     *
     * @return kind 문자열
     */
    String kind();

    static Continuation publish(String contentId) {
        return new Publish(contentId);
    }

    static Continuation recordApprovalOnly(String cacheKey) {
        return new RecordApprovalOnly(cacheKey);
    }

    static Continuation notifyListener(String listener) {
        return new Notify(listener);
    }

    /**
     * 승인 완료 시 콘텐츠 게시.
     *
     * @param contentId 게시할 콘텐츠 ID
     */
    record Publish(String contentId) implements Continuation {
        public Publish {
            if (contentId == null || contentId.isBlank()) {
                throw new IllegalArgumentException("contentId cannot be null or blank");
            }
        }

        @Override
        public String kind() {
            return PUBLISH;
        }
    }

    /**
     * 예약 항목(cacheKey)에 승인 결과만 기록. 게시는 예약 시각에 수행됩니다.
     *
     * @param cacheKey 예약 항목 캐시 키
     */
    record RecordApprovalOnly(String cacheKey) implements Continuation {
        public RecordApprovalOnly {
            if (cacheKey == null || cacheKey.isBlank()) {
                throw new IllegalArgumentException("cacheKey cannot be null or blank");
            }
        }

        @Override
        public String kind() {
            return RECORD_APPROVAL_ONLY;
        }
    }

    /**
     * 이름으로 식별되는 외부 리스너에게 통지.
     *
     * @param listener 리스너 이름
     */
    record Notify(String listener) implements Continuation {
        public Notify {
            if (listener == null || listener.isBlank()) {
                throw new IllegalArgumentException("listener cannot be null or blank");
            }
        }

        @Override
        public String kind() {
            return NOTIFY;
        }
    }
}
