package com.ryuqq.publisher.application.orchestrator;

import com.ryuqq.publisher.core.model.ApprovalRequest;
import com.ryuqq.publisher.core.model.ContentPiece;
import com.ryuqq.publisher.core.model.DeliveryOptions;
import com.ryuqq.publisher.core.model.DeliveryResult;
import com.ryuqq.publisher.core.model.Platform;

import java.util.List;
import java.util.Map;

/**
 * 콘텐츠 전달 조정자.
 *
 * <p>콘텐츠 조각을 제출부터 게시 또는 폐기까지 이끌며, 승인과 게시를 미래 시각으로
 * 미룰 수 있고 프로세스 재시작 후에도 캐시만으로 이어서 진행할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DeliveryResult result = orchestrator.submitContent(piece, DeliveryOptions.empty());
 *
 * switch (result.stage()) {
 *     case PUBLISHED -> // 즉시 게시 완료
 *     case APPROVAL_PENDING -> // 승인 후 게시 예정
 *     case SCHEDULED -> // 예약 시각에 게시 예정
 *     default -> // result.error() 확인
 * }
 * </pre>
 *
 * <p>모든 어댑터/제공자 오류는 {@link DeliveryResult#error()}로 변환되며
 * 호출자에게 예외로 전파되지 않습니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public interface DeliveryOrchestrator {

    /**
     * 콘텐츠 제출.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>이미 PUBLISHED이면 success=false로 즉시 반환 (어댑터 호출 없음)</li>
     *   <li>기본 옵션 병합</li>
     *   <li>format → validate (검증 실패 시 validationErrors와 함께 반환)</li>
     *   <li>scheduledTime이 미래이면 예약 후 SCHEDULED 반환</li>
     *   <li>승인 필요 시 Approval Coordinator에 publish 후속 작업과 함께 제출</li>
     *   <li>승인 생략 시 자동 승인 후 즉시 게시</li>
     * </ol>
     *
     * @param piece 콘텐츠
     * @param options 옵션 (null이면 기본값)
     * @return 전달 결과
     */
    DeliveryResult submitContent(ContentPiece piece, DeliveryOptions options);

    /**
     * 승인된 요청의 콘텐츠를 재시도 정책 하에 게시.
     *
     * @param request 승인 요청 (APPROVED가 아니면 attempts=0으로 실패)
     * @return 전달 결과
     */
    DeliveryResult publishContent(ApprovalRequest<ContentPiece> request);

    /**
     * 같은 콘텐츠를 여러 플랫폼에 제출.
     *
     * <p>플랫폼마다 {@code <id>-<platform>} 식별자의 사본으로 제출되어 게시 여부가 플랫폼별로 판정됩니다.</p>
     *
     * @param piece 콘텐츠
     * @param platforms 대상 플랫폼 목록
     * @param options 옵션
     * @return 플랫폼별 결과 (입력 순서 유지)
     */
    List<DeliveryResult> submitToPlatforms(ContentPiece piece, List<Platform> platforms, DeliveryOptions options);

    /**
     * 예약 게시 취소. 승인 선행 타이머와 게시 타이머를 모두 해제한 뒤 항목을 삭제합니다.
     *
     * @param scheduledId {@code <contentId>-<scheduledEpochMs>}
     * @return 취소할 대상이 있었으면 true
     */
    boolean cancelScheduledDelivery(String scheduledId);

    /**
     * 캐시에 저장된 예약을 모두 다시 무장.
     *
     * @return 복구된 항목 수
     */
    int loadScheduledDeliveries();

    /**
     * 활성 어댑터별 연결 상태.
     *
     * @return 플랫폼 → 연결 여부
     */
    Map<Platform, Boolean> checkPlatformConnections();

    void initialize();

    void shutdown();
}
