package com.ryuqq.publisher.application.approval;

import com.ryuqq.publisher.core.model.Approvable;
import com.ryuqq.publisher.core.model.ApprovalRequest;
import com.ryuqq.publisher.core.model.Continuation;
import com.ryuqq.publisher.core.spi.ApprovalProvider;
import com.ryuqq.publisher.core.spi.ContinuationHandler;

/**
 * 승인 요청 생명주기 조정자.
 *
 * <p>페이로드마다 승인 제공자를 결정하고, 제출하고, 종료 상태까지 추적하며,
 * 상태 변경마다 후속 작업을 실행합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * (none) ──submit──► PENDING ──► APPROVED | REJECTED | FAILED
 *    └──auto-approve──► APPROVED
 * </pre>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public interface ApprovalCoordinator {

    /**
     * 승인 요청 제출.
     *
     * <ul>
     *   <li>자동 승인: APPROVED 요청을 만들고 후속 작업을 실행한 뒤 반환</li>
     *   <li>제공자 없음: FAILED 요청 반환 (후속 작업 실행 안 함)</li>
     *   <li>캐시에 동일 요청 존재: 캐시된 요청 반환 (재제출 안 함)</li>
     *   <li>그 외: PENDING 요청을 제공자에 제출하고 저장</li>
     * </ul>
     *
     * @param content 승인 대상
     * @param continuation 상태 변경 시 후속 작업 (null 가능)
     * @param <T> 페이로드 타입
     * @return 승인 요청
     */
    <T extends Approvable> ApprovalRequest<T> sendForApproval(T content, Continuation continuation);

    /**
     * 제공자에게 현재 상태를 조회하고 변경되었으면 반영.
     *
     * @param request 활성 요청
     * @param <T> 페이로드 타입
     * @return 최신 요청 (비활성이면 입력 그대로)
     */
    <T extends Approvable> ApprovalRequest<T> checkApprovalStatus(ApprovalRequest<T> request);

    /**
     * 상태 변경 반영: 활성 집합 갱신, 저장, 후속 작업 실행.
     *
     * @param request 갱신된 요청
     */
    void updateApprovalRequest(ApprovalRequest<?> request);

    /**
     * 활성 요청을 REJECTED로 취소.
     *
     * @param requestId 요청 ID
     * @return 활성 요청이 있었으면 true
     */
    boolean cancelApprovalRequest(String requestId);

    int getPendingApprovalsCount();

    /**
     * 승인 제공자 등록.
     *
     * @param provider 제공자
     * @throws IllegalStateException 같은 이름이 이미 등록된 경우
     */
    void registerProvider(ApprovalProvider provider);

    /**
     * 후속 작업 종류별 처리기 등록. 같은 종류는 덮어씁니다.
     *
     * @param kind {@link Continuation#kind()}
     * @param handler 처리기
     */
    void registerContinuationHandler(String kind, ContinuationHandler handler);

    boolean isEnabled();

    void initialize();

    void shutdown();
}
