package com.ryuqq.publisher.core.model;

/**
 * 콘텐츠 조각의 생명주기 상태.
 *
 * <p>PUBLISHED와 CANCELLED는 종료 상태입니다. 게시 파이프라인은
 * PUBLISHED 상태의 콘텐츠를 다시 게시하지 않습니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public enum ContentStatus {

    PLANNED,

    DRAFT,

    READY,

    PUBLISHED,

    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return PUBLISHED 또는 CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == PUBLISHED || this == CANCELLED;
    }
}
