package com.ryuqq.publisher.core.model;

import java.time.Instant;
import java.util.List;

/**
 * 게시 가능한 콘텐츠 단위.
 *
 * <p>상위 기획 파이프라인이 생성하며, Delivery Orchestrator에 제출된 이후에는
 * {@code status}, {@code platformId}, {@code publishedUrl}만 변경됩니다.
 * 불변 record이므로 변경은 {@code withX} 메서드로 새 인스턴스를 생성합니다.</p>
 *
 * @param id 콘텐츠 ID (필수)
 * @param topic 주제
 * @param format 형식 (예: thread, post, article)
 * @param platform 대상 플랫폼 (필수)
 * @param goalAlignment 연관 목표 ID 목록
 * @param scheduledDate 예정 일시
 * @param keywords 키워드 목록
 * @param mediaRequirements 미디어 요구사항 목록
 * @param brief 작성 개요
 * @param status 생명주기 상태 (필수)
 * @param generatedContent 생성된 원문 (null 가능)
 * @param formattedContent 플랫폼 포맷 적용 본문 (null 가능)
 * @param platformId 플랫폼 게시물 ID (게시 후 설정)
 * @param publishedUrl 게시 URL (게시 후 설정)
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public record ContentPiece(
    String id,
    String topic,
    String format,
    Platform platform,
    List<String> goalAlignment,
    Instant scheduledDate,
    List<String> keywords,
    List<String> mediaRequirements,
    String brief,
    ContentStatus status,
    String generatedContent,
    String formattedContent,
    String platformId,
    String publishedUrl
) implements Approvable {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id, platform, status가 유효하지 않은 경우
     */
    public ContentPiece {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (platform == null) {
            throw new IllegalArgumentException("platform cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        goalAlignment = goalAlignment == null ? List.of() : List.copyOf(goalAlignment);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        mediaRequirements = mediaRequirements == null ? List.of() : List.copyOf(mediaRequirements);
    }

    /**
     * 최소 필드로 READY 상태의 콘텐츠 생성.
     *
     * @param id 콘텐츠 ID
     * @param platform 대상 플랫폼
     * @param generatedContent 본문
     * @return ContentPiece 인스턴스
     */
    public static ContentPiece of(String id, Platform platform, String generatedContent) {
        return new ContentPiece(
            id, null, null, platform, List.of(), null, List.of(), List.of(), null,
            ContentStatus.READY, generatedContent, null, null, null
        );
    }

    public ContentPiece withStatus(ContentStatus status) {
        return new ContentPiece(id, topic, format, platform, goalAlignment, scheduledDate, keywords,
            mediaRequirements, brief, status, generatedContent, formattedContent, platformId, publishedUrl);
    }

    public ContentPiece withPlatform(Platform platform) {
        return new ContentPiece(id, topic, format, platform, goalAlignment, scheduledDate, keywords,
            mediaRequirements, brief, status, generatedContent, formattedContent, platformId, publishedUrl);
    }

    /**
     * 다중 플랫폼 전달용 사본 생성.
     *
     * <p>사본은 {@code <id>-<platform>} 식별자를 가지므로 플랫폼별로 게시 여부와 승인 키가 분리됩니다.</p>
     *
     * @param platform 대상 플랫폼
     * @return 플랫폼별 사본
     */
    public ContentPiece forPlatform(Platform platform) {
        if (platform == null) {
            throw new IllegalArgumentException("platform cannot be null");
        }
        return new ContentPiece(id + "-" + platform.getValue(), topic, format, platform, goalAlignment, scheduledDate,
            keywords, mediaRequirements, brief, status, generatedContent, formattedContent, platformId, publishedUrl);
    }

    public ContentPiece withScheduledDate(Instant scheduledDate) {
        return new ContentPiece(id, topic, format, platform, goalAlignment, scheduledDate, keywords,
            mediaRequirements, brief, status, generatedContent, formattedContent, platformId, publishedUrl);
    }

    public ContentPiece withFormattedContent(String formattedContent) {
        return new ContentPiece(id, topic, format, platform, goalAlignment, scheduledDate, keywords,
            mediaRequirements, brief, status, generatedContent, formattedContent, platformId, publishedUrl);
    }

    /**
     * 게시 완료 상태로 전환한 새 인스턴스 생성.
     *
     * @param platformId 플랫폼 게시물 ID
     * @param publishedUrl 게시 URL
     * @return PUBLISHED 상태의 ContentPiece
     */
    public ContentPiece markPublished(String platformId, String publishedUrl) {
        return new ContentPiece(id, topic, format, platform, goalAlignment, scheduledDate, keywords,
            mediaRequirements, brief, ContentStatus.PUBLISHED, generatedContent, formattedContent,
            platformId, publishedUrl);
    }
}
