package com.ryuqq.publisher.core.model;

import java.time.Instant;

/**
 * 플랫폼 어댑터의 게시 결과.
 *
 * @param success 성공 여부
 * @param publishedUrl 게시 URL (null 가능)
 * @param platformId 플랫폼 게시물 ID (null 가능)
 * @param timestamp 게시 시각
 * @param error 실패 사유 (성공 시 null)
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public record PublishResult(
    boolean success,
    String publishedUrl,
    String platformId,
    Instant timestamp,
    String error
) {

    public static PublishResult success(String platformId, String publishedUrl, Instant timestamp) {
        return new PublishResult(true, publishedUrl, platformId, timestamp, null);
    }

    public static PublishResult failure(String error, Instant timestamp) {
        return new PublishResult(false, null, null, timestamp, error);
    }
}
