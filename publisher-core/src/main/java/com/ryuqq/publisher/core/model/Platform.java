package com.ryuqq.publisher.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.regex.Pattern;

/**
 * 게시 대상 플랫폼 식별자.
 *
 * <p>Platform은 플랫폼 어댑터 조회 키이자 승인 제공자 매핑 키로 사용됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Platform.of("twitter")</li>
 *   <li>Platform.of("discord")</li>
 *   <li>Platform.of("medium")</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~50자</li>
 *   <li>패턴: 소문자, 숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class Platform implements Comparable<Platform> {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z0-9\\-_]+$");

    public static final Platform TWITTER = new Platform("twitter");
    public static final Platform DISCORD = new Platform("discord");
    public static final Platform MEDIUM = new Platform("medium");

    private final String value;

    private Platform(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Platform cannot be null or blank");
        }
        if (value.length() > 50) {
            throw new IllegalArgumentException("Platform length cannot exceed 50 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "Platform must contain only lowercase letters, digits, hyphen and underscore (current: " + value + ")"
            );
        }
        this.value = value;
    }

    /**
     * Platform 생성.
     *
     * <p>대소문자 구분 없이 받아 소문자로 정규화합니다.</p>
     *
     * @param value 플랫폼 식별자 (예: twitter)
     * @return Platform 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    @JsonCreator
    public static Platform of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Platform cannot be null or blank");
        }
        return new Platform(value.trim().toLowerCase());
    }

    /**
     * 플랫폼 식별자 조회.
     *
     * @return 식별자 값
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(Platform other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Platform platform = (Platform) o;
        return value.equals(platform.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
