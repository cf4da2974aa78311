package com.ryuqq.publisher.adapter.runner;

import java.util.List;
import java.util.Locale;

/**
 * 재시도해도 성공할 수 없는 게시 오류 판별.
 *
 * <p>오류 메시지에 아래 패턴 중 하나가 포함되면(대소문자 무시) 재시도 루프를 즉시 중단합니다.
 * 예외 메시지와 실패한 {@code PublishResult.error} 모두에 동일하게 적용됩니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class NonRetryableErrors {

    public static final List<String> PATTERNS = List.of(
        "authentication failed",
        "insufficient permissions",
        "invalid content format",
        "account suspended",
        "rate limit exceeded"
    );

    private NonRetryableErrors() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param message 오류 메시지 (null 허용)
     * @return 치명 오류 패턴에 해당하면 true
     */
    public static boolean matches(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        for (String pattern : PATTERNS) {
            if (normalized.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
