package com.ryuqq.publisher.core.model;

import java.util.List;

/**
 * 플랫폼 규칙 검증 결과.
 *
 * @param valid 유효 여부
 * @param errors 위반 사항 목록 (유효하면 빈 목록)
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult invalid(List<String> errors) {
        return new ValidationResult(false, errors);
    }
}
