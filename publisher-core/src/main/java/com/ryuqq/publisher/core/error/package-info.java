/**
 * 오류 분류와 도메인 예외.
 *
 * <p>모든 예외는 unchecked이며 {@link com.ryuqq.publisher.core.error.ErrorCode}를 가집니다.</p>
 *
 * @since 1.0.0
 * @author Publisher Team
 */
package com.ryuqq.publisher.core.error;
