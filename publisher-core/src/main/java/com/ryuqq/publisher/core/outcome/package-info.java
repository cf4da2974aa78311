/**
 * 게시 시도 결과 타입 (Ok / Retry / Fail).
 *
 * @since 1.0.0
 * @author Publisher Team
 */
package com.ryuqq.publisher.core.outcome;
