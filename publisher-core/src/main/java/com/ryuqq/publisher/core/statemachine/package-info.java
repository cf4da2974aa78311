/**
 * 승인 상태 머신.
 *
 * @since 1.0.0
 * @author Publisher Team
 */
package com.ryuqq.publisher.core.statemachine;
